package courier.spi;

/**
 * Thrown when the broker transport cannot be reached (closed, connection refused, I/O error).
 */
public class BrokerUnavailableException extends EnqueueException {

    public BrokerUnavailableException(String message) {
        super(message);
    }

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
