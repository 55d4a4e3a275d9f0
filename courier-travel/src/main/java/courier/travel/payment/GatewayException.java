package courier.travel.payment;

/**
 * The payment provider could not be asked: I/O error, timeout, rate limit or server error.
 * Nothing was recorded; verifying again later is safe.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
