package courier.spi;

/**
 * Thrown when an envelope could not be handed to the broker.
 *
 * <p>A lost enqueue means the task never runs, so this always surfaces synchronously to the
 * caller that tried to enqueue.
 */
public class EnqueueException extends RuntimeException {

    public EnqueueException(String message) {
        super(message);
    }

    public EnqueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
