package courier.codec;

/**
 * Thrown when a broker message body cannot be turned back into an envelope.
 *
 * <p>Such a message can never be processed, so brokers discard it instead of requeueing.
 */
public class EnvelopeCodecException extends RuntimeException {

    public EnvelopeCodecException(String message) {
        super(message);
    }

    public EnvelopeCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
