package courier.travel.mail;

/**
 * Outbound email transport.
 *
 * <p>Implementations report failures through {@link SendResult} rather than exceptions so that
 * handlers can tell a retryable transport problem from a bad recipient. An unexpected runtime
 * exception is still tolerated: the worker classifies it as retryable.
 *
 * @see JakartaMailEmailSender
 */
@FunctionalInterface
public interface EmailSender {

    /**
     * Sends one message.
     *
     * @param message the message
     * @return the transport outcome, never null
     */
    SendResult send(EmailMessage message);
}
