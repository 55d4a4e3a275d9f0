package courier.travel.mail;

import java.util.Objects;

/**
 * Outcome of {@link EmailSender#send(EmailMessage)}.
 */
public sealed interface SendResult
        permits SendResult.Sent, SendResult.TransientError, SendResult.PermanentError {

    static Sent sent() {
        return Sent.INSTANCE;
    }

    static TransientError transientError(String reason) {
        return new TransientError(reason);
    }

    static PermanentError permanentError(String reason) {
        return new PermanentError(reason);
    }

    /** Accepted by the mail transport. */
    record Sent() implements SendResult {
        private static final Sent INSTANCE = new Sent();
    }

    /** Timeouts, connection refused, 4xx SMTP replies: worth another try later. */
    record TransientError(String reason) implements SendResult {
        public TransientError {
            Objects.requireNonNull(reason, "reason");
        }
    }

    /** Invalid recipient or a message the server will never accept. */
    record PermanentError(String reason) implements SendResult {
        public PermanentError {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
