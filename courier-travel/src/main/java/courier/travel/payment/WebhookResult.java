package courier.travel.payment;

import java.util.Objects;

/**
 * What happened to one webhook call. Applications map it to an HTTP status: {@code REJECTED}
 * to 401, {@code IGNORED} to 400, the rest to 200.
 *
 * @param disposition    outcome kind
 * @param transactionRef reference named by the webhook, {@code null} if none could be read
 * @param result         the reconciliation, only for {@code RECONCILED}
 * @param reason         explanation for {@code REJECTED} and {@code IGNORED}
 */
public record WebhookResult(
        Disposition disposition,
        String transactionRef,
        ReconciliationResult result,
        String reason
) {

    public enum Disposition {
        /** Verified and recorded (or already recorded). */
        RECONCILED,
        /** Verified, provider still reports the payment pending. */
        PENDING,
        /** Signature missing or wrong; nothing was recorded. */
        REJECTED,
        /** Signed but unusable body. */
        IGNORED
    }

    public WebhookResult {
        Objects.requireNonNull(disposition, "disposition");
    }

    public static WebhookResult reconciled(ReconciliationResult result) {
        return new WebhookResult(Disposition.RECONCILED, result.transactionRef(), result, null);
    }

    public static WebhookResult pending(String transactionRef) {
        return new WebhookResult(Disposition.PENDING, transactionRef, null, null);
    }

    public static WebhookResult rejected(String reason) {
        return new WebhookResult(Disposition.REJECTED, null, null, reason);
    }

    public static WebhookResult ignored(String reason) {
        return new WebhookResult(Disposition.IGNORED, null, null, reason);
    }
}
