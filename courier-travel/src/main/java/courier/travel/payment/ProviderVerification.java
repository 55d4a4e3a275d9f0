package courier.travel.payment;

import java.util.Objects;

/**
 * What the payment provider reported for a transaction reference.
 *
 * @param transactionRef    the verified reference
 * @param status            mapped status
 * @param providerReference provider-side transaction id, or {@code null}
 * @param rawStatus         status string as sent by the provider, for logs
 */
public record ProviderVerification(
        String transactionRef,
        PaymentStatus status,
        String providerReference,
        String rawStatus
) {

    public ProviderVerification {
        Objects.requireNonNull(transactionRef, "transactionRef");
        Objects.requireNonNull(status, "status");
    }
}
