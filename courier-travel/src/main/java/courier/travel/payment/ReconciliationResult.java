package courier.travel.payment;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal outcome of a transaction, recorded once per reference.
 *
 * @param transactionRef    transaction reference, the record key
 * @param bookingId         booking the payment belongs to
 * @param status            {@link PaymentStatus#CONFIRMED} or {@link PaymentStatus#FAILED}
 * @param verifiedAt        when the terminal state was first observed
 * @param providerReference provider-side transaction id, or {@code null}
 */
public record ReconciliationResult(
        String transactionRef,
        String bookingId,
        PaymentStatus status,
        Instant verifiedAt,
        String providerReference
) {

    public ReconciliationResult {
        Objects.requireNonNull(transactionRef, "transactionRef");
        Objects.requireNonNull(bookingId, "bookingId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(verifiedAt, "verifiedAt");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Reconciliation result must be terminal, got " + status);
        }
    }
}
