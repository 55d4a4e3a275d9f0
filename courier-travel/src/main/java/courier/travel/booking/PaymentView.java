package courier.travel.booking;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Current state of a payment, looked up by its transaction reference.
 *
 * @param transactionRef reference sent to the payment provider
 * @param bookingId      booking the payment belongs to
 * @param amount         charged amount
 * @param currency       ISO currency code
 * @param state          current state
 * @param transactionId  provider transaction id, {@code null} until completed
 * @param paymentDate    completion time, {@code null} until completed
 */
public record PaymentView(
        String transactionRef,
        String bookingId,
        BigDecimal amount,
        String currency,
        PaymentState state,
        String transactionId,
        Instant paymentDate
) {

    public PaymentView {
        Objects.requireNonNull(transactionRef, "transactionRef");
        Objects.requireNonNull(bookingId, "bookingId");
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(state, "state");
    }
}
