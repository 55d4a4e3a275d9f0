package courier.travel.booking;

/**
 * Payment row state in the system of record. Distinct from the provider-side
 * {@link courier.travel.payment.PaymentStatus}, which is what reconciliation observes.
 */
public enum PaymentState {
    PENDING,
    COMPLETED,
    FAILED
}
