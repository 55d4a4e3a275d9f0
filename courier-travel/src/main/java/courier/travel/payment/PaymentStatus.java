package courier.travel.payment;

/**
 * Provider-side state of a transaction. {@code CONFIRMED} and {@code FAILED} are terminal.
 */
public enum PaymentStatus {
    PENDING,
    CONFIRMED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
