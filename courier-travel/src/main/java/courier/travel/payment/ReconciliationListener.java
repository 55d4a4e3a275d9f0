package courier.travel.payment;

/**
 * Applies a terminal reconciliation to the system of record (mark the payment completed or
 * failed, confirm the booking) before the notification is enqueued.
 *
 * <p>May be invoked more than once for the same reference if an earlier enqueue failed, so it
 * must be idempotent. Throwing aborts the notification; the next verification retries both.
 */
@FunctionalInterface
public interface ReconciliationListener {

    ReconciliationListener NOOP = result -> {
    };

    void onReconciled(ReconciliationResult result);
}
