package courier.travel.payment;

import java.util.List;
import java.util.Optional;

/**
 * Per-reference reconciliation records with a "notified" marker.
 *
 * <p>A record is written once, when a reference first reaches a terminal state, and never
 * changes afterwards. The marker is claimed by whoever enqueues the notification; claiming is
 * atomic, so concurrent verifications of the same reference enqueue at most once. Once the task
 * is on the broker the claim is confirmed; records whose notification was never confirmed are
 * listed by {@link #findUnconfirmedNotifications(int)} so a sweep can enqueue them.
 *
 * <p>Implementations must be thread-safe; the JDBC one is also safe across processes.
 */
public interface ReconciliationStore {

    Optional<ReconciliationResult> find(String transactionRef);

    /**
     * Inserts the result unless a record for its reference already exists.
     *
     * @return the stored record: {@code result} if it was inserted, otherwise the earlier one
     */
    ReconciliationResult recordTerminal(ReconciliationResult result);

    /**
     * Atomically sets the notified marker.
     *
     * @return {@code true} if this call set it, {@code false} if it was already set or no
     *         record exists
     */
    boolean claimNotification(String transactionRef);

    /**
     * Clears the notified marker after a failed enqueue so a later verification can retry.
     */
    void releaseNotification(String transactionRef);

    /**
     * Returns whether the notified marker of a reference is set.
     */
    boolean isNotified(String transactionRef);

    /**
     * Records that the notification task of a reference reached the broker.
     */
    void confirmNotification(String transactionRef);

    /**
     * Lists terminal records whose notification was never confirmed, oldest verification first.
     * This includes records whose marker is still claimed by a process that stopped before
     * enqueueing.
     */
    List<ReconciliationResult> findUnconfirmedNotifications(int limit);
}
