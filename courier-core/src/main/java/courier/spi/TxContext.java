package courier.spi;

/**
 * Hook into the caller's unit of work, used to hold a dispatch back until the state change that
 * triggered it has committed.
 *
 * @see courier.TaskDispatcher#dispatchAfterCommit
 */
public interface TxContext {

    /**
     * Whether the current thread is inside a transaction that can still commit.
     */
    boolean isTransactionActive();

    /**
     * Queues {@code callback} to run once the current transaction has committed. It never runs
     * on rollback.
     *
     * @throws IllegalStateException when called outside a transaction
     */
    void afterCommit(Runnable callback);
}
