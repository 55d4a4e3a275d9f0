package courier.spring;

import courier.spi.TxContext;
import org.springframework.core.Ordered;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Objects;

/**
 * Lets {@link courier.TaskDispatcher#dispatchAfterCommit} enqueue from inside a
 * {@code @Transactional} method: the envelope is handed to the broker only once Spring has
 * committed the booking or payment change.
 *
 * <p>Callbacks run last among the registered synchronizations, after resources such as
 * JPA flushes or cache evictions have completed.
 */
public final class SpringTxContext implements TxContext {

    @Override
    public boolean isTransactionActive() {
        return TransactionSynchronizationManager.isActualTransactionActive()
                && TransactionSynchronizationManager.isSynchronizationActive();
    }

    @Override
    public void afterCommit(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        if (!isTransactionActive()) {
            throw new IllegalStateException(
                    "No Spring transaction with synchronization on this thread; cannot defer dispatch");
        }
        TransactionSynchronizationManager.registerSynchronization(new DispatchOnCommit(callback));
    }

    private static final class DispatchOnCommit implements TransactionSynchronization {
        private final Runnable dispatch;

        DispatchOnCommit(Runnable dispatch) {
            this.dispatch = dispatch;
        }

        @Override
        public int getOrder() {
            return Ordered.LOWEST_PRECEDENCE;
        }

        @Override
        public void afterCommit() {
            dispatch.run();
        }
    }
}
