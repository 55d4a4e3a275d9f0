package courier.spi;

/**
 * Observability hook for exporting task counters to a metrics backend.
 *
 * <p>Implementations are called concurrently from every worker context and must use atomic
 * increments. The {@link #NOOP} instance discards everything.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of envelopes handed to the broker by a dispatcher.
     */
    void incrementEnqueued();

    /**
     * Increments the count of dispatches that failed after every enqueue attempt.
     */
    void incrementEnqueueFailure();

    /**
     * Increments the count of attempts that ended in {@code Success}.
     */
    void incrementSuccess();

    /**
     * Increments the count of redeliveries handed to the redelivery scheduler.
     */
    void incrementRetryScheduled();

    /**
     * Increments the count of envelopes that failed permanently (fatal or exhausted).
     */
    void incrementDead();

    /**
     * Increments the count of deliveries whose task name has no handler.
     */
    default void incrementUnroutable() {
    }

    /**
     * Records the number of handler executions currently running.
     *
     * @param inFlight current in-flight count
     */
    default void recordInFlight(int inFlight) {
    }

    /**
     * Records the time spent inside the handler for one attempt.
     *
     * @param durationMs execution time in milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementEnqueueFailure() {
        }

        @Override
        public void incrementSuccess() {
        }

        @Override
        public void incrementRetryScheduled() {
        }

        @Override
        public void incrementDead() {
        }
    }
}
