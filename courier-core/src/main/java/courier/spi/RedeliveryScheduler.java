package courier.spi;

import courier.TaskEnvelope;

import java.time.Duration;

/**
 * Publishes an envelope once a delay has elapsed, without holding a worker thread.
 *
 * <p>Brokers implement this with their native delay mechanism (a future visibility time, a TTL
 * queue, a scheduled re-publish).
 */
@FunctionalInterface
public interface RedeliveryScheduler {

    /**
     * Schedules {@code envelope} to become visible on its queue after {@code delay}.
     *
     * <p>When this method returns normally the redelivery is the broker's responsibility.
     *
     * @param envelope the envelope to redeliver, already carrying its next attempt number
     * @param delay    delay before the envelope becomes visible; zero for immediate
     * @throws BrokerUnavailableException if the redelivery could not be registered
     */
    void scheduleRedelivery(TaskEnvelope envelope, Duration delay);
}
