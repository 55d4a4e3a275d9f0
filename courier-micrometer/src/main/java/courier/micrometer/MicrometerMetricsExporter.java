package courier.micrometer;

import courier.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Publishes task counters to a Micrometer {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code courier.tasks.enqueued}: envelopes handed to the broker by a dispatcher</li>
 *   <li>{@code courier.tasks.enqueue.failed}: dispatches that failed after every attempt</li>
 *   <li>{@code courier.tasks.succeeded}: attempts that ended in success</li>
 *   <li>{@code courier.tasks.retried}: redeliveries scheduled</li>
 *   <li>{@code courier.tasks.dead}: envelopes that failed permanently</li>
 *   <li>{@code courier.tasks.unroutable}: deliveries whose task has no handler</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code courier.worker.in.flight}: handler executions currently running</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code courier.handler.duration.ms}: time spent inside handlers</li>
 * </ul>
 *
 * <p>The {@code courier} prefix is configurable for applications that run several pools.
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter enqueued;
    private final Counter enqueueFailed;
    private final Counter succeeded;
    private final Counter retried;
    private final Counter dead;
    private final Counter unroutable;
    private final Gauge inFlightGauge;
    private final DistributionSummary handlerDuration;

    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default name prefix {@code "courier"}.
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "courier");
    }

    /**
     * Creates an exporter with a custom name prefix.
     *
     * @param registry   the meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "bookings.courier"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.enqueued = Counter.builder(namePrefix + ".tasks.enqueued")
                .description("Envelopes handed to the broker")
                .register(registry);
        this.enqueueFailed = Counter.builder(namePrefix + ".tasks.enqueue.failed")
                .description("Dispatches that failed after every enqueue attempt")
                .register(registry);
        this.succeeded = Counter.builder(namePrefix + ".tasks.succeeded")
                .description("Attempts that ended in success")
                .register(registry);
        this.retried = Counter.builder(namePrefix + ".tasks.retried")
                .description("Redeliveries scheduled after a retryable failure")
                .register(registry);
        this.dead = Counter.builder(namePrefix + ".tasks.dead")
                .description("Envelopes that failed permanently")
                .register(registry);
        this.unroutable = Counter.builder(namePrefix + ".tasks.unroutable")
                .description("Deliveries whose task name has no handler")
                .register(registry);
        this.inFlightGauge = Gauge.builder(namePrefix + ".worker.in.flight", inFlight, AtomicInteger::get)
                .description("Handler executions currently running")
                .register(registry);
        this.handlerDuration = DistributionSummary.builder(namePrefix + ".handler.duration.ms")
                .description("Handler execution time in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementEnqueued() {
        if (closed) return;
        enqueued.increment();
    }

    @Override
    public void incrementEnqueueFailure() {
        if (closed) return;
        enqueueFailed.increment();
    }

    @Override
    public void incrementSuccess() {
        if (closed) return;
        succeeded.increment();
    }

    @Override
    public void incrementRetryScheduled() {
        if (closed) return;
        retried.increment();
    }

    @Override
    public void incrementDead() {
        if (closed) return;
        dead.increment();
    }

    @Override
    public void incrementUnroutable() {
        if (closed) return;
        unroutable.increment();
    }

    @Override
    public void recordInFlight(int inFlight) {
        if (closed) return;
        this.inFlight.set(inFlight);
    }

    @Override
    public void recordHandlerDurationMs(long durationMs) {
        if (closed) return;
        handlerDuration.record(durationMs);
    }

    /**
     * Removes every meter this exporter registered. Later calls are ignored.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(enqueued, enqueueFailed, succeeded, retried, dead, unroutable,
                inFlightGauge, handlerDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
