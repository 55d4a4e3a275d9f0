package courier;

import courier.registry.TaskRegistration;
import courier.registry.TaskRegistry;
import courier.registry.UnknownTaskException;
import courier.spi.BrokerTransport;
import courier.spi.BrokerUnavailableException;
import courier.spi.MetricsExporter;
import courier.spi.TxContext;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Caller-side entry point: turns a task name and its arguments into an envelope and hands it
 * to the broker. Fire-and-forget: callers never wait for the task to run.
 *
 * <p>The envelope's queue and retry budget come from the task's registration; the queue can
 * be overridden per call. Names without a registration fail fast with
 * {@link UnknownTaskException}, before anything reaches the broker.
 *
 * <p>If the broker is unreachable the enqueue is retried synchronously up to
 * {@code enqueueAttempts} times, {@code enqueueBackoff} apart, then
 * {@link BrokerUnavailableException} is raised.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * // inside the booking service, once the booking row is written
 * dispatcher.dispatchAfterCommit(txContext, NotificationTasks.BOOKING_CONFIRMATION,
 *     Map.of("bookingId", booking.id()));
 * }</pre>
 */
public final class TaskDispatcher {
    private static final Logger logger = Logger.getLogger(TaskDispatcher.class.getName());

    private final BrokerTransport broker;
    private final TaskRegistry registry;
    private final MetricsExporter metrics;
    private final int enqueueAttempts;
    private final Duration enqueueBackoff;

    private TaskDispatcher(Builder builder) {
        this.broker = Objects.requireNonNull(builder.broker, "broker");
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.enqueueBackoff = Objects.requireNonNull(builder.enqueueBackoff, "enqueueBackoff");
        if (builder.enqueueAttempts < 1) {
            throw new IllegalArgumentException("enqueueAttempts must be >= 1, got: " + builder.enqueueAttempts);
        }
        if (enqueueBackoff.isNegative()) {
            throw new IllegalArgumentException("enqueueBackoff must not be negative");
        }
        this.enqueueAttempts = builder.enqueueAttempts;
        registry.requireRegistered(builder.requiredTasks);
    }

    public static Builder builder() {
        return new Builder();
    }

    public UUID dispatch(TaskName taskName, Map<String, String> payload) {
        Objects.requireNonNull(taskName, "taskName");
        return dispatch(taskName.taskName(), payload, null);
    }

    public UUID dispatch(String taskName, Map<String, String> payload) {
        return dispatch(taskName, payload, null);
    }

    /**
     * Enqueues one task now.
     *
     * @param taskName      registered task name
     * @param payload       named arguments
     * @param queueOverride queue to publish to instead of the registered one; {@code null} for
     *                      the default
     * @return the envelope id
     * @throws UnknownTaskException       if the task is not registered
     * @throws IllegalArgumentException   if the payload is invalid or too large
     * @throws BrokerUnavailableException if the broker stays unreachable for every attempt
     */
    public UUID dispatch(String taskName, Map<String, String> payload, String queueOverride) {
        TaskEnvelope envelope = envelope(taskName, payload, queueOverride);
        enqueue(envelope);
        return envelope.id();
    }

    public UUID dispatchAfterCommit(TxContext txContext, TaskName taskName, Map<String, String> payload) {
        Objects.requireNonNull(taskName, "taskName");
        return dispatchAfterCommit(txContext, taskName.taskName(), payload, null);
    }

    public UUID dispatchAfterCommit(TxContext txContext, String taskName, Map<String, String> payload) {
        return dispatchAfterCommit(txContext, taskName, payload, null);
    }

    /**
     * Enqueues one task once the caller's transaction commits; immediately if none is active.
     *
     * <p>The envelope is built and validated now, so configuration errors still reach the
     * caller. A broker failure at enqueue time is logged and counted, never thrown: the
     * committed operation must not fail because a notification could not be queued.
     *
     * @param txContext     the caller's transaction context
     * @param taskName      registered task name
     * @param payload       named arguments
     * @param queueOverride optional queue override
     * @return the id the envelope will carry
     * @throws UnknownTaskException     if the task is not registered
     * @throws IllegalArgumentException if the payload is invalid or too large
     */
    public UUID dispatchAfterCommit(TxContext txContext, String taskName, Map<String, String> payload,
            String queueOverride) {
        Objects.requireNonNull(txContext, "txContext");
        TaskEnvelope envelope = envelope(taskName, payload, queueOverride);
        if (txContext.isTransactionActive()) {
            txContext.afterCommit(() -> enqueueQuietly(envelope));
        } else {
            enqueueQuietly(envelope);
        }
        return envelope.id();
    }

    private TaskEnvelope envelope(String taskName, Map<String, String> payload, String queueOverride) {
        Objects.requireNonNull(taskName, "taskName");
        Objects.requireNonNull(payload, "payload");
        TaskRegistration registration = registry.require(taskName);
        return TaskEnvelope.builder(taskName)
                .queue(queueOverride != null ? queueOverride : registration.queue())
                .maxRetries(registration.policy().maxRetries())
                .payload(payload)
                .build();
    }

    private void enqueueQuietly(TaskEnvelope envelope) {
        try {
            enqueue(envelope);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Dropped task " + envelope.taskName() + " (" + envelope.id()
                    + ") after commit; the broker did not accept it", e);
        }
    }

    private void enqueue(TaskEnvelope envelope) {
        BrokerUnavailableException last = null;
        for (int attempt = 1; attempt <= enqueueAttempts; attempt++) {
            try {
                broker.enqueue(envelope);
                metrics.incrementEnqueued();
                return;
            } catch (BrokerUnavailableException e) {
                last = e;
                logger.log(Level.WARNING, "Enqueue attempt {0}/{1} for task {2} failed: {3}",
                        new Object[] {attempt, enqueueAttempts, envelope.id(), e.getMessage()});
                if (attempt < enqueueAttempts && !sleepBackoff()) {
                    break;
                }
            } catch (RuntimeException e) {
                metrics.incrementEnqueueFailure();
                throw e;
            }
        }
        metrics.incrementEnqueueFailure();
        throw new BrokerUnavailableException("Broker unavailable after " + enqueueAttempts
                + " enqueue attempt(s) for task " + envelope.taskName(), last);
    }

    private boolean sleepBackoff() {
        if (enqueueBackoff.isZero()) {
            return true;
        }
        try {
            Thread.sleep(enqueueBackoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Builder for {@link TaskDispatcher}. */
    public static final class Builder {
        private BrokerTransport broker;
        private TaskRegistry registry;
        private MetricsExporter metrics;
        private int enqueueAttempts = 3;
        private Duration enqueueBackoff = Duration.ofMillis(200);
        private List<String> requiredTasks = List.of();

        private Builder() {
        }

        /**
         * Sets the broker envelopes are published to.
         *
         * <p><b>Required.</b>
         *
         * @param broker the broker transport
         * @return this builder
         */
        public Builder broker(BrokerTransport broker) {
            this.broker = broker;
            return this;
        }

        /**
         * Sets the registry that supplies each task's default queue and retry budget.
         *
         * <p><b>Required.</b>
         *
         * @param registry the task registry
         * @return this builder
         */
        public Builder registry(TaskRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets how many times an enqueue is tried while the broker is unreachable.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
         *
         * @param enqueueAttempts total enqueue attempts
         * @return this builder
         */
        public Builder enqueueAttempts(int enqueueAttempts) {
            this.enqueueAttempts = enqueueAttempts;
            return this;
        }

        /**
         * Sets the pause between enqueue attempts.
         *
         * <p>Optional. Defaults to 200 ms.
         *
         * @param enqueueBackoff pause between attempts
         * @return this builder
         */
        public Builder enqueueBackoff(Duration enqueueBackoff) {
            this.enqueueBackoff = enqueueBackoff;
            return this;
        }

        /**
         * Names tasks this dispatcher will be asked to send; {@link #build()} fails if any of them
         * is not registered.
         *
         * <p>Optional.
         *
         * @param taskNames task names the caller depends on
         * @return this builder
         */
        public Builder requireTasks(Collection<String> taskNames) {
            this.requiredTasks = List.copyOf(taskNames);
            return this;
        }

        /**
         * Builds the dispatcher.
         *
         * @return a new dispatcher
         * @throws UnknownTaskException if a name passed to {@link #requireTasks} is not registered
         */
        public TaskDispatcher build() {
            return new TaskDispatcher(this);
        }
    }
}
