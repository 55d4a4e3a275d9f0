package courier;

import courier.dead.DeadTaskLog;
import courier.registry.TaskRegistry;
import courier.retry.RetryScheduler;
import courier.spi.BrokerTransport;
import courier.spi.MetricsExporter;
import courier.spi.RedeliveryScheduler;
import courier.worker.DeliveryObserver;
import courier.worker.LoggingDeliveryObserver;
import courier.worker.TaskInterceptor;
import courier.worker.WorkerPool;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Composite entry point that wires a {@link TaskDispatcher}, a {@link WorkerPool} and a
 * {@link DeadTaskLog} over one broker into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Courier courier = Courier.builder()
 *     .broker(broker)
 *     .registry(registry)
 *     .concurrency(4)
 *     .build()) {
 *   courier.dispatcher().dispatch("send_booking_confirmation_email", Map.of("bookingId", "b1"));
 * }
 * }</pre>
 *
 * <p>With {@code concurrency(0)} no workers are started and the instance only dispatches,
 * for processes that publish tasks consumed elsewhere.
 */
public final class Courier implements AutoCloseable {
    private final TaskDispatcher dispatcher;
    private final WorkerPool workerPool;
    private final DeadTaskLog deadTasks;
    private final MetricsExporter metrics;

    private Courier(TaskDispatcher dispatcher, WorkerPool workerPool, DeadTaskLog deadTasks,
            MetricsExporter metrics) {
        this.dispatcher = dispatcher;
        this.workerPool = workerPool;
        this.deadTasks = deadTasks;
        this.metrics = metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    public TaskDispatcher dispatcher() {
        return dispatcher;
    }

    /**
     * Returns the worker pool, or {@code null} in dispatch-only mode.
     */
    public WorkerPool workerPool() {
        return workerPool;
    }

    public DeadTaskLog deadTasks() {
        return deadTasks;
    }

    /**
     * Stops the worker pool, then closes the metrics exporter if it is {@link AutoCloseable}.
     * The broker is left open; it belongs to the caller.
     */
    @Override
    public void close() {
        RuntimeException first = null;
        if (workerPool != null) {
            try {
                workerPool.close();
            } catch (RuntimeException e) {
                first = e;
            }
        }
        if (metrics instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
                if (first == null) first = re; else first.addSuppressed(re);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /** Builder for {@link Courier}. */
    public static final class Builder {
        private BrokerTransport broker;
        private RedeliveryScheduler redeliveryScheduler;
        private TaskRegistry registry;
        private MetricsExporter metrics;
        private Duration maxRetryDelay = RetryScheduler.DEFAULT_MAX_DELAY;
        private int concurrency = 4;
        private final List<String> queues = new ArrayList<>();
        private Duration gracePeriod = Duration.ofSeconds(10);
        private Duration pollTimeout = Duration.ofMillis(200);
        private int enqueueAttempts = 3;
        private Duration enqueueBackoff = Duration.ofMillis(200);
        private int deadTaskCapacity = DeadTaskLog.DEFAULT_CAPACITY;
        private final List<TaskInterceptor> interceptors = new ArrayList<>();
        private final List<DeliveryObserver> observers = new ArrayList<>();

        private Builder() {
        }

        /** <b>Required.</b> */
        public Builder broker(BrokerTransport broker) {
            this.broker = broker;
            return this;
        }

        /** Optional when the broker implements {@link RedeliveryScheduler}. */
        public Builder redeliveryScheduler(RedeliveryScheduler redeliveryScheduler) {
            this.redeliveryScheduler = redeliveryScheduler;
            return this;
        }

        /** <b>Required.</b> */
        public Builder registry(TaskRegistry registry) {
            this.registry = registry;
            return this;
        }

        /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Optional. Defaults to 600 s. */
        public Builder maxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
            return this;
        }

        /** Optional. Defaults to {@code 4}; {@code 0} starts no workers. */
        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        /** Optional. Defaults to the queues named by the registry. */
        public Builder queues(List<String> queues) {
            this.queues.addAll(queues);
            return this;
        }

        /** Optional. Defaults to 10 s. */
        public Builder gracePeriod(Duration gracePeriod) {
            this.gracePeriod = gracePeriod;
            return this;
        }

        /** Optional. Defaults to 200 ms. */
        public Builder pollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
            return this;
        }

        /** Optional. Defaults to {@code 3}. */
        public Builder enqueueAttempts(int enqueueAttempts) {
            this.enqueueAttempts = enqueueAttempts;
            return this;
        }

        /** Optional. Defaults to 200 ms. */
        public Builder enqueueBackoff(Duration enqueueBackoff) {
            this.enqueueBackoff = enqueueBackoff;
            return this;
        }

        /** Optional. Defaults to {@value DeadTaskLog#DEFAULT_CAPACITY}. */
        public Builder deadTaskCapacity(int deadTaskCapacity) {
            this.deadTaskCapacity = deadTaskCapacity;
            return this;
        }

        public Builder interceptor(TaskInterceptor interceptor) {
            this.interceptors.add(interceptor);
            return this;
        }

        /**
         * Adds an observer next to the built-in logging observer and dead task log.
         */
        public Builder observer(DeliveryObserver observer) {
            this.observers.add(observer);
            return this;
        }

        /**
         * Builds the dispatcher and, unless concurrency is {@code 0}, builds and starts the
         * worker pool.
         *
         * @return a running instance
         */
        public Courier build() {
            Objects.requireNonNull(broker, "broker");
            Objects.requireNonNull(registry, "registry");
            if (concurrency < 0) {
                throw new IllegalArgumentException("concurrency must be >= 0");
            }
            MetricsExporter exporter = metrics != null ? metrics : MetricsExporter.NOOP;
            TaskDispatcher dispatcher = TaskDispatcher.builder()
                    .broker(broker)
                    .registry(registry)
                    .metrics(exporter)
                    .enqueueAttempts(enqueueAttempts)
                    .enqueueBackoff(enqueueBackoff)
                    .build();
            DeadTaskLog deadTasks = new DeadTaskLog(deadTaskCapacity);

            WorkerPool pool = null;
            if (concurrency > 0) {
                WorkerPool.Builder poolBuilder = WorkerPool.builder()
                        .broker(broker)
                        .redeliveryScheduler(redeliveryScheduler)
                        .registry(registry)
                        .retryScheduler(new RetryScheduler(maxRetryDelay))
                        .metrics(exporter)
                        .interceptors(interceptors)
                        .observer(new LoggingDeliveryObserver())
                        .observer(deadTasks)
                        .queues(queues)
                        .gracePeriod(gracePeriod)
                        .pollTimeout(pollTimeout);
                observers.forEach(poolBuilder::observer);
                pool = poolBuilder.build();
                pool.start(concurrency);
            }
            return new Courier(dispatcher, pool, deadTasks, exporter);
        }
    }
}
