package courier.worker;

import courier.TaskEnvelope;
import courier.TaskHandler;
import courier.TaskOutcome;
import courier.registry.TaskRegistration;
import courier.registry.TaskRegistry;
import courier.retry.RetryDecision;
import courier.retry.RetryScheduler;
import courier.spi.BrokerTransport;
import courier.spi.Delivery;
import courier.spi.DeliveryStream;
import courier.spi.EnqueueException;
import courier.spi.MetricsExporter;
import courier.spi.RedeliveryScheduler;
import courier.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pool of independent execution contexts that pull deliveries from the broker, run the
 * registered handler and settle each delivery according to the {@link RetryScheduler}.
 *
 * <p>Each context is one thread with its own {@link DeliveryStream} per queue. Contexts share
 * nothing but the read-only {@link TaskRegistry} and the metrics exporter.
 *
 * <p>Per delivery:
 * <ol>
 *   <li>Resolve the handler. An unknown task name is a configuration error: the delivery is
 *       rejected without requeue and reported as a permanent failure.</li>
 *   <li>Run interceptors and the handler. Anything thrown is classified by
 *       {@link FailureClassifier}; nothing escapes to kill the context.</li>
 *   <li>Ask the retry scheduler: acknowledge, hand a copy with {@code attempt + 1} to the
 *       {@link RedeliveryScheduler} and acknowledge, or acknowledge and give up.</li>
 * </ol>
 *
 * <p>{@link #stop()} stops pulling, waits for in-flight executions up to the grace period and
 * then interrupts them. An interrupted execution is never acknowledged; closing its stream
 * hands the delivery back to the broker.
 *
 * @see WorkerPool.Builder
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(WorkerPool.class.getName());

    private final BrokerTransport broker;
    private final RedeliveryScheduler redeliveryScheduler;
    private final TaskRegistry registry;
    private final RetryScheduler retryScheduler;
    private final MetricsExporter metrics;
    private final List<TaskInterceptor> interceptors;
    private final List<DeliveryObserver> observers;
    private final List<String> queues;
    private final Duration gracePeriod;
    private final Duration pollTimeout;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile ExecutorService contexts;

    private WorkerPool(Builder builder) {
        this.broker = Objects.requireNonNull(builder.broker, "broker");
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        if (builder.redeliveryScheduler != null) {
            this.redeliveryScheduler = builder.redeliveryScheduler;
        } else if (broker instanceof RedeliveryScheduler scheduler) {
            this.redeliveryScheduler = scheduler;
        } else {
            throw new NullPointerException("redeliveryScheduler");
        }
        this.retryScheduler = builder.retryScheduler != null ? builder.retryScheduler : new RetryScheduler();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
        this.observers = builder.observers.isEmpty()
                ? List.of(new LoggingDeliveryObserver())
                : Collections.unmodifiableList(new ArrayList<>(builder.observers));
        this.gracePeriod = Objects.requireNonNull(builder.gracePeriod, "gracePeriod");
        this.pollTimeout = Objects.requireNonNull(builder.pollTimeout, "pollTimeout");
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must not be negative");
        }
        if (pollTimeout.isNegative() || pollTimeout.isZero()) {
            throw new IllegalArgumentException("pollTimeout must be > 0");
        }

        LinkedHashSet<String> queueNames = new LinkedHashSet<>(builder.queues);
        if (queueNames.isEmpty()) {
            for (String name : registry.taskNames()) {
                registry.resolve(name).ifPresent(registration -> queueNames.add(registration.queue()));
            }
        }
        if (queueNames.isEmpty()) {
            throw new IllegalArgumentException("No queues to consume: configure queues or register tasks");
        }
        this.queues = List.copyOf(queueNames);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Launches {@code concurrency} execution contexts, each consuming every configured queue.
     *
     * @param concurrency number of contexts, at least 1
     * @throws IllegalArgumentException if {@code concurrency < 1}
     * @throws IllegalStateException    if the pool was already started
     */
    public void start(int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, got: " + concurrency);
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("WorkerPool already started");
        }
        running.set(true);
        ExecutorService executor = Executors.newFixedThreadPool(concurrency, new DaemonThreadFactory("courier-worker-"));
        for (int i = 0; i < concurrency; i++) {
            executor.submit(this::runContext);
        }
        this.contexts = executor;
        logger.log(Level.INFO, "Started {0} worker context(s) on queues {1}", new Object[] {concurrency, queues});
    }

    /**
     * Stops pulling deliveries, waits up to the grace period for in-flight executions and then
     * interrupts whatever is still running. Idempotent.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ExecutorService executor = contexts;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Grace period of {0} ms exceeded with {1} execution(s) in flight; "
                        + "cancelling, unacknowledged deliveries will be redelivered",
                        new Object[] {gracePeriod.toMillis(), inFlight.get()});
                executor.shutdownNow();
                executor.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Worker pool stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Returns the number of handler executions currently running.
     */
    public int inFlightCount() {
        return inFlight.get();
    }

    public List<String> queues() {
        return queues;
    }

    @Override
    public void close() {
        stop();
    }

    private void runContext() {
        List<DeliveryStream> streams = new ArrayList<>(queues.size());
        Duration perQueueTimeout = queues.size() == 1
                ? pollTimeout
                : Duration.ofMillis(Math.max(1L, pollTimeout.toMillis() / queues.size()));
        try {
            for (String queue : queues) {
                streams.add(broker.consume(queue));
            }
            int cursor = 0;
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                int index = cursor;
                cursor = (cursor + 1) % streams.size();
                Delivery delivery;
                try {
                    delivery = streams.get(index).next(perQueueTimeout);
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Failed to receive from queue " + queues.get(index), e);
                    Thread.sleep(pollTimeout.toMillis());
                    continue;
                }
                if (delivery != null) {
                    processSafely(delivery);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Worker context terminated unexpectedly", e);
        } finally {
            for (DeliveryStream stream : streams) {
                try {
                    stream.close();
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Failed to close delivery stream", e);
                }
            }
        }
    }

    private void processSafely(Delivery delivery) {
        try {
            process(delivery);
        } catch (RuntimeException e) {
            // Settlement failed; the broker still owns the delivery and will redeliver it.
            logger.log(Level.SEVERE, "Failed to settle delivery of task " + delivery.envelope().id(), e);
        }
    }

    void process(Delivery delivery) {
        TaskEnvelope task = delivery.envelope();
        Optional<TaskRegistration> registration = registry.resolve(task.taskName());
        if (registration.isEmpty()) {
            rejectUnroutable(delivery);
            return;
        }

        metrics.recordInFlight(inFlight.incrementAndGet());
        long start = System.nanoTime();
        TaskOutcome outcome;
        try {
            outcome = execute(registration.get().handler(), task);
        } finally {
            metrics.recordInFlight(inFlight.decrementAndGet());
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        metrics.recordHandlerDurationMs(durationMs);

        if (Thread.currentThread().isInterrupted()) {
            if (running.get()) {
                // Interrupted by the handler itself, not by stop(): keep the context alive.
                Thread.interrupted();
                broker.reject(delivery, true);
                logger.log(Level.WARNING, "Execution of task {0} was interrupted; requeued", task.id());
                return;
            }
            logger.log(Level.WARNING, "Execution of task {0} ({1}) was cancelled; leaving it unacknowledged",
                    new Object[] {task.id(), task.taskName()});
            return;
        }

        RetryDecision decision = retryScheduler.decide(task, registration.get().policy(), outcome);
        if (decision instanceof RetryDecision.Acknowledge) {
            broker.ack(delivery);
            metrics.incrementSuccess();
            notifyAttempt(DeliveryRecord.of(task, delivery.queue(), outcome.label(), null, durationMs));
        } else if (decision instanceof RetryDecision.Redeliver redeliver) {
            String reason = ((TaskOutcome.RetryableFailure) outcome).reason();
            try {
                redeliveryScheduler.scheduleRedelivery(redeliver.next(), redeliver.delay());
            } catch (EnqueueException e) {
                logger.log(Level.WARNING, "Could not schedule redelivery of task " + task.id()
                        + "; requeueing current delivery", e);
                broker.reject(delivery, true);
                notifyAttempt(DeliveryRecord.of(task, delivery.queue(), outcome.label(), reason, durationMs));
                return;
            }
            broker.ack(delivery);
            metrics.incrementRetryScheduled();
            logger.log(Level.FINE, "Task {0} attempt {1} failed; redelivery in {2} ms",
                    new Object[] {task.id(), task.attempt(), redeliver.delay().toMillis()});
            notifyAttempt(DeliveryRecord.of(task, delivery.queue(), outcome.label(), reason, durationMs));
        } else {
            RetryDecision.GiveUp giveUp = (RetryDecision.GiveUp) decision;
            broker.ack(delivery);
            metrics.incrementDead();
            DeliveryRecord record = DeliveryRecord.of(task, delivery.queue(), "FATAL", giveUp.reason(), durationMs);
            notifyAttempt(record);
            notifyPermanentFailure(record, task);
        }
    }

    private void rejectUnroutable(Delivery delivery) {
        TaskEnvelope task = delivery.envelope();
        broker.reject(delivery, false);
        metrics.incrementUnroutable();
        metrics.incrementDead();
        logger.log(Level.SEVERE, "No handler registered for task {0}; discarded delivery {1}. "
                + "Register the handler and redeploy", new Object[] {task.taskName(), task.id()});
        DeliveryRecord record = DeliveryRecord.of(task, delivery.queue(), "FATAL",
                "No handler registered for task: " + task.taskName(), 0L);
        notifyAttempt(record);
        notifyPermanentFailure(record, task);
    }

    private TaskOutcome execute(TaskHandler handler, TaskEnvelope task) {
        int completedBefore = 0;
        TaskOutcome outcome;
        try {
            for (int i = 0; i < interceptors.size(); i++) {
                interceptors.get(i).beforeExecute(task);
                completedBefore = i + 1;
            }
            outcome = handler.handle(task);
            if (outcome == null) {
                outcome = TaskOutcome.fatal("Handler returned no outcome");
            }
        } catch (Throwable t) {
            outcome = FailureClassifier.classify(t);
        }
        for (int i = completedBefore - 1; i >= 0; i--) {
            try {
                interceptors.get(i).afterExecute(task, outcome);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Interceptor afterExecute failed", e);
            }
        }
        return outcome;
    }

    private void notifyAttempt(DeliveryRecord record) {
        for (DeliveryObserver observer : observers) {
            try {
                observer.onAttempt(record);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Delivery observer failed", e);
            }
        }
    }

    private void notifyPermanentFailure(DeliveryRecord record, TaskEnvelope task) {
        for (DeliveryObserver observer : observers) {
            try {
                observer.onPermanentFailure(record, task);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Delivery observer failed", e);
            }
        }
    }

    /** Builder for {@link WorkerPool}. */
    public static final class Builder {
        private BrokerTransport broker;
        private RedeliveryScheduler redeliveryScheduler;
        private TaskRegistry registry;
        private RetryScheduler retryScheduler;
        private MetricsExporter metrics;
        private final List<TaskInterceptor> interceptors = new ArrayList<>();
        private final List<DeliveryObserver> observers = new ArrayList<>();
        private final List<String> queues = new ArrayList<>();
        private Duration gracePeriod = Duration.ofSeconds(10);
        private Duration pollTimeout = Duration.ofMillis(200);

        private Builder() {
        }

        /**
         * Sets the broker deliveries are consumed from and settled on.
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
         * Sets the delayed-redelivery capability.
         *
         * <p>Optional when the broker itself implements {@link RedeliveryScheduler}; required
         * otherwise.
         *
         * @param redeliveryScheduler the redelivery scheduler
         * @return this builder
         */
        public Builder redeliveryScheduler(RedeliveryScheduler redeliveryScheduler) {
            this.redeliveryScheduler = redeliveryScheduler;
            return this;
        }

        /**
         * Sets the task registry. It must be complete before the pool starts.
         *
         * <p><b>Required.</b>
         *
         * @param registry the registry
         * @return this builder
         */
        public Builder registry(TaskRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets the retry scheduler.
         *
         * <p>Optional. Defaults to a {@link RetryScheduler} with a 600 s delay ceiling.
         *
         * @param retryScheduler the retry scheduler
         * @return this builder
         */
        public Builder retryScheduler(RetryScheduler retryScheduler) {
            this.retryScheduler = retryScheduler;
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
         * Appends an interceptor. Interceptors run in registration order before the handler and in
         * reverse order after it.
         *
         * @param interceptor the interceptor
         * @return this builder
         */
        public Builder interceptor(TaskInterceptor interceptor) {
            this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
            return this;
        }

        public Builder interceptors(List<TaskInterceptor> interceptors) {
            interceptors.forEach(this::interceptor);
            return this;
        }

        /**
         * Appends a delivery observer.
         *
         * <p>Optional. When none is added, a {@link LoggingDeliveryObserver} is used. Add it
         * explicitly to combine it with other observers.
         *
         * @param observer the observer
         * @return this builder
         */
        public Builder observer(DeliveryObserver observer) {
            this.observers.add(Objects.requireNonNull(observer, "observer"));
            return this;
        }

        /**
         * Adds queues to consume.
         *
         * <p>Optional. Defaults to every queue named by a registration in the registry.
         *
         * @param queues queue names
         * @return this builder
         */
        public Builder queues(String... queues) {
            for (String queue : queues) {
                this.queues.add(Objects.requireNonNull(queue, "queue"));
            }
            return this;
        }

        public Builder queues(List<String> queues) {
            return queues(queues.toArray(new String[0]));
        }

        /**
         * Sets how long {@link WorkerPool#stop()} waits for in-flight executions before
         * cancelling them.
         *
         * <p>Optional. Defaults to 10 seconds.
         *
         * @param gracePeriod grace period
         * @return this builder
         */
        public Builder gracePeriod(Duration gracePeriod) {
            this.gracePeriod = gracePeriod;
            return this;
        }

        /**
         * Sets how long a context waits on an empty queue before re-checking for shutdown.
         *
         * <p>Optional. Defaults to 200 ms.
         *
         * @param pollTimeout poll timeout
         * @return this builder
         */
        public Builder pollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
            return this;
        }

        /**
         * Builds the pool. Call {@link WorkerPool#start(int)} to launch it.
         *
         * @return a new pool
         * @throws NullPointerException if {@code broker} or {@code registry} is null, or no
         *     redelivery scheduler is available
         */
        public WorkerPool build() {
            return new WorkerPool(this);
        }
    }
}
