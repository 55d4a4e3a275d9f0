package courier.broker;

import courier.TaskEnvelope;
import courier.codec.EnvelopeCodec;
import courier.codec.EnvelopeCodecException;
import courier.codec.JsonEnvelopeCodec;
import courier.spi.BrokerTransport;
import courier.spi.BrokerUnavailableException;
import courier.spi.Delivery;
import courier.spi.DeliveryStream;
import courier.spi.RedeliveryScheduler;
import courier.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-local {@link BrokerTransport} backed by one blocking deque per queue.
 *
 * <p>Messages are stored encoded, exactly as a remote broker would carry them, so every
 * delivery goes through the {@link EnvelopeCodec}. Delayed redelivery is a scheduled
 * re-publish on a single daemon thread.
 *
 * <p>Nothing survives {@link #close()}: pending messages and scheduled redeliveries are
 * dropped. Use it for tests and single-process deployments that accept that; use the JDBC
 * broker for durability.
 */
public final class InMemoryBroker implements BrokerTransport, RedeliveryScheduler, AutoCloseable {
    private static final Logger logger = Logger.getLogger(InMemoryBroker.class.getName());

    private final EnvelopeCodec codec;
    private final Map<String, LinkedBlockingDeque<Message>> queues = new ConcurrentHashMap<>();
    private final Map<String, Unacked> unacked = new ConcurrentHashMap<>();
    private final AtomicInteger scheduled = new AtomicInteger();
    private final ScheduledExecutorService timer;
    private final AtomicLong tagSequence = new AtomicLong();
    private final AtomicLong streamSequence = new AtomicLong();
    private final AtomicBoolean open = new AtomicBoolean(true);

    public InMemoryBroker() {
        this(JsonEnvelopeCodec.getDefault());
    }

    public InMemoryBroker(EnvelopeCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(1, new DaemonThreadFactory("courier-redelivery-"));
        executor.setRemoveOnCancelPolicy(true);
        this.timer = executor;
    }

    @Override
    public void enqueue(TaskEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        ensureOpen();
        queue(envelope.queue()).offerLast(new Message(codec.encode(envelope), codec.contentType()));
    }

    /**
     * Publishes raw bytes, bypassing the codec. Undecodable messages are discarded on
     * consumption.
     *
     * @param queue       target queue
     * @param body        message body
     * @param contentType content type of the body
     */
    public void enqueueRaw(String queue, byte[] body, String contentType) {
        ensureOpen();
        queue(queue).offerLast(new Message(body.clone(), contentType));
    }

    @Override
    public void scheduleRedelivery(TaskEnvelope envelope, Duration delay) {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(delay, "delay");
        if (delay.isZero() || delay.isNegative()) {
            enqueue(envelope);
            return;
        }
        ensureOpen();
        Message message = new Message(codec.encode(envelope), codec.contentType());
        String queueName = envelope.queue();
        scheduled.incrementAndGet();
        try {
            timer.schedule(() -> {
                scheduled.decrementAndGet();
                if (open.get()) {
                    queue(queueName).offerLast(message);
                }
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            scheduled.decrementAndGet();
            throw new BrokerUnavailableException("In-memory broker is closed", e);
        }
    }

    @Override
    public DeliveryStream consume(String queue) {
        Objects.requireNonNull(queue, "queue");
        ensureOpen();
        return new Stream(queue, "stream-" + streamSequence.incrementAndGet());
    }

    @Override
    public void ack(Delivery delivery) {
        settle(delivery);
    }

    @Override
    public void reject(Delivery delivery, boolean requeue) {
        Unacked entry = settle(delivery);
        if (requeue) {
            queue(entry.queue).offerFirst(entry.message);
        }
    }

    /**
     * Returns the number of messages waiting on a queue, excluding unacknowledged and
     * scheduled ones.
     */
    public int pendingCount(String queue) {
        LinkedBlockingDeque<Message> deque = queues.get(queue);
        return deque == null ? 0 : deque.size();
    }

    /**
     * Returns the number of delivered messages not yet acknowledged or rejected.
     */
    public int unackedCount() {
        return unacked.size();
    }

    /**
     * Returns the number of delayed redeliveries that have not fired yet.
     */
    public int scheduledCount() {
        return scheduled.get();
    }

    /**
     * Stops the redelivery timer and drops everything still held.
     */
    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        List<Runnable> dropped = timer.shutdownNow();
        int pending = queues.values().stream().mapToInt(LinkedBlockingDeque::size).sum();
        if (!dropped.isEmpty() || pending > 0 || !unacked.isEmpty()) {
            logger.log(Level.WARNING, "In-memory broker closed with {0} pending, {1} unacknowledged and "
                    + "{2} scheduled message(s); they are lost",
                    new Object[] {pending, unacked.size(), dropped.size()});
        }
        scheduled.set(0);
    }

    private Unacked settle(Delivery delivery) {
        Objects.requireNonNull(delivery, "delivery");
        Unacked entry = unacked.remove(delivery.tag());
        if (entry == null) {
            throw new IllegalStateException("Unknown or already settled delivery: " + delivery.tag());
        }
        return entry;
    }

    private LinkedBlockingDeque<Message> queue(String name) {
        return queues.computeIfAbsent(name, ignored -> new LinkedBlockingDeque<>());
    }

    private void ensureOpen() {
        if (!open.get()) {
            throw new BrokerUnavailableException("In-memory broker is closed");
        }
    }

    private record Message(byte[] body, String contentType) {
    }

    private record Unacked(String queue, String streamId, Message message) {
    }

    private final class Stream implements DeliveryStream {
        private final String queueName;
        private final String streamId;
        private final LinkedBlockingDeque<Message> deque;
        private volatile boolean closed;

        Stream(String queueName, String streamId) {
            this.queueName = queueName;
            this.streamId = streamId;
            this.deque = queue(queueName);
        }

        @Override
        public Delivery next(Duration timeout) throws InterruptedException {
            if (closed) {
                throw new IllegalStateException("Delivery stream is closed");
            }
            long deadline = System.nanoTime() + timeout.toNanos();
            while (true) {
                long remaining = deadline - System.nanoTime();
                Message message = deque.pollFirst(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
                if (message == null) {
                    return null;
                }
                TaskEnvelope envelope;
                try {
                    envelope = codec.decode(message.body(), message.contentType());
                } catch (EnvelopeCodecException e) {
                    logger.log(Level.SEVERE, "Discarding undecodable message on queue " + queueName, e);
                    continue;
                }
                String tag = streamId + "-" + tagSequence.incrementAndGet();
                unacked.put(tag, new Unacked(queueName, streamId, message));
                return new Delivery(envelope, queueName, tag);
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            unacked.entrySet().removeIf(entry -> {
                Unacked held = entry.getValue();
                if (!held.streamId().equals(streamId)) {
                    return false;
                }
                queue(held.queue()).offerFirst(held.message());
                return true;
            });
        }
    }
}
