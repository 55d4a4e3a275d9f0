package courier.jdbc.broker;

import com.github.f4b6a3.ulid.UlidCreator;
import courier.TaskEnvelope;
import courier.codec.EnvelopeCodec;
import courier.codec.EnvelopeCodecException;
import courier.codec.JsonEnvelopeCodec;
import courier.jdbc.CourierStoreException;
import courier.spi.BrokerTransport;
import courier.spi.BrokerUnavailableException;
import courier.spi.ConnectionProvider;
import courier.spi.Delivery;
import courier.spi.DeliveryStream;
import courier.spi.RedeliveryScheduler;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable {@link BrokerTransport} backed by a single relational table.
 *
 * <p>Consumers lease rows: a claim writes the stream's owner id and the claim time, an
 * acknowledgement deletes the row, a requeue clears the lease. A lease older than
 * {@linkplain Builder#leaseTimeout(Duration) the lease timeout} is treated as abandoned and the
 * row becomes claimable again, which covers consumers that died without closing their stream.
 * Delayed redelivery is an insert with a future {@code available_at}, so scheduled retries
 * survive restarts.
 *
 * <p>Every operation borrows its own connection in auto-commit mode and never joins the
 * caller's transaction. Use {@code dispatchAfterCommit} on the dispatcher to tie enqueues to a
 * business transaction.
 *
 * <pre>{@code
 * JdbcBroker broker = JdbcBroker.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .build();
 * }</pre>
 */
public final class JdbcBroker implements BrokerTransport, RedeliveryScheduler {
    private static final Logger logger = Logger.getLogger(JdbcBroker.class.getName());

    private final ConnectionProvider connectionProvider;
    private final AbstractJdbcQueueStore store;
    private final EnvelopeCodec codec;
    private final Duration leaseTimeout;
    private final Duration pollInterval;
    private final Map<String, Lease> leases = new ConcurrentHashMap<>();

    private JdbcBroker(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = builder.store != null ? builder.store : JdbcQueueStores.detect(connectionProvider);
        this.codec = builder.codec;
        this.leaseTimeout = builder.leaseTimeout;
        this.pollInterval = builder.pollInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    public AbstractJdbcQueueStore store() {
        return store;
    }

    @Override
    public void enqueue(TaskEnvelope envelope) {
        insert(envelope, Instant.now());
    }

    /**
     * Inserts the envelope with {@code available_at} set {@code delay} into the future.
     */
    @Override
    public void scheduleRedelivery(TaskEnvelope envelope, Duration delay) {
        Objects.requireNonNull(delay, "delay");
        Instant now = Instant.now();
        insert(envelope, delay.isNegative() ? now : now.plus(delay));
    }

    /**
     * Inserts a raw body, bypassing the codec. Undecodable messages are discarded on
     * consumption.
     *
     * @param queue       target queue
     * @param body        message body
     * @param contentType content type of the body
     */
    public void enqueueRaw(String queue, byte[] body, String contentType) {
        Instant now = Instant.now();
        QueuedMessage message = new QueuedMessage(newMessageId(), null, null, queue,
                new String(body, StandardCharsets.UTF_8), contentType, now);
        String failure = "Failed to enqueue raw message on queue " + queue;
        withConnection(failure, conn -> {
            store.insert(conn, message, now);
            return null;
        }, BrokerUnavailableException::new);
    }

    @Override
    public DeliveryStream consume(String queue) {
        Objects.requireNonNull(queue, "queue");
        return new JdbcStream(queue, "courier-" + UlidCreator.getMonotonicUlid());
    }

    @Override
    public void ack(Delivery delivery) {
        Lease lease = settle(delivery);
        int deleted = withConnection("Failed to acknowledge message " + lease.messageId,
                conn -> store.delete(conn, lease.messageId, lease.ownerId), CourierStoreException::new);
        if (deleted == 0) {
            logger.log(Level.WARNING, "Lease on message {0} expired before acknowledgement; "
                    + "task {1} may run again", new Object[] {lease.messageId, delivery.envelope().id()});
        }
    }

    @Override
    public void reject(Delivery delivery, boolean requeue) {
        Lease lease = settle(delivery);
        if (requeue) {
            withConnection("Failed to requeue message " + lease.messageId,
                    conn -> store.release(conn, lease.messageId, lease.ownerId), CourierStoreException::new);
        } else {
            withConnection("Failed to discard message " + lease.messageId,
                    conn -> store.delete(conn, lease.messageId, lease.ownerId), CourierStoreException::new);
        }
    }

    /**
     * Returns the number of messages on a queue that are ready and not leased.
     */
    public int pendingCount(String queue) {
        return withConnection("Failed to count messages on queue " + queue,
                conn -> store.countAvailable(conn, queue, Instant.now()), CourierStoreException::new);
    }

    /**
     * Returns the number of stored messages on a queue, including leased and delayed ones.
     */
    public int storedCount(String queue) {
        return withConnection("Failed to count messages on queue " + queue,
                conn -> store.countAll(conn, queue), CourierStoreException::new);
    }

    /**
     * Returns the number of deliveries handed out by this broker and not yet settled.
     */
    public int unackedCount() {
        return leases.size();
    }

    private void insert(TaskEnvelope envelope, Instant availableAt) {
        Objects.requireNonNull(envelope, "envelope");
        QueuedMessage message = new QueuedMessage(newMessageId(), envelope.id().toString(),
                envelope.taskName(), envelope.queue(),
                new String(codec.encode(envelope), StandardCharsets.UTF_8), codec.contentType(), availableAt);
        String failure = "Failed to enqueue task " + envelope.taskName() + " on queue " + envelope.queue();
        withConnection(failure, conn -> {
            store.insert(conn, message, Instant.now());
            return null;
        }, BrokerUnavailableException::new);
    }

    private Lease settle(Delivery delivery) {
        Objects.requireNonNull(delivery, "delivery");
        Lease lease = leases.remove(delivery.tag());
        if (lease == null) {
            throw new IllegalStateException("Unknown or already settled delivery: " + delivery.tag());
        }
        return lease;
    }

    private <T> T withConnection(String failure, SqlWork<T> work,
            BiFunction<String, Throwable, ? extends RuntimeException> onError) {
        try (Connection conn = connectionProvider.getConnection()) {
            return work.run(conn);
        } catch (SQLException | CourierStoreException e) {
            throw onError.apply(failure, e);
        }
    }

    private static String newMessageId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn);
    }

    private record Lease(String messageId, String ownerId) {
    }

    private final class JdbcStream implements DeliveryStream {
        private final String queue;
        private final String ownerId;
        private volatile boolean closed;

        JdbcStream(String queue, String ownerId) {
            this.queue = queue;
            this.ownerId = ownerId;
        }

        @Override
        public Delivery next(Duration timeout) throws InterruptedException {
            Objects.requireNonNull(timeout, "timeout");
            long deadline = System.nanoTime() + timeout.toNanos();
            while (true) {
                if (closed) {
                    throw new IllegalStateException("Delivery stream on queue " + queue + " is closed");
                }
                Delivery delivery = poll();
                if (delivery != null) {
                    return delivery;
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return null;
                }
                TimeUnit.NANOSECONDS.sleep(Math.min(remaining, pollInterval.toNanos()));
            }
        }

        private Delivery poll() {
            while (true) {
                Instant now = Instant.now();
                Optional<QueuedMessage> claimed = withConnection("Failed to claim from queue " + queue,
                        conn -> store.claimNext(conn, queue, ownerId, now, now.minus(leaseTimeout)),
                        CourierStoreException::new);
                if (claimed.isEmpty()) {
                    return null;
                }
                QueuedMessage message = claimed.get();
                TaskEnvelope envelope;
                try {
                    envelope = codec.decode(message.body().getBytes(StandardCharsets.UTF_8), message.contentType());
                } catch (EnvelopeCodecException e) {
                    logger.log(Level.SEVERE, "Discarding undecodable message " + message.messageId()
                            + " on queue " + queue, e);
                    withConnection("Failed to discard message " + message.messageId(),
                            conn -> store.delete(conn, message.messageId(), ownerId), CourierStoreException::new);
                    continue;
                }
                String tag = message.messageId() + "@" + ownerId;
                leases.put(tag, new Lease(message.messageId(), ownerId));
                return new Delivery(envelope, queue, tag);
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            leases.values().removeIf(lease -> lease.ownerId.equals(ownerId));
            int released = withConnection("Failed to release leases of " + ownerId,
                    conn -> store.releaseAll(conn, ownerId), CourierStoreException::new);
            if (released > 0) {
                logger.log(Level.FINE, "Returned {0} unacknowledged message(s) to queue {1}",
                        new Object[] {released, queue});
            }
        }
    }

    /**
     * Builder for {@link JdbcBroker}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private AbstractJdbcQueueStore store;
        private EnvelopeCodec codec = JsonEnvelopeCodec.getDefault();
        private Duration leaseTimeout = Duration.ofMinutes(5);
        private Duration pollInterval = Duration.ofMillis(100);

        private Builder() {
        }

        /**
         * <b>Required.</b> Source of connections; one is borrowed per operation.
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Optional. Defaults to the store detected from the connection URL.
         */
        public Builder store(AbstractJdbcQueueStore store) {
            this.store = store;
            return this;
        }

        /**
         * Optional. Defaults to {@link JsonEnvelopeCodec#getDefault()}.
         */
        public Builder codec(EnvelopeCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
            return this;
        }

        /**
         * Optional. Age after which an unacknowledged lease is considered abandoned. Must exceed
         * the longest handler run. Defaults to 5 minutes.
         */
        public Builder leaseTimeout(Duration leaseTimeout) {
            Objects.requireNonNull(leaseTimeout, "leaseTimeout");
            if (leaseTimeout.isZero() || leaseTimeout.isNegative()) {
                throw new IllegalArgumentException("leaseTimeout must be positive");
            }
            this.leaseTimeout = leaseTimeout;
            return this;
        }

        /**
         * Optional. Sleep between empty claims while a stream waits. Defaults to 100 ms.
         */
        public Builder pollInterval(Duration pollInterval) {
            Objects.requireNonNull(pollInterval, "pollInterval");
            if (pollInterval.isZero() || pollInterval.isNegative()) {
                throw new IllegalArgumentException("pollInterval must be positive");
            }
            this.pollInterval = pollInterval;
            return this;
        }

        public JdbcBroker build() {
            return new JdbcBroker(this);
        }
    }
}
