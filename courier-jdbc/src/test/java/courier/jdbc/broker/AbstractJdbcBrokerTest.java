package courier.jdbc.broker;

import courier.TaskEnvelope;
import courier.jdbc.DataSourceConnectionProvider;
import courier.spi.Delivery;
import courier.spi.DeliveryStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Broker behaviour shared by every database. Subclasses provide the DataSource (with the
 * schema applied) and the store.
 */
abstract class AbstractJdbcBrokerTest {
    static final Duration WAIT = Duration.ofSeconds(2);
    static final Duration SHORT = Duration.ofMillis(50);

    JdbcBroker broker;

    abstract DataSource dataSource();

    abstract AbstractJdbcQueueStore store();

    @BeforeEach
    void setUpBroker() throws Exception {
        try (Connection conn = dataSource().getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("DELETE FROM courier_message");
        }
        broker = newBroker(Duration.ofMinutes(5));
    }

    JdbcBroker newBroker(Duration leaseTimeout) {
        return JdbcBroker.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource()))
                .store(store())
                .leaseTimeout(leaseTimeout)
                .pollInterval(Duration.ofMillis(10))
                .build();
    }

    static TaskEnvelope envelope(String queue) {
        return TaskEnvelope.builder("send_booking_confirmation_email")
                .queue(queue)
                .maxRetries(3)
                .argument("bookingId", "b-" + UUID.randomUUID())
                .build();
    }

    // ── Round trip ──

    @Test
    void enqueuedEnvelopeIsDeliveredUnchanged() throws Exception {
        TaskEnvelope sent = envelope("emails");
        broker.enqueue(sent);

        try (DeliveryStream stream = broker.consume("emails")) {
            Delivery delivery = stream.next(WAIT);
            assertNotNull(delivery);
            assertEquals("emails", delivery.queue());
            assertEquals(sent.id(), delivery.envelope().id());
            assertEquals(sent.taskName(), delivery.envelope().taskName());
            assertEquals(sent.payload(), delivery.envelope().payload());
            assertEquals(3, delivery.envelope().maxRetries());
            broker.ack(delivery);
        }
        assertEquals(0, broker.storedCount("emails"));
    }

    @Test
    void queuesAreIsolated() throws Exception {
        broker.enqueue(envelope("emails"));

        try (DeliveryStream stream = broker.consume("payments")) {
            assertNull(stream.next(SHORT));
        }
        assertEquals(1, broker.pendingCount("emails"));
    }

    @Test
    void emptyQueueTimesOut() throws Exception {
        try (DeliveryStream stream = broker.consume("emails")) {
            assertNull(stream.next(SHORT));
        }
    }

    // ── Settlement ──

    @Test
    void rejectWithRequeueMakesMessageVisibleAgain() throws Exception {
        TaskEnvelope sent = envelope("emails");
        broker.enqueue(sent);

        try (DeliveryStream stream = broker.consume("emails")) {
            Delivery first = stream.next(WAIT);
            broker.reject(first, true);
            Delivery second = stream.next(WAIT);
            assertNotNull(second);
            assertEquals(sent.id(), second.envelope().id());
            broker.ack(second);
        }
        assertEquals(0, broker.storedCount("emails"));
    }

    @Test
    void rejectWithoutRequeueDiscards() throws Exception {
        broker.enqueue(envelope("emails"));

        try (DeliveryStream stream = broker.consume("emails")) {
            broker.reject(stream.next(WAIT), false);
            assertNull(stream.next(SHORT));
        }
        assertEquals(0, broker.storedCount("emails"));
    }

    @Test
    void settlingTwiceFails() throws Exception {
        broker.enqueue(envelope("emails"));

        try (DeliveryStream stream = broker.consume("emails")) {
            Delivery delivery = stream.next(WAIT);
            broker.ack(delivery);
            assertThrows(IllegalStateException.class, () -> broker.ack(delivery));
            assertThrows(IllegalStateException.class, () -> broker.reject(delivery, true));
        }
    }

    // ── Visibility and leases ──

    @Test
    void claimedMessageIsInvisibleToOtherStreams() throws Exception {
        broker.enqueue(envelope("emails"));

        try (DeliveryStream owner = broker.consume("emails");
             DeliveryStream other = broker.consume("emails")) {
            Delivery delivery = owner.next(WAIT);
            assertNotNull(delivery);
            assertNull(other.next(SHORT));
            assertEquals(1, broker.unackedCount());
            broker.ack(delivery);
        }
    }

    @Test
    void closingStreamReturnsUnacknowledgedMessages() throws Exception {
        TaskEnvelope sent = envelope("emails");
        broker.enqueue(sent);

        DeliveryStream first = broker.consume("emails");
        assertNotNull(first.next(WAIT));
        first.close();
        assertEquals(0, broker.unackedCount());

        try (DeliveryStream second = broker.consume("emails")) {
            Delivery again = second.next(WAIT);
            assertNotNull(again);
            assertEquals(sent.id(), again.envelope().id());
            broker.ack(again);
        }
    }

    @Test
    void nextOnClosedStreamFails() {
        DeliveryStream stream = broker.consume("emails");
        stream.close();
        assertThrows(IllegalStateException.class, () -> stream.next(SHORT));
    }

    @Test
    void abandonedLeaseIsReclaimedAfterTimeout() throws Exception {
        JdbcBroker shortLease = newBroker(Duration.ofMillis(200));
        TaskEnvelope sent = envelope("emails");
        shortLease.enqueue(sent);

        DeliveryStream crashed = shortLease.consume("emails");
        Delivery stale = crashed.next(WAIT);
        assertNotNull(stale);

        try (DeliveryStream survivor = shortLease.consume("emails")) {
            assertNull(survivor.next(Duration.ofMillis(20)));
            Delivery reclaimed = survivor.next(WAIT);
            assertNotNull(reclaimed);
            assertEquals(sent.id(), reclaimed.envelope().id());

            // the stale owner no longer holds the lease, so its ack leaves the row alone
            shortLease.ack(stale);
            assertEquals(1, shortLease.storedCount("emails"));

            shortLease.ack(reclaimed);
        }
        assertEquals(0, shortLease.storedCount("emails"));
    }

    // ── Delayed redelivery ──

    @Test
    void scheduledRedeliveryBecomesVisibleAfterDelay() throws Exception {
        TaskEnvelope retry = envelope("emails").nextAttempt();
        broker.scheduleRedelivery(retry, Duration.ofMillis(400));

        assertEquals(1, broker.storedCount("emails"));
        assertEquals(0, broker.pendingCount("emails"));
        try (DeliveryStream stream = broker.consume("emails")) {
            assertNull(stream.next(SHORT));
            Delivery delivery = stream.next(WAIT);
            assertNotNull(delivery);
            assertEquals(1, delivery.envelope().attempt());
            broker.ack(delivery);
        }
    }

    @Test
    void zeroDelayRedeliveryIsImmediatelyVisible() throws Exception {
        broker.scheduleRedelivery(envelope("emails"), Duration.ZERO);
        assertEquals(1, broker.pendingCount("emails"));
    }

    // ── Malformed messages ──

    @Test
    void undecodableMessageIsDiscarded() throws Exception {
        broker.enqueueRaw("emails", "not an envelope".getBytes(StandardCharsets.UTF_8), "text/plain");
        TaskEnvelope sent = envelope("emails");
        broker.enqueue(sent);

        try (DeliveryStream stream = broker.consume("emails")) {
            Delivery delivery = stream.next(WAIT);
            assertNotNull(delivery);
            assertEquals(sent.id(), delivery.envelope().id());
            broker.ack(delivery);
        }
        assertEquals(0, broker.storedCount("emails"));
    }

    // ── Concurrency ──

    @Test
    void concurrentConsumersNeverShareAMessage() throws Exception {
        int messages = 40;
        for (int i = 0; i < messages; i++) {
            broker.enqueue(envelope("emails"));
        }

        Set<UUID> seen = ConcurrentHashMap.newKeySet();
        AtomicInteger deliveries = new AtomicInteger();
        ExecutorService consumers = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            futures.add(consumers.submit(() -> {
                try (DeliveryStream stream = broker.consume("emails")) {
                    Delivery delivery;
                    while ((delivery = stream.next(Duration.ofMillis(300))) != null) {
                        seen.add(delivery.envelope().id());
                        deliveries.incrementAndGet();
                        broker.ack(delivery);
                    }
                }
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        consumers.shutdown();

        assertEquals(messages, deliveries.get());
        assertEquals(messages, seen.size());
        assertEquals(0, broker.storedCount("emails"));
    }
}
