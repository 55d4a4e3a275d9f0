package courier.travel.payment;

import courier.TaskDispatcher;
import courier.TaskEnvelope;
import courier.broker.InMemoryBroker;
import courier.registry.DefaultTaskRegistry;
import courier.spi.BrokerTransport;
import courier.spi.BrokerUnavailableException;
import courier.spi.Delivery;
import courier.spi.DeliveryStream;
import courier.travel.NotificationTasks;
import courier.travel.RecordingEmailSender;
import courier.travel.StubBookingDirectory;
import courier.travel.TravelNotifications;
import courier.travel.booking.PaymentState;
import courier.travel.notification.EmailTemplates;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PaymentReconcilerTest {
    private static final Instant NOW = Instant.parse("2026-10-18T09:30:00Z");

    private final InMemoryBroker broker = new InMemoryBroker();
    private final StubGateway gateway = new StubGateway();
    private final InMemoryReconciliationStore store = new InMemoryReconciliationStore();
    private final StubBookingDirectory directory = new StubBookingDirectory();
    private final DefaultTaskRegistry registry = TravelNotifications.register(DefaultTaskRegistry.builder(),
            directory, new RecordingEmailSender(), new EmailTemplates("no-reply@travel.example")).build();

    @AfterEach
    void tearDown() {
        broker.close();
    }

    private PaymentReconciler reconciler(BrokerTransport transport, ReconciliationListener listener) {
        TaskDispatcher dispatcher = TaskDispatcher.builder()
                .broker(transport)
                .registry(registry)
                .enqueueAttempts(1)
                .enqueueBackoff(Duration.ZERO)
                .build();
        return PaymentReconciler.builder()
                .gateway(gateway)
                .dispatcher(dispatcher)
                .store(store)
                .directory(directory)
                .listener(listener)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    private PaymentReconciler reconciler() {
        return reconciler(broker, ReconciliationListener.NOOP);
    }

    private TaskEnvelope takeEmail() throws InterruptedException {
        try (DeliveryStream stream = broker.consume("emails")) {
            Delivery delivery = stream.next(Duration.ofSeconds(1));
            broker.ack(delivery);
            return delivery.envelope();
        }
    }

    // ── Terminal states ──

    @Test
    void confirmedPaymentEnqueuesConfirmationEmail() throws Exception {
        directory.withPayment("tx1", "b1", PaymentState.PENDING);
        gateway.answer("tx1", PaymentStatus.CONFIRMED);

        ReconciliationResult result = reconciler().verify("tx1").orElseThrow();

        assertEquals(new ReconciliationResult("tx1", "b1", PaymentStatus.CONFIRMED, NOW, "CHK-tx1"), result);
        assertTrue(store.isNotified("tx1"));
        assertEquals(1, broker.pendingCount("emails"));
        TaskEnvelope task = takeEmail();
        assertEquals(NotificationTasks.PAYMENT_CONFIRMATION.taskName(), task.taskName());
        assertEquals("tx1", task.argument("transactionRef"));
        assertEquals("b1", task.argument("bookingId"));
        assertEquals(3, task.maxRetries());
    }

    @Test
    void failedPaymentEnqueuesFailureEmail() throws Exception {
        directory.withPayment("tx1", "b1", PaymentState.PENDING);
        gateway.answer("tx1", PaymentStatus.FAILED);

        ReconciliationResult result = reconciler().verify("tx1").orElseThrow();

        assertEquals(PaymentStatus.FAILED, result.status());
        assertEquals(NotificationTasks.PAYMENT_FAILED.taskName(), takeEmail().taskName());
    }

    @Test
    void pendingPaymentRecordsNothing() {
        Optional<ReconciliationResult> result = reconciler().verify("tx1");

        assertTrue(result.isEmpty());
        assertTrue(store.find("tx1").isEmpty());
        assertEquals(0, broker.pendingCount("emails"));
    }

    @Test
    void bookingIdFallsBackToTransactionRef() {
        String ref = TransactionRefs.generate("b42");
        gateway.answer(ref, PaymentStatus.CONFIRMED);

        assertEquals("b42", reconciler().verify(ref).orElseThrow().bookingId());
    }

    @Test
    void unattributablePaymentIsRejected() {
        gateway.answer("mystery", PaymentStatus.CONFIRMED);

        assertThrows(IllegalStateException.class, () -> reconciler().verify("mystery"));
        assertEquals(0, broker.pendingCount("emails"));
    }

    @Test
    void blankReferenceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> reconciler().verify(" "));
        assertEquals(0, gateway.calls.get());
    }

    @Test
    void gatewayFailurePropagates() {
        gateway.failure = new GatewayException("provider returned 503");

        assertThrows(GatewayException.class, () -> reconciler().verify("tx1"));
        assertTrue(store.find("tx1").isEmpty());
    }

    @Test
    void rejectedCredentialsLeaveReferenceOpenForLaterVerification() throws Exception {
        directory.withPayment("tx1", "b1", PaymentState.PENDING);
        gateway.answer("tx1", PaymentStatus.CONFIRMED);
        gateway.failure = new GatewayException("Chapa rejected credentials with HTTP 401 for tx1");
        PaymentReconciler reconciler = reconciler();

        assertThrows(GatewayException.class, () -> reconciler.verify("tx1"));
        assertTrue(store.find("tx1").isEmpty());
        assertEquals(0, broker.pendingCount("emails"));

        gateway.failure = null;
        ReconciliationResult result = reconciler.verify("tx1").orElseThrow();

        assertEquals(PaymentStatus.CONFIRMED, result.status());
        assertEquals(2, gateway.calls.get());
        assertEquals(NotificationTasks.PAYMENT_CONFIRMATION.taskName(), takeEmail().taskName());
    }

    // ── Exactly one notification ──

    @Test
    void duplicateVerificationEnqueuesOnce() {
        directory.withPayment("tx1", "b1", PaymentState.PENDING);
        gateway.answer("tx1", PaymentStatus.CONFIRMED);
        PaymentReconciler reconciler = reconciler();

        ReconciliationResult first = reconciler.verify("tx1").orElseThrow();
        ReconciliationResult second = reconciler.verify("tx1").orElseThrow();

        assertEquals(first, second);
        assertEquals(1, gateway.calls.get());
        assertEquals(1, broker.pendingCount("emails"));
    }

    @Test
    void terminalStateNeverChanges() {
        directory.withPayment("tx1", "b1", PaymentState.PENDING);
        gateway.answer("tx1", PaymentStatus.FAILED);
        PaymentReconciler reconciler = reconciler();
        reconciler.verify("tx1");

        gateway.answer("tx1", PaymentStatus.CONFIRMED);

        assertEquals(PaymentStatus.FAILED, reconciler.verify("tx1").orElseThrow().status());
        assertEquals(1, broker.pendingCount("emails"));
    }

    @Test
    void concurrentVerificationsEnqueueOnce() throws Exception {
        directory.withPayment("tx1", "b1", PaymentState.PENDING);
        gateway.answer("tx1", PaymentStatus.CONFIRMED);
        PaymentReconciler reconciler = reconciler();
        int callers = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        try {
            List<Future<Optional<ReconciliationResult>>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return reconciler.verify("tx1");
                }));
            }
            start.countDown();
            for (Future<Optional<ReconciliationResult>> future : futures) {
                assertEquals(PaymentStatus.CONFIRMED, future.get(5, TimeUnit.SECONDS).orElseThrow().status());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, broker.pendingCount("emails"));
    }

    @Test
    void listenerRunsBeforeEnqueue() {
        directory.withPayment("tx1", "b1", PaymentState.PENDING);
        gateway.answer("tx1", PaymentStatus.CONFIRMED);
        List<String> events = new CopyOnWriteArrayList<>();
        PaymentReconciler reconciler = reconciler(broker, result -> {
            events.add("listener:" + result.status());
            events.add("queued:" + broker.pendingCount("emails"));
        });

        reconciler.verify("tx1");
        reconciler.verify("tx1");

        assertEquals(List.of("listener:CONFIRMED", "queued:0"), events);
        assertEquals(1, broker.pendingCount("emails"));
    }

    @Test
    void failedEnqueueReleasesMarkerForNextVerification() {
        directory.withPayment("tx1", "b1", PaymentState.PENDING);
        gateway.answer("tx1", PaymentStatus.CONFIRMED);
        FlakyBroker flaky = new FlakyBroker(broker);
        flaky.down = true;
        PaymentReconciler reconciler = reconciler(flaky, ReconciliationListener.NOOP);

        assertThrows(BrokerUnavailableException.class, () -> reconciler.verify("tx1"));
        assertTrue(store.find("tx1").isPresent());
        assertFalse(store.isNotified("tx1"));
        assertEquals(0, broker.pendingCount("emails"));

        flaky.down = false;
        reconciler.verify("tx1");

        assertTrue(store.isNotified("tx1"));
        assertEquals(1, broker.pendingCount("emails"));
        assertEquals(1, gateway.calls.get());
    }

    @Test
    void failingListenerAbortsNotification() {
        directory.withPayment("tx1", "b1", PaymentState.PENDING);
        gateway.answer("tx1", PaymentStatus.CONFIRMED);
        PaymentReconciler reconciler = reconciler(broker, result -> {
            throw new IllegalStateException("booking table locked");
        });

        assertThrows(IllegalStateException.class, () -> reconciler.verify("tx1"));
        assertFalse(store.isNotified("tx1"));
        assertEquals(0, broker.pendingCount("emails"));
    }

    // ── Unconfirmed notifications ──

    @Test
    void enqueuedNotificationIsConfirmed() {
        directory.withPayment("tx1", "b1", PaymentState.PENDING);
        gateway.answer("tx1", PaymentStatus.CONFIRMED);

        reconciler().verify("tx1");

        assertTrue(store.findUnconfirmedNotifications(10).isEmpty());
    }

    @Test
    void sweepEnqueuesNotificationLostBetweenClaimAndEnqueue() throws Exception {
        // a previous process recorded and claimed tx1, then stopped before enqueueing
        store.recordTerminal(new ReconciliationResult("tx1", "b1", PaymentStatus.FAILED, NOW, null));
        assertTrue(store.claimNotification("tx1"));
        PaymentReconciler reconciler = reconciler();

        reconciler.verify("tx1");
        assertEquals(0, broker.pendingCount("emails"));

        assertEquals(1, reconciler.resendUnconfirmedNotifications(10));
        TaskEnvelope task = takeEmail();
        assertEquals(NotificationTasks.PAYMENT_FAILED.taskName(), task.taskName());
        assertEquals("tx1", task.argument("transactionRef"));
        assertEquals(0, gateway.calls.get());

        assertEquals(0, reconciler.resendUnconfirmedNotifications(10));
        assertEquals(0, broker.pendingCount("emails"));
    }

    @Test
    void sweepContinuesPastFailedEnqueue() {
        store.recordTerminal(new ReconciliationResult("tx1", "b1", PaymentStatus.CONFIRMED, NOW, null));
        store.claimNotification("tx1");
        FlakyBroker flaky = new FlakyBroker(broker);
        flaky.down = true;

        assertEquals(0, reconciler(flaky, ReconciliationListener.NOOP).resendUnconfirmedNotifications(10));
        assertFalse(store.isNotified("tx1"));
        assertEquals(1, store.findUnconfirmedNotifications(10).size());

        assertEquals(1, reconciler().resendUnconfirmedNotifications(10));
        assertEquals(1, broker.pendingCount("emails"));
    }

    @Test
    void builderRequiresGatewayAndDispatcher() {
        assertThrows(NullPointerException.class, () -> PaymentReconciler.builder().gateway(gateway).build());
    }

    /**
     * Rejects every enqueue while {@link #down} is set.
     */
    private static final class FlakyBroker implements BrokerTransport {
        private final BrokerTransport delegate;
        volatile boolean down;

        FlakyBroker(BrokerTransport delegate) {
            this.delegate = delegate;
        }

        @Override
        public void enqueue(TaskEnvelope envelope) {
            if (down) {
                throw new BrokerUnavailableException("connection refused");
            }
            delegate.enqueue(envelope);
        }

        @Override
        public DeliveryStream consume(String queue) {
            return delegate.consume(queue);
        }

        @Override
        public void ack(Delivery delivery) {
            delegate.ack(delivery);
        }

        @Override
        public void reject(Delivery delivery, boolean requeue) {
            delegate.reject(delivery, requeue);
        }
    }
}
