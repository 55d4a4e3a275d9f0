package courier.travel.payment;

import courier.TaskDispatcher;
import courier.travel.NotificationTasks;
import courier.travel.booking.BookingDirectory;
import courier.travel.booking.PaymentView;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns provider verifications into reconciliation records and exactly one notification task
 * per transaction reference.
 *
 * <p>Per reference the state moves {@code PENDING -> CONFIRMED | FAILED} and stays there. The
 * first terminal answer is recorded in the {@link ReconciliationStore}; later verifications of
 * the same reference return that record without asking the provider again. The notification is
 * enqueued by whichever call claims the store's notified marker, so duplicate webhooks and
 * concurrent verifications enqueue once. If enqueueing fails the marker is released and the
 * exception propagates; verifying again retries.
 *
 * <p>A process that stops between claiming the marker and enqueueing leaves the reference
 * claimed with no task on the broker, and later verifications do not notify it again. Each
 * successful enqueue is therefore confirmed in the store, and
 * {@link #resendUnconfirmedNotifications(int)} enqueues the notification of every terminal
 * reference that was never confirmed. Run it at startup or on a schedule; a reference whose
 * verification is still in flight may then be notified twice, which the email handlers tolerate.
 *
 * <pre>{@code
 * PaymentReconciler reconciler = PaymentReconciler.builder()
 *     .gateway(chapa)
 *     .dispatcher(courier.dispatcher())
 *     .store(new JdbcReconciliationStore(connections))
 *     .directory(bookings)
 *     .build();
 * }</pre>
 */
public final class PaymentReconciler {
    private static final Logger logger = Logger.getLogger(PaymentReconciler.class.getName());

    private final PaymentGateway gateway;
    private final TaskDispatcher dispatcher;
    private final ReconciliationStore store;
    private final BookingDirectory directory;
    private final ReconciliationListener listener;
    private final Clock clock;

    private PaymentReconciler(Builder builder) {
        this.gateway = Objects.requireNonNull(builder.gateway, "gateway");
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
        this.store = builder.store != null ? builder.store : new InMemoryReconciliationStore();
        this.directory = builder.directory;
        this.listener = builder.listener;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Verifies a transaction and enqueues its notification if this is the first terminal
     * observation that has not been notified yet.
     *
     * @param transactionRef reference to verify
     * @return the terminal result, or empty while the provider still reports the payment pending
     * @throws GatewayException                       if the provider could not be asked
     * @throws courier.spi.EnqueueException           if the notification could not be enqueued
     * @throws IllegalStateException                  if the booking of the payment cannot be determined
     */
    public Optional<ReconciliationResult> verify(String transactionRef) {
        Objects.requireNonNull(transactionRef, "transactionRef");
        if (transactionRef.isBlank()) {
            throw new IllegalArgumentException("transactionRef must not be blank");
        }

        ReconciliationResult result;
        Optional<ReconciliationResult> known = store.find(transactionRef);
        if (known.isPresent()) {
            result = known.get();
            logger.log(Level.FINE, "Transaction {0} already reconciled as {1}",
                    new Object[] {transactionRef, result.status()});
        } else {
            ProviderVerification verification = gateway.verify(transactionRef);
            if (!verification.status().isTerminal()) {
                logger.log(Level.FINE, "Transaction {0} still pending (provider status {1})",
                        new Object[] {transactionRef, verification.rawStatus()});
                return Optional.empty();
            }
            ReconciliationResult candidate = new ReconciliationResult(transactionRef,
                    bookingIdFor(transactionRef), verification.status(), clock.instant(),
                    verification.providerReference());
            result = store.recordTerminal(candidate);
            if (result.equals(candidate)) {
                logger.log(Level.INFO, "Transaction {0} reconciled as {1} for booking {2}",
                        new Object[] {transactionRef, result.status(), result.bookingId()});
            }
        }

        notifyOnce(result);
        return Optional.of(result);
    }

    /**
     * Enqueues the notification of terminal references whose enqueue was never confirmed,
     * oldest first. A failure on one reference is logged and the sweep moves on.
     *
     * @param limit maximum number of references to look at
     * @return the number of notifications enqueued
     */
    public int resendUnconfirmedNotifications(int limit) {
        List<ReconciliationResult> unconfirmed = store.findUnconfirmedNotifications(limit);
        int sent = 0;
        for (ReconciliationResult result : unconfirmed) {
            store.releaseNotification(result.transactionRef());
            try {
                if (notifyOnce(result)) {
                    sent++;
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Could not resend notification for " + result.transactionRef(), e);
            }
        }
        if (sent > 0) {
            logger.log(Level.INFO, "Resent {0} unconfirmed payment notification(s)", sent);
        }
        return sent;
    }

    private boolean notifyOnce(ReconciliationResult result) {
        String transactionRef = result.transactionRef();
        if (!store.claimNotification(transactionRef)) {
            return false;
        }
        try {
            listener.onReconciled(result);
            dispatcher.dispatch(notificationFor(result), Map.of(
                    NotificationTasks.TRANSACTION_REF, transactionRef,
                    NotificationTasks.BOOKING_ID, result.bookingId()));
        } catch (RuntimeException e) {
            store.releaseNotification(transactionRef);
            throw e;
        }
        try {
            store.confirmNotification(transactionRef);
        } catch (RuntimeException e) {
            // the task is on the broker; a later sweep may send it once more
            logger.log(Level.WARNING, "Could not confirm notification of " + transactionRef, e);
        }
        return true;
    }

    private String bookingIdFor(String transactionRef) {
        Optional<String> fromRecord = directory == null
                ? Optional.empty()
                : directory.findPayment(transactionRef).map(PaymentView::bookingId);
        return fromRecord
                .or(() -> TransactionRefs.bookingIdOf(transactionRef))
                .orElseThrow(() -> new IllegalStateException(
                        "Cannot determine the booking of transaction " + transactionRef));
    }

    private static NotificationTasks notificationFor(ReconciliationResult result) {
        return result.status() == PaymentStatus.CONFIRMED
                ? NotificationTasks.PAYMENT_CONFIRMATION
                : NotificationTasks.PAYMENT_FAILED;
    }

    /**
     * Builder for {@link PaymentReconciler}.
     */
    public static final class Builder {
        private PaymentGateway gateway;
        private TaskDispatcher dispatcher;
        private ReconciliationStore store;
        private BookingDirectory directory;
        private ReconciliationListener listener = ReconciliationListener.NOOP;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /**
         * <b>Required.</b> Provider to verify against.
         */
        public Builder gateway(PaymentGateway gateway) {
            this.gateway = gateway;
            return this;
        }

        /**
         * <b>Required.</b> Dispatcher that enqueues the payment notifications.
         */
        public Builder dispatcher(TaskDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /**
         * Optional. Defaults to an {@link InMemoryReconciliationStore}; use the JDBC store when
         * several instances receive webhooks.
         */
        public Builder store(ReconciliationStore store) {
            this.store = store;
            return this;
        }

        /**
         * Optional. Used to find the booking of a payment; without it the booking id is parsed
         * from the transaction reference.
         */
        public Builder directory(BookingDirectory directory) {
            this.directory = directory;
            return this;
        }

        /**
         * Optional. Defaults to {@link ReconciliationListener#NOOP}.
         */
        public Builder listener(ReconciliationListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        /**
         * Optional. Defaults to the UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public PaymentReconciler build() {
            return new PaymentReconciler(this);
        }
    }
}
