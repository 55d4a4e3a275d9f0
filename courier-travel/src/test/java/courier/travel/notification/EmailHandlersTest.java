package courier.travel.notification;

import courier.TaskEnvelope;
import courier.TaskOutcome;
import courier.travel.NotificationTasks;
import courier.travel.RecordingEmailSender;
import courier.travel.StubBookingDirectory;
import courier.travel.booking.BookingStatus;
import courier.travel.booking.PaymentState;
import courier.travel.mail.EmailMessage;
import courier.travel.mail.SendResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmailHandlersTest {
    private final StubBookingDirectory directory = new StubBookingDirectory();
    private final RecordingEmailSender sender = new RecordingEmailSender();
    private final EmailTemplates templates = new EmailTemplates("no-reply@travel.example");

    private final BookingConfirmationEmailHandler bookingHandler =
            new BookingConfirmationEmailHandler(directory, sender, templates);
    private final PaymentConfirmationEmailHandler paymentHandler =
            new PaymentConfirmationEmailHandler(directory, sender, templates);
    private final PaymentFailedEmailHandler failedHandler =
            new PaymentFailedEmailHandler(directory, sender, templates);

    private static TaskEnvelope task(NotificationTasks name, Map<String, String> payload) {
        return TaskEnvelope.builder(name).queue("emails").payload(payload).build();
    }

    private static TaskEnvelope paymentTask(NotificationTasks name, String ref) {
        return task(name, Map.of("transactionRef", ref, "bookingId", "b1"));
    }

    // ── Booking confirmation ──

    @Test
    void bookingConfirmationIsSentToGuest() throws Exception {
        directory.withBooking("b1", BookingStatus.CONFIRMED);

        TaskOutcome outcome = bookingHandler.handle(task(NotificationTasks.BOOKING_CONFIRMATION, Map.of("bookingId", "b1")));

        assertEquals(TaskOutcome.success(), outcome);
        assertEquals(1, sender.sent.size());
        EmailMessage message = sender.sent.get(0);
        assertEquals("abebe@example.com", message.to());
        assertEquals("no-reply@travel.example", message.from());
        assertEquals("Booking Confirmed - Lakeside Cabin", message.subject());
    }

    @Test
    void bookingStateIsReadAtExecutionTime() throws Exception {
        directory.withBooking("b1", BookingStatus.CONFIRMED);
        TaskEnvelope envelope = task(NotificationTasks.BOOKING_CONFIRMATION, Map.of("bookingId", "b1"));
        directory.withBooking("b1", BookingStatus.CANCELLED);

        assertEquals(TaskOutcome.success(), bookingHandler.handle(envelope));
        assertEquals(0, sender.sent.size());
    }

    @Test
    void missingBookingIsFatal() throws Exception {
        TaskOutcome outcome = bookingHandler.handle(task(NotificationTasks.BOOKING_CONFIRMATION, Map.of("bookingId", "nope")));
        assertInstanceOf(TaskOutcome.FatalFailure.class, outcome);
        assertTrue(((TaskOutcome.FatalFailure) outcome).reason().contains("nope"));
    }

    @Test
    void missingArgumentIsFatal() throws Exception {
        assertInstanceOf(TaskOutcome.FatalFailure.class,
                bookingHandler.handle(task(NotificationTasks.BOOKING_CONFIRMATION, Map.of())));
        assertInstanceOf(TaskOutcome.FatalFailure.class,
                paymentHandler.handle(task(NotificationTasks.PAYMENT_CONFIRMATION, Map.of("transactionRef", " "))));
    }

    // ── Transport outcomes ──

    @Test
    void transientTransportErrorIsRetryable() throws Exception {
        directory.withBooking("b1", BookingStatus.CONFIRMED);
        sender.then(SendResult.transientError("connection timed out"));

        TaskOutcome outcome = bookingHandler.handle(task(NotificationTasks.BOOKING_CONFIRMATION, Map.of("bookingId", "b1")));

        assertEquals(TaskOutcome.retryable("connection timed out"), outcome);
    }

    @Test
    void invalidRecipientIsFatal() throws Exception {
        directory.withBooking("b1", BookingStatus.CONFIRMED);
        sender.then(SendResult.permanentError("Recipient rejected"));

        TaskOutcome outcome = bookingHandler.handle(task(NotificationTasks.BOOKING_CONFIRMATION, Map.of("bookingId", "b1")));

        assertEquals(TaskOutcome.fatal("Recipient rejected"), outcome);
    }

    @Test
    void directoryOutagePropagatesToWorker() {
        BookingConfirmationEmailHandler handler = new BookingConfirmationEmailHandler(new StubBookingDirectory() {
            @Override
            public java.util.Optional<courier.travel.booking.BookingView> findBooking(String bookingId) {
                throw new IllegalStateException("database unavailable");
            }
        }, sender, templates);

        assertThrows(IllegalStateException.class,
                () -> handler.handle(task(NotificationTasks.BOOKING_CONFIRMATION, Map.of("bookingId", "b1"))));
    }

    // ── Payment notifications ──

    @Test
    void paymentConfirmationWaitsForPendingPayment() throws Exception {
        directory.withBooking("b1", BookingStatus.CONFIRMED)
                .withPayment("tx1", "b1", PaymentState.PENDING);

        TaskOutcome early = paymentHandler.handle(paymentTask(NotificationTasks.PAYMENT_CONFIRMATION, "tx1"));
        assertInstanceOf(TaskOutcome.RetryableFailure.class, early);
        assertEquals(0, sender.sent.size());

        directory.withPayment("tx1", "b1", PaymentState.COMPLETED);
        assertEquals(TaskOutcome.success(), paymentHandler.handle(paymentTask(NotificationTasks.PAYMENT_CONFIRMATION, "tx1")));
        assertEquals(1, sender.sent.size());
        assertEquals("Payment Confirmation - Booking #b1", sender.sent.get(0).subject());
    }

    @Test
    void paymentConfirmationIsSkippedForFailedPayment() throws Exception {
        directory.withBooking("b1", BookingStatus.CONFIRMED)
                .withPayment("tx1", "b1", PaymentState.FAILED);

        assertEquals(TaskOutcome.success(), paymentHandler.handle(paymentTask(NotificationTasks.PAYMENT_CONFIRMATION, "tx1")));
        assertEquals(0, sender.sent.size());
    }

    @Test
    void paymentFailedWaitsForPendingPayment() throws Exception {
        directory.withBooking("b1", BookingStatus.PENDING)
                .withPayment("tx1", "b1", PaymentState.PENDING);

        assertInstanceOf(TaskOutcome.RetryableFailure.class,
                failedHandler.handle(paymentTask(NotificationTasks.PAYMENT_FAILED, "tx1")));
        assertEquals(0, sender.sent.size());

        directory.withPayment("tx1", "b1", PaymentState.FAILED);
        assertEquals(TaskOutcome.success(), failedHandler.handle(paymentTask(NotificationTasks.PAYMENT_FAILED, "tx1")));
        assertEquals("Payment Failed - Action Required", sender.sent.get(0).subject());
    }

    @Test
    void paymentFailedIsSkippedForCompletedPayment() throws Exception {
        directory.withBooking("b1", BookingStatus.CONFIRMED)
                .withPayment("tx1", "b1", PaymentState.COMPLETED);

        assertEquals(TaskOutcome.success(), failedHandler.handle(paymentTask(NotificationTasks.PAYMENT_FAILED, "tx1")));
        assertEquals(0, sender.sent.size());
    }

    @Test
    void paymentWithoutBookingIsFatal() throws Exception {
        directory.withPayment("tx1", "b-missing", PaymentState.COMPLETED);

        TaskOutcome outcome = paymentHandler.handle(paymentTask(NotificationTasks.PAYMENT_CONFIRMATION, "tx1"));

        assertInstanceOf(TaskOutcome.FatalFailure.class, outcome);
    }

    @Test
    void unknownPaymentIsFatal() throws Exception {
        assertInstanceOf(TaskOutcome.FatalFailure.class,
                failedHandler.handle(paymentTask(NotificationTasks.PAYMENT_FAILED, "tx-unknown")));
    }
}
