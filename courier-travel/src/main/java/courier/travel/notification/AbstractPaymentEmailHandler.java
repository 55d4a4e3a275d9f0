package courier.travel.notification;

import courier.TaskEnvelope;
import courier.travel.NotificationTasks;
import courier.travel.booking.BookingDirectory;
import courier.travel.booking.BookingView;
import courier.travel.booking.PaymentState;
import courier.travel.booking.PaymentView;
import courier.travel.mail.EmailMessage;
import courier.travel.mail.EmailSender;

import java.util.Optional;

/**
 * Shared lookup for payment notifications: the payment by transaction reference, then its
 * booking. The message is only sent while the payment is in {@link #expectedState()}. A payment
 * still {@code PENDING} has not been updated by reconciliation yet, so the attempt is retried;
 * a payment in the other terminal state makes the task obsolete and it is skipped.
 */
abstract class AbstractPaymentEmailHandler extends AbstractEmailHandler {

    AbstractPaymentEmailHandler(BookingDirectory directory, EmailSender sender, EmailTemplates templates) {
        super(directory, sender, templates);
    }

    abstract PaymentState expectedState();

    abstract EmailMessage render(BookingView booking, PaymentView payment);

    @Override
    protected Composition compose(TaskEnvelope task) {
        String transactionRef = argument(task, NotificationTasks.TRANSACTION_REF);
        if (transactionRef == null) {
            return Composition.missing("Payload has no transactionRef");
        }
        Optional<PaymentView> payment = directory.findPayment(transactionRef);
        if (payment.isEmpty()) {
            return Composition.missing("Payment " + transactionRef + " does not exist");
        }
        if (payment.get().state() == PaymentState.PENDING) {
            return Composition.waitFor("payment " + transactionRef + " is still PENDING");
        }
        if (payment.get().state() != expectedState()) {
            return Composition.skip("payment " + transactionRef + " is " + payment.get().state());
        }
        String bookingId = payment.get().bookingId();
        Optional<BookingView> booking = directory.findBooking(bookingId);
        if (booking.isEmpty()) {
            return Composition.missing("Booking " + bookingId + " of payment " + transactionRef + " does not exist");
        }
        return Composition.send(render(booking.get(), payment.get()));
    }
}
