package courier.travel.notification;

import courier.travel.booking.BookingDirectory;
import courier.travel.booking.BookingView;
import courier.travel.booking.PaymentState;
import courier.travel.booking.PaymentView;
import courier.travel.mail.EmailMessage;
import courier.travel.mail.EmailSender;

/**
 * Handles {@code send_payment_failed_email}. Waits while the payment is pending and skips
 * payments that completed, e.g. retried successfully in the meantime.
 */
public final class PaymentFailedEmailHandler extends AbstractPaymentEmailHandler {

    public PaymentFailedEmailHandler(BookingDirectory directory, EmailSender sender, EmailTemplates templates) {
        super(directory, sender, templates);
    }

    @Override
    PaymentState expectedState() {
        return PaymentState.FAILED;
    }

    @Override
    EmailMessage render(BookingView booking, PaymentView payment) {
        return templates.paymentFailed(booking, payment);
    }
}
