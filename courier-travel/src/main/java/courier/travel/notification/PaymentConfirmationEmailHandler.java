package courier.travel.notification;

import courier.travel.booking.BookingDirectory;
import courier.travel.booking.BookingView;
import courier.travel.booking.PaymentState;
import courier.travel.booking.PaymentView;
import courier.travel.mail.EmailMessage;
import courier.travel.mail.EmailSender;

/**
 * Handles {@code send_payment_confirmation_email}. Waits while the payment is pending and skips
 * payments that failed.
 */
public final class PaymentConfirmationEmailHandler extends AbstractPaymentEmailHandler {

    public PaymentConfirmationEmailHandler(BookingDirectory directory, EmailSender sender, EmailTemplates templates) {
        super(directory, sender, templates);
    }

    @Override
    PaymentState expectedState() {
        return PaymentState.COMPLETED;
    }

    @Override
    EmailMessage render(BookingView booking, PaymentView payment) {
        return templates.paymentConfirmed(booking, payment);
    }
}
