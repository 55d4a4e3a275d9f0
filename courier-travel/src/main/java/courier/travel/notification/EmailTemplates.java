package courier.travel.notification;

import courier.travel.booking.BookingView;
import courier.travel.booking.Contact;
import courier.travel.booking.PaymentView;
import courier.travel.mail.EmailMessage;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

import static courier.travel.mail.HtmlText.escape;

/**
 * Renders the three notification emails.
 */
public final class EmailTemplates {
    private static final DateTimeFormatter PAYMENT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final String fromAddress;
    private final String signature;
    private final ZoneId zone;

    /**
     * @param fromAddress sender of every message
     * @param signature   closing line after "Best regards,"
     * @param zone        zone used to print payment timestamps
     */
    public EmailTemplates(String fromAddress, String signature, ZoneId zone) {
        this.fromAddress = Objects.requireNonNull(fromAddress, "fromAddress");
        this.signature = Objects.requireNonNull(signature, "signature");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public EmailTemplates(String fromAddress) {
        this(fromAddress, "The Travel Team", ZoneOffset.UTC);
    }

    public String fromAddress() {
        return fromAddress;
    }

    public EmailMessage bookingConfirmed(BookingView booking) {
        Contact guest = booking.guest();
        Contact host = booking.listing().host();
        String html = "<html>\n<body>\n"
                + "<h2>Booking Confirmed!</h2>\n"
                + greeting(guest)
                + "<p>Your booking has been confirmed by the host.</p>\n"
                + "<h3>Booking Details:</h3>\n<ul>\n"
                + item("Property", booking.listing().name())
                + item("Location", booking.listing().location())
                + item("Check-in", booking.checkIn().toString())
                + item("Check-out", booking.checkOut().toString())
                + item("Total Price", booking.totalPrice().toPlainString())
                + "</ul>\n"
                + "<h3>Host Information:</h3>\n<ul>\n"
                + item("Name", host.fullName())
                + item("Email", host.email())
                + item("Phone", host.phone() == null || host.phone().isBlank() ? "N/A" : host.phone())
                + "</ul>\n"
                + "<p>We hope you have a wonderful stay!</p>\n"
                + closing();
        return EmailMessage.html(fromAddress, guest.email(),
                "Booking Confirmed - " + booking.listing().name(), html);
    }

    public EmailMessage paymentConfirmed(BookingView booking, PaymentView payment) {
        Contact guest = booking.guest();
        String html = "<html>\n<body>\n"
                + "<h2>Payment Confirmed!</h2>\n"
                + greeting(guest)
                + "<p>Your payment has been successfully processed.</p>\n"
                + "<h3>Booking Details:</h3>\n<ul>\n"
                + item("Property", booking.listing().name())
                + item("Location", booking.listing().location())
                + item("Check-in", booking.checkIn().toString())
                + item("Check-out", booking.checkOut().toString())
                + item("Duration", booking.nights() + " nights")
                + "</ul>\n"
                + "<h3>Payment Details:</h3>\n<ul>\n"
                + item("Amount Paid", payment.currency() + " " + payment.amount().toPlainString())
                + item("Transaction ID", payment.transactionId() == null ? payment.transactionRef() : payment.transactionId())
                + item("Payment Date", formatDate(payment.paymentDate()))
                + "</ul>\n"
                + "<p>Thank you for choosing our service!</p>\n"
                + closing();
        return EmailMessage.html(fromAddress, guest.email(),
                "Payment Confirmation - Booking #" + booking.bookingId(), html);
    }

    public EmailMessage paymentFailed(BookingView booking, PaymentView payment) {
        Contact guest = booking.guest();
        String html = "<html>\n<body>\n"
                + "<h2>Payment Failed</h2>\n"
                + greeting(guest)
                + "<p>Unfortunately, your payment could not be processed.</p>\n"
                + "<p><strong>Booking Reference:</strong> " + escape(booking.bookingId()) + "</p>\n"
                + "<p><strong>Amount:</strong> " + escape(payment.currency() + " " + payment.amount().toPlainString())
                + "</p>\n"
                + "<p>Please try again or contact our support team for assistance.</p>\n"
                + closing();
        return EmailMessage.html(fromAddress, guest.email(), "Payment Failed - Action Required", html);
    }

    private String formatDate(Instant instant) {
        return instant == null ? "N/A" : PAYMENT_DATE.format(instant.atZone(zone));
    }

    private static String greeting(Contact guest) {
        return "<p>Dear " + escape(guest.fullName()) + ",</p>\n";
    }

    private static String item(String label, String value) {
        return "<li><strong>" + label + ":</strong> " + escape(value) + "</li>\n";
    }

    private String closing() {
        return "<p>Best regards,<br>" + escape(signature) + "</p>\n</body>\n</html>\n";
    }
}
