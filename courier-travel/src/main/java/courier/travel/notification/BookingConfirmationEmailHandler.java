package courier.travel.notification;

import courier.TaskEnvelope;
import courier.travel.NotificationTasks;
import courier.travel.booking.BookingDirectory;
import courier.travel.booking.BookingStatus;
import courier.travel.booking.BookingView;
import courier.travel.mail.EmailSender;

import java.util.Optional;

/**
 * Handles {@code send_booking_confirmation_email}. Skips bookings that were cancelled after the
 * task was enqueued.
 */
public final class BookingConfirmationEmailHandler extends AbstractEmailHandler {

    public BookingConfirmationEmailHandler(BookingDirectory directory, EmailSender sender, EmailTemplates templates) {
        super(directory, sender, templates);
    }

    @Override
    protected Composition compose(TaskEnvelope task) {
        String bookingId = argument(task, NotificationTasks.BOOKING_ID);
        if (bookingId == null) {
            return Composition.missing("Payload has no bookingId");
        }
        Optional<BookingView> booking = directory.findBooking(bookingId);
        if (booking.isEmpty()) {
            return Composition.missing("Booking " + bookingId + " does not exist");
        }
        if (booking.get().status() == BookingStatus.CANCELLED) {
            return Composition.skip("booking " + bookingId + " is cancelled");
        }
        return Composition.send(templates.bookingConfirmed(booking.get()));
    }
}
