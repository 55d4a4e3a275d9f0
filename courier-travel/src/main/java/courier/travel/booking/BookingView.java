package courier.travel.booking;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Current state of a booking, read fresh from the system of record by every handler attempt.
 *
 * @param bookingId  booking identifier as carried in task payloads
 * @param status     current status
 * @param guest      the booking's guest; recipient of every notification
 * @param listing    booked property
 * @param checkIn    first night
 * @param checkOut   departure day
 * @param totalPrice total price in the listing currency
 */
public record BookingView(
        String bookingId,
        BookingStatus status,
        Contact guest,
        Listing listing,
        LocalDate checkIn,
        LocalDate checkOut,
        BigDecimal totalPrice
) {

    public BookingView {
        Objects.requireNonNull(bookingId, "bookingId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(guest, "guest");
        Objects.requireNonNull(listing, "listing");
        Objects.requireNonNull(checkIn, "checkIn");
        Objects.requireNonNull(checkOut, "checkOut");
        Objects.requireNonNull(totalPrice, "totalPrice");
    }

    public long nights() {
        return ChronoUnit.DAYS.between(checkIn, checkOut);
    }
}
