package courier.travel.booking;

/**
 * Lifecycle of a booking as held by the system of record.
 */
public enum BookingStatus {
    PENDING,
    CONFIRMED,
    CANCELLED
}
