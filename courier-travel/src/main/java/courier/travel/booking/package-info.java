/**
 * Read-only view of bookings and payments that notification handlers and reconciliation
 * consult. The application provides the {@link courier.travel.booking.BookingDirectory}.
 */
package courier.travel.booking;
