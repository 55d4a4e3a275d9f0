package courier.travel.booking;

import java.util.Optional;

/**
 * Read access to the booking system of record.
 *
 * <p>Handlers call it on every attempt instead of trusting payload snapshots, because bookings
 * and payments change between enqueue and execution. Implementations must be safe for
 * concurrent use and obtain a connection per call (or from a pool), never share one across
 * worker contexts.
 *
 * <p>Lookup failures (database down, timeouts) should propagate as exceptions; the worker
 * classifies them as retryable.
 */
public interface BookingDirectory {

    /**
     * @param bookingId booking identifier
     * @return the booking, or empty if it does not exist
     */
    Optional<BookingView> findBooking(String bookingId);

    /**
     * @param transactionRef payment transaction reference
     * @return the payment, or empty if no payment carries that reference
     */
    Optional<PaymentView> findPayment(String transactionRef);
}
