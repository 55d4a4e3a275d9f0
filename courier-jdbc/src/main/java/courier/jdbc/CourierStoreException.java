package courier.jdbc;

/**
 * Unchecked wrapper for {@link java.sql.SQLException}s raised by the JDBC broker and stores.
 */
public class CourierStoreException extends RuntimeException {

    public CourierStoreException(String message) {
        super(message);
    }

    public CourierStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
