package courier.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for broker and reconciliation-store statements. Each statement
 * group borrows its own connection and closes it when done, so worker threads never share one.
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * @return a fresh or pooled connection, owned by the caller until closed
     * @throws SQLException if the database cannot be reached
     */
    Connection getConnection() throws SQLException;
}
