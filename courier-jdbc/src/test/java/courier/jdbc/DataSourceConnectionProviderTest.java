package courier.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.UUID;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataSourceConnectionProviderTest {

    @Test
    void rejectsNullDataSource() {
        assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
    }

    @Test
    void switchesManualCommitConnectionsToAutoCommit() throws SQLException {
        JdbcDataSource h2 = new JdbcDataSource();
        h2.setURL("jdbc:h2:mem:dscp_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        DataSource manualCommit = new ManualCommitDataSource(h2);

        try (Connection conn = new DataSourceConnectionProvider(manualCommit).getConnection()) {
            assertFalse(conn.isClosed());
            assertTrue(conn.getAutoCommit());
        }
    }

    /** Hands out connections with auto-commit off, like a pool configured for app transactions. */
    private static final class ManualCommitDataSource implements DataSource {
        private final DataSource delegate;

        ManualCommitDataSource(DataSource delegate) {
            this.delegate = delegate;
        }

        @Override
        public Connection getConnection() throws SQLException {
            Connection conn = delegate.getConnection();
            conn.setAutoCommit(false);
            return conn;
        }

        @Override
        public Connection getConnection(String username, String password) throws SQLException {
            return getConnection();
        }

        @Override
        public PrintWriter getLogWriter() {
            return null;
        }

        @Override
        public void setLogWriter(PrintWriter out) {
        }

        @Override
        public void setLoginTimeout(int seconds) {
        }

        @Override
        public int getLoginTimeout() {
            return 0;
        }

        @Override
        public Logger getParentLogger() throws SQLFeatureNotSupportedException {
            throw new SQLFeatureNotSupportedException();
        }

        @Override
        public <T> T unwrap(Class<T> iface) throws SQLException {
            throw new SQLException("Not a wrapper");
        }

        @Override
        public boolean isWrapperFor(Class<?> iface) {
            return false;
        }
    }
}
