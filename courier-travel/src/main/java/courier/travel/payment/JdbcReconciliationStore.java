package courier.travel.payment;

import courier.jdbc.CourierStoreException;
import courier.jdbc.JdbcTemplate;
import courier.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ReconciliationStore} backed by the {@code courier_reconciliation} table, keyed by
 * transaction reference. The primary key makes {@link #recordTerminal} first-writer-wins across
 * processes, and the marker is claimed with a conditional update. A separate
 * {@code notification_enqueued} flag records that the task reached the broker.
 *
 * <p>Table definitions ship as {@code /schema/reconciliation-h2.sql},
 * {@code /schema/reconciliation-mysql.sql} and {@code /schema/reconciliation-postgresql.sql}.
 */
public final class JdbcReconciliationStore implements ReconciliationStore {
    public static final String DEFAULT_TABLE = "courier_reconciliation";

    private static final String COLUMNS = "transaction_ref, booking_id, status, verified_at, provider_reference";

    private static final JdbcTemplate.RowMapper<ReconciliationResult> ROW_MAPPER = rs -> new ReconciliationResult(
            rs.getString("transaction_ref"),
            rs.getString("booking_id"),
            PaymentStatus.valueOf(rs.getString("status")),
            rs.getTimestamp("verified_at").toInstant(),
            rs.getString("provider_reference"));

    private final ConnectionProvider connectionProvider;
    private final String tableName;

    public JdbcReconciliationStore(ConnectionProvider connectionProvider) {
        this(connectionProvider, DEFAULT_TABLE);
    }

    public JdbcReconciliationStore(ConnectionProvider connectionProvider, String tableName) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        Objects.requireNonNull(tableName, "tableName");
        if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        this.tableName = tableName;
    }

    @Override
    public Optional<ReconciliationResult> find(String transactionRef) {
        Objects.requireNonNull(transactionRef, "transactionRef");
        try (Connection conn = connectionProvider.getConnection()) {
            return select(conn, transactionRef);
        } catch (SQLException e) {
            throw new CourierStoreException("Failed to read reconciliation " + transactionRef, e);
        }
    }

    @Override
    public ReconciliationResult recordTerminal(ReconciliationResult result) {
        Objects.requireNonNull(result, "result");
        String sql = "INSERT INTO " + tableName +
                " (transaction_ref, booking_id, status, verified_at, provider_reference, notified)" +
                " VALUES (?,?,?,?,?,FALSE)";
        try (Connection conn = connectionProvider.getConnection()) {
            Optional<ReconciliationResult> existing = select(conn, result.transactionRef());
            if (existing.isPresent()) {
                return existing.get();
            }
            try {
                JdbcTemplate.update(conn, sql,
                        result.transactionRef(), result.bookingId(), result.status().name(),
                        Timestamp.from(result.verifiedAt().truncatedTo(ChronoUnit.MILLIS)),
                        result.providerReference());
                return result;
            } catch (CourierStoreException e) {
                if (!isDuplicateKey(e)) {
                    throw e;
                }
                // lost the race to a concurrent writer
                return select(conn, result.transactionRef()).orElseThrow(() -> e);
            }
        } catch (SQLException e) {
            throw new CourierStoreException("Failed to record reconciliation " + result.transactionRef(), e);
        }
    }

    @Override
    public boolean claimNotification(String transactionRef) {
        return update("UPDATE " + tableName + " SET notified=TRUE WHERE transaction_ref=? AND notified=FALSE",
                transactionRef) == 1;
    }

    @Override
    public void releaseNotification(String transactionRef) {
        update("UPDATE " + tableName + " SET notified=FALSE WHERE transaction_ref=?", transactionRef);
    }

    @Override
    public boolean isNotified(String transactionRef) {
        try (Connection conn = connectionProvider.getConnection()) {
            return JdbcTemplate.queryOne(conn,
                    "SELECT notified FROM " + tableName + " WHERE transaction_ref=?",
                    rs -> rs.getBoolean(1), transactionRef).orElse(false);
        } catch (SQLException e) {
            throw new CourierStoreException("Failed to read reconciliation " + transactionRef, e);
        }
    }

    @Override
    public void confirmNotification(String transactionRef) {
        update("UPDATE " + tableName + " SET notification_enqueued=TRUE WHERE transaction_ref=?", transactionRef);
    }

    @Override
    public List<ReconciliationResult> findUnconfirmedNotifications(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        try (Connection conn = connectionProvider.getConnection()) {
            return JdbcTemplate.query(conn,
                    "SELECT " + COLUMNS + " FROM " + tableName +
                            " WHERE notification_enqueued=FALSE ORDER BY verified_at, transaction_ref LIMIT " + limit,
                    ROW_MAPPER);
        } catch (SQLException e) {
            throw new CourierStoreException("Failed to list unconfirmed reconciliations", e);
        }
    }

    private Optional<ReconciliationResult> select(Connection conn, String transactionRef) {
        return JdbcTemplate.queryOne(conn,
                "SELECT " + COLUMNS + " FROM " + tableName + " WHERE transaction_ref=?",
                ROW_MAPPER, transactionRef);
    }

    private int update(String sql, String transactionRef) {
        Objects.requireNonNull(transactionRef, "transactionRef");
        try (Connection conn = connectionProvider.getConnection()) {
            return JdbcTemplate.update(conn, sql, transactionRef);
        } catch (SQLException e) {
            throw new CourierStoreException("Failed to update reconciliation " + transactionRef, e);
        }
    }

    // SQLSTATE class 23 is integrity constraint violation on every supported database.
    private static boolean isDuplicateKey(CourierStoreException e) {
        return e.getCause() instanceof SQLException sql
                && sql.getSQLState() != null
                && sql.getSQLState().startsWith("23");
    }
}
