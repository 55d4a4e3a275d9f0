package courier.jdbc.broker;

import courier.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SQL for the durable message table, one subclass per database.
 *
 * <p>A message is claimable when its {@code available_at} has passed and it is either unleased
 * or its lease is older than the cutoff passed by the broker. The default claim is optimistic:
 * pick a few candidates, then take the first one whose conditional lease update succeeds. That
 * works on any database with row-level atomic updates; subclasses may replace it with a
 * single-statement claim.
 *
 * <p>Register custom implementations via
 * {@code META-INF/services/courier.jdbc.broker.AbstractJdbcQueueStore}.
 *
 * @see JdbcQueueStores
 */
public abstract class AbstractJdbcQueueStore {
    protected static final String DEFAULT_TABLE = "courier_message";
    private static final int CLAIM_CANDIDATES = 8;

    protected static final String COLUMNS =
            "message_id, task_id, task_name, queue_name, body, content_type, available_at";

    protected static final JdbcTemplate.RowMapper<QueuedMessage> MESSAGE_ROW_MAPPER = rs -> new QueuedMessage(
            rs.getString("message_id"),
            rs.getString("task_id"),
            rs.getString("task_name"),
            rs.getString("queue_name"),
            rs.getString("body"),
            rs.getString("content_type"),
            rs.getTimestamp("available_at").toInstant());

    private final String tableName;

    protected AbstractJdbcQueueStore() {
        this(DEFAULT_TABLE);
    }

    protected AbstractJdbcQueueStore(String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        this.tableName = tableName;
    }

    /**
     * Unique identifier for this store (e.g. "h2", "mysql", "postgresql").
     */
    public abstract String name();

    /**
     * JDBC URL prefixes this store handles (e.g. "jdbc:mysql:").
     */
    public abstract List<String> jdbcUrlPrefixes();

    /**
     * Returns a store of the same dialect that targets another table.
     */
    public abstract AbstractJdbcQueueStore withTableName(String tableName);

    public String tableName() {
        return tableName;
    }

    public void insert(Connection conn, QueuedMessage message, Instant createdAt) {
        String sql = "INSERT INTO " + tableName() + " (" +
                "message_id, task_id, task_name, queue_name, body, content_type, " +
                "available_at, created_at, locked_by, locked_at" +
                ") VALUES (?,?,?,?,?,?,?,?,NULL,NULL)";
        JdbcTemplate.update(conn, sql,
                message.messageId(), message.taskId(), message.taskName(), message.queue(),
                message.body(), message.contentType(),
                Timestamp.from(millis(message.availableAt())), Timestamp.from(millis(createdAt)));
    }

    /**
     * Leases the oldest claimable message of a queue to {@code ownerId}.
     *
     * @param conn        connection in auto-commit mode
     * @param queue       queue to claim from
     * @param ownerId     lease owner written to {@code locked_by}
     * @param now         current time; messages with a later {@code available_at} are skipped
     * @param leaseCutoff leases taken before this instant are considered abandoned
     * @return the claimed message, or empty if none is claimable
     */
    public Optional<QueuedMessage> claimNext(Connection conn, String queue, String ownerId,
            Instant now, Instant leaseCutoff) {
        String candidatesSql = "SELECT message_id FROM " + tableName() +
                " WHERE queue_name=? AND available_at <= ?" +
                " AND (locked_by IS NULL OR locked_at < ?)" +
                " ORDER BY available_at, message_id LIMIT " + CLAIM_CANDIDATES;
        List<String> candidates = JdbcTemplate.query(conn, candidatesSql, rs -> rs.getString(1),
                queue, Timestamp.from(now), Timestamp.from(leaseCutoff));

        String leaseSql = "UPDATE " + tableName() + " SET locked_by=?, locked_at=?" +
                " WHERE message_id=? AND (locked_by IS NULL OR locked_at < ?)";
        for (String messageId : candidates) {
            int updated = JdbcTemplate.update(conn, leaseSql,
                    ownerId, Timestamp.from(millis(now)), messageId, Timestamp.from(leaseCutoff));
            if (updated == 1) {
                return JdbcTemplate.queryOne(conn,
                        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE message_id=?",
                        MESSAGE_ROW_MAPPER, messageId);
            }
        }
        return Optional.empty();
    }

    /** Deletes a message if {@code ownerId} still holds its lease. */
    public int delete(Connection conn, String messageId, String ownerId) {
        return JdbcTemplate.update(conn,
                "DELETE FROM " + tableName() + " WHERE message_id=? AND locked_by=?",
                messageId, ownerId);
    }

    /** Clears the lease of one message if {@code ownerId} still holds it. */
    public int release(Connection conn, String messageId, String ownerId) {
        return JdbcTemplate.update(conn,
                "UPDATE " + tableName() + " SET locked_by=NULL, locked_at=NULL" +
                        " WHERE message_id=? AND locked_by=?",
                messageId, ownerId);
    }

    /** Clears every lease held by {@code ownerId}. */
    public int releaseAll(Connection conn, String ownerId) {
        return JdbcTemplate.update(conn,
                "UPDATE " + tableName() + " SET locked_by=NULL, locked_at=NULL WHERE locked_by=?",
                ownerId);
    }

    /** Counts messages of a queue that are claimable at {@code now}, ignoring leases. */
    public int countAvailable(Connection conn, String queue, Instant now) {
        return count(conn, " WHERE queue_name=? AND available_at <= ? AND locked_by IS NULL",
                queue, Timestamp.from(now));
    }

    /** Counts every stored message of a queue, leased, delayed or ready. */
    public int countAll(Connection conn, String queue) {
        return count(conn, " WHERE queue_name=?", queue);
    }

    private int count(Connection conn, String where, Object... params) {
        return JdbcTemplate.queryOne(conn, "SELECT COUNT(*) FROM " + tableName() + where,
                rs -> rs.getInt(1), params).orElse(0);
    }

    // Stored timestamps carry millisecond precision; compare against the same.
    protected static Instant millis(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MILLIS);
    }
}
