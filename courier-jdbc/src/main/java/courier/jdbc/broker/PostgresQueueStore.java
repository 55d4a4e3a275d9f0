package courier.jdbc.broker;

import courier.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL queue store. Claims in a single round trip with
 * {@code FOR UPDATE SKIP LOCKED} and {@code RETURNING}, so concurrent consumers never block on
 * each other's candidate rows.
 */
public final class PostgresQueueStore extends AbstractJdbcQueueStore {

    public PostgresQueueStore() {
        super();
    }

    public PostgresQueueStore(String tableName) {
        super(tableName);
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public PostgresQueueStore withTableName(String tableName) {
        return new PostgresQueueStore(tableName);
    }

    @Override
    public Optional<QueuedMessage> claimNext(Connection conn, String queue, String ownerId,
            Instant now, Instant leaseCutoff) {
        String sql = "UPDATE " + tableName() + " SET locked_by=?, locked_at=? " +
                "WHERE message_id = (" +
                "SELECT message_id FROM " + tableName() +
                " WHERE queue_name=? AND available_at <= ?" +
                " AND (locked_by IS NULL OR locked_at < ?)" +
                " ORDER BY available_at, message_id LIMIT 1 FOR UPDATE SKIP LOCKED) " +
                "RETURNING " + COLUMNS;
        List<QueuedMessage> claimed = JdbcTemplate.updateReturning(conn, sql, MESSAGE_ROW_MAPPER,
                ownerId, Timestamp.from(millis(now)), queue, Timestamp.from(now), Timestamp.from(leaseCutoff));
        return claimed.isEmpty() ? Optional.empty() : Optional.of(claimed.get(0));
    }
}
