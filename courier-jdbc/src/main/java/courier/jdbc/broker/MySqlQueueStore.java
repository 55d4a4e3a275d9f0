package courier.jdbc.broker;

import java.util.List;

/**
 * MySQL / MariaDB / TiDB queue store. Uses the optimistic claim, which needs no explicit
 * transaction and behaves the same under every isolation level.
 */
public final class MySqlQueueStore extends AbstractJdbcQueueStore {

    public MySqlQueueStore() {
        super();
    }

    public MySqlQueueStore(String tableName) {
        super(tableName);
    }

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
    }

    @Override
    public MySqlQueueStore withTableName(String tableName) {
        return new MySqlQueueStore(tableName);
    }
}
