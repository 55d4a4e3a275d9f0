package courier.jdbc.broker;

import java.util.List;

/**
 * H2 queue store, used mainly by tests and embedded deployments. Uses the optimistic claim.
 */
public final class H2QueueStore extends AbstractJdbcQueueStore {

    public H2QueueStore() {
        super();
    }

    public H2QueueStore(String tableName) {
        super(tableName);
    }

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }

    @Override
    public H2QueueStore withTableName(String tableName) {
        return new H2QueueStore(tableName);
    }
}
