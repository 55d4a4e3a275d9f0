package courier.jdbc.broker;

import org.junit.jupiter.api.BeforeAll;

import javax.sql.DataSource;

class H2JdbcBrokerTest extends AbstractJdbcBrokerTest {
    private static final H2QueueStore STORE = new H2QueueStore();
    private static SimpleDataSource dataSource;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = SimpleDataSource.h2();
        dataSource.applySchema("/schema/h2.sql");
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcQueueStore store() {
        return STORE;
    }
}
