package courier.jdbc.broker;

import courier.jdbc.DataSourceConnectionProvider;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JdbcQueueStoresTest {

    @Test
    void allStoresAreRegistered() {
        assertEquals(3, JdbcQueueStores.all().size());
    }

    @Test
    void getIsCaseInsensitive() {
        assertInstanceOf(PostgresQueueStore.class, JdbcQueueStores.get("PostgreSQL"));
        assertInstanceOf(MySqlQueueStore.class, JdbcQueueStores.get("mysql"));
        assertInstanceOf(H2QueueStore.class, JdbcQueueStores.get("h2"));
    }

    @Test
    void getUnknownStoreFails() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> JdbcQueueStores.get("oracle"));
        assertEquals(true, e.getMessage().contains("oracle"));
    }

    @Test
    void detectsFromJdbcUrl() {
        assertInstanceOf(PostgresQueueStore.class, JdbcQueueStores.detect("jdbc:postgresql://db:5432/travel"));
        assertInstanceOf(MySqlQueueStore.class, JdbcQueueStores.detect("jdbc:mariadb://db/travel"));
        assertInstanceOf(MySqlQueueStore.class, JdbcQueueStores.detect("JDBC:MYSQL://db/travel"));
        assertThrows(IllegalArgumentException.class, () -> JdbcQueueStores.detect("jdbc:sqlserver://db"));
    }

    @Test
    void detectsFromConnectionMetadata() {
        SimpleDataSource dataSource = SimpleDataSource.h2();
        assertInstanceOf(H2QueueStore.class,
                JdbcQueueStores.detect(new DataSourceConnectionProvider(dataSource)));
    }

    @Test
    void withTableNameKeepsDialect() {
        AbstractJdbcQueueStore custom = JdbcQueueStores.get("postgresql").withTableName("travel_tasks");
        assertInstanceOf(PostgresQueueStore.class, custom);
        assertEquals("travel_tasks", custom.tableName());
    }

    @Test
    void invalidTableNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new H2QueueStore("tasks; DROP TABLE x"));
    }
}
