package courier.jdbc.broker;

import courier.jdbc.CourierStoreException;
import courier.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of queue stores with JDBC URL auto-detection.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/courier.jdbc.broker.AbstractJdbcQueueStore}.
 *
 * <pre>{@code
 * AbstractJdbcQueueStore store = JdbcQueueStores.detect(connectionProvider);
 * AbstractJdbcQueueStore byUrl = JdbcQueueStores.detect("jdbc:postgresql://db/travel");
 * AbstractJdbcQueueStore byName = JdbcQueueStores.get("mysql");
 * }</pre>
 */
public final class JdbcQueueStores {

    private static final List<AbstractJdbcQueueStore> STORES;
    private static final Map<String, AbstractJdbcQueueStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcQueueStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcQueueStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(), store);
        }
    }

    private JdbcQueueStores() {
    }

    public static List<AbstractJdbcQueueStore> all() {
        return STORES;
    }

    /**
     * Gets a queue store by name.
     *
     * @param name store name (case-insensitive)
     * @return the store
     * @throws IllegalArgumentException if no store has that name
     */
    public static AbstractJdbcQueueStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcQueueStore store = BY_NAME.get(name.toLowerCase());
        if (store == null) {
            throw new IllegalArgumentException("Unknown queue store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Detects the queue store from the URL reported by a connection's metadata.
     *
     * @throws CourierStoreException    if no connection can be obtained
     * @throws IllegalArgumentException if no store matches the URL
     */
    public static AbstractJdbcQueueStore detect(ConnectionProvider connectionProvider) {
        Objects.requireNonNull(connectionProvider, "connectionProvider");
        try (Connection conn = connectionProvider.getConnection()) {
            return detect(conn.getMetaData().getURL());
        } catch (SQLException e) {
            throw new CourierStoreException("Failed to detect queue store from connection metadata", e);
        }
    }

    /**
     * Detects the queue store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no store matches the URL
     */
    public static AbstractJdbcQueueStore detect(String jdbcUrl) {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        String lowerUrl = jdbcUrl.toLowerCase();
        for (AbstractJdbcQueueStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (lowerUrl.startsWith(prefix.toLowerCase())) {
                    return store;
                }
            }
        }
        throw new IllegalArgumentException("Cannot detect queue store for URL: " + jdbcUrl +
                ". Available: " + BY_NAME.keySet());
    }
}
