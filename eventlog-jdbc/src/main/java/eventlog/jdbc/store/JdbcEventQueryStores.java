package eventlog.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC query stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/eventlog.jdbc.store.AbstractJdbcEventQueryStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcEventQueryStore store = JdbcEventQueryStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, custom table
 * AbstractJdbcEventQueryStore store = JdbcEventQueryStores.detect("jdbc:postgresql://localhost/app")
 *     .withTableName("journal.event_journal");
 *
 * // Get by name
 * AbstractJdbcEventQueryStore store = JdbcEventQueryStores.get("h2");
 * }</pre>
 */
public final class JdbcEventQueryStores {

    private static final List<AbstractJdbcEventQueryStore> STORES;
    private static final Map<String, AbstractJdbcEventQueryStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcEventQueryStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcEventQueryStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcEventQueryStores() {
    }

    /**
     * Returns all registered query stores.
     */
    public static List<AbstractJdbcEventQueryStore> all() {
        return STORES;
    }

    /**
     * Gets a query store by name.
     *
     * @param name store name (case-insensitive)
     * @return the store, reading the default journal table
     * @throws IllegalArgumentException if no store has that name
     */
    public static AbstractJdbcEventQueryStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcEventQueryStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown event query store: " + name
                    + ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the query store from a DataSource.
     *
     * @param dataSource the data source
     * @return detected store
     * @throws IllegalStateException if the connection URL cannot be read
     */
    public static AbstractJdbcEventQueryStore detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        try (Connection conn = dataSource.getConnection()) {
            return detect(conn.getMetaData().getURL());
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect event query store from DataSource", e);
        }
    }

    /**
     * Auto-detects the query store from a JDBC URL.
     *
     * @param jdbcUrl the JDBC URL
     * @return detected store
     * @throws IllegalArgumentException if no store handles the URL
     */
    public static AbstractJdbcEventQueryStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        String url = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcEventQueryStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }
        throw new IllegalArgumentException("No event query store found for JDBC URL: " + jdbcUrl
                + ". Supported prefixes: " + STORES.stream().flatMap(s -> s.jdbcUrlPrefixes().stream()).toList());
    }
}
