package relay.jdbc.store;

import relay.jdbc.DataSourceConnectionProvider;
import relay.jdbc.TableNames;

import javax.sql.DataSource;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC delivery stores with auto-detection support.
 *
 * <p>Delivery stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/relay.jdbc.store.AbstractJdbcDeliveryStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcDeliveryStore store = JdbcDeliveryStores.detect(dataSource);
 *
 * // Auto-detect with a custom table prefix
 * AbstractJdbcDeliveryStore store = JdbcDeliveryStores.detect(dataSource, TableNames.withPrefix("ops_"));
 *
 * // Get by name
 * AbstractJdbcDeliveryStore store = JdbcDeliveryStores.get("postgresql");
 * }</pre>
 */
public final class JdbcDeliveryStores {

    private static final List<AbstractJdbcDeliveryStore> STORES;
    private static final Map<String, AbstractJdbcDeliveryStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcDeliveryStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcDeliveryStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(), store);
        }
    }

    private JdbcDeliveryStores() {
    }

    /**
     * Returns all registered delivery stores.
     */
    public static List<AbstractJdbcDeliveryStore> all() {
        return STORES;
    }

    /**
     * Gets a delivery store by name.
     *
     * @param name delivery store name (case-insensitive)
     * @return the delivery store
     * @throws IllegalArgumentException if no delivery store found
     */
    public static AbstractJdbcDeliveryStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcDeliveryStore store = BY_NAME.get(name.toLowerCase());
        if (store == null) {
            throw new IllegalArgumentException("Unknown delivery store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the delivery store from a DataSource, using the default {@code relay_} tables.
     *
     * @throws relay.StoreException if the data source cannot be reached
     * @throws IllegalArgumentException if no delivery store matches its URL
     */
    public static AbstractJdbcDeliveryStore detect(DataSource dataSource) {
        return detect(dataSource, TableNames.defaults());
    }

    /**
     * Auto-detects the delivery store from a DataSource, reading and writing {@code tables}.
     *
     * @throws relay.StoreException if the data source cannot be reached
     * @throws IllegalArgumentException if no delivery store matches its URL
     */
    public static AbstractJdbcDeliveryStore detect(DataSource dataSource, TableNames tables) {
        Objects.requireNonNull(tables, "tables");
        String url = new DataSourceConnectionProvider(dataSource).jdbcUrl();
        return detect(url).withTables(tables);
    }

    /**
     * Auto-detects the delivery store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no matching delivery store found
     */
    public static AbstractJdbcDeliveryStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        for (AbstractJdbcDeliveryStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (jdbcUrl.toLowerCase().startsWith(prefix.toLowerCase())) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No delivery store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
