package io.mediaplatform.jdbc.store;

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
 * Registry for JDBC outbox stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.mediaplatform.jdbc.store.AbstractJdbcOutboxStore}.
 *
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcOutboxStore store = JdbcOutboxStores.detect(dataSource);
 *
 * // Get by name, bound to a custom table
 * AbstractJdbcOutboxStore store = JdbcOutboxStores.get("postgresql").withTableName("media_outbox");
 * }</pre>
 */
public final class JdbcOutboxStores {

    private static final List<AbstractJdbcOutboxStore> STORES;
    private static final Map<String, AbstractJdbcOutboxStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcOutboxStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcOutboxStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcOutboxStores() {
    }

    /**
     * Returns all registered outbox stores.
     */
    public static List<AbstractJdbcOutboxStore> all() {
        return STORES;
    }

    /**
     * Gets an outbox store by name.
     *
     * @param name outbox store name (case-insensitive)
     * @throws IllegalArgumentException if no outbox store is registered under that name
     */
    public static AbstractJdbcOutboxStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcOutboxStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown outbox store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the outbox store from a DataSource's JDBC URL.
     *
     * @throws IllegalStateException if the URL cannot be read
     * @throws IllegalArgumentException if no registered store matches the URL
     */
    public static AbstractJdbcOutboxStore detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        String url;
        try (Connection conn = dataSource.getConnection()) {
            url = conn.getMetaData().getURL();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect outbox store from DataSource", e);
        }
        return detect(url);
    }

    /**
     * Auto-detects the outbox store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no registered store matches the URL
     */
    public static AbstractJdbcOutboxStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        String normalized = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcOutboxStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (normalized.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No outbox store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
