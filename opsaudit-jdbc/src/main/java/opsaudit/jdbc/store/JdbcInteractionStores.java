package opsaudit.jdbc.store;

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
 * Registry for JDBC interaction stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/opsaudit.jdbc.store.AbstractJdbcInteractionStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AbstractJdbcInteractionStore store = JdbcInteractionStores.detect(dataSource);
 * AbstractJdbcInteractionStore store = JdbcInteractionStores.detect("jdbc:postgresql://db/audit");
 * AbstractJdbcInteractionStore store = JdbcInteractionStores.get("postgresql");
 * }</pre>
 */
public final class JdbcInteractionStores {

    private static final List<AbstractJdbcInteractionStore> STORES;
    private static final Map<String, AbstractJdbcInteractionStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcInteractionStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcInteractionStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcInteractionStores() {
    }

    /**
     * Returns all registered stores.
     */
    public static List<AbstractJdbcInteractionStore> all() {
        return STORES;
    }

    /**
     * Gets a store by name.
     *
     * @param name store name (case-insensitive)
     * @return the store
     * @throws IllegalArgumentException if no store is registered under that name
     */
    public static AbstractJdbcInteractionStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcInteractionStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown interaction store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the store from a DataSource. Opens one connection.
     *
     * @param dataSource the data source
     * @return detected store
     * @throws IllegalStateException if the connection fails or no store matches
     */
    public static AbstractJdbcInteractionStore detect(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            return detect(url);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect interaction store from DataSource", e);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    /**
     * Auto-detects the store from a JDBC URL.
     *
     * @param jdbcUrl the JDBC URL
     * @return detected store
     * @throws IllegalArgumentException if no store matches
     */
    public static AbstractJdbcInteractionStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        String lower = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcInteractionStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No interaction store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
