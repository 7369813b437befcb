package hookrelay.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC delivery stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/hookrelay.jdbc.store.AbstractJdbcDeliveryStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcDeliveryStore store = JdbcDeliveryStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcDeliveryStore store = JdbcDeliveryStores.detect("jdbc:mysql://localhost/mydb");
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
   * @param name store name (case-insensitive)
   * @return the store
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcDeliveryStore get(String name) {
    AbstractJdbcDeliveryStore store = BY_NAME.get(name.toLowerCase());
    if (store == null) {
      throw new IllegalArgumentException("Unknown delivery store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the delivery store from a DataSource.
   *
   * @throws IllegalStateException if the connection metadata cannot be read
   * @throws IllegalArgumentException if no store matches the JDBC URL
   */
  public static AbstractJdbcDeliveryStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect delivery store from DataSource", e);
    }
  }

  /**
   * Auto-detects the delivery store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no store matches
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
