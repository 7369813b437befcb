package hookrelay.jdbc;

import hookrelay.model.Subscription;
import hookrelay.model.SubscriptionStats;
import hookrelay.spi.SubscriptionStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC {@link SubscriptionStore}. The same SQL runs on H2, PostgreSQL and MySQL.
 *
 * <p>Event-type patterns are stored as a comma-separated list in {@code event_types}.
 * Statistics are updated with a single relative {@code UPDATE}, so concurrent workers
 * never lose increments.
 *
 * <p>{@link #insert} and {@link #setActive} are administrative helpers for the application
 * that owns subscriptions; the delivery engine itself only reads them.
 */
public final class JdbcSubscriptionStore implements SubscriptionStore {

  private static final String COLUMNS = "id, target_url, secret, event_types, active, " +
      "total_deliveries, success_deliveries, failed_deliveries, " +
      "last_delivery_at, last_success_at, last_failure_at";

  private static final JdbcTemplate.RowMapper<Subscription> ROW_MAPPER = rs -> new Subscription(
      rs.getString("id"),
      rs.getString("target_url"),
      rs.getString("secret"),
      Subscription.parsePatterns(rs.getString("event_types")),
      rs.getBoolean("active"),
      new SubscriptionStats(
          rs.getLong("total_deliveries"),
          rs.getLong("success_deliveries"),
          rs.getLong("failed_deliveries"),
          JdbcTemplate.instant(rs, "last_delivery_at"),
          JdbcTemplate.instant(rs, "last_success_at"),
          JdbcTemplate.instant(rs, "last_failure_at")));

  private final String tableName;

  public JdbcSubscriptionStore() {
    this(TableNames.DEFAULT_SUBSCRIPTION_TABLE);
  }

  public JdbcSubscriptionStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public Optional<Subscription> findSubscription(Connection conn, String subscriptionId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, subscriptionId).stream().findFirst();
  }

  @Override
  public List<Subscription> listActive(Connection conn) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE active=? ORDER BY created_at, id";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, true);
  }

  @Override
  public int updateStatistics(Connection conn, String subscriptionId, boolean success, Instant at) {
    Timestamp ts = Timestamp.from(at);
    String sql = success
        ? "UPDATE " + tableName + " SET total_deliveries=total_deliveries+1," +
            " success_deliveries=success_deliveries+1, last_delivery_at=?, last_success_at=?," +
            " updated_at=? WHERE id=?"
        : "UPDATE " + tableName + " SET total_deliveries=total_deliveries+1," +
            " failed_deliveries=failed_deliveries+1, last_delivery_at=?, last_failure_at=?," +
            " updated_at=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, ts, ts, ts, subscriptionId);
  }

  /**
   * Inserts a subscription with zeroed statistics.
   */
  public void insert(Connection conn, Subscription subscription, Instant createdAt) {
    String sql = "INSERT INTO " + tableName + " (id, target_url, secret, event_types, active, " +
        "total_deliveries, success_deliveries, failed_deliveries, created_at, updated_at) " +
        "VALUES (?,?,?,?,?,0,0,0,?,?)";
    Timestamp ts = Timestamp.from(createdAt);
    JdbcTemplate.update(conn, sql,
        subscription.id(), subscription.targetUrl(), subscription.secret(),
        Subscription.formatPatterns(subscription.eventTypePatterns()),
        subscription.active(), ts, ts);
  }

  /**
   * Activates or deactivates a subscription. Deactivated subscriptions receive no new
   * deliveries, and their queued or retrying deliveries fail on the next attempt.
   */
  public int setActive(Connection conn, String subscriptionId, boolean active, Instant at) {
    String sql = "UPDATE " + tableName + " SET active=?, updated_at=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, active, Timestamp.from(at), subscriptionId);
  }
}
