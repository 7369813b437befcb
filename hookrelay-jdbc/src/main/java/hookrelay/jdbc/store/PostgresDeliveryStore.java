package hookrelay.jdbc.store;

import hookrelay.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL delivery store.
 *
 * <p>Retention cleanup runs as a single statement: a data-modifying CTE deletes the
 * still-terminal deliveries of the selected batch and the attempts of exactly those rows.
 */
public final class PostgresDeliveryStore extends AbstractJdbcDeliveryStore {

  public PostgresDeliveryStore() {
    super();
  }

  public PostgresDeliveryStore(String deliveryTable, String attemptTable) {
    super(deliveryTable, attemptTable);
  }

  @Override
  public AbstractJdbcDeliveryStore withTables(String deliveryTable, String attemptTable) {
    return new PostgresDeliveryStore(deliveryTable, attemptTable);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public int deleteOlderThan(Connection conn, Instant cutoff, int limit) {
    String sql = "WITH doomed AS (" +
        "SELECT id FROM " + deliveryTable() +
        " WHERE status IN " + TERMINAL_STATUS_IN +
        " AND COALESCE(completed_at, created_at)<?" +
        " ORDER BY created_at LIMIT ?), " +
        "gone AS (DELETE FROM " + deliveryTable() +
        " WHERE id IN (SELECT id FROM doomed) AND status IN " + TERMINAL_STATUS_IN +
        " RETURNING id), " +
        "history AS (DELETE FROM " + attemptTable() +
        " WHERE delivery_id IN (SELECT id FROM gone)) " +
        "SELECT COUNT(*) FROM gone";
    return (int) JdbcTemplate.queryForLong(conn, sql, Timestamp.from(cutoff), limit);
  }
}
