package hookrelay.jdbc.store;

import hookrelay.jdbc.DeliveryStoreException;
import hookrelay.jdbc.JdbcTemplate;
import hookrelay.jdbc.TableNames;
import hookrelay.model.Delivery;
import hookrelay.model.DeliveryAttempt;
import hookrelay.model.DeliveryPage;
import hookrelay.model.DeliveryQuery;
import hookrelay.model.DeliveryStatus;
import hookrelay.spi.DeliveryStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Base JDBC delivery store with standard SQL implementations.
 *
 * <p>Subclasses override individual statements where a database offers a better form.
 * Register custom implementations via
 * {@code META-INF/services/hookrelay.jdbc.store.AbstractJdbcDeliveryStore}.
 *
 * @see JdbcDeliveryStores
 */
public abstract class AbstractJdbcDeliveryStore implements DeliveryStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String ACTIVE_STATUS_IN =
      "(" + DeliveryStatus.PENDING.code() + "," + DeliveryStatus.RETRYING.code() + ")";
  protected static final String TERMINAL_STATUS_IN =
      "(" + DeliveryStatus.SUCCESS.code() + "," + DeliveryStatus.FAILED.code() + ")";

  protected static final String DELIVERY_COLUMNS =
      "id, subscription_id, event_id, event_type, payload, status, attempt_count, " +
      "next_retry_at, last_attempt_at, last_error, completed_at, created_at, updated_at";

  protected static final JdbcTemplate.RowMapper<Delivery> DELIVERY_ROW_MAPPER = rs -> Delivery.builder()
      .id(rs.getString("id"))
      .subscriptionId(rs.getString("subscription_id"))
      .eventId(rs.getString("event_id"))
      .eventType(rs.getString("event_type"))
      .payload(rs.getBytes("payload"))
      .status(DeliveryStatus.fromCode(rs.getInt("status")))
      .attemptCount(rs.getInt("attempt_count"))
      .nextRetryAt(JdbcTemplate.instant(rs, "next_retry_at"))
      .lastAttemptAt(JdbcTemplate.instant(rs, "last_attempt_at"))
      .lastError(rs.getString("last_error"))
      .completedAt(JdbcTemplate.instant(rs, "completed_at"))
      .createdAt(JdbcTemplate.instant(rs, "created_at"))
      .updatedAt(JdbcTemplate.instant(rs, "updated_at"))
      .build();

  protected static final JdbcTemplate.RowMapper<DeliveryAttempt> ATTEMPT_ROW_MAPPER = rs -> new DeliveryAttempt(
      rs.getString("id"),
      rs.getString("delivery_id"),
      rs.getInt("attempt_number"),
      rs.getString("request_url"),
      rs.getInt("response_status"),
      rs.getString("response_body"),
      rs.getBoolean("success"),
      rs.getString("error"),
      rs.getLong("duration_ms"),
      JdbcTemplate.instant(rs, "created_at"));

  private final String deliveryTable;
  private final String attemptTable;

  protected AbstractJdbcDeliveryStore() {
    this(TableNames.DEFAULT_DELIVERY_TABLE, TableNames.DEFAULT_ATTEMPT_TABLE);
  }

  protected AbstractJdbcDeliveryStore(String deliveryTable, String attemptTable) {
    this.deliveryTable = TableNames.validate(deliveryTable);
    this.attemptTable = TableNames.validate(attemptTable);
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect using the given tables.
   */
  public abstract AbstractJdbcDeliveryStore withTables(String deliveryTable, String attemptTable);

  protected String deliveryTable() {
    return deliveryTable;
  }

  protected String attemptTable() {
    return attemptTable;
  }

  @Override
  public void createDelivery(Connection conn, Delivery delivery) {
    String sql = "INSERT INTO " + deliveryTable() + " (" + DELIVERY_COLUMNS +
        ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        delivery.id(), delivery.subscriptionId(), delivery.eventId(), delivery.eventType(),
        delivery.payload(), delivery.status().code(), delivery.attemptCount(),
        JdbcTemplate.timestamp(delivery.nextRetryAt()),
        JdbcTemplate.timestamp(delivery.lastAttemptAt()),
        truncateError(delivery.lastError()),
        JdbcTemplate.timestamp(delivery.completedAt()),
        JdbcTemplate.timestamp(delivery.createdAt()),
        JdbcTemplate.timestamp(delivery.updatedAt()));
  }

  @Override
  public int updateDelivery(Connection conn, Delivery delivery) {
    String sql = "UPDATE " + deliveryTable() +
        " SET status=?, attempt_count=?, next_retry_at=?, last_attempt_at=?, last_error=?," +
        " completed_at=?, updated_at=?" +
        " WHERE id=? AND status IN " + ACTIVE_STATUS_IN + " AND attempt_count<=?";
    return JdbcTemplate.update(conn, sql,
        delivery.status().code(), delivery.attemptCount(),
        JdbcTemplate.timestamp(delivery.nextRetryAt()),
        JdbcTemplate.timestamp(delivery.lastAttemptAt()),
        truncateError(delivery.lastError()),
        JdbcTemplate.timestamp(delivery.completedAt()),
        JdbcTemplate.timestamp(delivery.updatedAt()),
        delivery.id(), delivery.attemptCount());
  }

  @Override
  public int reviveFailed(Connection conn, Delivery revived) {
    String sql = "UPDATE " + deliveryTable() +
        " SET status=?, next_retry_at=?, last_error=?, completed_at=NULL, updated_at=?" +
        " WHERE id=? AND status=" + DeliveryStatus.FAILED.code();
    return JdbcTemplate.update(conn, sql,
        revived.status().code(),
        JdbcTemplate.timestamp(revived.nextRetryAt()),
        truncateError(revived.lastError()),
        JdbcTemplate.timestamp(revived.updatedAt()),
        revived.id());
  }

  @Override
  public void createAttempt(Connection conn, DeliveryAttempt attempt) {
    String sql = "INSERT INTO " + attemptTable() + " (" +
        "id, delivery_id, attempt_number, request_url, response_status, response_body, " +
        "success, error, duration_ms, created_at" +
        ") VALUES (?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        attempt.id(), attempt.deliveryId(), attempt.attemptNumber(), attempt.requestUrl(),
        attempt.responseStatus(), attempt.responseBody(), attempt.success(),
        truncateError(attempt.error()), attempt.durationMs(),
        JdbcTemplate.timestamp(attempt.createdAt()));
  }

  @Override
  public Optional<Delivery> findDelivery(Connection conn, String deliveryId) {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + deliveryTable() + " WHERE id=?";
    return JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, deliveryId).stream().findFirst();
  }

  @Override
  public List<DeliveryAttempt> listAttempts(Connection conn, String deliveryId) {
    String sql = "SELECT id, delivery_id, attempt_number, request_url, response_status, " +
        "response_body, success, error, duration_ms, created_at FROM " + attemptTable() +
        " WHERE delivery_id=? ORDER BY attempt_number";
    return JdbcTemplate.query(conn, sql, ATTEMPT_ROW_MAPPER, deliveryId);
  }

  @Override
  public List<Delivery> listByStatus(Connection conn, DeliveryStatus status, int limit) {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + deliveryTable() +
        " WHERE status=? ORDER BY created_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, status.code(), limit);
  }

  @Override
  public List<Delivery> listRevivable(Connection conn, int maxAttempts, String excludedErrorPrefix,
      int limit) {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + deliveryTable() +
        " WHERE status=" + DeliveryStatus.FAILED.code() + " AND attempt_count<?" +
        " AND (last_error IS NULL OR last_error NOT LIKE ?)" +
        " ORDER BY created_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER,
        maxAttempts, likePrefix(excludedErrorPrefix), limit);
  }

  @Override
  public long countExhausted(Connection conn, int maxAttempts) {
    return JdbcTemplate.queryForLong(conn, "SELECT COUNT(*) FROM " + deliveryTable() +
        " WHERE status=" + DeliveryStatus.FAILED.code() + " AND attempt_count>=?", maxAttempts);
  }

  @Override
  public List<Delivery> listDueRetries(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + deliveryTable() +
        " WHERE status=" + DeliveryStatus.RETRYING.code() + " AND next_retry_at<=?" +
        " ORDER BY next_retry_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, Timestamp.from(now), limit);
  }

  @Override
  public List<Delivery> listStalePending(Connection conn, Instant createdBefore, int limit) {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + deliveryTable() +
        " WHERE status=" + DeliveryStatus.PENDING.code() + " AND created_at<?" +
        " ORDER BY created_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, Timestamp.from(createdBefore), limit);
  }

  @Override
  public DeliveryPage listDeliveries(Connection conn, DeliveryQuery query) {
    StringBuilder where = new StringBuilder(" WHERE 1=1");
    List<Object> params = new ArrayList<>();
    if (query.subscriptionId() != null) {
      where.append(" AND subscription_id=?");
      params.add(query.subscriptionId());
    }
    if (query.status() != null) {
      where.append(" AND status=?");
      params.add(query.status().code());
    }
    long total = JdbcTemplate.queryForLong(conn,
        "SELECT COUNT(*) FROM " + deliveryTable() + where, params.toArray());
    if (total == 0) {
      return new DeliveryPage(List.of(), 0);
    }
    List<Object> pageParams = new ArrayList<>(params);
    pageParams.add(query.limit());
    pageParams.add(query.offset());
    List<Delivery> rows = JdbcTemplate.query(conn,
        "SELECT " + DELIVERY_COLUMNS + " FROM " + deliveryTable() + where +
            " ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?",
        DELIVERY_ROW_MAPPER, pageParams.toArray());
    return new DeliveryPage(rows, total);
  }

  /**
   * Selects a batch of expired terminal deliveries and removes them with
   * {@link #deleteBatch}. On an auto-commit connection the batch runs in its own transaction.
   */
  @Override
  public int deleteOlderThan(Connection conn, Instant cutoff, int limit) {
    String select = "SELECT id FROM " + deliveryTable() +
        " WHERE status IN " + TERMINAL_STATUS_IN +
        " AND COALESCE(completed_at, created_at)<?" +
        " ORDER BY created_at LIMIT ?";
    List<String> ids = JdbcTemplate.query(conn, select, rs -> rs.getString(1),
        Timestamp.from(cutoff), limit);
    if (ids.isEmpty()) {
      return 0;
    }
    try {
      boolean ownTransaction = conn.getAutoCommit();
      if (ownTransaction) {
        conn.setAutoCommit(false);
      }
      try {
        int deleted = deleteBatch(conn, ids);
        if (ownTransaction) {
          conn.commit();
        }
        return deleted;
      } catch (RuntimeException e) {
        if (ownTransaction) {
          try {
            conn.rollback();
          } catch (SQLException rollbackFailure) {
            e.addSuppressed(rollbackFailure);
          }
        }
        throw e;
      } finally {
        if (ownTransaction) {
          conn.setAutoCommit(true);
        }
      }
    } catch (SQLException e) {
      throw new DeliveryStoreException("Failed to purge deliveries", e);
    }
  }

  /**
   * Deletes the given deliveries that are still terminal, then the attempts of those that
   * are gone. A delivery revived since it was selected keeps both its row and its attempts.
   */
  protected int deleteBatch(Connection conn, List<String> ids) {
    String in = "(" + String.join(",", Collections.nCopies(ids.size(), "?")) + ")";
    int deleted = JdbcTemplate.update(conn, "DELETE FROM " + deliveryTable() +
        " WHERE id IN " + in + " AND status IN " + TERMINAL_STATUS_IN, ids.toArray());
    List<Object> params = new ArrayList<>(ids);
    params.addAll(ids);
    JdbcTemplate.update(conn, "DELETE FROM " + attemptTable() +
        " WHERE delivery_id IN " + in +
        " AND delivery_id NOT IN (SELECT id FROM " + deliveryTable() + " WHERE id IN " + in + ")",
        params.toArray());
    return deleted;
  }

  /** Escapes {@code LIKE} wildcards in a literal prefix and appends {@code %}. */
  protected static String likePrefix(String prefix) {
    return prefix.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_") + "%";
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
