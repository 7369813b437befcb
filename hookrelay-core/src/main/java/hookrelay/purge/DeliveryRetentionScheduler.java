package hookrelay.purge;

import hookrelay.spi.ConnectionProvider;
import hookrelay.spi.DeliveryStore;
import hookrelay.spi.MetricsExporter;
import hookrelay.util.PeriodicTask;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that deletes terminal deliveries (SUCCESS and FAILED), with their
 * attempts, once they are older than the retention period. PENDING and RETRYING rows are
 * never deleted.
 *
 * <p>Each cycle deletes in batches (default 500) until fewer than {@code batchSize} rows
 * are deleted, then sleeps until the next interval. Each batch uses its own auto-committed
 * connection to limit lock duration.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see DeliveryStore#deleteOlderThan
 */
public final class DeliveryRetentionScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryRetentionScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Duration retention;
  private final int batchSize;
  private final PeriodicTask task;

  private volatile boolean closed;

  private DeliveryRetentionScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");

    if (builder.retentionDays <= 0) {
      throw new IllegalArgumentException("retentionDays must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.interval == null || builder.interval.isNegative() || builder.interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }

    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.retention = Duration.ofDays(builder.retentionDays);
    this.batchSize = builder.batchSize;
    this.task = new PeriodicTask("hookrelay-retention-", this::runOnce, Duration.ZERO, builder.interval);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled cleanup; the first cycle runs immediately.
   * Subsequent calls are no-ops if already started.
   */
  public void start() {
    if (closed) {
      throw new IllegalStateException("DeliveryRetentionScheduler has been closed");
    }
    task.start();
  }

  /**
   * Executes a single cleanup cycle. May be invoked directly for testing or one-off cleanups.
   *
   * @return the number of deliveries deleted
   */
  public long runOnce() {
    if (closed) {
      return 0;
    }
    try {
      Instant cutoff = clock.instant().minus(retention);
      long totalDeleted = 0;
      int deleted;
      do {
        deleted = purgeBatch(cutoff);
        totalDeleted += deleted;
        if (deleted > 0) {
          metrics.recordPurged(deleted);
        }
      } while (deleted >= batchSize);
      if (totalDeleted > 0) {
        logger.log(Level.INFO, "Deleted {0} terminal deliveries older than {1}",
            new Object[]{totalDeleted, cutoff});
      }
      return totalDeleted;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Retention cycle failed", t);
      return 0;
    }
  }

  private int purgeBatch(Instant cutoff) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return deliveryStore.deleteOlderThan(conn, cutoff, batchSize);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to obtain connection for retention cleanup", e);
      return 0;
    }
  }

  /** Cancels the cleanup schedule and shuts down the scheduler thread. */
  @Override
  public void close() {
    closed = true;
    task.close();
  }

  /** Builder for {@link DeliveryRetentionScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DeliveryStore deliveryStore;
    private MetricsExporter metrics;
    private Clock clock;
    private int retentionDays = 30;
    private int batchSize = 500;
    private Duration interval = Duration.ofHours(24);

    private Builder() {}

    /**
     * Sets the connection provider for obtaining JDBC connections during cleanup.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the store that deletes terminal deliveries.
     *
     * <p><b>Required.</b>
     *
     * @param deliveryStore the delivery store
     * @return this builder
     */
    public Builder deliveryStore(DeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock used to compute the cutoff
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the retention period in days. Terminal deliveries completed longer ago
     * are deleted.
     *
     * <p>Optional. Defaults to {@code 30}. Must be &gt; 0.
     *
     * @param retentionDays retention in days
     * @return this builder
     */
    public Builder retentionDays(int retentionDays) {
      this.retentionDays = retentionDays;
      return this;
    }

    /**
     * Sets the maximum number of deliveries deleted per batch within a cycle.
     *
     * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
     *
     * @param batchSize max deliveries per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the delay between cleanup cycles.
     *
     * <p>Optional. Defaults to 24 hours. Must be &gt; 0.
     *
     * @param interval cleanup interval
     * @return this builder
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Builds the scheduler. Call {@link DeliveryRetentionScheduler#start()} to begin.
     *
     * @return a new {@link DeliveryRetentionScheduler} instance
     * @throws NullPointerException if {@code connectionProvider} or {@code deliveryStore} is null
     * @throws IllegalArgumentException if {@code retentionDays <= 0}, {@code batchSize <= 0},
     *     or {@code interval <= 0}
     */
    public DeliveryRetentionScheduler build() {
      return new DeliveryRetentionScheduler(this);
    }
  }
}
