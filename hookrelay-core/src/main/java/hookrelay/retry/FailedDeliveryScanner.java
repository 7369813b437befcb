package hookrelay.retry;

import hookrelay.dispatch.DeliveryDispatcher;
import hookrelay.lifecycle.DeliveryLifecycle;
import hookrelay.model.Delivery;
import hookrelay.spi.ConnectionProvider;
import hookrelay.spi.DeliveryStore;
import hookrelay.util.PeriodicTask;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opt-in scanner that gives {@code FAILED} deliveries with attempts left another chance.
 *
 * <p>A delivery can be {@code FAILED} while still under its attempt budget when it was
 * abandoned, or when {@code maxRetries} was raised after it failed. Each cycle asks the store
 * for up to {@code batchSize} failed deliveries below {@code maxRetries} and moves them back
 * to {@code RETRYING} with {@code nextRetryAt} computed from their attempt count; exhausted
 * deliveries are only counted, as skipped. The {@link RetryScheduler} then picks the revived
 * ones up like any other due retry.
 *
 * <p>Deliveries failed with {@link DeliveryDispatcher#UNRECORDED_OUTCOME_ERROR} are never
 * revived here: their last attempt may have reached the subscriber.
 *
 * <p>Not started by default; see {@code HookRelay.Builder#failedScanInterval}.
 */
public final class FailedDeliveryScanner implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FailedDeliveryScanner.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final RetryScheduler retryScheduler;
  private final DeliveryLifecycle lifecycle;
  private final Clock clock;
  private final int batchSize;
  private final PeriodicTask task;

  private volatile boolean closed;

  private FailedDeliveryScanner(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
    this.retryScheduler = Objects.requireNonNull(builder.retryScheduler, "retryScheduler");
    this.lifecycle = Objects.requireNonNull(builder.lifecycle, "lifecycle");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.interval == null || builder.interval.isNegative() || builder.interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    this.batchSize = builder.batchSize;
    this.task = new PeriodicTask("hookrelay-failed-scan-", this::runOnce, builder.interval, builder.interval);
  }

  public static Builder builder() {
    return new Builder();
  }

  public void start() {
    if (closed) {
      throw new IllegalStateException("FailedDeliveryScanner has been closed");
    }
    task.start();
  }

  /**
   * Executes a single scan.
   *
   * @return what the scan did
   */
  public ScanResult runOnce() {
    if (closed) {
      return new ScanResult(0, 0);
    }
    int revived = 0;
    long skipped = 0;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      int maxRetries = lifecycle.maxRetries();
      List<Delivery> revivable = deliveryStore.listRevivable(conn, maxRetries,
          DeliveryDispatcher.UNRECORDED_OUTCOME_ERROR, batchSize);
      for (Delivery delivery : revivable) {
        Instant now = clock.instant();
        Delivery retrying = lifecycle.revive(delivery,
            retryScheduler.computeNextRetry(delivery.attemptCount()), now, false);
        revived += deliveryStore.reviveFailed(conn, retrying);
      }
      skipped = deliveryStore.countExhausted(conn, maxRetries);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to obtain connection for failed-delivery scan", e);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed-delivery scan failed", e);
    }
    if (revived > 0) {
      logger.log(Level.INFO, "Failed-delivery scan: revived={0}, skipped (max retries reached)={1}",
          new Object[]{revived, skipped});
    }
    return new ScanResult(revived, skipped);
  }

  @Override
  public void close() {
    closed = true;
    task.close();
  }

  /**
   * Counts from one scan.
   *
   * @param revived deliveries moved back to {@code RETRYING}
   * @param skipped deliveries left {@code FAILED} because they reached max retries
   */
  public record ScanResult(int revived, long skipped) {}

  /** Builder for {@link FailedDeliveryScanner}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DeliveryStore deliveryStore;
    private RetryScheduler retryScheduler;
    private DeliveryLifecycle lifecycle;
    private Clock clock;
    private int batchSize = 100;
    private Duration interval = Duration.ofMinutes(5);

    private Builder() {}

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder deliveryStore(DeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    /** Source of {@link RetryScheduler#computeNextRetry}. */
    public Builder retryScheduler(RetryScheduler retryScheduler) {
      this.retryScheduler = retryScheduler;
      return this;
    }

    public Builder lifecycle(DeliveryLifecycle lifecycle) {
      this.lifecycle = lifecycle;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Defaults to {@code 100}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Optional. Defaults to 5 minutes. */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    public FailedDeliveryScanner build() {
      return new FailedDeliveryScanner(this);
    }
  }
}
