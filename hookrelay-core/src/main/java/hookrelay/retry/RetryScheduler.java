package hookrelay.retry;

import hookrelay.dispatch.DeliveryDispatcher;
import hookrelay.dispatch.EnqueueResult;
import hookrelay.lifecycle.DeliveryLifecycle;
import hookrelay.model.Delivery;
import hookrelay.model.Subscription;
import hookrelay.spi.ConnectionProvider;
import hookrelay.spi.DeliveryStore;
import hookrelay.spi.SubscriptionStore;
import hookrelay.util.PeriodicTask;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic sweep that moves due retries from the store onto the dispatcher's retry queue.
 *
 * <p>Each cycle lists up to {@code batchSize} {@code RETRYING} deliveries whose
 * {@code nextRetryAt} has passed, attaches their subscription and offers them to
 * {@link DeliveryDispatcher#enqueueRetry}. When the retry queue fills up the cycle stops;
 * the remaining rows are untouched and picked up on the next tick.
 *
 * <p>The same cycle also recovers {@code PENDING} deliveries older than
 * {@code stalePendingAge}: rows that never reached a worker because the fresh queue was
 * full at ingestion or the process stopped before dispatching them.
 *
 * <p>Modeled as an owned timer: {@link #start()} runs the first cycle immediately and then
 * every {@code interval}; tests call {@link #runOnce()} with a controlled {@link Clock}.
 *
 * @see RetryScheduler.Builder
 */
public final class RetryScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RetryScheduler.class.getName());

  static final String MISSING_SUBSCRIPTION_ERROR = "Webhook no longer exists";

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final SubscriptionStore subscriptionStore;
  private final DeliveryDispatcher dispatcher;
  private final DeliveryLifecycle lifecycle;
  private final Clock clock;
  private final int batchSize;
  private final Duration stalePendingAge;
  private final PeriodicTask task;

  private volatile boolean closed;

  private RetryScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
    this.subscriptionStore = Objects.requireNonNull(builder.subscriptionStore, "subscriptionStore");
    this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
    this.lifecycle = Objects.requireNonNull(builder.lifecycle, "lifecycle");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.interval == null || builder.interval.isNegative() || builder.interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    if (builder.stalePendingAge != null && builder.stalePendingAge.isNegative()) {
      throw new IllegalArgumentException("stalePendingAge must be >= 0");
    }
    this.batchSize = builder.batchSize;
    this.stalePendingAge = builder.stalePendingAge;
    this.task = new PeriodicTask("hookrelay-retry-sweep-", this::runOnce, Duration.ZERO, builder.interval);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns when a delivery that has just failed for the {@code attemptCount}-th time
   * becomes due: now plus the lifecycle's backoff for that count.
   *
   * @param attemptCount the attempt count after the failed attempt (1-based)
   */
  public Instant computeNextRetry(int attemptCount) {
    return clock.instant().plus(lifecycle.retryPolicy().computeDelay(attemptCount));
  }

  /**
   * Starts the periodic sweep. Subsequent calls are no-ops if already started.
   *
   * @throws IllegalStateException if this scheduler has been closed
   */
  public void start() {
    if (closed) {
      throw new IllegalStateException("RetryScheduler has been closed");
    }
    task.start();
  }

  /**
   * Executes a single sweep. Called by the timer, but may also be invoked directly.
   *
   * @return what the sweep did
   */
  public SweepResult runOnce() {
    if (closed) {
      return SweepResult.EMPTY;
    }
    try {
      Instant now = clock.instant();
      Map<String, Optional<Subscription>> subscriptions = new HashMap<>();
      SweepResult.Counter counter = new SweepResult.Counter();

      List<Delivery> due = fetch(conn -> deliveryStore.listDueRetries(conn, now, batchSize), "due retries");
      boolean full = submit(due, subscriptions, counter);

      if (!full && stalePendingAge != null) {
        Instant createdBefore = now.minus(stalePendingAge);
        List<Delivery> stale = fetch(
            conn -> deliveryStore.listStalePending(conn, createdBefore, batchSize), "stale pending");
        submit(stale, subscriptions, counter);
      }

      SweepResult result = counter.toResult();
      if (result.enqueued() > 0 || result.skipped() > 0 || result.abandoned() > 0) {
        logger.log(Level.INFO, "Retry sweep: enqueued={0}, skipped (queue full)={1}, abandoned={2}",
            new Object[]{result.enqueued(), result.skipped(), result.abandoned()});
      }
      return result;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Retry sweep failed", t);
      return SweepResult.EMPTY;
    }
  }

  /**
   * Offers rows to the retry queue. Returns {@code true} if the queue filled up.
   */
  private boolean submit(List<Delivery> rows, Map<String, Optional<Subscription>> subscriptions,
      SweepResult.Counter counter) {
    for (int i = 0; i < rows.size(); i++) {
      Delivery delivery = rows.get(i);
      if (dispatcher.isUnresolved(delivery.id())) {
        continue;
      }
      Optional<Subscription> subscription = subscriptions.computeIfAbsent(
          delivery.subscriptionId(), this::loadSubscription);
      if (subscription.isEmpty()) {
        abandon(delivery);
        counter.abandoned++;
        continue;
      }
      EnqueueResult result = dispatcher.enqueueRetry(delivery, subscription.get());
      if (result.isAccepted()) {
        counter.enqueued++;
      } else {
        counter.skipped += rows.size() - i;
        return true;
      }
    }
    return false;
  }

  private Optional<Subscription> loadSubscription(String subscriptionId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return subscriptionStore.findSubscription(conn, subscriptionId);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to load subscription " + subscriptionId, e);
    }
  }

  private void abandon(Delivery delivery) {
    Delivery failed = lifecycle.abandon(delivery, MISSING_SUBSCRIPTION_ERROR, clock.instant());
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      deliveryStore.updateDelivery(conn, failed);
      logger.log(Level.WARNING, "Delivery {0} failed: subscription {1} no longer exists",
          new Object[]{delivery.id(), delivery.subscriptionId()});
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to abandon deliveryId=" + delivery.id(), e);
    }
  }

  private List<Delivery> fetch(Query query, String what) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return query.run(conn);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to fetch " + what, e);
      return List.of();
    }
  }

  @FunctionalInterface
  private interface Query {
    List<Delivery> run(Connection conn) throws SQLException;
  }

  /** Cancels the sweep and shuts down its thread. */
  @Override
  public void close() {
    closed = true;
    task.close();
  }

  /**
   * Counts from one sweep.
   *
   * @param enqueued  deliveries accepted by the retry queue
   * @param skipped   deliveries left for the next sweep because the queue was full
   * @param abandoned deliveries failed because their subscription no longer exists
   */
  public record SweepResult(int enqueued, int skipped, int abandoned) {
    static final SweepResult EMPTY = new SweepResult(0, 0, 0);

    private static final class Counter {
      int enqueued;
      int skipped;
      int abandoned;

      SweepResult toResult() {
        return new SweepResult(enqueued, skipped, abandoned);
      }
    }
  }

  /** Builder for {@link RetryScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DeliveryStore deliveryStore;
    private SubscriptionStore subscriptionStore;
    private DeliveryDispatcher dispatcher;
    private DeliveryLifecycle lifecycle;
    private Clock clock;
    private int batchSize = 100;
    private Duration interval = Duration.ofMinutes(1);
    private Duration stalePendingAge = Duration.ofMinutes(5);

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder deliveryStore(DeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    /** <b>Required.</b> Used to attach subscriptions to due deliveries. */
    public Builder subscriptionStore(SubscriptionStore subscriptionStore) {
      this.subscriptionStore = subscriptionStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder dispatcher(DeliveryDispatcher dispatcher) {
      this.dispatcher = dispatcher;
      return this;
    }

    /** <b>Required.</b> Supplies the backoff for {@link RetryScheduler#computeNextRetry}. */
    public Builder lifecycle(DeliveryLifecycle lifecycle) {
      this.lifecycle = lifecycle;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the maximum number of rows read per query in one sweep.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the delay between sweeps ({@code retryCheckInterval}).
     *
     * <p>Optional. Defaults to 1 minute. Must be &gt; 0.
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Sets how old a {@code PENDING} delivery must be before the sweep re-submits it.
     *
     * <p>Optional. Defaults to 5 minutes. {@code null} disables stale-pending recovery.
     */
    public Builder stalePendingAge(Duration stalePendingAge) {
      this.stalePendingAge = stalePendingAge;
      return this;
    }

    /**
     * Builds the scheduler. Call {@link RetryScheduler#start()} to begin.
     *
     * @throws NullPointerException if a required collaborator is missing
     * @throws IllegalArgumentException if {@code batchSize <= 0}, {@code interval <= 0}
     *     or {@code stalePendingAge} is negative
     */
    public RetryScheduler build() {
      return new RetryScheduler(this);
    }
  }
}
