package hookrelay.dispatch;

import hookrelay.model.Delivery;
import hookrelay.model.DeliveryStatus;
import hookrelay.model.Subscription;
import hookrelay.spi.ConnectionProvider;
import hookrelay.spi.DeliveryStore;
import hookrelay.spi.MetricsExporter;
import hookrelay.spi.SubscriptionStore;
import hookrelay.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dual-queue dispatch pool for webhook deliveries.
 *
 * <p>Deliveries arrive on two bounded queues: the <em>fresh queue</em> (newly ingested
 * events) and the <em>retry queue</em> (due retries found by the
 * {@link hookrelay.retry.RetryScheduler}). Each queue has its own worker pool:
 * {@code workerCount} fresh workers and {@code max(1, workerCount / 2)} retry workers, so a
 * retry storm cannot starve new deliveries and vice versa.
 *
 * <p>Enqueueing never blocks. A full queue yields {@link EnqueueResult#QUEUE_FULL} and the
 * persisted delivery is left as it was, to be found again by the next sweep.
 *
 * <p>For every dequeued item a worker:
 * <ol>
 *   <li>claims the delivery id in the {@link InFlightTracker}, skipping it if busy;</li>
 *   <li>re-reads the delivery and skips it if deleted, terminal, or not yet due;</li>
 *   <li>fails it without an attempt if the subscription is no longer active;</li>
 *   <li>runs one attempt through the {@link DeliveryWorker};</li>
 *   <li>records the attempt in the subscription statistics, whatever its outcome.</li>
 * </ol>
 *
 * <p>If an attempt was sent but its outcome could not be committed, the delivery is failed
 * with {@link #UNRECORDED_OUTCOME_ERROR} so no sweep sends it again. When even that write
 * fails, its id is held in memory and skipped by workers and sweeps until an operator
 * retries it; see {@link #isUnresolved(String)}.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable}: closing stops intake, lets each worker finish the attempt it is
 * running, and leaves queued but unstarted deliveries in the store.
 *
 * @see DeliveryDispatcher.Builder
 */
public final class DeliveryDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryDispatcher.class.getName());

  static final String INACTIVE_SUBSCRIPTION_ERROR = "Webhook is no longer active";

  /**
   * Prefix of {@code lastError} for deliveries failed because an attempt was sent but its
   * outcome could not be recorded. Such deliveries are only revived by an operator.
   */
  public static final String UNRECORDED_OUTCOME_ERROR = "Outcome not recorded";

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final BlockingQueue<QueuedDelivery> freshQueue;
  private final BlockingQueue<QueuedDelivery> retryQueue;
  private final ExecutorService freshWorkers;
  private final ExecutorService retryWorkers;
  private final int freshWorkerCount;
  private final int retryWorkerCount;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final Set<String> unresolved = ConcurrentHashMap.newKeySet();

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final SubscriptionStore subscriptionStore;
  private final DeliveryWorker deliveryWorker;
  private final InFlightTracker inFlightTracker;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final long drainTimeoutMs;

  private DeliveryDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
    this.subscriptionStore = Objects.requireNonNull(builder.subscriptionStore, "subscriptionStore");
    this.deliveryWorker = Objects.requireNonNull(builder.deliveryWorker, "deliveryWorker");
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    int workerCount = builder.workerCount;
    int queueCapacity = builder.queueCapacity;
    Duration drainTimeout = builder.drainTimeout;

    if (workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (drainTimeout == null || drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }
    this.drainTimeoutMs = drainTimeout.toMillis();

    this.freshQueue = new ArrayBlockingQueue<>(queueCapacity);
    this.retryQueue = new ArrayBlockingQueue<>(queueCapacity);
    this.freshWorkerCount = workerCount;
    this.retryWorkerCount = retryWorkersFor(workerCount);

    if (workerCount > 0) {
      this.freshWorkers = Executors.newFixedThreadPool(freshWorkerCount,
          new DaemonThreadFactory("hookrelay-fresh-"));
      this.retryWorkers = Executors.newFixedThreadPool(retryWorkerCount,
          new DaemonThreadFactory("hookrelay-retry-worker-"));
      for (int i = 0; i < freshWorkerCount; i++) {
        freshWorkers.submit(() -> workerLoop(freshQueue));
      }
      for (int i = 0; i < retryWorkerCount; i++) {
        retryWorkers.submit(() -> workerLoop(retryQueue));
      }
    } else {
      // workerCount=0: queues accept work but nothing drains them (testing only)
      logger.warning("workerCount=0: no delivery workers started; queued deliveries will not be processed");
      this.freshWorkers = Executors.newCachedThreadPool(new DaemonThreadFactory("hookrelay-fresh-"));
      this.retryWorkers = Executors.newCachedThreadPool(new DaemonThreadFactory("hookrelay-retry-worker-"));
    }
  }

  /**
   * Number of retry workers derived from the fresh worker count: {@code max(1, workerCount / 2)},
   * or zero when {@code workerCount} is zero.
   */
  public static int retryWorkersFor(int workerCount) {
    return workerCount == 0 ? 0 : Math.max(1, workerCount / 2);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Offers a newly created delivery to the fresh queue without blocking.
   *
   * @param delivery     the persisted {@code PENDING} delivery
   * @param subscription its subscription
   * @return {@link EnqueueResult#ACCEPTED}, or why the delivery was not queued
   */
  public EnqueueResult enqueueFresh(Delivery delivery, Subscription subscription) {
    EnqueueResult result = offer(freshQueue, new QueuedDelivery(delivery, subscription), "fresh");
    if (result.isAccepted()) {
      metrics.incrementFreshEnqueued();
    } else if (result == EnqueueResult.QUEUE_FULL) {
      metrics.incrementFreshRejected();
    }
    return result;
  }

  /**
   * Offers a due delivery to the retry queue without blocking.
   *
   * @param delivery     the persisted {@code RETRYING} delivery
   * @param subscription its subscription
   * @return {@link EnqueueResult#ACCEPTED}, or why the delivery was not queued
   */
  public EnqueueResult enqueueRetry(Delivery delivery, Subscription subscription) {
    EnqueueResult result = offer(retryQueue, new QueuedDelivery(delivery, subscription), "retry");
    if (result.isAccepted()) {
      metrics.incrementRetryEnqueued();
    } else if (result == EnqueueResult.QUEUE_FULL) {
      metrics.incrementRetryRejected();
    }
    return result;
  }

  private EnqueueResult offer(BlockingQueue<QueuedDelivery> queue, QueuedDelivery item, String name) {
    if (!accepting.get()) {
      return EnqueueResult.SHUTTING_DOWN;
    }
    boolean enqueued = queue.offer(item);
    metrics.recordQueueDepths(freshQueue.size(), retryQueue.size());
    if (!enqueued) {
      logger.log(Level.WARNING, "{0} queue full; deliveryId={1} left {2} in store",
          new Object[]{name, item.delivery().id(), item.delivery().status()});
      return EnqueueResult.QUEUE_FULL;
    }
    return EnqueueResult.ACCEPTED;
  }

  public int retryQueueRemainingCapacity() {
    return retryQueue.remainingCapacity();
  }

  public int freshQueueRemainingCapacity() {
    return freshQueue.remainingCapacity();
  }

  public QueueStatus status() {
    return new QueueStatus(
        freshQueue.size(), freshQueue.remainingCapacity(),
        retryQueue.size(), retryQueue.remainingCapacity(),
        freshWorkerCount, retryWorkerCount,
        unresolved.size(), accepting.get());
  }

  /**
   * Whether the delivery had an attempt sent whose outcome could not be written anywhere.
   * Workers and sweeps skip such deliveries.
   */
  public boolean isUnresolved(String deliveryId) {
    return unresolved.contains(deliveryId);
  }

  /** Releases a delivery held by {@link #isUnresolved(String)}, after operator action. */
  public void resolve(String deliveryId) {
    unresolved.remove(deliveryId);
  }

  private void workerLoop(BlockingQueue<QueuedDelivery> queue) {
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      try {
        QueuedDelivery item = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (item == null) {
          continue;
        }
        process(item);
        metrics.recordQueueDepths(freshQueue.size(), retryQueue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Delivery worker loop error", t);
      }
    }
  }

  private void process(QueuedDelivery item) {
    String deliveryId = item.delivery().id();
    if (unresolved.contains(deliveryId) || !inFlightTracker.tryAcquire(deliveryId)) {
      return;
    }
    try {
      Delivery current = reload(deliveryId);
      if (current == null || !isDue(current)) {
        return;
      }
      Subscription subscription = item.subscription();
      if (!subscription.active()) {
        abandon(current, INACTIVE_SUBSCRIPTION_ERROR);
        return;
      }

      AttemptOutcome outcome;
      try {
        outcome = deliveryWorker.deliver(current, subscription);
      } catch (DeliveryPersistenceException e) {
        metrics.incrementPersistenceFailure();
        logger.log(Level.SEVERE, "Attempt outcome not persisted for deliveryId=" + deliveryId
            + "; delivery needs operator attention", e);
        park(current, e);
        return;
      }
      recordOutcome(outcome);
      updateStatistics(subscription.id(), outcome);
    } finally {
      inFlightTracker.release(deliveryId);
    }
  }

  /**
   * Re-reads the delivery so a stale queued copy never overwrites newer state.
   * Returns {@code null} if the row is gone or cannot be read.
   */
  private Delivery reload(String deliveryId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return deliveryStore.findDelivery(conn, deliveryId).orElse(null);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to load deliveryId=" + deliveryId, e);
      return null;
    }
  }

  private boolean isDue(Delivery current) {
    if (current.isTerminal()) {
      return false;
    }
    if (current.status() == DeliveryStatus.RETRYING) {
      return !current.nextRetryAt().isAfter(clock.instant());
    }
    return true;
  }

  private void abandon(Delivery current, String reason) {
    Delivery failed = deliveryWorker.lifecycle().abandon(current, reason, clock.instant());
    withConnection("abandon", current.id(), conn -> {
      if (deliveryStore.updateDelivery(conn, failed) == 1) {
        metrics.incrementDeliveryAbandoned();
        logger.log(Level.WARNING, "Delivery {0} failed without attempt: {1}",
            new Object[]{current.id(), reason});
      }
    });
  }

  /**
   * Fails a delivery whose last attempt went out unrecorded. The attempt count stays equal to
   * the number of attempt rows.
   */
  private void park(Delivery current, DeliveryPersistenceException cause) {
    unresolved.add(current.id());
    String reason = UNRECORDED_OUTCOME_ERROR + " for attempt " + (current.attemptCount() + 1)
        + ": " + cause.getMessage();
    Delivery failed = deliveryWorker.lifecycle().abandon(current, reason, clock.instant());
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      deliveryStore.updateDelivery(conn, failed);
      unresolved.remove(current.id());
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to park deliveryId=" + current.id()
          + "; holding it in memory until an operator retries it", e);
    }
  }

  private void recordOutcome(AttemptOutcome outcome) {
    metrics.recordAttemptDurationMs(Math.max(0L, outcome.attempt().durationMs()));
    if (outcome.success()) {
      metrics.incrementAttemptSuccess();
      return;
    }
    metrics.incrementAttemptFailure();
    if (outcome.delivery().status() == DeliveryStatus.FAILED) {
      metrics.incrementDeliveryExhausted();
    }
  }

  private void updateStatistics(String subscriptionId, AttemptOutcome outcome) {
    Instant at = outcome.attempt().createdAt();
    withConnection("update statistics", outcome.delivery().id(),
        conn -> subscriptionStore.updateStatistics(conn, subscriptionId, outcome.success(), at));
  }

  private void withConnection(String action, String deliveryId, SqlAction op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      op.execute(conn);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for deliveryId=" + deliveryId, e);
    }
  }

  @FunctionalInterface
  private interface SqlAction {
    void execute(Connection conn) throws SQLException;
  }

  /**
   * Stops accepting deliveries and waits up to the drain timeout for workers to finish the
   * attempt in progress. In-flight HTTP calls are not interrupted; each is bounded by the
   * transport timeout. Deliveries still queued are dropped from memory only: their rows stay
   * {@code PENDING} or {@code RETRYING} and are picked up again after restart.
   */
  @Override
  public void close() {
    if (!accepting.getAndSet(false)) {
      return;
    }
    running.set(false);
    freshWorkers.shutdown();
    retryWorkers.shutdown();
    try {
      long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(drainTimeoutMs);
      boolean freshDone = freshWorkers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS);
      long remaining = Math.max(0L, deadline - System.nanoTime());
      boolean retryDone = retryWorkers.awaitTermination(remaining, TimeUnit.NANOSECONDS);
      if (!freshDone || !retryDone) {
        logger.log(Level.WARNING, "Drain timeout exceeded; workers still finishing their current attempt");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    int dropped = freshQueue.size() + retryQueue.size();
    freshQueue.clear();
    retryQueue.clear();
    if (dropped > 0) {
      logger.log(Level.INFO, "Dispatcher closed with {0} queued deliveries left in the store", dropped);
    }
    metrics.recordQueueDepths(0, 0);
  }

  /** Builder for {@link DeliveryDispatcher}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DeliveryStore deliveryStore;
    private SubscriptionStore subscriptionStore;
    private DeliveryWorker deliveryWorker;
    private InFlightTracker inFlightTracker;
    private MetricsExporter metrics;
    private Clock clock;
    private int workerCount = 10;
    private int queueCapacity = 1000;
    private Duration drainTimeout = Duration.ofSeconds(35);

    private Builder() {}

    /**
     * Sets the connection provider used to reload deliveries and update statistics.
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
     * Sets the delivery store.
     *
     * <p><b>Required.</b>
     *
     * @param deliveryStore the delivery persistence backend
     * @return this builder
     */
    public Builder deliveryStore(DeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    /**
     * Sets the subscription store receiving per-attempt statistics.
     *
     * <p><b>Required.</b>
     *
     * @param subscriptionStore the subscription store
     * @return this builder
     */
    public Builder subscriptionStore(SubscriptionStore subscriptionStore) {
      this.subscriptionStore = subscriptionStore;
      return this;
    }

    /**
     * Sets the worker that performs and records attempts.
     *
     * <p><b>Required.</b>
     *
     * @param deliveryWorker the delivery worker
     * @return this builder
     */
    public Builder deliveryWorker(DeliveryWorker deliveryWorker) {
      this.deliveryWorker = deliveryWorker;
      return this;
    }

    /**
     * Sets a custom in-flight tracker.
     *
     * <p>Optional. Defaults to {@link DefaultInFlightTracker}.
     *
     * @param inFlightTracker the tracker implementation
     * @return this builder
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used to decide whether a retry is due.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the number of fresh-queue workers. The retry queue gets
     * {@code max(1, workerCount / 2)} workers of its own.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 0. Setting to {@code 0}
     * disables processing (useful for testing only).
     *
     * @param workerCount number of fresh-queue workers
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the capacity of each queue.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     *
     * @param queueCapacity maximum number of deliveries per queue
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets how long {@link #close()} waits for workers to finish their current attempt.
     *
     * <p>Optional. Defaults to 35 seconds (the default delivery timeout plus 5 seconds).
     *
     * @param drainTimeout the drain timeout
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Builds and starts the dispatcher. Worker threads begin draining queues immediately.
     *
     * @return a new {@link DeliveryDispatcher} instance
     * @throws NullPointerException if {@code connectionProvider}, {@code deliveryStore},
     *     {@code subscriptionStore} or {@code deliveryWorker} is null
     * @throws IllegalArgumentException if {@code workerCount < 0}, {@code queueCapacity <= 0}
     *     or {@code drainTimeout} is negative
     */
    public DeliveryDispatcher build() {
      return new DeliveryDispatcher(this);
    }
  }
}
