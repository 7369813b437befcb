package hookrelay;

import com.github.f4b6a3.ulid.UlidCreator;
import hookrelay.dispatch.DeliveryDispatcher;
import hookrelay.dispatch.DeliveryWorker;
import hookrelay.dispatch.EnqueueResult;
import hookrelay.dispatch.QueueStatus;
import hookrelay.http.HttpDeliveryTransport;
import hookrelay.lifecycle.DeliveryLifecycle;
import hookrelay.match.SubscriptionMatcher;
import hookrelay.model.Delivery;
import hookrelay.model.DeliveryDetails;
import hookrelay.model.DeliveryPage;
import hookrelay.model.DeliveryQuery;
import hookrelay.model.DeliveryStatus;
import hookrelay.model.Subscription;
import hookrelay.purge.DeliveryRetentionScheduler;
import hookrelay.retry.ExponentialBackoffRetryPolicy;
import hookrelay.retry.FailedDeliveryScanner;
import hookrelay.retry.RetryScheduler;
import hookrelay.spi.ConnectionProvider;
import hookrelay.spi.DeliveryStore;
import hookrelay.spi.DeliveryTransport;
import hookrelay.spi.MetricsExporter;
import hookrelay.spi.SubscriptionStore;
import hookrelay.util.JsonObjects;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the delivery worker, {@link DeliveryDispatcher},
 * {@link RetryScheduler} and the optional {@link FailedDeliveryScanner} and
 * {@link DeliveryRetentionScheduler} into a single {@link AutoCloseable} unit.
 *
 * <p>Events come in through {@link #ingest(WebhookEvent)}: the event type is matched
 * against the active subscriptions, one {@code PENDING} delivery is persisted per match
 * and handed to the fresh queue. Everything after that (attempts, retries, statistics) runs
 * on background threads owned by this instance.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (HookRelay relay = HookRelay.builder()
 *     .connectionProvider(connProvider)
 *     .deliveryStore(deliveryStore)
 *     .subscriptionStore(subscriptionStore)
 *     .build()) {
 *   relay.ingest(WebhookEvent.ofJson("blog.post.created", "{\"id\":42}"));
 * }
 * }</pre>
 */
public final class HookRelay implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HookRelay.class.getName());

  public static final String TEST_EVENT_TYPE = "test.webhook";

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final SubscriptionStore subscriptionStore;
  private final SubscriptionMatcher matcher;
  private final DeliveryLifecycle lifecycle;
  private final DeliveryDispatcher dispatcher;
  private final RetryScheduler retryScheduler;
  private final FailedDeliveryScanner failedScanner;
  private final DeliveryRetentionScheduler retentionScheduler;
  private final MetricsExporter metrics;
  private final Clock clock;

  private HookRelay(Builder builder, DeliveryLifecycle lifecycle, DeliveryDispatcher dispatcher,
      RetryScheduler retryScheduler, FailedDeliveryScanner failedScanner,
      DeliveryRetentionScheduler retentionScheduler, Clock clock) {
    this.connectionProvider = builder.connectionProvider;
    this.deliveryStore = builder.deliveryStore;
    this.subscriptionStore = builder.subscriptionStore;
    this.matcher = new SubscriptionMatcher();
    this.lifecycle = lifecycle;
    this.dispatcher = dispatcher;
    this.retryScheduler = retryScheduler;
    this.failedScanner = failedScanner;
    this.retentionScheduler = retentionScheduler;
    this.metrics = builder.metrics;
    this.clock = clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Ingests a decoded event from the event bus.
   *
   * @param eventId   the producer's event id, or {@code null} to generate one
   * @param eventType the event type matched against subscription patterns
   * @param payload   the raw payload, delivered to subscribers unchanged
   * @see #ingest(WebhookEvent)
   */
  public IngestResult ingestEvent(String eventId, String eventType, byte[] payload) {
    WebhookEvent.Builder builder = WebhookEvent.builder(eventType).payload(payload);
    if (eventId != null) {
      builder.eventId(eventId);
    }
    return ingest(builder.build());
  }

  /**
   * Convenience for {@code ingest(WebhookEvent.ofJson(eventType, payloadJson))}.
   */
  public IngestResult ingestEvent(String eventType, String payloadJson) {
    return ingest(WebhookEvent.ofJson(eventType, payloadJson));
  }

  /**
   * Fans an event out to every active subscription whose patterns match its type.
   *
   * <p>For each match a {@code PENDING} delivery is persisted and offered to the fresh queue.
   * A delivery that cannot be queued stays {@code PENDING} in the store and is recovered by
   * the retry sweep. A delivery that cannot be persisted is logged and reported in the
   * result; the other matches are still processed.
   *
   * @param event the event
   * @return what happened for each matched subscription
   * @throws IngestException if the active subscriptions cannot be read
   */
  public IngestResult ingest(WebhookEvent event) {
    Objects.requireNonNull(event, "event");
    List<Subscription> matched;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      matched = matcher.match(event.eventType(), subscriptionStore.listActive(conn));
    } catch (SQLException | RuntimeException e) {
      throw new IngestException("Failed to load active subscriptions for event " + event.eventId(), e);
    }
    if (matched.isEmpty()) {
      logger.log(Level.FINE, "No subscriptions match eventType={0}", event.eventType());
      return new IngestResult(event.eventId(), List.of());
    }

    List<IngestResult.Entry> entries = new ArrayList<>(matched.size());
    for (Subscription subscription : matched) {
      entries.add(createAndEnqueue(event, subscription));
    }
    IngestResult result = new IngestResult(event.eventId(), entries);
    logger.log(Level.INFO, "Ingested eventId={0} type={1}: matched={2}, queued={3}, deferred={4}, failed={5}",
        new Object[]{event.eventId(), event.eventType(), result.matched(),
            result.queued(), result.deferred(), result.failed()});
    return result;
  }

  private IngestResult.Entry createAndEnqueue(WebhookEvent event, Subscription subscription) {
    Delivery delivery = Delivery.pending(newId(), subscription.id(), event.eventId(),
        event.eventType(), event.payload(), clock.instant());
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      deliveryStore.createDelivery(conn, delivery);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to create delivery for eventId=" + event.eventId()
          + " subscriptionId=" + subscription.id(), e);
      metrics.incrementPersistenceFailure();
      return new IngestResult.Entry(subscription.id(), null, null);
    }
    EnqueueResult result = dispatcher.enqueueFresh(delivery, subscription);
    return new IngestResult.Entry(subscription.id(), delivery.id(), result);
  }

  /**
   * Sends a {@value #TEST_EVENT_TYPE} event to a single subscription, bypassing pattern
   * matching. The delivery goes through the normal pipeline, including retries.
   *
   * @param subscriptionId the subscription to test
   * @return the outcome for that subscription
   * @throws IllegalArgumentException if the subscription does not exist
   */
  public IngestResult sendTestEvent(String subscriptionId) {
    Subscription subscription = withConnection(
        conn -> subscriptionStore.findSubscription(conn, subscriptionId))
        .orElseThrow(() -> new IllegalArgumentException("Subscription not found: " + subscriptionId));

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("message", "This is a test webhook");
    payload.put("subscription_id", subscription.id());
    payload.put("test", true);
    payload.put("timestamp", clock.instant().toString());
    WebhookEvent event = WebhookEvent.builder(TEST_EVENT_TYPE)
        .payload(JsonObjects.toJson(payload).getBytes(StandardCharsets.UTF_8))
        .occurredAt(clock.instant())
        .build();

    IngestResult.Entry entry = createAndEnqueue(event, subscription);
    if (entry.deliveryId() == null) {
      throw new IllegalStateException("Failed to persist test delivery for subscription " + subscriptionId);
    }
    return new IngestResult(event.eventId(), List.of(entry));
  }

  /**
   * Manually retries a {@code FAILED} delivery: it moves back to {@code RETRYING}, due now,
   * with its error cleared, and is offered to the retry queue. If the queue is full the
   * retry sweep picks it up instead.
   *
   * @param deliveryId the delivery to retry
   * @return the revived delivery
   * @throws IllegalArgumentException if the delivery does not exist
   * @throws IllegalStateException if the delivery is not {@code FAILED}
   */
  public Delivery retryDelivery(String deliveryId) {
    Delivery delivery = withConnection(conn -> deliveryStore.findDelivery(conn, deliveryId))
        .orElseThrow(() -> new IllegalArgumentException("Delivery not found: " + deliveryId));
    if (delivery.status() != DeliveryStatus.FAILED) {
      throw new IllegalStateException("Only failed deliveries can be retried; deliveryId="
          + deliveryId + " is " + delivery.status());
    }
    Instant now = clock.instant();
    Delivery revived = lifecycle.revive(delivery, now, now, true);
    int updated = withConnection(conn -> deliveryStore.reviveFailed(conn, revived));
    if (updated != 1) {
      throw new IllegalStateException("Delivery " + deliveryId + " changed concurrently; not retried");
    }
    dispatcher.resolve(deliveryId);
    logger.log(Level.INFO, "Manual retry of deliveryId={0}", deliveryId);

    Optional<Subscription> subscription = withConnection(
        conn -> subscriptionStore.findSubscription(conn, revived.subscriptionId()));
    subscription.ifPresent(sub -> dispatcher.enqueueRetry(revived, sub));
    return revived;
  }

  /**
   * Returns a delivery together with its attempts, ordered by attempt number.
   */
  public Optional<DeliveryDetails> findDelivery(String deliveryId) {
    return withConnection(conn -> deliveryStore.findDelivery(conn, deliveryId)
        .map(d -> new DeliveryDetails(d, deliveryStore.listAttempts(conn, deliveryId))));
  }

  public DeliveryPage listDeliveries(DeliveryQuery query) {
    Objects.requireNonNull(query, "query");
    return withConnection(conn -> deliveryStore.listDeliveries(conn, query));
  }

  /** Snapshot of both worker queues. */
  public QueueStatus queueStatus() {
    return dispatcher.status();
  }

  public DeliveryDispatcher dispatcher() {
    return dispatcher;
  }

  public RetryScheduler retryScheduler() {
    return retryScheduler;
  }

  public Optional<FailedDeliveryScanner> failedDeliveryScanner() {
    return Optional.ofNullable(failedScanner);
  }

  public Optional<DeliveryRetentionScheduler> retentionScheduler() {
    return Optional.ofNullable(retentionScheduler);
  }

  private <T> T withConnection(SqlAction<T> action) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return action.run(conn);
    } catch (SQLException e) {
      throw new IllegalStateException("Database access failed", e);
    }
  }

  @FunctionalInterface
  private interface SqlAction<T> {
    T run(Connection conn) throws SQLException;
  }

  private static String newId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  /**
   * Shuts down components in order: retention, failed-delivery scanner, retry scheduler,
   * then the dispatcher. The metrics exporter belongs to the caller and is left open.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    for (Object component : new Object[]{
        retentionScheduler, failedScanner, retryScheduler, dispatcher}) {
      if (!(component instanceof AutoCloseable closeable)) {
        continue;
      }
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link HookRelay}. {@link #build()} starts every background component.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DeliveryStore deliveryStore;
    private SubscriptionStore subscriptionStore;
    private DeliveryTransport transport;
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private Clock clock;
    private int workerCount = 10;
    private int queueCapacity = 1000;
    private int maxRetries = 5;
    private Duration initialRetryDelay = Duration.ofMinutes(1);
    private Duration maxRetryDelay = Duration.ofHours(1);
    private Duration deliveryTimeout = Duration.ofSeconds(30);
    private Duration retryCheckInterval = Duration.ofMinutes(1);
    private int retryBatchSize = 100;
    private Duration stalePendingAge = Duration.ofMinutes(5);
    private int retentionDays = 30;
    private Duration cleanupInterval = Duration.ofHours(24);
    private Duration failedScanInterval;

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

    /** <b>Required.</b> */
    public Builder subscriptionStore(SubscriptionStore subscriptionStore) {
      this.subscriptionStore = subscriptionStore;
      return this;
    }

    /**
     * Sets how deliveries are sent.
     *
     * <p>Optional. Defaults to an {@link HttpDeliveryTransport} using {@code deliveryTimeout}.
     */
    public Builder transport(DeliveryTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}. The caller owns the exporter;
     * {@link HookRelay#close()} does not close it.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the number of fresh-queue workers. The retry queue gets
     * {@code max(1, workerCount / 2)} workers of its own.
     *
     * <p>Optional. Defaults to {@code 10}.
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** Capacity of each queue. Optional. Defaults to {@code 1000}. */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets the total number of attempts a delivery gets before it is {@code FAILED}.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &gt;= 1.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /** Optional. Defaults to 1 minute. */
    public Builder initialRetryDelay(Duration initialRetryDelay) {
      this.initialRetryDelay = initialRetryDelay;
      return this;
    }

    /** Upper bound on the backoff. Optional. Defaults to 1 hour. */
    public Builder maxRetryDelay(Duration maxRetryDelay) {
      this.maxRetryDelay = maxRetryDelay;
      return this;
    }

    /** Per-attempt HTTP timeout. Optional. Defaults to 30 seconds. */
    public Builder deliveryTimeout(Duration deliveryTimeout) {
      this.deliveryTimeout = deliveryTimeout;
      return this;
    }

    /** Optional. Defaults to 1 minute. */
    public Builder retryCheckInterval(Duration retryCheckInterval) {
      this.retryCheckInterval = retryCheckInterval;
      return this;
    }

    /** Rows read per retry sweep query. Optional. Defaults to {@code 100}. */
    public Builder retryBatchSize(int retryBatchSize) {
      this.retryBatchSize = retryBatchSize;
      return this;
    }

    /**
     * Age after which an unqueued {@code PENDING} delivery is re-submitted by the retry sweep.
     *
     * <p>Optional. Defaults to 5 minutes. {@code null} disables the recovery.
     */
    public Builder stalePendingAge(Duration stalePendingAge) {
      this.stalePendingAge = stalePendingAge;
      return this;
    }

    /**
     * Sets how long terminal deliveries are kept.
     *
     * <p>Optional. Defaults to {@code 30}. {@code 0} disables cleanup.
     */
    public Builder retentionDays(int retentionDays) {
      this.retentionDays = retentionDays;
      return this;
    }

    /** Optional. Defaults to 24 hours. */
    public Builder cleanupInterval(Duration cleanupInterval) {
      this.cleanupInterval = cleanupInterval;
      return this;
    }

    /**
     * Enables the {@link FailedDeliveryScanner} with the given interval.
     *
     * <p>Optional. Disabled unless set.
     */
    public Builder failedScanInterval(Duration failedScanInterval) {
      this.failedScanInterval = failedScanInterval;
      return this;
    }

    /**
     * Builds and starts all components. If any component fails to build or start, the ones
     * already built are closed before rethrowing.
     *
     * @return a running {@link HookRelay}
     * @throws NullPointerException if a required collaborator is missing
     * @throws IllegalArgumentException if a setting is out of range
     */
    public HookRelay build() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(deliveryStore, "deliveryStore");
      Objects.requireNonNull(subscriptionStore, "subscriptionStore");
      Objects.requireNonNull(metrics, "metrics");
      if (retentionDays < 0) {
        throw new IllegalArgumentException("retentionDays must be >= 0");
      }
      if (deliveryTimeout == null || deliveryTimeout.isNegative() || deliveryTimeout.isZero()) {
        throw new IllegalArgumentException("deliveryTimeout must be > 0");
      }
      Clock effectiveClock = clock != null ? clock : Clock.systemUTC();

      DeliveryLifecycle lifecycle = new DeliveryLifecycle(maxRetries,
          new ExponentialBackoffRetryPolicy(initialRetryDelay, maxRetryDelay));
      DeliveryTransport effectiveTransport = transport != null ? transport
          : HttpDeliveryTransport.builder().timeout(deliveryTimeout).clock(effectiveClock).build();
      DeliveryWorker worker = new DeliveryWorker(connectionProvider, deliveryStore,
          effectiveTransport, lifecycle, effectiveClock);

      List<AutoCloseable> built = new ArrayList<>();
      try {
        DeliveryDispatcher dispatcher = DeliveryDispatcher.builder()
            .connectionProvider(connectionProvider)
            .deliveryStore(deliveryStore)
            .subscriptionStore(subscriptionStore)
            .deliveryWorker(worker)
            .metrics(metrics)
            .clock(effectiveClock)
            .workerCount(workerCount)
            .queueCapacity(queueCapacity)
            .drainTimeout(deliveryTimeout.plusSeconds(5))
            .build();
        built.add(dispatcher);

        RetryScheduler retryScheduler = RetryScheduler.builder()
            .connectionProvider(connectionProvider)
            .deliveryStore(deliveryStore)
            .subscriptionStore(subscriptionStore)
            .dispatcher(dispatcher)
            .lifecycle(lifecycle)
            .clock(effectiveClock)
            .batchSize(retryBatchSize)
            .interval(retryCheckInterval)
            .stalePendingAge(stalePendingAge)
            .build();
        built.add(retryScheduler);

        FailedDeliveryScanner failedScanner = null;
        if (failedScanInterval != null) {
          failedScanner = FailedDeliveryScanner.builder()
              .connectionProvider(connectionProvider)
              .deliveryStore(deliveryStore)
              .retryScheduler(retryScheduler)
              .lifecycle(lifecycle)
              .clock(effectiveClock)
              .batchSize(retryBatchSize)
              .interval(failedScanInterval)
              .build();
          built.add(failedScanner);
        }

        DeliveryRetentionScheduler retentionScheduler = null;
        if (retentionDays > 0) {
          retentionScheduler = DeliveryRetentionScheduler.builder()
              .connectionProvider(connectionProvider)
              .deliveryStore(deliveryStore)
              .metrics(metrics)
              .clock(effectiveClock)
              .retentionDays(retentionDays)
              .interval(cleanupInterval)
              .build();
          built.add(retentionScheduler);
        }

        retryScheduler.start();
        if (failedScanner != null) {
          failedScanner.start();
        }
        if (retentionScheduler != null) {
          retentionScheduler.start();
        }
        logger.log(Level.INFO, "HookRelay started: workers={0}/{1}, queueCapacity={2}, maxRetries={3}",
            new Object[]{workerCount, DeliveryDispatcher.retryWorkersFor(workerCount),
                queueCapacity, maxRetries});
        return new HookRelay(this, lifecycle, dispatcher, retryScheduler, failedScanner,
            retentionScheduler, effectiveClock);
      } catch (RuntimeException e) {
        for (int i = built.size() - 1; i >= 0; i--) {
          try {
            built.get(i).close();
          } catch (Exception closeFailure) {
            e.addSuppressed(closeFailure);
          }
        }
        throw e;
      }
    }
  }
}
