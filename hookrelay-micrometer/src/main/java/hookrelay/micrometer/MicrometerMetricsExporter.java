package hookrelay.micrometer;

import hookrelay.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code hookrelay.enqueue.fresh}: new deliveries accepted by the fresh queue</li>
 *   <li>{@code hookrelay.enqueue.fresh.rejected}: new deliveries left in the store (queue full)</li>
 *   <li>{@code hookrelay.enqueue.retry}: due retries accepted by the retry queue</li>
 *   <li>{@code hookrelay.enqueue.retry.rejected}: due retries deferred to the next sweep</li>
 *   <li>{@code hookrelay.attempt.success}: attempts answered with 2xx</li>
 *   <li>{@code hookrelay.attempt.failure}: attempts that failed</li>
 *   <li>{@code hookrelay.delivery.exhausted}: deliveries failed after their last attempt</li>
 *   <li>{@code hookrelay.delivery.abandoned}: deliveries failed because their subscription is gone</li>
 *   <li>{@code hookrelay.persistence.failure}: writes that could not be persisted</li>
 *   <li>{@code hookrelay.purged}: deliveries removed by retention</li>
 * </ul>
 *
 * <h3>Gauges and summaries</h3>
 * <ul>
 *   <li>{@code hookrelay.queue.fresh.depth}, {@code hookrelay.queue.retry.depth}</li>
 *   <li>{@code hookrelay.attempt.duration.ms}: HTTP attempt durations</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter freshEnqueued;
  private final Counter freshRejected;
  private final Counter retryEnqueued;
  private final Counter retryRejected;
  private final Counter attemptSuccess;
  private final Counter attemptFailure;
  private final Counter deliveryExhausted;
  private final Counter deliveryAbandoned;
  private final Counter persistenceFailure;
  private final Counter purged;
  private final DistributionSummary attemptDuration;
  private final Gauge freshDepthGauge;
  private final Gauge retryDepthGauge;

  private final AtomicInteger freshDepth = new AtomicInteger();
  private final AtomicInteger retryDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "hookrelay"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "hookrelay");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several engines
   * against one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.hookrelay"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.freshEnqueued = counter(namePrefix + ".enqueue.fresh", "New deliveries queued for a first attempt");
    this.freshRejected = counter(namePrefix + ".enqueue.fresh.rejected", "New deliveries not queued (fresh queue full)");
    this.retryEnqueued = counter(namePrefix + ".enqueue.retry", "Due retries queued");
    this.retryRejected = counter(namePrefix + ".enqueue.retry.rejected", "Due retries deferred (retry queue full)");
    this.attemptSuccess = counter(namePrefix + ".attempt.success", "Attempts answered with 2xx");
    this.attemptFailure = counter(namePrefix + ".attempt.failure", "Failed attempts");
    this.deliveryExhausted = counter(namePrefix + ".delivery.exhausted", "Deliveries failed after max retries");
    this.deliveryAbandoned = counter(namePrefix + ".delivery.abandoned", "Deliveries failed without an attempt");
    this.persistenceFailure = counter(namePrefix + ".persistence.failure", "Delivery writes that failed");
    this.purged = counter(namePrefix + ".purged", "Deliveries removed by retention");

    this.attemptDuration = DistributionSummary.builder(namePrefix + ".attempt.duration.ms")
        .description("HTTP attempt duration")
        .baseUnit("milliseconds")
        .register(registry);
    this.freshDepthGauge = Gauge.builder(namePrefix + ".queue.fresh.depth", freshDepth, AtomicInteger::get)
        .register(registry);
    this.retryDepthGauge = Gauge.builder(namePrefix + ".queue.retry.depth", retryDepth, AtomicInteger::get)
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementFreshEnqueued() {
    if (closed) return;
    freshEnqueued.increment();
  }

  @Override
  public void incrementFreshRejected() {
    if (closed) return;
    freshRejected.increment();
  }

  @Override
  public void incrementRetryEnqueued() {
    if (closed) return;
    retryEnqueued.increment();
  }

  @Override
  public void incrementRetryRejected() {
    if (closed) return;
    retryRejected.increment();
  }

  @Override
  public void incrementAttemptSuccess() {
    if (closed) return;
    attemptSuccess.increment();
  }

  @Override
  public void incrementAttemptFailure() {
    if (closed) return;
    attemptFailure.increment();
  }

  @Override
  public void incrementDeliveryExhausted() {
    if (closed) return;
    deliveryExhausted.increment();
  }

  @Override
  public void incrementDeliveryAbandoned() {
    if (closed) return;
    deliveryAbandoned.increment();
  }

  @Override
  public void incrementPersistenceFailure() {
    if (closed) return;
    persistenceFailure.increment();
  }

  @Override
  public void recordQueueDepths(int freshDepth, int retryDepth) {
    if (closed) return;
    this.freshDepth.set(freshDepth);
    this.retryDepth.set(retryDepth);
  }

  @Override
  public void recordAttemptDurationMs(long durationMs) {
    if (closed) return;
    attemptDuration.record(durationMs);
  }

  @Override
  public void recordPurged(int count) {
    if (closed || count <= 0) return;
    purged.increment(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry, so a closed
   * {@link hookrelay.HookRelay} leaves no stale gauges behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(freshEnqueued, freshRejected, retryEnqueued, retryRejected,
        attemptSuccess, attemptFailure, deliveryExhausted, deliveryAbandoned,
        persistenceFailure, purged, attemptDuration, freshDepthGauge, retryDepthGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
