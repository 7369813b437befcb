package hookrelay.support;

import hookrelay.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** Counts every metrics call. */
public final class RecordingMetrics implements MetricsExporter, AutoCloseable {
  public final AtomicInteger freshEnqueued = new AtomicInteger();
  public final AtomicInteger freshRejected = new AtomicInteger();
  public final AtomicInteger retryEnqueued = new AtomicInteger();
  public final AtomicInteger retryRejected = new AtomicInteger();
  public final AtomicInteger attemptSuccess = new AtomicInteger();
  public final AtomicInteger attemptFailure = new AtomicInteger();
  public final AtomicInteger exhausted = new AtomicInteger();
  public final AtomicInteger persistenceFailures = new AtomicInteger();
  public final AtomicInteger abandoned = new AtomicInteger();
  public final AtomicLong purged = new AtomicLong();
  public volatile boolean closed;

  @Override
  public void incrementFreshEnqueued() {
    freshEnqueued.incrementAndGet();
  }

  @Override
  public void incrementFreshRejected() {
    freshRejected.incrementAndGet();
  }

  @Override
  public void incrementRetryEnqueued() {
    retryEnqueued.incrementAndGet();
  }

  @Override
  public void incrementRetryRejected() {
    retryRejected.incrementAndGet();
  }

  @Override
  public void incrementAttemptSuccess() {
    attemptSuccess.incrementAndGet();
  }

  @Override
  public void incrementAttemptFailure() {
    attemptFailure.incrementAndGet();
  }

  @Override
  public void incrementDeliveryExhausted() {
    exhausted.incrementAndGet();
  }

  @Override
  public void incrementPersistenceFailure() {
    persistenceFailures.incrementAndGet();
  }

  @Override
  public void recordQueueDepths(int freshDepth, int retryDepth) {}

  @Override
  public void incrementDeliveryAbandoned() {
    abandoned.incrementAndGet();
  }

  @Override
  public void recordPurged(int count) {
    purged.addAndGet(count);
  }

  @Override
  public void close() {
    closed = true;
  }
}
