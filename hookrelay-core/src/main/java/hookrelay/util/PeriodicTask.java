package hookrelay.util;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * An owned, single-threaded timer that runs one action with a fixed delay between runs.
 *
 * <p>Each background component (retry sweep, failed scan, retention) owns one instance
 * instead of sharing a global scheduler, so tests can skip {@link #start()} entirely and
 * drive the action by hand.
 */
public final class PeriodicTask implements AutoCloseable {
  private final String name;
  private final Runnable action;
  private final Duration initialDelay;
  private final Duration interval;

  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> future;
  private boolean closed;

  /**
   * @param name         thread name prefix, e.g. {@code "hookrelay-retry-"}
   * @param action       the action; must handle its own exceptions
   * @param initialDelay delay before the first run
   * @param interval     delay between the end of one run and the start of the next
   */
  public PeriodicTask(String name, Runnable action, Duration initialDelay, Duration interval) {
    this.name = Objects.requireNonNull(name, "name");
    this.action = Objects.requireNonNull(action, "action");
    this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
    this.interval = Objects.requireNonNull(interval, "interval");
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must be >= 0");
    }
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
  }

  /**
   * Starts the timer. Subsequent calls are no-ops if already started.
   *
   * @throws IllegalStateException if the task has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException(name + " has been closed");
    }
    if (future != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory(name));
    future = scheduler.scheduleWithFixedDelay(action,
        initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
  }

  public synchronized boolean isStarted() {
    return future != null && !closed;
  }

  /** Cancels the schedule and waits briefly for a running action to notice the interrupt. */
  @Override
  public synchronized void close() {
    closed = true;
    if (future != null) {
      future.cancel(false);
      future = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      scheduler = null;
    }
  }
}
