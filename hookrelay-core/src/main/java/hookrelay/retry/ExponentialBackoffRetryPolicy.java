package hookrelay.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Deterministic exponential backoff.
 *
 * <p>Delay formula: {@code initialDelay * 2^(attemptCount-1)}, capped at {@code maxDelay}.
 * With the default one-minute initial delay the sequence is 1, 2, 4, 8, 16 minutes.
 * There is no jitter: the same attempt count always yields the same delay.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMinutes(1);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofHours(1);

  private final long initialDelayMs;
  private final long maxDelayMs;

  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY);
  }

  /**
   * @param initialDelay delay before the first retry
   * @param maxDelay     upper bound for any single delay
   */
  public ExponentialBackoffRetryPolicy(Duration initialDelay, Duration maxDelay) {
    Objects.requireNonNull(initialDelay, "initialDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (initialDelay.isNegative() || initialDelay.isZero()) {
      throw new IllegalArgumentException("initialDelay must be > 0, got: " + initialDelay);
    }
    if (maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= initialDelay, got: " + maxDelay);
    }
    this.initialDelayMs = initialDelay.toMillis();
    this.maxDelayMs = maxDelay.toMillis();
  }

  @Override
  public Duration computeDelay(int attemptCount) {
    if (attemptCount <= 0) {
      return Duration.ZERO;
    }
    if (attemptCount >= 63) {
      return Duration.ofMillis(maxDelayMs);
    }
    long shift = 1L << (attemptCount - 1);
    // Guard against overflow: anything past maxDelay/initialDelay is capped anyway
    if (shift > maxDelayMs / initialDelayMs) {
      return Duration.ofMillis(maxDelayMs);
    }
    return Duration.ofMillis(Math.min(maxDelayMs, initialDelayMs * shift));
  }

  public Duration initialDelay() {
    return Duration.ofMillis(initialDelayMs);
  }

  public Duration maxDelay() {
    return Duration.ofMillis(maxDelayMs);
  }
}
