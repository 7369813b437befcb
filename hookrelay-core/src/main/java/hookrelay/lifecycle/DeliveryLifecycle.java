package hookrelay.lifecycle;

import hookrelay.model.Delivery;
import hookrelay.model.DeliveryStatus;
import hookrelay.retry.RetryPolicy;

import java.time.Instant;
import java.util.Objects;

/**
 * State machine for {@link Delivery} records.
 *
 * <pre>
 *   PENDING  --success-----------------------&gt; SUCCESS
 *   PENDING  --failure, attempts &lt; max-------&gt; RETRYING
 *   RETRYING --success-----------------------&gt; SUCCESS
 *   RETRYING --failure, attempts &lt; max-------&gt; RETRYING (rescheduled)
 *   PENDING|RETRYING --failure, attempts &gt;= max --&gt; FAILED
 *   PENDING|RETRYING --abandon----------------&gt; FAILED (no attempt)
 *   FAILED   --revive------------------------&gt; RETRYING (operator or scanner)
 * </pre>
 *
 * <p>No other transition leaves {@code SUCCESS} or {@code FAILED}.
 */
public final class DeliveryLifecycle {
  private final int maxRetries;
  private final RetryPolicy retryPolicy;

  public DeliveryLifecycle(int maxRetries, RetryPolicy retryPolicy) {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1");
    }
    this.maxRetries = maxRetries;
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
  }

  public int maxRetries() {
    return maxRetries;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  /**
   * Applies the outcome of one attempt.
   *
   * @param delivery    the delivery as it was before the attempt
   * @param success     whether the attempt succeeded
   * @param error       failure summary, ignored on success
   * @param attemptedAt when the attempt completed
   * @return the delivery after the attempt, with {@code attemptCount} incremented
   * @throws IllegalTransitionException if the delivery is already terminal
   */
  public Delivery applyAttempt(Delivery delivery, boolean success, String error, Instant attemptedAt) {
    requireActive(delivery, "record an attempt on");
    int attempts = delivery.attemptCount() + 1;
    Delivery.Builder next = delivery.toBuilder()
        .attemptCount(attempts)
        .lastAttemptAt(attemptedAt)
        .updatedAt(attemptedAt);

    if (success) {
      return next.status(DeliveryStatus.SUCCESS)
          .nextRetryAt(null)
          .lastError(null)
          .completedAt(attemptedAt)
          .build();
    }
    if (attempts >= maxRetries) {
      return next.status(DeliveryStatus.FAILED)
          .nextRetryAt(null)
          .lastError("Max retries reached. Last error: " + error)
          .completedAt(attemptedAt)
          .build();
    }
    return next.status(DeliveryStatus.RETRYING)
        .nextRetryAt(attemptedAt.plus(retryPolicy.computeDelay(attempts)))
        .lastError("Attempt " + attempts + " failed: " + error)
        .build();
  }

  /**
   * Fails a delivery without attempting it, e.g. because its subscription was
   * deactivated or removed. The attempt count is left unchanged.
   */
  public Delivery abandon(Delivery delivery, String reason, Instant at) {
    requireActive(delivery, "abandon");
    return delivery.toBuilder()
        .status(DeliveryStatus.FAILED)
        .nextRetryAt(null)
        .lastError(reason)
        .completedAt(at)
        .updatedAt(at)
        .build();
  }

  /**
   * Moves a {@link DeliveryStatus#FAILED} delivery back to {@link DeliveryStatus#RETRYING}.
   * The attempt count is preserved: a delivery revived after exhausting its budget gets
   * exactly one more attempt before failing again.
   *
   * @param clearError whether to clear {@code lastError}
   */
  public Delivery revive(Delivery delivery, Instant nextRetryAt, Instant at, boolean clearError) {
    if (delivery.status() != DeliveryStatus.FAILED) {
      throw new IllegalTransitionException(delivery.id(), delivery.status(), "revive");
    }
    if (nextRetryAt.isBefore(at)) {
      throw new IllegalArgumentException("nextRetryAt must not be before " + at);
    }
    return delivery.toBuilder()
        .status(DeliveryStatus.RETRYING)
        .nextRetryAt(nextRetryAt)
        .lastError(clearError ? null : delivery.lastError())
        .completedAt(null)
        .updatedAt(at)
        .build();
  }

  /** Whether the delivery has used its whole attempt budget. */
  public boolean isExhausted(Delivery delivery) {
    return delivery.attemptCount() >= maxRetries;
  }

  private static void requireActive(Delivery delivery, String action) {
    if (delivery.isTerminal()) {
      throw new IllegalTransitionException(delivery.id(), delivery.status(), action);
    }
  }
}
