package hookrelay.retry;

import java.time.Duration;

/**
 * Strategy for computing the delay before retrying a failed delivery.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay before the next attempt.
     *
     * @param attemptCount the delivery's attempt count after the failed attempt (1-based)
     * @return delay (non-negative)
     */
    Duration computeDelay(int attemptCount);
}
