package hookrelay.spi;

/**
 * Observability hook for exporting delivery counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see hookrelay.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of deliveries accepted by the fresh queue.
     */
    void incrementFreshEnqueued();

    /**
     * Increments the count of deliveries rejected because the fresh queue was full.
     */
    void incrementFreshRejected();

    /**
     * Increments the count of deliveries accepted by the retry queue.
     */
    void incrementRetryEnqueued();

    /**
     * Increments the count of deliveries skipped by a sweep because the retry queue was full.
     */
    void incrementRetryRejected();

    /**
     * Increments the count of attempts answered with 2xx.
     */
    void incrementAttemptSuccess();

    /**
     * Increments the count of failed attempts (transport error or non-2xx).
     */
    void incrementAttemptFailure();

    /**
     * Increments the count of deliveries moved to FAILED after using every attempt.
     */
    void incrementDeliveryExhausted();

    /**
     * Increments the count of attempts whose outcome could not be persisted.
     */
    void incrementPersistenceFailure();

    /**
     * Records the current depth of both queues.
     *
     * @param freshDepth deliveries waiting in the fresh queue
     * @param retryDepth deliveries waiting in the retry queue
     */
    void recordQueueDepths(int freshDepth, int retryDepth);

    /**
     * Increments the count of deliveries failed without an attempt because their
     * subscription was removed or deactivated.
     */
    default void incrementDeliveryAbandoned() {
    }

    /**
     * Records the duration of one HTTP attempt.
     *
     * @param durationMs attempt time in milliseconds (always non-negative)
     */
    default void recordAttemptDurationMs(long durationMs) {
    }

    /**
     * Records deliveries removed by the retention sweep.
     *
     * @param count number of deliveries deleted
     */
    default void recordPurged(int count) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementFreshEnqueued() {
        }

        @Override
        public void incrementFreshRejected() {
        }

        @Override
        public void incrementRetryEnqueued() {
        }

        @Override
        public void incrementRetryRejected() {
        }

        @Override
        public void incrementAttemptSuccess() {
        }

        @Override
        public void incrementAttemptFailure() {
        }

        @Override
        public void incrementDeliveryExhausted() {
        }

        @Override
        public void incrementPersistenceFailure() {
        }

        @Override
        public void recordQueueDepths(int freshDepth, int retryDepth) {
        }
    }
}
