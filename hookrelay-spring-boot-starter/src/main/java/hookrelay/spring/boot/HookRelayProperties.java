package hookrelay.spring.boot;

import hookrelay.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the webhook delivery engine.
 *
 * @see HookRelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "hookrelay")
public class HookRelayProperties {

    /**
     * Worker threads for first attempts. Retries get half of this, at least one.
     */
    private int workerCount = 10;

    /**
     * Capacity of each in-memory queue (fresh and retry).
     */
    private int queueCapacity = 1000;

    /**
     * Attempts per delivery before it is marked failed.
     */
    private int maxRetries = 5;

    /**
     * Timeout of a single HTTP attempt.
     */
    private Duration deliveryTimeout = Duration.ofSeconds(30);

    private final Tables tables = new Tables();
    private final Retry retry = new Retry();
    private final Retention retention = new Retention();
    private final FailedScan failedScan = new FailedScan();
    private final Metrics metrics = new Metrics();

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getDeliveryTimeout() {
        return deliveryTimeout;
    }

    public void setDeliveryTimeout(Duration deliveryTimeout) {
        this.deliveryTimeout = deliveryTimeout;
    }

    public Tables getTables() {
        return tables;
    }

    public Retry getRetry() {
        return retry;
    }

    public Retention getRetention() {
        return retention;
    }

    public FailedScan getFailedScan() {
        return failedScan;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Tables {
        private String subscription = TableNames.DEFAULT_SUBSCRIPTION_TABLE;
        private String delivery = TableNames.DEFAULT_DELIVERY_TABLE;
        private String attempt = TableNames.DEFAULT_ATTEMPT_TABLE;

        public String getSubscription() {
            return subscription;
        }

        public void setSubscription(String subscription) {
            this.subscription = subscription;
        }

        public String getDelivery() {
            return delivery;
        }

        public void setDelivery(String delivery) {
            this.delivery = delivery;
        }

        public String getAttempt() {
            return attempt;
        }

        public void setAttempt(String attempt) {
            this.attempt = attempt;
        }
    }

    public static class Retry {
        private Duration initialDelay = Duration.ofMinutes(1);
        private Duration maxDelay = Duration.ofHours(1);

        /**
         * How often the sweep looks for due retries.
         */
        private Duration checkInterval = Duration.ofMinutes(1);
        private int batchSize = 100;

        /**
         * Age after which a pending delivery that never reached a worker is re-submitted.
         * Zero disables the recovery.
         */
        private Duration stalePendingAge = Duration.ofMinutes(5);

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Duration getCheckInterval() {
            return checkInterval;
        }

        public void setCheckInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getStalePendingAge() {
            return stalePendingAge;
        }

        public void setStalePendingAge(Duration stalePendingAge) {
            this.stalePendingAge = stalePendingAge;
        }
    }

    public static class Retention {
        /**
         * Days to keep completed deliveries. Zero disables cleanup.
         */
        private int days = 30;
        private Duration cleanupInterval = Duration.ofHours(24);

        public int getDays() {
            return days;
        }

        public void setDays(int days) {
            this.days = days;
        }

        public Duration getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }
    }

    public static class FailedScan {
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "hookrelay";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
