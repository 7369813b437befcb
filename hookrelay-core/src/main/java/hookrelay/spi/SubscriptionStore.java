package hookrelay.spi;

import hookrelay.model.Subscription;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to webhook subscriptions plus the one write the engine performs:
 * per-attempt statistics.
 *
 * @see hookrelay.jdbc.JdbcSubscriptionStore
 */
public interface SubscriptionStore {

    Optional<Subscription> findSubscription(Connection conn, String subscriptionId);

    /**
     * Returns all active subscriptions. The matcher filters them by event type.
     */
    List<Subscription> listActive(Connection conn);

    /**
     * Records the outcome of one attempt.
     *
     * <p>Implementations <strong>must</strong> apply this as a single atomic increment
     * ({@code total = total + 1}, and {@code success} or {@code failed} likewise) together
     * with {@code lastDeliveryAt} and {@code lastSuccessAt} or {@code lastFailureAt},
     * never as a read-modify-write, since many workers update the same subscription.
     *
     * @param conn           the JDBC connection
     * @param subscriptionId the subscription
     * @param success        whether the attempt succeeded
     * @param at             when the attempt completed
     * @return the number of rows updated (0 or 1)
     */
    int updateStatistics(Connection conn, String subscriptionId, boolean success, Instant at);
}
