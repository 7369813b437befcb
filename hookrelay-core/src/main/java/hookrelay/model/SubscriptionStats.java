package hookrelay.model;

import java.time.Instant;

/**
 * Per-subscription delivery counters. Each counter counts attempts, not deliveries:
 * a delivery that fails twice and then succeeds contributes three to {@code total}.
 */
public record SubscriptionStats(
    long totalDeliveries,
    long successDeliveries,
    long failedDeliveries,
    Instant lastDeliveryAt,
    Instant lastSuccessAt,
    Instant lastFailureAt) {

  public static final SubscriptionStats EMPTY = new SubscriptionStats(0, 0, 0, null, null, null);
}
