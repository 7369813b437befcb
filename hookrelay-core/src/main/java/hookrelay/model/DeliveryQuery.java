package hookrelay.model;

/**
 * Filter and page for listing deliveries. {@code null} filters match everything.
 *
 * @param subscriptionId only deliveries of this subscription
 * @param status         only deliveries in this status
 * @param limit          page size, must be &gt; 0
 * @param offset         rows to skip, must be &ge; 0
 */
public record DeliveryQuery(String subscriptionId, DeliveryStatus status, int limit, int offset) {
  public static final int DEFAULT_LIMIT = 50;

  public DeliveryQuery {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0");
    }
  }

  public static DeliveryQuery all() {
    return new DeliveryQuery(null, null, DEFAULT_LIMIT, 0);
  }

  public static DeliveryQuery forSubscription(String subscriptionId) {
    return new DeliveryQuery(subscriptionId, null, DEFAULT_LIMIT, 0);
  }

  public DeliveryQuery withStatus(DeliveryStatus status) {
    return new DeliveryQuery(subscriptionId, status, limit, offset);
  }

  public DeliveryQuery page(int limit, int offset) {
    return new DeliveryQuery(subscriptionId, status, limit, offset);
  }
}
