package hookrelay.model;

import java.util.List;

/**
 * A delivery together with its attempts ordered by attempt number.
 */
public record DeliveryDetails(Delivery delivery, List<DeliveryAttempt> attempts) {
  public DeliveryDetails {
    attempts = List.copyOf(attempts);
  }
}
