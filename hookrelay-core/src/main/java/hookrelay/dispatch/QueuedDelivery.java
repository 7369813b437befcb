package hookrelay.dispatch;

import hookrelay.model.Delivery;
import hookrelay.model.Subscription;

import java.util.Objects;

/**
 * A delivery waiting in one of the dispatcher queues, with its subscription attached.
 */
public record QueuedDelivery(Delivery delivery, Subscription subscription) {
  public QueuedDelivery {
    Objects.requireNonNull(delivery, "delivery");
    Objects.requireNonNull(subscription, "subscription");
    if (!delivery.subscriptionId().equals(subscription.id())) {
      throw new IllegalArgumentException("Delivery " + delivery.id() + " belongs to subscription "
          + delivery.subscriptionId() + ", not " + subscription.id());
    }
  }
}
