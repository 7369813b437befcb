package hookrelay.lifecycle;

import hookrelay.model.DeliveryStatus;

/**
 * Thrown when a delivery is asked to leave a state it cannot leave,
 * such as recording an attempt on a {@link DeliveryStatus#SUCCESS} delivery.
 */
public final class IllegalTransitionException extends IllegalStateException {
  private final String deliveryId;
  private final DeliveryStatus from;

  public IllegalTransitionException(String deliveryId, DeliveryStatus from, String action) {
    super("Cannot " + action + " delivery " + deliveryId + " in status " + from);
    this.deliveryId = deliveryId;
    this.from = from;
  }

  public String deliveryId() {
    return deliveryId;
  }

  public DeliveryStatus from() {
    return from;
  }
}
