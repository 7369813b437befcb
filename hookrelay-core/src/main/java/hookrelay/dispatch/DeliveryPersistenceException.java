package hookrelay.dispatch;

/**
 * The outcome of an attempt could not be written. Neither the attempt row nor the
 * delivery update was committed, so the stored delivery still shows its state from
 * before the attempt. The engine does not retry these; operators must reconcile.
 */
public final class DeliveryPersistenceException extends RuntimeException {
  private final String deliveryId;

  public DeliveryPersistenceException(String deliveryId, String message) {
    super(message);
    this.deliveryId = deliveryId;
  }

  public DeliveryPersistenceException(String deliveryId, String message, Throwable cause) {
    super(message, cause);
    this.deliveryId = deliveryId;
  }

  public String deliveryId() {
    return deliveryId;
  }
}
