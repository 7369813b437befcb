package hookrelay.dispatch;

/**
 * Guarantees a delivery is processed by at most one worker at a time within this process.
 */
public interface InFlightTracker {
  boolean tryAcquire(String deliveryId);

  void release(String deliveryId);
}
