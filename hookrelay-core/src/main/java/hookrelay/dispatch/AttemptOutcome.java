package hookrelay.dispatch;

import hookrelay.model.Delivery;
import hookrelay.model.DeliveryAttempt;

/**
 * What one call to {@link DeliveryWorker#deliver} persisted.
 *
 * @param delivery the delivery after the attempt
 * @param attempt  the recorded attempt
 */
public record AttemptOutcome(Delivery delivery, DeliveryAttempt attempt) {
  public boolean success() {
    return attempt.success();
  }
}
