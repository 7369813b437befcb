package hookrelay.dispatch;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-backed {@link InFlightTracker}. Thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Set<String> inflight = ConcurrentHashMap.newKeySet();

  @Override
  public boolean tryAcquire(String deliveryId) {
    return inflight.add(deliveryId);
  }

  @Override
  public void release(String deliveryId) {
    inflight.remove(deliveryId);
  }

  public int size() {
    return inflight.size();
  }
}
