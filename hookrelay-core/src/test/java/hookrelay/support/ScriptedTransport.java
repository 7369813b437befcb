package hookrelay.support;

import hookrelay.model.Delivery;
import hookrelay.model.Subscription;
import hookrelay.spi.DeliveryTransport;
import hookrelay.spi.TransportResponse;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport that replays queued responses, then repeats the fallback.
 */
public final class ScriptedTransport implements DeliveryTransport {
  private final Deque<TransportResponse> script = new ArrayDeque<>();
  private volatile TransportResponse fallback = TransportResponse.accepted(200, "ok", 1);
  public final AtomicInteger calls = new AtomicInteger();

  public synchronized ScriptedTransport then(TransportResponse response) {
    script.addLast(response);
    return this;
  }

  public ScriptedTransport otherwise(TransportResponse response) {
    this.fallback = response;
    return this;
  }

  @Override
  public synchronized TransportResponse send(Delivery delivery, Subscription subscription, int attemptNumber) {
    calls.incrementAndGet();
    TransportResponse next = script.pollFirst();
    return next != null ? next : fallback;
  }
}
