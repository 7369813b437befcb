package hookrelay.dispatch;

import hookrelay.lifecycle.DeliveryLifecycle;
import hookrelay.lifecycle.IllegalTransitionException;
import hookrelay.model.Delivery;
import hookrelay.model.DeliveryAttempt;
import hookrelay.model.DeliveryStatus;
import hookrelay.model.Subscription;
import hookrelay.retry.ExponentialBackoffRetryPolicy;
import hookrelay.spi.TransportResponse;
import hookrelay.support.InMemoryDeliveryStore;
import hookrelay.support.MutableClock;
import hookrelay.support.ScriptedTransport;
import hookrelay.support.StubConnections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryWorkerTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  private final Subscription subscription =
      new Subscription("s-1", "http://localhost/hook", "s3cret", Set.of("*"), true);

  private StubConnections connections;
  private InMemoryDeliveryStore store;
  private ScriptedTransport transport;
  private MutableClock clock;
  private DeliveryWorker worker;

  @BeforeEach
  void setUp() {
    connections = new StubConnections();
    store = new InMemoryDeliveryStore();
    transport = new ScriptedTransport();
    clock = new MutableClock(T0);
    worker = newWorker(store);
  }

  @Test
  void successfulAttemptIsRecordedAndCommitted() {
    Delivery d = pending();
    store.createDelivery(null, d);
    transport.then(TransportResponse.accepted(200, "ok", 12));

    AttemptOutcome outcome = worker.deliver(d, subscription);

    assertTrue(outcome.success());
    assertEquals(DeliveryStatus.SUCCESS, store.get(d.id()).status());
    List<DeliveryAttempt> attempts = store.attempts(d.id());
    assertEquals(1, attempts.size());
    DeliveryAttempt attempt = attempts.get(0);
    assertEquals(1, attempt.attemptNumber());
    assertEquals(200, attempt.responseStatus());
    assertEquals("ok", attempt.responseBody());
    assertEquals("", attempt.error());
    assertEquals(12, attempt.durationMs());
    assertEquals(subscription.targetUrl(), attempt.requestUrl());
    assertEquals(1, connections.commits.get());
    assertEquals(0, connections.rollbacks.get());
  }

  @Test
  void failedAttemptSchedulesRetry() {
    Delivery d = pending();
    store.createDelivery(null, d);
    transport.then(TransportResponse.rejected(503, "down", 5));

    AttemptOutcome outcome = worker.deliver(d, subscription);

    assertFalse(outcome.success());
    Delivery stored = store.get(d.id());
    assertEquals(DeliveryStatus.RETRYING, stored.status());
    assertEquals(1, stored.attemptCount());
    assertEquals(T0.plus(Duration.ofMinutes(1)), stored.nextRetryAt());
    assertEquals("Attempt 1 failed: HTTP 503: down", stored.lastError());
    assertEquals("HTTP 503: down", store.attempts(d.id()).get(0).error());
  }

  @Test
  void guardedUpdateMissRollsBackAndThrows() {
    Delivery d = pending();
    store.createDelivery(null, d);
    Delivery stale = d;
    store.put(d.toBuilder().status(DeliveryStatus.SUCCESS).attemptCount(1)
        .completedAt(T0).build());

    DeliveryPersistenceException e = assertThrows(DeliveryPersistenceException.class,
        () -> worker.deliver(stale, subscription));

    assertEquals(d.id(), e.deliveryId());
    assertEquals(1, connections.rollbacks.get());
    assertEquals(0, connections.commits.get());
  }

  @Test
  void storeFailureIsWrappedAfterRollback() {
    InMemoryDeliveryStore failing = new InMemoryDeliveryStore() {
      @Override
      public void createAttempt(Connection conn, DeliveryAttempt attempt) {
        throw new IllegalStateException("disk full");
      }
    };
    worker = newWorker(failing);
    Delivery d = pending();
    failing.createDelivery(null, d);

    DeliveryPersistenceException e = assertThrows(DeliveryPersistenceException.class,
        () -> worker.deliver(d, subscription));

    assertInstanceOf(IllegalStateException.class, e.getCause());
    assertEquals(1, connections.rollbacks.get());
    assertEquals(DeliveryStatus.PENDING, failing.get(d.id()).status());
  }

  @Test
  void terminalDeliveryIsNotSent() {
    Delivery done = pending().toBuilder().status(DeliveryStatus.SUCCESS).attemptCount(1)
        .completedAt(T0).build();

    assertThrows(IllegalTransitionException.class, () -> worker.deliver(done, subscription));
    assertEquals(0, transport.calls.get());
  }

  private DeliveryWorker newWorker(InMemoryDeliveryStore deliveryStore) {
    return new DeliveryWorker(connections, deliveryStore, transport,
        new DeliveryLifecycle(3, new ExponentialBackoffRetryPolicy()), clock);
  }

  private static Delivery pending() {
    return Delivery.pending("d-1", "s-1", "e-1", "blog.post.created",
        "{}".getBytes(StandardCharsets.UTF_8), T0);
  }
}
