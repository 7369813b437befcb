package hookrelay.dispatch;

import com.github.f4b6a3.ulid.UlidCreator;
import hookrelay.lifecycle.DeliveryLifecycle;
import hookrelay.lifecycle.IllegalTransitionException;
import hookrelay.model.Delivery;
import hookrelay.model.DeliveryAttempt;
import hookrelay.model.DeliveryStatus;
import hookrelay.model.Subscription;
import hookrelay.spi.ConnectionProvider;
import hookrelay.spi.DeliveryStore;
import hookrelay.spi.DeliveryTransport;
import hookrelay.spi.TransportResponse;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Performs and records a single delivery attempt.
 *
 * <p>Each call sends one request through the {@link DeliveryTransport}, then writes the
 * {@link DeliveryAttempt} row and the delivery update in one transaction. If either write
 * fails, or the guarded update matches no row, the transaction is rolled back and a
 * {@link DeliveryPersistenceException} is thrown: delivery state never advances without
 * its attempt row, and an attempt row never exists without the matching delivery state.
 *
 * <p>This class is thread-safe; the dispatcher shares one instance across workers.
 */
public final class DeliveryWorker {
  private static final Logger logger = Logger.getLogger(DeliveryWorker.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final DeliveryTransport transport;
  private final DeliveryLifecycle lifecycle;
  private final Clock clock;

  public DeliveryWorker(ConnectionProvider connectionProvider, DeliveryStore deliveryStore,
      DeliveryTransport transport, DeliveryLifecycle lifecycle, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public DeliveryLifecycle lifecycle() {
    return lifecycle;
  }

  /**
   * Sends attempt {@code delivery.attemptCount() + 1} and persists its outcome.
   *
   * @param delivery     the current, non-terminal state of the delivery
   * @param subscription the subscription to deliver to
   * @return the persisted attempt and the delivery after it
   * @throws DeliveryPersistenceException if the outcome could not be committed
   * @throws IllegalTransitionException if the delivery is terminal
   */
  public AttemptOutcome deliver(Delivery delivery, Subscription subscription) {
    if (delivery.isTerminal()) {
      throw new IllegalTransitionException(delivery.id(), delivery.status(), "deliver");
    }
    int attemptNumber = delivery.attemptCount() + 1;
    TransportResponse response = transport.send(delivery, subscription, attemptNumber);
    Instant completedAt = clock.instant();

    DeliveryAttempt attempt = new DeliveryAttempt(
        UlidCreator.getMonotonicUlid().toString(),
        delivery.id(),
        attemptNumber,
        subscription.targetUrl(),
        response.statusCode(),
        response.body(),
        response.success(),
        response.success() ? "" : response.error(),
        response.durationMs(),
        completedAt);
    Delivery next = lifecycle.applyAttempt(delivery, response.success(), response.error(), completedAt);

    persist(attempt, next);
    logOutcome(next, attempt);
    return new AttemptOutcome(next, attempt);
  }

  private void persist(DeliveryAttempt attempt, Delivery next) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        deliveryStore.createAttempt(conn, attempt);
        int updated = deliveryStore.updateDelivery(conn, next);
        if (updated != 1) {
          throw new DeliveryPersistenceException(next.id(), "Delivery " + next.id()
              + " is terminal or was updated concurrently; attempt " + attempt.attemptNumber()
              + " discarded");
        }
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        try {
          conn.rollback();
        } catch (SQLException rollbackFailure) {
          e.addSuppressed(rollbackFailure);
        }
        throw e;
      }
    } catch (DeliveryPersistenceException e) {
      throw e;
    } catch (SQLException | RuntimeException e) {
      throw new DeliveryPersistenceException(next.id(),
          "Failed to record attempt " + attempt.attemptNumber() + " for delivery " + next.id(), e);
    }
  }

  private static void logOutcome(Delivery next, DeliveryAttempt attempt) {
    if (attempt.success()) {
      logger.log(Level.FINE, "Delivered {0} to {1} (attempt {2})",
          new Object[]{next.id(), attempt.requestUrl(), attempt.attemptNumber()});
    } else if (next.status() == DeliveryStatus.RETRYING) {
      logger.log(Level.INFO, "Delivery {0} failed (attempt {1}), retry at {2}: {3}",
          new Object[]{next.id(), attempt.attemptNumber(), next.nextRetryAt(), attempt.error()});
    } else {
      logger.log(Level.WARNING, "Delivery {0} failed after {1} attempts: {2}",
          new Object[]{next.id(), attempt.attemptNumber(), attempt.error()});
    }
  }
}
