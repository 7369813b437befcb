package hookrelay.support;

import hookrelay.model.Delivery;
import hookrelay.model.DeliveryAttempt;
import hookrelay.model.DeliveryPage;
import hookrelay.model.DeliveryQuery;
import hookrelay.model.DeliveryStatus;
import hookrelay.spi.DeliveryStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Delivery store backed by maps, with the same update guards as the JDBC stores.
 * Writes are not transactional: a rolled-back connection leaves earlier writes in place.
 */
public class InMemoryDeliveryStore implements DeliveryStore {
  private final Map<String, Delivery> deliveries = new LinkedHashMap<>();
  private final List<DeliveryAttempt> attempts = new ArrayList<>();
  public final AtomicInteger updateCalls = new AtomicInteger();
  /** When set, thrown by {@link #createAttempt}. */
  public volatile RuntimeException attemptFailure;
  /** When set, thrown by {@link #updateDelivery}. */
  public volatile RuntimeException updateFailure;

  public synchronized Delivery get(String deliveryId) {
    return deliveries.get(deliveryId);
  }

  public synchronized List<Delivery> all() {
    return List.copyOf(deliveries.values());
  }

  public synchronized List<DeliveryAttempt> attempts(String deliveryId) {
    return attempts.stream().filter(a -> a.deliveryId().equals(deliveryId)).toList();
  }

  /** Stores a delivery as-is, bypassing the guards. */
  public synchronized void put(Delivery delivery) {
    deliveries.put(delivery.id(), delivery);
  }

  @Override
  public synchronized void createDelivery(Connection conn, Delivery delivery) {
    if (deliveries.putIfAbsent(delivery.id(), delivery) != null) {
      throw new IllegalStateException("Duplicate delivery " + delivery.id());
    }
  }

  @Override
  public synchronized int updateDelivery(Connection conn, Delivery delivery) {
    updateCalls.incrementAndGet();
    if (updateFailure != null) {
      throw updateFailure;
    }
    Delivery current = deliveries.get(delivery.id());
    if (current == null || current.isTerminal() || current.attemptCount() > delivery.attemptCount()) {
      return 0;
    }
    deliveries.put(delivery.id(), delivery);
    return 1;
  }

  @Override
  public synchronized int reviveFailed(Connection conn, Delivery revived) {
    Delivery current = deliveries.get(revived.id());
    if (current == null || current.status() != DeliveryStatus.FAILED) {
      return 0;
    }
    deliveries.put(revived.id(), revived);
    return 1;
  }

  @Override
  public synchronized void createAttempt(Connection conn, DeliveryAttempt attempt) {
    if (attemptFailure != null) {
      throw attemptFailure;
    }
    attempts.add(attempt);
  }

  @Override
  public synchronized Optional<Delivery> findDelivery(Connection conn, String deliveryId) {
    return Optional.ofNullable(deliveries.get(deliveryId));
  }

  @Override
  public synchronized List<DeliveryAttempt> listAttempts(Connection conn, String deliveryId) {
    return attempts.stream()
        .filter(a -> a.deliveryId().equals(deliveryId))
        .sorted(Comparator.comparingInt(DeliveryAttempt::attemptNumber))
        .toList();
  }

  @Override
  public synchronized List<Delivery> listByStatus(Connection conn, DeliveryStatus status, int limit) {
    return select(d -> d.status() == status, Comparator.comparing(Delivery::createdAt), limit);
  }

  @Override
  public synchronized List<Delivery> listRevivable(Connection conn, int maxAttempts,
      String excludedErrorPrefix, int limit) {
    return select(d -> d.status() == DeliveryStatus.FAILED && d.attemptCount() < maxAttempts
            && (d.lastError() == null || !d.lastError().startsWith(excludedErrorPrefix)),
        Comparator.comparing(Delivery::createdAt), limit);
  }

  @Override
  public synchronized long countExhausted(Connection conn, int maxAttempts) {
    return deliveries.values().stream()
        .filter(d -> d.status() == DeliveryStatus.FAILED && d.attemptCount() >= maxAttempts)
        .count();
  }

  @Override
  public synchronized List<Delivery> listDueRetries(Connection conn, Instant now, int limit) {
    return select(d -> d.status() == DeliveryStatus.RETRYING && !d.nextRetryAt().isAfter(now),
        Comparator.comparing(Delivery::nextRetryAt), limit);
  }

  @Override
  public synchronized List<Delivery> listStalePending(Connection conn, Instant createdBefore, int limit) {
    return select(d -> d.status() == DeliveryStatus.PENDING && d.createdAt().isBefore(createdBefore),
        Comparator.comparing(Delivery::createdAt), limit);
  }

  @Override
  public synchronized DeliveryPage listDeliveries(Connection conn, DeliveryQuery query) {
    Predicate<Delivery> filter = d -> (query.subscriptionId() == null
        || query.subscriptionId().equals(d.subscriptionId()))
        && (query.status() == null || query.status() == d.status());
    List<Delivery> matching = deliveries.values().stream()
        .filter(filter)
        .sorted(Comparator.comparing(Delivery::createdAt).reversed())
        .toList();
    List<Delivery> page = matching.stream().skip(query.offset()).limit(query.limit()).toList();
    return new DeliveryPage(page, matching.size());
  }

  @Override
  public synchronized int deleteOlderThan(Connection conn, Instant cutoff, int limit) {
    List<Delivery> doomed = select(d -> d.isTerminal()
            && (d.completedAt() != null ? d.completedAt() : d.createdAt()).isBefore(cutoff),
        Comparator.comparing(Delivery::createdAt), limit);
    for (Delivery d : doomed) {
      deliveries.remove(d.id());
      attempts.removeIf(a -> a.deliveryId().equals(d.id()));
    }
    return doomed.size();
  }

  private List<Delivery> select(Predicate<Delivery> filter, Comparator<Delivery> order, int limit) {
    return deliveries.values().stream().filter(filter).sorted(order).limit(limit).toList();
  }
}
