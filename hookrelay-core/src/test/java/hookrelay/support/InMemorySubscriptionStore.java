package hookrelay.support;

import hookrelay.model.Subscription;
import hookrelay.model.SubscriptionStats;
import hookrelay.spi.SubscriptionStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Subscription store backed by a map; statistics updates are atomic per subscription. */
public final class InMemorySubscriptionStore implements SubscriptionStore {
  private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

  public Subscription add(Subscription subscription) {
    subscriptions.put(subscription.id(), subscription);
    return subscription;
  }

  public void remove(String subscriptionId) {
    subscriptions.remove(subscriptionId);
  }

  public void setActive(String subscriptionId, boolean active) {
    subscriptions.computeIfPresent(subscriptionId, (id, s) -> new Subscription(
        s.id(), s.targetUrl(), s.secret(), s.eventTypePatterns(), active, s.stats()));
  }

  public SubscriptionStats stats(String subscriptionId) {
    return subscriptions.get(subscriptionId).stats();
  }

  @Override
  public Optional<Subscription> findSubscription(Connection conn, String subscriptionId) {
    return Optional.ofNullable(subscriptions.get(subscriptionId));
  }

  @Override
  public List<Subscription> listActive(Connection conn) {
    return subscriptions.values().stream()
        .filter(Subscription::active)
        .sorted((a, b) -> a.id().compareTo(b.id()))
        .toList();
  }

  @Override
  public int updateStatistics(Connection conn, String subscriptionId, boolean success, Instant at) {
    Subscription updated = subscriptions.computeIfPresent(subscriptionId, (id, s) -> {
      SubscriptionStats st = s.stats();
      SubscriptionStats next = new SubscriptionStats(
          st.totalDeliveries() + 1,
          st.successDeliveries() + (success ? 1 : 0),
          st.failedDeliveries() + (success ? 0 : 1),
          at,
          success ? at : st.lastSuccessAt(),
          success ? st.lastFailureAt() : at);
      return new Subscription(s.id(), s.targetUrl(), s.secret(), s.eventTypePatterns(), s.active(), next);
    });
    return updated == null ? 0 : 1;
  }
}
