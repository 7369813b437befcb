package hookrelay.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A registered webhook endpoint: target URL, signing secret and event-type filter.
 *
 * <p>Subscriptions are owned by an external store; the engine only reads them and
 * updates their {@link SubscriptionStats} through atomic store operations.
 *
 * @param id                unique subscription id
 * @param targetUrl         endpoint receiving {@code POST} requests (unique per subscription)
 * @param secret            shared HMAC-SHA256 signing key
 * @param eventTypePatterns exact event types, {@code prefix*} patterns, or {@code *}
 * @param active            inactive subscriptions never receive deliveries
 * @param stats             delivery counters, may be {@link SubscriptionStats#EMPTY}
 */
public record Subscription(
    String id,
    String targetUrl,
    String secret,
    Set<String> eventTypePatterns,
    boolean active,
    SubscriptionStats stats) {

  public Subscription {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(targetUrl, "targetUrl");
    Objects.requireNonNull(secret, "secret");
    eventTypePatterns = eventTypePatterns == null
        ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(eventTypePatterns));
    stats = stats == null ? SubscriptionStats.EMPTY : stats;
  }

  public Subscription(String id, String targetUrl, String secret,
      Set<String> eventTypePatterns, boolean active) {
    this(id, targetUrl, secret, eventTypePatterns, active, SubscriptionStats.EMPTY);
  }

  /**
   * Parses a comma-separated pattern list as stored in the {@code event_types} column.
   * Entries are trimmed and blanks dropped; {@code null} yields an empty set.
   */
  public static Set<String> parsePatterns(String csv) {
    if (csv == null || csv.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(csv.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /** Inverse of {@link #parsePatterns(String)}. */
  public static String formatPatterns(Set<String> patterns) {
    return patterns == null ? "" : String.join(",", patterns);
  }
}
