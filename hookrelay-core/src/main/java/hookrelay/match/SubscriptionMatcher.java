package hookrelay.match;

import hookrelay.model.Subscription;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Resolves which subscriptions receive an event type.
 *
 * <p>A pattern matches an event type when it is {@code "*"}, when it ends with {@code *}
 * and the event type starts with the text before the {@code *}, or when it equals the
 * event type exactly. A subscription matches when any of its patterns matches.
 *
 * <p>A subscription with an empty pattern set matches nothing: receiving events requires
 * an explicit pattern, {@code "*"} included. Inactive subscriptions never match.
 */
public final class SubscriptionMatcher {
  public static final String WILDCARD = "*";

  /**
   * Returns the active subscriptions whose patterns match {@code eventType}, in input order.
   */
  public List<Subscription> match(String eventType, Collection<Subscription> subscriptions) {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(subscriptions, "subscriptions");
    List<Subscription> matched = new ArrayList<>();
    for (Subscription subscription : subscriptions) {
      if (subscription.active() && matchesAny(subscription, eventType)) {
        matched.add(subscription);
      }
    }
    return matched;
  }

  public boolean matchesAny(Subscription subscription, String eventType) {
    for (String pattern : subscription.eventTypePatterns()) {
      if (matches(pattern, eventType)) {
        return true;
      }
    }
    return false;
  }

  public static boolean matches(String pattern, String eventType) {
    if (pattern == null || eventType == null) {
      return false;
    }
    if (WILDCARD.equals(pattern)) {
      return true;
    }
    if (pattern.endsWith(WILDCARD)) {
      return eventType.startsWith(pattern.substring(0, pattern.length() - 1));
    }
    return pattern.equals(eventType);
  }
}
