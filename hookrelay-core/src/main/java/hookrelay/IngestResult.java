package hookrelay;

import hookrelay.dispatch.EnqueueResult;

import java.util.List;

/**
 * What {@link HookRelay#ingest(WebhookEvent)} did for each matched subscription.
 *
 * @param eventId the ingested event
 * @param entries one entry per matched subscription, in match order
 */
public record IngestResult(String eventId, List<Entry> entries) {

  public IngestResult {
    entries = List.copyOf(entries);
  }

  /** Number of subscriptions the event matched. */
  public int matched() {
    return entries.size();
  }

  /** Deliveries persisted and handed to a worker queue. */
  public long queued() {
    return entries.stream().filter(e -> e.enqueueResult() == EnqueueResult.ACCEPTED).count();
  }

  /**
   * Deliveries persisted as {@code PENDING} but not queued (queue full or shutting down).
   * The retry sweep re-submits them once they are older than the stale-pending age.
   */
  public long deferred() {
    return entries.stream()
        .filter(e -> e.deliveryId() != null && e.enqueueResult() != EnqueueResult.ACCEPTED)
        .count();
  }

  /** Matches for which no delivery could be persisted. */
  public long failed() {
    return entries.stream().filter(e -> e.deliveryId() == null).count();
  }

  /**
   * @param subscriptionId the matched subscription
   * @param deliveryId     the created delivery, or {@code null} if it could not be persisted
   * @param enqueueResult  the enqueue outcome, or {@code null} if nothing was persisted
   */
  public record Entry(String subscriptionId, String deliveryId, EnqueueResult enqueueResult) {}
}
