package hookrelay.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable audit record of one HTTP call made for a {@link Delivery}.
 *
 * @param id             unique attempt id
 * @param deliveryId     owning delivery
 * @param attemptNumber  1-based; equals the delivery's attempt count after this call
 * @param requestUrl     URL the request was sent to
 * @param responseStatus HTTP status, or {@code 0} when no response was received
 * @param responseBody   response body, truncated
 * @param success        whether the response was 2xx
 * @param error          failure summary, empty on success
 * @param durationMs     wall-clock time of the call
 * @param createdAt      when the attempt was recorded
 */
public record DeliveryAttempt(
    String id,
    String deliveryId,
    int attemptNumber,
    String requestUrl,
    int responseStatus,
    String responseBody,
    boolean success,
    String error,
    long durationMs,
    Instant createdAt) {

  public DeliveryAttempt {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(deliveryId, "deliveryId");
    Objects.requireNonNull(requestUrl, "requestUrl");
    Objects.requireNonNull(createdAt, "createdAt");
    if (attemptNumber < 1) {
      throw new IllegalArgumentException("attemptNumber must be >= 1");
    }
    responseBody = responseBody == null ? "" : responseBody;
    error = error == null ? "" : error;
  }
}
