package hookrelay.spi;

/**
 * Outcome of one transport call.
 *
 * @param statusCode HTTP status, or {@code 0} when no response was received
 * @param body       response body, possibly truncated; never {@code null}
 * @param success    whether the subscriber accepted the delivery
 * @param error      failure summary, empty on success
 * @param durationMs elapsed time of the call
 */
public record TransportResponse(int statusCode, String body, boolean success, String error, long durationMs) {

  public TransportResponse {
    body = body == null ? "" : body;
    error = error == null ? "" : error;
  }

  public static TransportResponse accepted(int statusCode, String body, long durationMs) {
    return new TransportResponse(statusCode, body, true, "", durationMs);
  }

  public static TransportResponse rejected(int statusCode, String body, long durationMs) {
    return new TransportResponse(statusCode, body, false, "HTTP " + statusCode + ": " + body, durationMs);
  }

  public static TransportResponse unreachable(String error, long durationMs) {
    return new TransportResponse(0, "", false, error, durationMs);
  }
}
