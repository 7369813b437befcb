package hookrelay;

/**
 * Thrown when an event cannot be ingested at all, for instance because the active
 * subscriptions could not be read. Nothing was persisted for the event.
 */
public final class IngestException extends RuntimeException {
  public IngestException(String message, Throwable cause) {
    super(message, cause);
  }
}
