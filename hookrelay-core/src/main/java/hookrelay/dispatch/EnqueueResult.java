package hookrelay.dispatch;

/**
 * Result of a non-blocking enqueue. Only {@link #ACCEPTED} means a worker will pick the
 * delivery up; in every other case the persisted delivery is left untouched.
 */
public enum EnqueueResult {
  ACCEPTED,
  /** The target queue is at capacity. */
  QUEUE_FULL,
  /** The dispatcher is closing or closed. */
  SHUTTING_DOWN;

  public boolean isAccepted() {
    return this == ACCEPTED;
  }
}
