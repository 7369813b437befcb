package hookrelay.dispatch;

/**
 * Snapshot of the dispatcher queues.
 *
 * <p>{@code unresolved} counts deliveries held in memory because an attempt was sent and
 * neither its outcome nor the failure could be written to the store.
 */
public record QueueStatus(
    int freshDepth,
    int freshRemainingCapacity,
    int retryDepth,
    int retryRemainingCapacity,
    int freshWorkers,
    int retryWorkers,
    int unresolved,
    boolean accepting) {}
