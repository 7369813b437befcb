/**
 * Dispatch pool and delivery worker.
 *
 * <p>{@link hookrelay.dispatch.DeliveryDispatcher} owns two bounded queues with separate
 * worker pools so retry traffic cannot starve fresh deliveries.
 * {@link hookrelay.dispatch.DeliveryWorker} performs and records one attempt.
 */
package hookrelay.dispatch;
