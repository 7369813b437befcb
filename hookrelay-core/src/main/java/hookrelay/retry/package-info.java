/**
 * Backoff policy, due-retry sweep and the opt-in failed-delivery scanner.
 */
package hookrelay.retry;
