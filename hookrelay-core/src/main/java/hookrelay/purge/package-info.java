/**
 * Retention cleanup of terminal deliveries.
 */
package hookrelay.purge;
