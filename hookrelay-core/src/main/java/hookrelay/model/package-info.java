/**
 * Domain model: subscriptions, deliveries and their attempts.
 */
package hookrelay.model;
