/**
 * Delivery state machine.
 */
package hookrelay.lifecycle;
