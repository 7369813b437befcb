/**
 * Webhook delivery engine entry point.
 *
 * <p>{@link hookrelay.HookRelay} is the composite most applications use; the packages below
 * it hold the individual components and the SPI the {@code hookrelay-jdbc} module implements.
 */
package hookrelay;
