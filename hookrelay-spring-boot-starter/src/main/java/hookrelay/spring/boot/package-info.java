/**
 * Spring Boot auto-configuration for the webhook delivery engine.
 *
 * <p>Add the starter and a {@code DataSource}; a running {@link hookrelay.HookRelay} bean is
 * created from {@code hookrelay.*} properties and closed with the context.
 */
package hookrelay.spring.boot;
