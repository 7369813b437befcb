/**
 * JDBC {@link hookrelay.spi.DeliveryStore} implementations, one per database, discovered
 * with {@link java.util.ServiceLoader}.
 */
package hookrelay.jdbc.store;
