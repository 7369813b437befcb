/**
 * Service Provider Interfaces (SPI) for plugging hookrelay into a host application.
 *
 * <p>These interfaces define the extension points integrators implement to provide
 * connections, delivery and subscription persistence, the delivery transport, and metrics.
 *
 * @see hookrelay.spi.ConnectionProvider
 * @see hookrelay.spi.DeliveryStore
 * @see hookrelay.spi.SubscriptionStore
 * @see hookrelay.spi.DeliveryTransport
 * @see hookrelay.spi.MetricsExporter
 */
package hookrelay.spi;
