package hookrelay.spring.boot;

import hookrelay.HookRelay;
import hookrelay.jdbc.DataSourceConnectionProvider;
import hookrelay.jdbc.JdbcSubscriptionStore;
import hookrelay.jdbc.store.AbstractJdbcDeliveryStore;
import hookrelay.jdbc.store.JdbcDeliveryStores;
import hookrelay.spi.ConnectionProvider;
import hookrelay.spi.DeliveryStore;
import hookrelay.spi.DeliveryTransport;
import hookrelay.spi.MetricsExporter;
import hookrelay.spi.SubscriptionStore;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Auto-configuration for the webhook delivery engine.
 *
 * <p>Wires a {@link HookRelay} from a {@link DataSource} and {@link HookRelayProperties}.
 * The delivery store dialect is detected from the JDBC URL. Any {@link DeliveryTransport}
 * or {@link MetricsExporter} bean in the context is picked up.
 *
 * @see HookRelayProperties
 * @see HookRelayMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(HookRelay.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(HookRelayProperties.class)
public class HookRelayAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(DeliveryStore.class)
  public AbstractJdbcDeliveryStore deliveryStore(DataSource dataSource, HookRelayProperties props) {
    HookRelayProperties.Tables tables = props.getTables();
    return JdbcDeliveryStores.detect(dataSource).withTables(tables.getDelivery(), tables.getAttempt());
  }

  @Bean
  @ConditionalOnMissingBean(SubscriptionStore.class)
  public JdbcSubscriptionStore subscriptionStore(HookRelayProperties props) {
    return new JdbcSubscriptionStore(props.getTables().getSubscription());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public HookRelay hookRelay(HookRelayProperties props,
      ConnectionProvider connectionProvider,
      DeliveryStore deliveryStore,
      SubscriptionStore subscriptionStore,
      ObjectProvider<DeliveryTransport> transportProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    HookRelayProperties.Retry retry = props.getRetry();
    HookRelayProperties.Retention retention = props.getRetention();
    Duration stalePendingAge = retry.getStalePendingAge();

    var builder = HookRelay.builder()
        .connectionProvider(connectionProvider)
        .deliveryStore(deliveryStore)
        .subscriptionStore(subscriptionStore)
        .workerCount(props.getWorkerCount())
        .queueCapacity(props.getQueueCapacity())
        .maxRetries(props.getMaxRetries())
        .deliveryTimeout(props.getDeliveryTimeout())
        .initialRetryDelay(retry.getInitialDelay())
        .maxRetryDelay(retry.getMaxDelay())
        .retryCheckInterval(retry.getCheckInterval())
        .retryBatchSize(retry.getBatchSize())
        .stalePendingAge(stalePendingAge == null || stalePendingAge.isZero() ? null : stalePendingAge)
        .retentionDays(retention.getDays())
        .cleanupInterval(retention.getCleanupInterval());
    if (props.getFailedScan().isEnabled()) {
      builder.failedScanInterval(props.getFailedScan().getInterval());
    }
    DeliveryTransport transport = transportProvider.getIfAvailable();
    if (transport != null) {
      builder.transport(transport);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}
