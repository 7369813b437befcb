package hookrelay.spring.boot;

import hookrelay.HookRelay;
import hookrelay.IngestResult;
import hookrelay.jdbc.DataSourceConnectionProvider;
import hookrelay.jdbc.JdbcSubscriptionStore;
import hookrelay.jdbc.store.AbstractJdbcDeliveryStore;
import hookrelay.jdbc.store.H2DeliveryStore;
import hookrelay.model.DeliveryStatus;
import hookrelay.model.Subscription;
import hookrelay.spi.ConnectionProvider;
import hookrelay.spi.DeliveryTransport;
import hookrelay.spi.SubscriptionStore;
import hookrelay.spi.TransportResponse;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class HookRelayAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          HookRelayAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:hookrelay_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:hookrelay/schema/h2.sql",
          "hookrelay.worker-count=2");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("deliveryStore"));
      assertTrue(ctx.containsBean("subscriptionStore"));
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("hookRelay"));

      assertInstanceOf(H2DeliveryStore.class, ctx.getBean(AbstractJdbcDeliveryStore.class));
      assertInstanceOf(JdbcSubscriptionStore.class, ctx.getBean(SubscriptionStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertNotNull(ctx.getBean(HookRelay.class));
    });
  }

  @Test
  void bindsQueueAndSchedulerSettings() {
    runner
        .withPropertyValues(
            "hookrelay.worker-count=8",
            "hookrelay.queue-capacity=50",
            "hookrelay.retention.days=0",
            "hookrelay.failed-scan.enabled=true",
            "hookrelay.failed-scan.interval=PT10M")
        .run(ctx -> {
          HookRelay relay = ctx.getBean(HookRelay.class);
          assertEquals(50, relay.queueStatus().freshRemainingCapacity());
          assertEquals(8, relay.queueStatus().freshWorkers());
          assertEquals(4, relay.queueStatus().retryWorkers());
          assertTrue(relay.retentionScheduler().isEmpty());
          assertTrue(relay.failedDeliveryScanner().isPresent());
        });
  }

  @Test
  void retentionAndNoFailedScanByDefault() {
    runner.run(ctx -> {
      HookRelay relay = ctx.getBean(HookRelay.class);
      assertTrue(relay.retentionScheduler().isPresent());
      assertTrue(relay.failedDeliveryScanner().isEmpty());
    });
  }

  @Test
  void invalidSettingsFailStartup() {
    runner.withPropertyValues("hookrelay.max-retries=0").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalArgumentException.class, rootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void customTableNamesAreValidated() {
    runner.withPropertyValues("hookrelay.tables.delivery=bad;name").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalArgumentException.class, rootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void deliversThroughCustomTransport() {
    runner.withUserConfiguration(CountingTransportConfig.class).run(ctx -> {
      DataSource dataSource = ctx.getBean(DataSource.class);
      JdbcSubscriptionStore subscriptions = ctx.getBean(JdbcSubscriptionStore.class);
      try (Connection conn = dataSource.getConnection()) {
        subscriptions.insert(conn, new Subscription("s-1", "http://orders.test/hook", "k",
            Set.of("order.*"), true), Instant.now());
      }
      HookRelay relay = ctx.getBean(HookRelay.class);

      IngestResult result = relay.ingestEvent("order.paid", "{\"order\":1}");
      String deliveryId = result.entries().get(0).deliveryId();

      await().atMost(Duration.ofSeconds(5)).until(() ->
          relay.findDelivery(deliveryId).orElseThrow().delivery().status() == DeliveryStatus.SUCCESS);
      assertEquals(1, ctx.getBean(CountingTransportConfig.class).calls.get());
    });
  }

  @Test
  void backsOffWhenHookRelayDefined() {
    runner.withUserConfiguration(CustomRelayConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean("hookRelay"));
      assertTrue(ctx.containsBean("customRelay"));
    });
  }

  @Test
  void skippedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(HookRelayAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("hookRelay")));
  }

  private static Throwable rootCause(Throwable t) {
    while (t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }

  @Configuration
  static class CountingTransportConfig {
    final AtomicInteger calls = new AtomicInteger();

    @Bean
    DeliveryTransport countingTransport() {
      return (delivery, subscription, attemptNumber) -> {
        calls.incrementAndGet();
        return TransportResponse.accepted(200, "ok", 1);
      };
    }
  }

  @Configuration
  static class CustomRelayConfig {
    @Bean(destroyMethod = "close")
    HookRelay customRelay(DataSource dataSource) {
      return HookRelay.builder()
          .connectionProvider(new DataSourceConnectionProvider(dataSource))
          .deliveryStore(new H2DeliveryStore())
          .subscriptionStore(new JdbcSubscriptionStore())
          .workerCount(1)
          .build();
    }
  }
}
