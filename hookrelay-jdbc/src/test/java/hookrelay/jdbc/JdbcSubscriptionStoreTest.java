package hookrelay.jdbc;

import hookrelay.model.Subscription;
import hookrelay.model.SubscriptionStats;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSubscriptionStoreTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  private JdbcDataSource dataSource;
  private JdbcSubscriptionStore store;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = Schemas.h2();
    Schemas.apply(dataSource, "h2");
    store = new JdbcSubscriptionStore();
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, new Subscription("s-1", "http://a.test/hook", "k1",
          Set.of("blog.*", "user.created"), true), T0);
      store.insert(conn, new Subscription("s-2", "http://b.test/hook", "k2", Set.of("*"), true),
          T0.plusSeconds(1));
      store.insert(conn, new Subscription("s-3", "http://c.test/hook", "k3", Set.of("*"), false),
          T0.plusSeconds(2));
    }
  }

  @Test
  void findReadsPatternsAndEmptyStats() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      Subscription s = store.findSubscription(conn, "s-1").orElseThrow();

      assertEquals("http://a.test/hook", s.targetUrl());
      assertEquals("k1", s.secret());
      assertEquals(Set.of("blog.*", "user.created"), s.eventTypePatterns());
      assertTrue(s.active());
      assertEquals(0, s.stats().totalDeliveries());
      assertNull(s.stats().lastDeliveryAt());
      assertTrue(store.findSubscription(conn, "nope").isEmpty());
    }
  }

  @Test
  void listActiveSkipsInactive() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(List.of("s-1", "s-2"), store.listActive(conn).stream().map(Subscription::id).toList());

      assertEquals(1, store.setActive(conn, "s-3", true, T0));
      assertEquals(1, store.setActive(conn, "s-1", false, T0));
      assertEquals(List.of("s-2", "s-3"), store.listActive(conn).stream().map(Subscription::id).toList());
    }
  }

  @Test
  void targetUrlIsUnique() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      assertThrows(DeliveryStoreException.class, () -> store.insert(conn,
          new Subscription("s-dup", "http://a.test/hook", "k", Set.of("*"), true), T0));
    }
  }

  @Test
  void statisticsTrackSuccessAndFailure() throws Exception {
    Instant failedAt = T0.plusSeconds(60);
    Instant succeededAt = T0.plusSeconds(120);
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(1, store.updateStatistics(conn, "s-1", false, failedAt));
      assertEquals(1, store.updateStatistics(conn, "s-1", true, succeededAt));
      assertEquals(0, store.updateStatistics(conn, "missing", true, succeededAt));

      SubscriptionStats stats = store.findSubscription(conn, "s-1").orElseThrow().stats();
      assertEquals(2, stats.totalDeliveries());
      assertEquals(1, stats.successDeliveries());
      assertEquals(1, stats.failedDeliveries());
      assertEquals(succeededAt, stats.lastDeliveryAt());
      assertEquals(succeededAt, stats.lastSuccessAt());
      assertEquals(failedAt, stats.lastFailureAt());
    }
  }

  @Test
  void concurrentUpdatesDoNotLoseIncrements() throws Exception {
    int threads = 8;
    int perThread = 25;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        boolean success = t % 2 == 0;
        futures.add(pool.submit(() -> {
          try (Connection conn = dataSource.getConnection()) {
            for (int i = 0; i < perThread; i++) {
              store.updateStatistics(conn, "s-2", success, T0);
            }
          }
          return null;
        }));
      }
      for (Future<?> f : futures) {
        f.get();
      }
    } finally {
      pool.shutdownNow();
    }

    try (Connection conn = dataSource.getConnection()) {
      SubscriptionStats stats = store.findSubscription(conn, "s-2").orElseThrow().stats();
      assertEquals(threads * perThread, stats.totalDeliveries());
      assertEquals(threads * perThread / 2, stats.successDeliveries());
      assertEquals(threads * perThread / 2, stats.failedDeliveries());
    }
  }
}
