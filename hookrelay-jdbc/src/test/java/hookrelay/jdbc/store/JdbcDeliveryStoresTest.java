package hookrelay.jdbc.store;

import hookrelay.jdbc.Schemas;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDeliveryStoresTest {

  @Test
  void allReturnsBuiltInStores() {
    List<AbstractJdbcDeliveryStore> stores = JdbcDeliveryStores.all();

    assertTrue(stores.size() >= 3);
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("mysql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("postgresql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("h2")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertInstanceOf(MySqlDeliveryStore.class, JdbcDeliveryStores.get("MySQL"));
    assertInstanceOf(PostgresDeliveryStore.class, JdbcDeliveryStores.get("POSTGRESQL"));
    assertInstanceOf(H2DeliveryStore.class, JdbcDeliveryStores.get("h2"));
  }

  @Test
  void getByNameThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcDeliveryStores.get("oracle"));
    assertTrue(ex.getMessage().contains("Unknown delivery store"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void detectFromJdbcUrl() {
    assertEquals("mysql", JdbcDeliveryStores.detect("jdbc:mysql://localhost:3306/app").name());
    assertEquals("mysql", JdbcDeliveryStores.detect("jdbc:tidb://localhost:4000/app").name());
    assertEquals("mysql", JdbcDeliveryStores.detect("jdbc:mariadb://localhost/app").name());
    assertEquals("postgresql", JdbcDeliveryStores.detect("jdbc:postgresql://localhost/app").name());
    assertEquals("h2", JdbcDeliveryStores.detect("jdbc:h2:mem:app").name());
  }

  @Test
  void detectRejectsUnknownOrEmptyUrl() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcDeliveryStores.detect("jdbc:oracle:thin:@localhost"));
    assertTrue(ex.getMessage().contains("Supported prefixes"));
    assertThrows(IllegalArgumentException.class, () -> JdbcDeliveryStores.detect(""));
    assertThrows(IllegalArgumentException.class, () -> JdbcDeliveryStores.detect((String) null));
  }

  @Test
  void detectFromDataSource() {
    assertEquals("h2", JdbcDeliveryStores.detect(Schemas.h2()).name());
  }

  @Test
  void withTablesKeepsDialect() {
    AbstractJdbcDeliveryStore custom = JdbcDeliveryStores.get("postgresql")
        .withTables("app_delivery", "app_attempt");
    assertInstanceOf(PostgresDeliveryStore.class, custom);
    assertEquals("app_delivery", custom.deliveryTable());
    assertEquals("app_attempt", custom.attemptTable());
  }
}
