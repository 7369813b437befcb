package hookrelay.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectionProviderTest {

  @Test
  void nullDataSourceThrows() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }

  @Test
  void handsOutFreshConnections() throws SQLException {
    JdbcDataSource ds = Schemas.h2();
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);

    try (Connection first = provider.getConnection(); Connection second = provider.getConnection()) {
      assertNotSame(first, second);
      assertFalse(first.isClosed());
      assertFalse(second.isClosed());
    }
  }
}
