package hookrelay.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Loads the bundled {@code hookrelay/schema/<dialect>.sql} scripts into test databases.
 */
public final class Schemas {
  private Schemas() {}

  public static JdbcDataSource h2() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    return ds;
  }

  public static void apply(DataSource dataSource, String dialect) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      apply(conn, dialect);
    }
  }

  public static void apply(Connection conn, String dialect) throws SQLException {
    try (Statement st = conn.createStatement()) {
      for (String statement : load(dialect).split(";")) {
        if (!statement.isBlank()) {
          st.execute(statement);
        }
      }
    }
  }

  static String load(String dialect) {
    String resource = "/hookrelay/schema/" + dialect + ".sql";
    try (InputStream in = Schemas.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No schema resource " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
