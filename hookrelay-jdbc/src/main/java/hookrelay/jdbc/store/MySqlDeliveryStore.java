package hookrelay.jdbc.store;

import java.util.List;

/**
 * MySQL delivery store. Also compatible with TiDB and MariaDB.
 *
 * <p>Retention cleanup uses the portable select-then-delete from
 * {@link AbstractJdbcDeliveryStore}: MySQL rejects a {@code DELETE} whose subquery reads
 * the same table, and a multi-table {@code DELETE} cannot take a {@code LIMIT}.
 */
public final class MySqlDeliveryStore extends AbstractJdbcDeliveryStore {

  public MySqlDeliveryStore() {
    super();
  }

  public MySqlDeliveryStore(String deliveryTable, String attemptTable) {
    super(deliveryTable, attemptTable);
  }

  @Override
  public AbstractJdbcDeliveryStore withTables(String deliveryTable, String attemptTable) {
    return new MySqlDeliveryStore(deliveryTable, attemptTable);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }
}
