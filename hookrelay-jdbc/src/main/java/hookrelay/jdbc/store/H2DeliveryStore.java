package hookrelay.jdbc.store;

import java.util.List;

/**
 * H2 delivery store. Primarily for testing.
 *
 * <p>Uses the default statements from {@link AbstractJdbcDeliveryStore}.
 */
public final class H2DeliveryStore extends AbstractJdbcDeliveryStore {

  public H2DeliveryStore() {
    super();
  }

  public H2DeliveryStore(String deliveryTable, String attemptTable) {
    super(deliveryTable, attemptTable);
  }

  @Override
  public AbstractJdbcDeliveryStore withTables(String deliveryTable, String attemptTable) {
    return new H2DeliveryStore(deliveryTable, attemptTable);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
