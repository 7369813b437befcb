package hookrelay.jdbc;

import java.util.Objects;

/**
 * Default table names and validation for names that are concatenated into SQL.
 */
public final class TableNames {
  public static final String DEFAULT_SUBSCRIPTION_TABLE = "webhook_subscription";
  public static final String DEFAULT_DELIVERY_TABLE = "webhook_delivery";
  public static final String DEFAULT_ATTEMPT_TABLE = "webhook_delivery_attempt";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
