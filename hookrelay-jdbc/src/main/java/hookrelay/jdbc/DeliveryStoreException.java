package hookrelay.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC delivery and subscription
 * stores.
 */
public final class DeliveryStoreException extends RuntimeException {
  public DeliveryStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
