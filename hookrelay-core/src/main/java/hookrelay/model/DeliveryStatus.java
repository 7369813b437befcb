package hookrelay.model;

/**
 * Status of a {@link Delivery}. {@link #SUCCESS} and {@link #FAILED} are terminal.
 *
 * <p>Each constant carries a stable integer code used as the persisted column value.
 */
public enum DeliveryStatus {
  PENDING(0),
  RETRYING(1),
  SUCCESS(2),
  FAILED(3);

  private final int code;

  DeliveryStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == SUCCESS || this == FAILED;
  }

  /**
   * Resolves a status from its persisted code.
   *
   * @throws IllegalArgumentException if the code is unknown
   */
  public static DeliveryStatus fromCode(int code) {
    for (DeliveryStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status code: " + code);
  }
}
