package hookrelay.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One at-least-once delivery obligation for a single {@code (subscription, event)} pair.
 *
 * <p>Instances are immutable. State changes produce a new instance via {@link #toBuilder()},
 * normally through {@link hookrelay.lifecycle.DeliveryLifecycle} which enforces the legal
 * transitions. The constructor only checks structural invariants:
 * <ul>
 *   <li>{@code attemptCount >= 0}</li>
 *   <li>{@code nextRetryAt} is set if and only if the status is {@link DeliveryStatus#RETRYING}</li>
 * </ul>
 *
 * @see DeliveryAttempt
 */
public final class Delivery {
  private final String id;
  private final String subscriptionId;
  private final String eventId;
  private final String eventType;
  private final byte[] payload;
  private final DeliveryStatus status;
  private final int attemptCount;
  private final Instant nextRetryAt;
  private final Instant lastAttemptAt;
  private final String lastError;
  private final Instant completedAt;
  private final Instant createdAt;
  private final Instant updatedAt;

  private Delivery(Builder builder) {
    this.id = Objects.requireNonNull(builder.id, "id");
    this.subscriptionId = Objects.requireNonNull(builder.subscriptionId, "subscriptionId");
    this.eventId = Objects.requireNonNull(builder.eventId, "eventId");
    this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
    Objects.requireNonNull(builder.payload, "payload");
    this.payload = Arrays.copyOf(builder.payload, builder.payload.length);
    this.status = Objects.requireNonNull(builder.status, "status");
    this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt");
    this.updatedAt = builder.updatedAt == null ? builder.createdAt : builder.updatedAt;

    if (builder.attemptCount < 0) {
      throw new IllegalArgumentException("attemptCount must be >= 0");
    }
    if ((status == DeliveryStatus.RETRYING) != (builder.nextRetryAt != null)) {
      throw new IllegalArgumentException(
          "nextRetryAt must be set if and only if status is RETRYING, got status=" + status);
    }
    this.attemptCount = builder.attemptCount;
    this.nextRetryAt = builder.nextRetryAt;
    this.lastAttemptAt = builder.lastAttemptAt;
    this.lastError = builder.lastError;
    this.completedAt = builder.completedAt;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a fresh {@link DeliveryStatus#PENDING} delivery with no attempts.
   */
  public static Delivery pending(String id, String subscriptionId, String eventId,
      String eventType, byte[] payload, Instant createdAt) {
    return builder()
        .id(id)
        .subscriptionId(subscriptionId)
        .eventId(eventId)
        .eventType(eventType)
        .payload(payload)
        .status(DeliveryStatus.PENDING)
        .createdAt(createdAt)
        .updatedAt(createdAt)
        .build();
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id)
        .subscriptionId(subscriptionId)
        .eventId(eventId)
        .eventType(eventType)
        .payload(payload)
        .status(status)
        .attemptCount(attemptCount)
        .nextRetryAt(nextRetryAt)
        .lastAttemptAt(lastAttemptAt)
        .lastError(lastError)
        .completedAt(completedAt)
        .createdAt(createdAt)
        .updatedAt(updatedAt);
  }

  public String id() {
    return id;
  }

  public String subscriptionId() {
    return subscriptionId;
  }

  public String eventId() {
    return eventId;
  }

  public String eventType() {
    return eventType;
  }

  /** Returns a copy of the raw payload bytes. */
  public byte[] payload() {
    return Arrays.copyOf(payload, payload.length);
  }

  public String payloadAsString() {
    return new String(payload, StandardCharsets.UTF_8);
  }

  public DeliveryStatus status() {
    return status;
  }

  public int attemptCount() {
    return attemptCount;
  }

  public Instant nextRetryAt() {
    return nextRetryAt;
  }

  public Instant lastAttemptAt() {
    return lastAttemptAt;
  }

  public String lastError() {
    return lastError;
  }

  public Instant completedAt() {
    return completedAt;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  @Override
  public String toString() {
    return "Delivery{id=" + id
        + ", subscriptionId=" + subscriptionId
        + ", eventType=" + eventType
        + ", status=" + status
        + ", attemptCount=" + attemptCount
        + ", nextRetryAt=" + nextRetryAt + '}';
  }

  /** Builder for {@link Delivery}. */
  public static final class Builder {
    private String id;
    private String subscriptionId;
    private String eventId;
    private String eventType;
    private byte[] payload;
    private DeliveryStatus status;
    private int attemptCount;
    private Instant nextRetryAt;
    private Instant lastAttemptAt;
    private String lastError;
    private Instant completedAt;
    private Instant createdAt;
    private Instant updatedAt;

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder subscriptionId(String subscriptionId) {
      this.subscriptionId = subscriptionId;
      return this;
    }

    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    public Builder eventType(String eventType) {
      this.eventType = eventType;
      return this;
    }

    public Builder payload(byte[] payload) {
      this.payload = payload;
      return this;
    }

    public Builder status(DeliveryStatus status) {
      this.status = status;
      return this;
    }

    public Builder attemptCount(int attemptCount) {
      this.attemptCount = attemptCount;
      return this;
    }

    public Builder nextRetryAt(Instant nextRetryAt) {
      this.nextRetryAt = nextRetryAt;
      return this;
    }

    public Builder lastAttemptAt(Instant lastAttemptAt) {
      this.lastAttemptAt = lastAttemptAt;
      return this;
    }

    public Builder lastError(String lastError) {
      this.lastError = lastError;
      return this;
    }

    public Builder completedAt(Instant completedAt) {
      this.completedAt = completedAt;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    /**
     * @throws NullPointerException if any identifying field, the payload, the status
     *     or {@code createdAt} is missing
     * @throws IllegalArgumentException if {@code attemptCount < 0} or {@code nextRetryAt}
     *     does not agree with the status
     */
    public Delivery build() {
      return new Delivery(this);
    }
  }
}
