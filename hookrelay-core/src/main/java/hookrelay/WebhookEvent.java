package hookrelay;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * An internal event to fan out to webhook subscribers.
 *
 * <p>The payload is an opaque byte blob sent to subscribers unchanged; only the
 * {@code eventType} is interpreted, by the subscription matcher. Each event is assigned a
 * ULID-based {@code eventId} unless one is supplied. Payloads are limited to
 * {@value #MAX_PAYLOAD_BYTES} bytes.
 */
public final class WebhookEvent {
    public static final int MAX_PAYLOAD_BYTES = 1024 * 1024; // 1MB

    private final String eventId;
    private final String eventType;
    private final byte[] payload;
    private final Instant occurredAt;

    private WebhookEvent(Builder builder) {
        this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
        if (this.eventId.isEmpty()) {
            throw new IllegalArgumentException("eventId cannot be empty");
        }
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
        if (this.eventType.isEmpty()) {
            throw new IllegalArgumentException("eventType cannot be empty");
        }
        if (builder.payload == null) {
            throw new IllegalArgumentException("payload must be set");
        }
        if (builder.payload.length > MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
        }
        this.payload = Arrays.copyOf(builder.payload, builder.payload.length);
        this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;
    }

    public static Builder builder(String eventType) {
        return new Builder(eventType);
    }

    /**
     * Creates an event with a generated id and a UTF-8 JSON payload.
     *
     * @param eventType   the event type, e.g. {@code blog.post.created}
     * @param payloadJson the JSON payload
     * @return a new event
     */
    public static WebhookEvent ofJson(String eventType, String payloadJson) {
        return builder(eventType).payloadJson(payloadJson).build();
    }

    public String eventId() {
        return eventId;
    }

    public String eventType() {
        return eventType;
    }

    /** Returns a copy of the payload bytes. */
    public byte[] payload() {
        return Arrays.copyOf(payload, payload.length);
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    private static String newEventId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    @Override
    public String toString() {
        return "WebhookEvent{eventId=" + eventId + ", eventType=" + eventType
            + ", payloadBytes=" + payload.length + '}';
    }

    /** Builder for {@link WebhookEvent}. */
    public static final class Builder {
        private String eventId;
        private final String eventType;
        private byte[] payload;
        private Instant occurredAt;

        private Builder(String eventType) {
            this.eventType = eventType;
        }

        /** Optional. Defaults to a new ULID. */
        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        public Builder payloadJson(String payloadJson) {
            this.payload = payloadJson == null ? null : payloadJson.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        /** Optional. Defaults to now. */
        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public WebhookEvent build() {
            return new WebhookEvent(this);
        }
    }
}
