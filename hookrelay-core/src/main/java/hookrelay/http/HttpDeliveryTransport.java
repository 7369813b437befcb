package hookrelay.http;

import hookrelay.model.Delivery;
import hookrelay.model.Subscription;
import hookrelay.spi.DeliveryTransport;
import hookrelay.spi.TransportResponse;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DeliveryTransport} that POSTs the raw payload with the JDK {@link HttpClient}.
 *
 * <p>Request headers:
 * <ul>
 *   <li>{@code Content-Type: application/json}</li>
 *   <li>{@code User-Agent}</li>
 *   <li>{@code X-Webhook-Event}, {@code X-Webhook-Delivery}, {@code X-Webhook-Attempt}</li>
 *   <li>{@code X-Webhook-Timestamp}, epoch seconds</li>
 *   <li>{@code X-Webhook-Signature} and {@code X-Webhook-Signature-256}, see {@link WebhookSigner}</li>
 * </ul>
 *
 * <p>Any 2xx status is a success. At most {@code maxResponseBodyBytes} of the response body
 * are read and recorded.
 */
public final class HttpDeliveryTransport implements DeliveryTransport {
  private static final Logger logger = Logger.getLogger(HttpDeliveryTransport.class.getName());

  public static final String EVENT_HEADER = "X-Webhook-Event";
  public static final String DELIVERY_HEADER = "X-Webhook-Delivery";
  public static final String ATTEMPT_HEADER = "X-Webhook-Attempt";
  public static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";

  private static final Duration MAX_CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private final HttpClient httpClient;
  private final Duration timeout;
  private final String userAgent;
  private final int maxResponseBodyBytes;
  private final Clock clock;

  private HttpDeliveryTransport(Builder builder) {
    Duration timeout = builder.timeout;
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    if (builder.maxResponseBodyBytes < 0) {
      throw new IllegalArgumentException("maxResponseBodyBytes must be >= 0");
    }
    this.timeout = timeout;
    this.userAgent = Objects.requireNonNull(builder.userAgent, "userAgent");
    this.maxResponseBodyBytes = builder.maxResponseBodyBytes;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
        .connectTimeout(timeout.compareTo(MAX_CONNECT_TIMEOUT) < 0 ? timeout : MAX_CONNECT_TIMEOUT)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public TransportResponse send(Delivery delivery, Subscription subscription, int attemptNumber) {
    long start = System.nanoTime();
    byte[] payload = delivery.payload();
    HttpRequest request;
    try {
      request = buildRequest(delivery, subscription, attemptNumber, payload);
    } catch (IllegalArgumentException e) {
      return TransportResponse.unreachable(
          "Invalid target URL " + subscription.targetUrl() + ": " + e.getMessage(), elapsedMs(start));
    }

    try {
      HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
      String body = readBody(response.body(), delivery.id());
      int status = response.statusCode();
      long durationMs = elapsedMs(start);
      if (status >= 200 && status < 300) {
        return TransportResponse.accepted(status, body, durationMs);
      }
      return TransportResponse.rejected(status, body, durationMs);
    } catch (IOException e) {
      return TransportResponse.unreachable("HTTP request failed: " + describe(e), elapsedMs(start));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return TransportResponse.unreachable("HTTP request interrupted", elapsedMs(start));
    }
  }

  private HttpRequest buildRequest(Delivery delivery, Subscription subscription,
      int attemptNumber, byte[] payload) {
    String signature = WebhookSigner.sign(payload, subscription.secret());
    return HttpRequest.newBuilder(URI.create(subscription.targetUrl()))
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .header("User-Agent", userAgent)
        .header(EVENT_HEADER, delivery.eventType())
        .header(DELIVERY_HEADER, delivery.id())
        .header(ATTEMPT_HEADER, Integer.toString(attemptNumber))
        .header(TIMESTAMP_HEADER, Long.toString(clock.instant().getEpochSecond()))
        .header(WebhookSigner.SIGNATURE_HEADER, signature)
        .header(WebhookSigner.SIGNATURE_256_HEADER, WebhookSigner.SHA256_PREFIX + signature)
        .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
        .build();
  }

  private String readBody(InputStream in, String deliveryId) {
    try (InputStream body = in) {
      byte[] bytes = body.readNBytes(maxResponseBodyBytes);
      int end = bytes.length == maxResponseBodyBytes ? completeUtf8Length(bytes) : bytes.length;
      return new String(bytes, 0, end, StandardCharsets.UTF_8);
    } catch (IOException e) {
      logger.log(Level.FINE, "Failed to read response body for deliveryId=" + deliveryId, e);
      return "";
    }
  }

  /** Length of {@code bytes} without a multi-byte sequence cut off at the end. */
  static int completeUtf8Length(byte[] bytes) {
    int i = bytes.length - 1;
    int continuation = 0;
    while (i >= 0 && continuation < 3 && (bytes[i] & 0xC0) == 0x80) {
      i--;
      continuation++;
    }
    if (i < 0) {
      return bytes.length;
    }
    int lead = bytes[i] & 0xFF;
    int expected = lead >= 0xF0 ? 4 : lead >= 0xE0 ? 3 : lead >= 0xC0 ? 2 : 1;
    return expected > continuation + 1 ? i : bytes.length;
  }

  private static String describe(IOException e) {
    String message = e.getMessage();
    return message == null || message.isEmpty() ? e.getClass().getSimpleName() : message;
  }

  private static long elapsedMs(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
  }

  /** Builder for {@link HttpDeliveryTransport}. */
  public static final class Builder {
    private HttpClient httpClient;
    private Duration timeout = Duration.ofSeconds(30);
    private String userAgent = "hookrelay/1.0";
    private int maxResponseBodyBytes = 10 * 1024;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the HTTP client. Optional; by default a client with a connect timeout of
     * {@code min(timeout, 10s)} that does not follow redirects.
     */
    public Builder httpClient(HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    /**
     * Sets the per-attempt timeout. Optional, defaults to 30 seconds.
     */
    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /**
     * Sets the {@code User-Agent} header. Optional, defaults to {@code hookrelay/1.0}.
     */
    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    /**
     * Sets how much of a response body is kept. Optional, defaults to 10 KiB.
     */
    public Builder maxResponseBodyBytes(int maxResponseBodyBytes) {
      this.maxResponseBodyBytes = maxResponseBodyBytes;
      return this;
    }

    /**
     * Sets the clock used for the timestamp header. Optional, defaults to UTC system clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public HttpDeliveryTransport build() {
      return new HttpDeliveryTransport(this);
    }
  }
}
