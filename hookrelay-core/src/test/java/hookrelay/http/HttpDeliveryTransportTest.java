package hookrelay.http;

import com.github.tomakehurst.wiremock.WireMockServer;
import hookrelay.model.Delivery;
import hookrelay.model.Subscription;
import hookrelay.spi.TransportResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Set;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.junit.jupiter.api.Assertions.*;

class HttpDeliveryTransportTest {
  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
  private static final String PAYLOAD = "{\"post\":{\"id\":7}}";

  private WireMockServer server;
  private HttpDeliveryTransport transport;

  @BeforeEach
  void setUp() {
    server = new WireMockServer(wireMockConfig().dynamicPort());
    server.start();
    transport = HttpDeliveryTransport.builder()
        .timeout(Duration.ofSeconds(2))
        .maxResponseBodyBytes(16)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
  }

  @AfterEach
  void tearDown() {
    server.stop();
  }

  @Test
  void postsSignedPayloadWithWebhookHeaders() {
    server.stubFor(post("/hook").willReturn(aResponse().withStatus(202).withBody("queued")));

    TransportResponse response = transport.send(delivery(), subscription("/hook"), 3);

    assertTrue(response.success());
    assertEquals(202, response.statusCode());
    assertEquals("queued", response.body());
    assertEquals("", response.error());

    String signature = WebhookSigner.sign(PAYLOAD.getBytes(StandardCharsets.UTF_8), "s3cret");
    server.verify(postRequestedFor(urlEqualTo("/hook"))
        .withHeader("Content-Type", equalTo("application/json"))
        .withHeader("User-Agent", equalTo("hookrelay/1.0"))
        .withHeader(HttpDeliveryTransport.EVENT_HEADER, equalTo("blog.post.created"))
        .withHeader(HttpDeliveryTransport.DELIVERY_HEADER, equalTo("d-1"))
        .withHeader(HttpDeliveryTransport.ATTEMPT_HEADER, equalTo("3"))
        .withHeader(HttpDeliveryTransport.TIMESTAMP_HEADER, equalTo(Long.toString(NOW.getEpochSecond())))
        .withHeader(WebhookSigner.SIGNATURE_HEADER, equalTo(signature))
        .withHeader(WebhookSigner.SIGNATURE_256_HEADER, equalTo("sha256=" + signature))
        .withRequestBody(equalToJson(PAYLOAD)));
  }

  @Test
  void non2xxIsFailureWithStatusAndBody() {
    server.stubFor(post("/hook").willReturn(aResponse().withStatus(500).withBody("boom")));

    TransportResponse response = transport.send(delivery(), subscription("/hook"), 1);

    assertFalse(response.success());
    assertEquals(500, response.statusCode());
    assertEquals("HTTP 500: boom", response.error());
  }

  @Test
  void redirectIsNotSuccess() {
    server.stubFor(post("/hook").willReturn(aResponse().withStatus(301)
        .withHeader("Location", server.baseUrl() + "/elsewhere")));

    TransportResponse response = transport.send(delivery(), subscription("/hook"), 1);

    assertFalse(response.success());
    assertEquals(301, response.statusCode());
  }

  @Test
  void responseBodyIsTruncated() {
    server.stubFor(post("/hook").willReturn(aResponse().withStatus(200)
        .withBody("0123456789abcdefTRUNCATED")));

    TransportResponse response = transport.send(delivery(), subscription("/hook"), 1);

    assertTrue(response.success());
    assertEquals("0123456789abcdef", response.body());
  }

  @Test
  void truncationDoesNotSplitMultiByteCharacter() {
    byte[] body = "aaaaaaaaaaaaaaa\u20ac tail".getBytes(StandardCharsets.UTF_8);
    server.stubFor(post("/hook").willReturn(aResponse().withStatus(500).withBody(body)));

    TransportResponse response = transport.send(delivery(), subscription("/hook"), 1);

    assertEquals("aaaaaaaaaaaaaaa", response.body());
    assertEquals("HTTP 500: aaaaaaaaaaaaaaa", response.error());
  }

  @Test
  void completeUtf8LengthKeepsWholeCharacters() {
    assertEquals(3, HttpDeliveryTransport.completeUtf8Length("abc".getBytes(StandardCharsets.UTF_8)));
    assertEquals(3, HttpDeliveryTransport.completeUtf8Length("\u20ac".getBytes(StandardCharsets.UTF_8)));
    byte[] emoji = "x\uD83D\uDE00".getBytes(StandardCharsets.UTF_8);
    assertEquals(1, HttpDeliveryTransport.completeUtf8Length(Arrays.copyOf(emoji, 3)));
    assertEquals(5, HttpDeliveryTransport.completeUtf8Length(emoji));
  }

  @Test
  void unreachableEndpointIsFailureWithoutStatus() throws Exception {
    int closedPort;
    try (ServerSocket socket = new ServerSocket(0)) {
      closedPort = socket.getLocalPort();
    }
    Subscription sub = new Subscription("s-1", "http://localhost:" + closedPort + "/hook",
        "s3cret", Set.of("*"), true);

    TransportResponse response = transport.send(delivery(), sub, 1);

    assertFalse(response.success());
    assertEquals(0, response.statusCode());
    assertTrue(response.error().startsWith("HTTP request failed: "), response.error());
  }

  @Test
  void timeoutIsFailure() {
    server.stubFor(post("/slow").willReturn(aResponse().withStatus(200).withFixedDelay(3000)));

    TransportResponse response = transport.send(delivery(), subscription("/slow"), 1);

    assertFalse(response.success());
    assertEquals(0, response.statusCode());
  }

  @Test
  void invalidUrlIsFailure() {
    Subscription sub = new Subscription("s-1", "not a url", "s3cret", Set.of("*"), true);

    TransportResponse response = transport.send(delivery(), sub, 1);

    assertFalse(response.success());
    assertTrue(response.error().startsWith("Invalid target URL"), response.error());
  }

  private Subscription subscription(String path) {
    return new Subscription("s-1", server.baseUrl() + path, "s3cret", Set.of("*"), true);
  }

  private static Delivery delivery() {
    return Delivery.pending("d-1", "s-1", "e-1", "blog.post.created",
        PAYLOAD.getBytes(StandardCharsets.UTF_8), NOW);
  }
}
