package hookrelay.http;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * HMAC-SHA256 payload signatures, hex encoded.
 *
 * <p>The signature is sent twice: bare in {@value #SIGNATURE_HEADER} and prefixed with
 * {@code sha256=} in {@value #SIGNATURE_256_HEADER}. {@link #verify} accepts either form.
 */
public final class WebhookSigner {
  public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
  public static final String SIGNATURE_256_HEADER = "X-Webhook-Signature-256";
  public static final String SHA256_PREFIX = "sha256=";

  private static final String ALGORITHM = "HmacSHA256";
  private static final HexFormat HEX = HexFormat.of();

  private WebhookSigner() {}

  /**
   * Computes {@code hex(HMAC-SHA256(payload, secret))}.
   */
  public static String sign(byte[] payload, String secret) {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(secret, "secret");
    return HEX.formatHex(hmac(payload, secret));
  }

  /**
   * Checks a signature in constant time. Returns {@code false} for a {@code null}, malformed
   * or mismatching signature.
   */
  public static boolean verify(byte[] payload, String secret, String signature) {
    if (payload == null || secret == null || signature == null) {
      return false;
    }
    String hex = signature.startsWith(SHA256_PREFIX)
        ? signature.substring(SHA256_PREFIX.length()) : signature;
    byte[] provided;
    try {
      provided = HEX.parseHex(hex.toLowerCase());
    } catch (IllegalArgumentException e) {
      return false;
    }
    return MessageDigest.isEqual(hmac(payload, secret), provided);
  }

  private static byte[] hmac(byte[] payload, String secret) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      byte[] key = secret.getBytes(StandardCharsets.UTF_8);
      // SecretKeySpec rejects empty keys; HMAC zero-pads keys, so {0x00} is equivalent
      mac.init(new SecretKeySpec(key.length == 0 ? new byte[1] : key, ALGORITHM));
      return mac.doFinal(payload);
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("HMAC-SHA256 not available", e);
    }
  }
}
