package hookrelay.util;

import java.util.Map;

/**
 * Minimal encoder for flat JSON objects whose values are strings, numbers, booleans or
 * {@code null}. Used for payloads the engine generates itself; subscriber payloads are
 * opaque bytes and never pass through here.
 */
public final class JsonObjects {

  private JsonObjects() {}

  public static String toJson(Map<String, ?> fields) {
    StringBuilder sb = new StringBuilder();
    sb.append('{');
    boolean first = true;
    for (Map.Entry<String, ?> entry : fields.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("JSON object cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"').append(escape(entry.getKey())).append("\":");
      Object value = entry.getValue();
      if (value == null) {
        sb.append("null");
      } else if (value instanceof Boolean || value instanceof Integer || value instanceof Long) {
        sb.append(value);
      } else {
        sb.append('"').append(escape(value.toString())).append('"');
      }
    }
    sb.append('}');
    return sb.toString();
  }

  static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.toString();
  }
}
