package relay.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Zero-dependency {@link JsonCodec} for flat string objects. Keys are written in the map's
 * iteration order.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  private DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return "{}";
    }
    StringBuilder sb = new StringBuilder("{");
    for (Map.Entry<String, String> entry : metadata.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("metadata cannot contain null keys");
      }
      if (sb.length() > 1) {
        sb.append(',');
      }
      sb.append('"').append(escape(entry.getKey())).append("\":");
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        sb.append('"').append(escape(entry.getValue())).append('"');
      }
    }
    return sb.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    Cursor cursor = new Cursor(json);
    cursor.expect('{');
    Map<String, String> result = new LinkedHashMap<>();
    if (cursor.consumeIf('}')) {
      cursor.expectEnd();
      return result;
    }
    do {
      String key = cursor.readString();
      cursor.expect(':');
      if (cursor.consumeLiteral("null")) {
        continue;
      }
      result.put(key, cursor.readString());
    } while (cursor.consumeIf(','));
    cursor.expect('}');
    cursor.expectEnd();
    return result;
  }

  static String escape(String value) {
    if (value == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
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

  /** Single-pass reader over the input text. */
  private static final class Cursor {
    private final String text;
    private int pos;

    Cursor(String text) {
      this.text = text;
    }

    void skipWhitespace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    void expect(char c) {
      if (!consumeIf(c)) {
        throw new IllegalArgumentException("Expected '" + c + "' at offset " + pos);
      }
    }

    boolean consumeIf(char c) {
      skipWhitespace();
      if (pos < text.length() && text.charAt(pos) == c) {
        pos++;
        return true;
      }
      return false;
    }

    boolean consumeLiteral(String literal) {
      skipWhitespace();
      if (text.startsWith(literal, pos)) {
        pos += literal.length();
        return true;
      }
      return false;
    }

    void expectEnd() {
      skipWhitespace();
      if (pos != text.length()) {
        throw new IllegalArgumentException("Trailing content at offset " + pos);
      }
    }

    String readString() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (pos < text.length()) {
        char c = text.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= text.length()) {
          break;
        }
        char esc = text.charAt(pos++);
        switch (esc) {
          case '"', '\\', '/' -> sb.append(esc);
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'u' -> {
            if (pos + 4 > text.length()) {
              throw new IllegalArgumentException("Invalid unicode escape at offset " + pos);
            }
            try {
              sb.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid unicode escape at offset " + pos, e);
            }
            pos += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape \\" + esc);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }
  }
}
