package io.mediaplatform.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dependency-free {@link JsonCodec} for flat string objects.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> fields) {
    Objects.requireNonNull(fields, "fields");
    StringBuilder sb = new StringBuilder(64);
    sb.append('{');
    for (Map.Entry<String, String> entry : fields.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("fields cannot contain null keys");
      }
      if (entry.getValue() == null) {
        throw new IllegalArgumentException("field '" + entry.getKey() + "' has a null value");
      }
      if (sb.length() > 1) {
        sb.append(',');
      }
      appendQuoted(sb, entry.getKey());
      sb.append(':');
      appendQuoted(sb, entry.getValue());
    }
    return sb.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null) {
      throw new IllegalArgumentException("JSON input is null");
    }
    return new Reader(json).readObject();
  }

  private static void appendQuoted(StringBuilder sb, String value) {
    sb.append('"');
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
    sb.append('"');
  }

  /** Single-use cursor over the input text. */
  private static final class Reader {
    private final String in;
    private int pos;

    private Reader(String in) {
      this.in = in;
    }

    Map<String, String> readObject() {
      Map<String, String> result = new LinkedHashMap<>();
      skipWhitespace();
      expect('{');
      skipWhitespace();
      if (peek() == '}') {
        pos++;
        return finish(result);
      }
      while (true) {
        skipWhitespace();
        expect('"');
        String key = readString();
        skipWhitespace();
        expect(':');
        skipWhitespace();
        if (in.startsWith("null", pos)) {
          pos += 4;
        } else {
          expect('"');
          result.put(key, readString());
        }
        skipWhitespace();
        char next = next();
        if (next == '}') {
          return finish(result);
        }
        if (next != ',') {
          throw error("Expected ',' or '}'");
        }
      }
    }

    private Map<String, String> finish(Map<String, String> result) {
      skipWhitespace();
      if (pos != in.length()) {
        throw error("Trailing characters after JSON object");
      }
      return result;
    }

    private String readString() {
      StringBuilder sb = new StringBuilder();
      while (true) {
        char c = next();
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        char escaped = next();
        switch (escaped) {
          case '"', '\\', '/' -> sb.append(escaped);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (pos + 4 > in.length()) {
              throw error("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(in.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid unicode escape at " + pos, e);
            }
            pos += 4;
          }
          default -> throw error("Unsupported escape sequence: \\" + escaped);
        }
      }
    }

    private void skipWhitespace() {
      while (pos < in.length() && Character.isWhitespace(in.charAt(pos))) {
        pos++;
      }
    }

    private char peek() {
      if (pos >= in.length()) {
        throw error("Unexpected end of JSON input");
      }
      return in.charAt(pos);
    }

    private char next() {
      char c = peek();
      pos++;
      return c;
    }

    private void expect(char expected) {
      if (next() != expected) {
        throw error("Expected '" + expected + "'");
      }
    }

    private IllegalArgumentException error(String message) {
      return new IllegalArgumentException(message + " at position " + pos);
    }
  }
}
