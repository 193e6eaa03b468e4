package chatfeed.util;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lightweight JSON encoder/decoder for flat objects with scalar values.
 * Has no external dependencies; nested objects and arrays are rejected.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()} or the singleton {@link #INSTANCE}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, ?> fields) {
    if (fields == null) {
      return "{}";
    }
    StringBuilder sb = new StringBuilder();
    sb.append('{');
    boolean first = true;
    for (Map.Entry<String, ?> entry : fields.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("fields cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"').append(escape(entry.getKey())).append('"').append(':');
      appendValue(sb, entry.getValue());
    }
    sb.append('}');
    return sb.toString();
  }

  private static void appendValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof Boolean b) {
      sb.append(b.booleanValue());
    } else if (value instanceof BigDecimal d) {
      sb.append(d.toPlainString());
    } else if (value instanceof Number n) {
      sb.append(n);
    } else {
      sb.append('"').append(escape(value.toString())).append('"');
    }
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    int len = trimmed.length();
    int idx = skipWhitespace(trimmed, 0);
    if (idx >= len || trimmed.charAt(idx) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    idx++;
    Map<String, Object> result = new LinkedHashMap<>();
    while (true) {
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char ch = trimmed.charAt(idx);
      if (ch == '}' && result.isEmpty()) {
        return finish(trimmed, idx + 1, result);
      }
      if (ch != '"') {
        throw new IllegalArgumentException("Expected string key");
      }
      ParseResult key = parseString(trimmed, idx + 1);
      idx = skipWhitespace(trimmed, key.nextIndex);
      if (idx >= len || trimmed.charAt(idx) != ':') {
        throw new IllegalArgumentException("Expected ':' after key");
      }
      idx = skipWhitespace(trimmed, idx + 1);
      ParseResult value = parseValue(trimmed, idx);
      result.put((String) key.value, value.value);
      idx = skipWhitespace(trimmed, value.nextIndex);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char next = trimmed.charAt(idx);
      if (next == ',') {
        idx++;
        continue;
      }
      if (next == '}') {
        return finish(trimmed, idx + 1, result);
      }
      throw new IllegalArgumentException("Expected ',' or '}'");
    }
  }

  private static Map<String, Object> finish(String input, int index, Map<String, Object> result) {
    if (skipWhitespace(input, index) != input.length()) {
      throw new IllegalArgumentException("Trailing characters after JSON object");
    }
    return result;
  }

  private static ParseResult parseValue(String input, int index) {
    if (index >= input.length()) {
      throw new IllegalArgumentException("Expected value");
    }
    char c = input.charAt(index);
    if (c == '"') {
      return parseString(input, index + 1);
    }
    if (input.startsWith("null", index)) {
      return new ParseResult(null, index + 4);
    }
    if (input.startsWith("true", index)) {
      return new ParseResult(Boolean.TRUE, index + 4);
    }
    if (input.startsWith("false", index)) {
      return new ParseResult(Boolean.FALSE, index + 5);
    }
    if (c == '-' || (c >= '0' && c <= '9')) {
      return parseNumber(input, index);
    }
    if (c == '{' || c == '[') {
      throw new IllegalArgumentException("Nested JSON values are not supported");
    }
    throw new IllegalArgumentException("Unexpected character '" + c + "' at " + index);
  }

  private static ParseResult parseNumber(String input, int startIndex) {
    int i = startIndex;
    boolean integral = true;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c >= '0' && c <= '9' || c == '-' || c == '+') {
        i++;
      } else if (c == '.' || c == 'e' || c == 'E') {
        integral = false;
        i++;
      } else {
        break;
      }
    }
    String text = input.substring(startIndex, i);
    try {
      if (integral) {
        try {
          return new ParseResult(Long.parseLong(text), i);
        } catch (NumberFormatException overflow) {
          return new ParseResult(new BigDecimal(text), i);
        }
      }
      return new ParseResult(new BigDecimal(text), i);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number: " + text, ex);
    }
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
        break;
      }
      i++;
    }
    return i;
  }

  private static ParseResult parseString(String input, int startIndex) {
    StringBuilder sb = new StringBuilder();
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        return new ParseResult(sb.toString(), i + 1);
      }
      if (c == '\\') {
        if (i + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(i + 1);
        switch (next) {
          case '"', '\\', '/' -> sb.append(next);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (i + 5 >= input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            String hex = input.substring(i + 2, i + 6);
            try {
              sb.append((char) Integer.parseInt(hex, 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            i += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
        i += 2;
      } else {
        sb.append(c);
        i++;
      }
    }
    throw new IllegalArgumentException("Unterminated string");
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder();
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

  private static final class ParseResult {
    private final Object value;
    private final int nextIndex;

    private ParseResult(Object value, int nextIndex) {
      this.value = value;
      this.nextIndex = nextIndex;
    }
  }
}
