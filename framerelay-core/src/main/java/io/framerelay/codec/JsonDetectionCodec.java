package io.framerelay.codec;

import io.framerelay.BoundingBox;
import io.framerelay.Detection;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lightweight JSON encoder/decoder for {@link Detection}s. Has no external dependencies.
 *
 * <p>Document shape:
 * <pre>{@code
 * {"sourceId":"cam0","frameSequenceNumber":5,"attemptCount":1,
 *  "processedAt":"2024-05-01T10:15:30.123Z",
 *  "boxes":[{"label":"person","confidence":0.91,"x":10,"y":20,"width":64,"height":128}]}
 * }</pre>
 *
 * <p>The parser accepts any well-formed JSON value but only maps the fields above; unknown
 * fields are ignored.
 */
public final class JsonDetectionCodec implements DetectionCodec {
  static final JsonDetectionCodec INSTANCE = new JsonDetectionCodec();

  public JsonDetectionCodec() {
  }

  @Override
  public byte[] encode(Detection detection) {
    StringBuilder sb = new StringBuilder(96 + detection.boxes().size() * 80);
    sb.append("{\"sourceId\":\"").append(escape(detection.sourceId())).append('"');
    sb.append(",\"frameSequenceNumber\":").append(detection.frameSequenceNumber());
    sb.append(",\"attemptCount\":").append(detection.attemptCount());
    sb.append(",\"processedAt\":\"").append(detection.processedAt()).append('"');
    sb.append(",\"boxes\":[");
    boolean first = true;
    for (BoundingBox box : detection.boxes()) {
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append("{\"label\":\"").append(escape(box.label())).append('"');
      sb.append(",\"confidence\":").append(box.confidence());
      sb.append(",\"x\":").append(box.x());
      sb.append(",\"y\":").append(box.y());
      sb.append(",\"width\":").append(box.width());
      sb.append(",\"height\":").append(box.height());
      sb.append('}');
    }
    sb.append("]}");
    return sb.toString().getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public Detection decode(byte[] payload) {
    if (payload == null) {
      throw new IllegalArgumentException("payload must not be null");
    }
    Parser parser = new Parser(new String(payload, StandardCharsets.UTF_8));
    Object root = parser.parseDocument();
    if (!(root instanceof Map<?, ?> object)) {
      throw new IllegalArgumentException("Expected JSON object");
    }
    List<BoundingBox> boxes = new ArrayList<>();
    Object rawBoxes = object.get("boxes");
    if (rawBoxes != null) {
      if (!(rawBoxes instanceof List<?> list)) {
        throw new IllegalArgumentException("boxes must be an array");
      }
      for (Object item : list) {
        if (!(item instanceof Map<?, ?> box)) {
          throw new IllegalArgumentException("box must be an object");
        }
        boxes.add(new BoundingBox(
            string(box, "label"),
            number(box, "confidence").doubleValue(),
            integer(box, "x"),
            integer(box, "y"),
            integer(box, "width"),
            integer(box, "height")));
      }
    }
    Instant processedAt;
    try {
      processedAt = Instant.parse(string(object, "processedAt"));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("processedAt is not an ISO-8601 instant", e);
    }
    return new Detection(
        string(object, "sourceId"),
        whole(object, "frameSequenceNumber"),
        integer(object, "attemptCount"),
        boxes,
        processedAt);
  }

  private static String string(Map<?, ?> object, String field) {
    Object value = object.get(field);
    if (!(value instanceof String s)) {
      throw new IllegalArgumentException("Missing string field " + field);
    }
    return s;
  }

  private static Number number(Map<?, ?> object, String field) {
    Object value = object.get(field);
    if (!(value instanceof Number n)) {
      throw new IllegalArgumentException("Missing numeric field " + field);
    }
    return n;
  }

  private static long whole(Map<?, ?> object, String field) {
    Number value = number(object, field);
    if (!(value instanceof Long l)) {
      throw new IllegalArgumentException("Field " + field + " must be an integer, got " + value);
    }
    return l;
  }

  private static int integer(Map<?, ?> object, String field) {
    long value = whole(object, field);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Field " + field + " out of int range: " + value);
    }
    return (int) value;
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }

  /** Recursive-descent parser producing maps, lists, strings, numbers, booleans and null. */
  private static final class Parser {
    private final String input;
    private int pos;

    Parser(String input) {
      this.input = input;
    }

    Object parseDocument() {
      Object value = parseValue();
      skipWhitespace();
      if (pos != input.length()) {
        throw new IllegalArgumentException("Trailing characters at " + pos);
      }
      return value;
    }

    private Object parseValue() {
      skipWhitespace();
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      char c = input.charAt(pos);
      switch (c) {
        case '{':
          return parseObject();
        case '[':
          return parseArray();
        case '"':
          pos++;
          return parseString();
        case 't':
          return literal("true", Boolean.TRUE);
        case 'f':
          return literal("false", Boolean.FALSE);
        case 'n':
          return literal("null", null);
        default:
          return parseNumber();
      }
    }

    private Map<String, Object> parseObject() {
      pos++; // '{'
      Map<String, Object> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peek() == '}') {
        pos++;
        return result;
      }
      while (true) {
        skipWhitespace();
        if (peek() != '"') {
          throw new IllegalArgumentException("Expected string key at " + pos);
        }
        pos++;
        String key = parseString();
        skipWhitespace();
        if (peek() != ':') {
          throw new IllegalArgumentException("Expected ':' after key at " + pos);
        }
        pos++;
        result.put(key, parseValue());
        skipWhitespace();
        char next = peek();
        pos++;
        if (next == ',') {
          continue;
        }
        if (next == '}') {
          return result;
        }
        throw new IllegalArgumentException("Expected ',' or '}' at " + (pos - 1));
      }
    }

    private List<Object> parseArray() {
      pos++; // '['
      List<Object> result = new ArrayList<>();
      skipWhitespace();
      if (peek() == ']') {
        pos++;
        return result;
      }
      while (true) {
        result.add(parseValue());
        skipWhitespace();
        char next = peek();
        pos++;
        if (next == ',') {
          continue;
        }
        if (next == ']') {
          return result;
        }
        throw new IllegalArgumentException("Expected ',' or ']' at " + (pos - 1));
      }
    }

    private String parseString() {
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c == '"') {
          pos++;
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          pos++;
          continue;
        }
        if (pos + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(pos + 1);
        switch (next) {
          case '"':
          case '\\':
          case '/':
            sb.append(next);
            break;
          case 'b':
            sb.append('\b');
            break;
          case 'f':
            sb.append('\f');
            break;
          case 'n':
            sb.append('\n');
            break;
          case 'r':
            sb.append('\r');
            break;
          case 't':
            sb.append('\t');
            break;
          case 'u':
            if (pos + 5 >= input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos + 2, pos + 6), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            pos += 4;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
        pos += 2;
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private Number parseNumber() {
      int start = pos;
      boolean floating = false;
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c == '.' || c == 'e' || c == 'E') {
          floating = true;
        } else if (c != '-' && c != '+' && (c < '0' || c > '9')) {
          break;
        }
        pos++;
      }
      if (start == pos) {
        throw new IllegalArgumentException("Unexpected character at " + pos);
      }
      String token = input.substring(start, pos);
      try {
        return floating ? (Number) Double.parseDouble(token) : (Number) Long.parseLong(token);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid number: " + token, e);
      }
    }

    private Object literal(String word, Object value) {
      if (!input.startsWith(word, pos)) {
        throw new IllegalArgumentException("Unexpected token at " + pos);
      }
      pos += word.length();
      return value;
    }

    private char peek() {
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      return input.charAt(pos);
    }

    private void skipWhitespace() {
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          break;
        }
        pos++;
      }
    }
  }
}
