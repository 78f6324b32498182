package logpipe.util;

import logpipe.LogEntry;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.reflect.Array;
import java.util.Map;

/**
 * Dependency-free JSON encoder for {@link LogEntry} values.
 *
 * <p>Metadata values map as follows: {@code null}, booleans and finite numbers are written
 * as-is; maps become objects (keys via {@code String.valueOf}); iterables and arrays become
 * arrays; a {@link Throwable} becomes {@code {"name","message","stack"}}; anything else is
 * written as its {@code toString()}. Nesting deeper than {@value #MAX_DEPTH} is cut off.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();
  static final int MAX_DEPTH = 16;

  DefaultJsonCodec() {
  }

  @Override
  public String encode(LogEntry entry) {
    StringBuilder sb = new StringBuilder(128);
    sb.append('{');
    field(sb, "id", entry.id()).append(',');
    field(sb, "time", entry.timestamp().toString()).append(',');
    field(sb, "level", entry.level().label()).append(',');
    field(sb, "service", entry.service()).append(',');
    if (entry.scope() != null) {
      field(sb, "scope", entry.scope()).append(',');
    }
    field(sb, "msg", entry.message());
    if (!entry.metadata().isEmpty()) {
      sb.append(",\"meta\":");
      writeValue(sb, entry.metadata(), 0);
    }
    return sb.append('}').toString();
  }

  private static StringBuilder field(StringBuilder sb, String name, String value) {
    sb.append('"').append(name).append("\":");
    writeString(sb, value);
    return sb;
  }

  private static void writeValue(StringBuilder sb, Object value, int depth) {
    if (value == null) {
      sb.append("null");
    } else if (depth >= MAX_DEPTH) {
      writeString(sb, "[max depth]");
    } else if (value instanceof CharSequence) {
      writeString(sb, value.toString());
    } else if (value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof Number) {
      writeNumber(sb, (Number) value);
    } else if (value instanceof Throwable) {
      writeThrowable(sb, (Throwable) value);
    } else if (value instanceof Map) {
      writeMap(sb, (Map<?, ?>) value, depth);
    } else if (value instanceof Iterable) {
      sb.append('[');
      boolean first = true;
      for (Object element : (Iterable<?>) value) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        writeValue(sb, element, depth + 1);
      }
      sb.append(']');
    } else if (value.getClass().isArray()) {
      sb.append('[');
      int length = Array.getLength(value);
      for (int i = 0; i < length; i++) {
        if (i > 0) {
          sb.append(',');
        }
        writeValue(sb, Array.get(value, i), depth + 1);
      }
      sb.append(']');
    } else {
      writeString(sb, value.toString());
    }
  }

  private static void writeMap(StringBuilder sb, Map<?, ?> map, int depth) {
    sb.append('{');
    boolean first = true;
    for (Map.Entry<?, ?> e : map.entrySet()) {
      if (!first) {
        sb.append(',');
      }
      first = false;
      writeString(sb, String.valueOf(e.getKey()));
      sb.append(':');
      writeValue(sb, e.getValue(), depth + 1);
    }
    sb.append('}');
  }

  private static void writeNumber(StringBuilder sb, Number number) {
    if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        writeString(sb, number.toString());
        return;
      }
    }
    sb.append(number);
  }

  private static void writeThrowable(StringBuilder sb, Throwable error) {
    StringWriter stack = new StringWriter();
    error.printStackTrace(new PrintWriter(stack));
    sb.append('{');
    field(sb, "name", error.getClass().getName()).append(',');
    sb.append("\"message\":");
    if (error.getMessage() == null) {
      sb.append("null");
    } else {
      writeString(sb, error.getMessage());
    }
    sb.append(',');
    field(sb, "stack", stack.toString());
    sb.append('}');
  }

  private static void writeString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
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
    sb.append('"');
  }
}
