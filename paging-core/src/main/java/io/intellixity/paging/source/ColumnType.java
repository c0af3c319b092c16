package io.intellixity.paging.source;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Scalar column types. Request parameters arrive as strings; {@link #coerce(Object)} converts them to
 * the value a JDBC driver expects for the column.
 */
public enum ColumnType {
  STRING,
  INTEGER,
  LONG,
  DECIMAL,
  BOOLEAN,
  UUID;

  public Object coerce(Object value) {
    if (value == null) return null;
    if (!(value instanceof String s)) return value;
    String t = s.trim();
    try {
      return switch (this) {
        case STRING -> s;
        case INTEGER -> Integer.valueOf(t);
        case LONG -> Long.valueOf(t);
        case DECIMAL -> new BigDecimal(t);
        case BOOLEAN -> parseBoolean(t);
        case UUID -> java.util.UUID.fromString(t);
      };
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Cannot convert '" + s + "' to " + this, e);
    }
  }

  public boolean textual() {
    return this == STRING;
  }

  private static Boolean parseBoolean(String s) {
    return switch (s.toLowerCase(Locale.ROOT)) {
      case "true", "1", "yes", "on" -> Boolean.TRUE;
      case "false", "0", "no", "off" -> Boolean.FALSE;
      default -> throw new IllegalArgumentException("not a boolean: " + s);
    };
  }
}
