package ru.dimension.pivot.storage;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import ru.dimension.pivot.model.schema.ValueType;

/**
 * Converts caller literals to the Java type bound for a field of the given value type
 */
public final class Converter {

  private Converter() {}

  public static Object convertLiteral(Object raw, ValueType valueType) {
    if (raw == null) {
      throw new IllegalArgumentException("null literal, use IS_NULL instead");
    }

    return switch (valueType) {
      case TEXT -> raw.toString();
      case INTEGER -> toLong(raw);
      case NUMBER -> toBigDecimal(raw);
      case BOOLEAN -> toBoolean(raw);
      case DATE -> toLocalDate(raw);
    };
  }

  private static Long toLong(Object raw) {
    if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
      return ((Number) raw).longValue();
    }
    if (raw instanceof BigInteger bi) {
      return bi.longValueExact();
    }
    if (raw instanceof Number n) {
      return new BigDecimal(n.toString()).longValueExact();
    }
    try {
      return Long.parseLong(raw.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not an integer: " + raw, e);
    }
  }

  private static BigDecimal toBigDecimal(Object raw) {
    if (raw instanceof BigDecimal bd) {
      return bd;
    }
    try {
      return new BigDecimal(raw.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not a number: " + raw, e);
    }
  }

  private static Boolean toBoolean(Object raw) {
    if (raw instanceof Boolean b) {
      return b;
    }
    String s = raw.toString().trim();
    if ("true".equalsIgnoreCase(s)) {
      return Boolean.TRUE;
    }
    if ("false".equalsIgnoreCase(s)) {
      return Boolean.FALSE;
    }
    throw new IllegalArgumentException("not a boolean: " + raw);
  }

  private static LocalDate toLocalDate(Object raw) {
    if (raw instanceof LocalDate localDate) {
      return localDate;
    }
    if (raw instanceof LocalDateTime localDateTime) {
      return localDateTime.toLocalDate();
    }
    try {
      return LocalDate.parse(raw.toString().trim());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("not an ISO date: " + raw, e);
    }
  }
}
