package ru.dimension.pivot.model.output;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.temporal.TemporalAccessor;
import java.util.Comparator;
import lombok.Getter;

/**
 * Homogeneous cell of the result tree: text, floating number, integer or null.
 * Equality follows the ordering, so INTEGER(1) and NUMBER(1.0) are the same value.
 */
public final class CellValue implements Comparable<CellValue> {

  public enum Kind {
    TEXT,
    NUMBER,
    INTEGER,
    NULL
  }

  public static final CellValue NULL = new CellValue(Kind.NULL, null);

  private static final Comparator<CellValue> ORDER = Comparator
      .comparingInt(CellValue::orderClass)
      .thenComparing(CellValue::compareWithinClass);

  @Getter
  private final Kind kind;
  private final Object value;

  private CellValue(Kind kind, Object value) {
    this.kind = kind;
    this.value = value;
  }

  public static CellValue text(String value) {
    return value == null ? NULL : new CellValue(Kind.TEXT, value);
  }

  public static CellValue number(double value) {
    return new CellValue(Kind.NUMBER, value);
  }

  public static CellValue integer(long value) {
    return new CellValue(Kind.INTEGER, value);
  }

  @JsonCreator
  public static CellValue of(Object raw) {
    if (raw == null) {
      return NULL;
    }
    if (raw instanceof CellValue cellValue) {
      return cellValue;
    }
    if (raw instanceof String s) {
      return text(s);
    }
    if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
      return integer(((Number) raw).longValue());
    }
    if (raw instanceof BigInteger bigInteger) {
      return bigInteger.bitLength() < 64 ? integer(bigInteger.longValue()) : number(bigInteger.doubleValue());
    }
    if (raw instanceof BigDecimal || raw instanceof Double || raw instanceof Float) {
      return number(((Number) raw).doubleValue());
    }
    if (raw instanceof Boolean b) {
      return text(b.toString());
    }
    if (raw instanceof java.sql.Date date) {
      return text(date.toLocalDate().toString());
    }
    if (raw instanceof Timestamp timestamp) {
      return text(timestamp.toLocalDateTime().toString());
    }
    if (raw instanceof TemporalAccessor) {
      return text(raw.toString());
    }
    return text(raw.toString());
  }

  @JsonValue
  public Object getValue() {
    return value;
  }

  public boolean isNull() {
    return kind == Kind.NULL;
  }

  public boolean isNumeric() {
    return kind == Kind.NUMBER || kind == Kind.INTEGER;
  }

  public double asDouble() {
    if (!isNumeric()) {
      throw new IllegalStateException("Not a numeric cell: " + kind);
    }
    return ((Number) value).doubleValue();
  }

  public long asLong() {
    if (!isNumeric()) {
      throw new IllegalStateException("Not a numeric cell: " + kind);
    }
    return ((Number) value).longValue();
  }

  public String asText() {
    return value == null ? null : value.toString();
  }

  /**
   * Numbers first, then text, nulls last
   */
  @Override
  public int compareTo(CellValue other) {
    return ORDER.compare(this, other);
  }

  private int orderClass() {
    return switch (kind) {
      case NUMBER, INTEGER -> 0;
      case TEXT -> 1;
      case NULL -> 2;
    };
  }

  private static int compareWithinClass(CellValue left, CellValue right) {
    return switch (left.kind) {
      case NUMBER, INTEGER -> {
        if (left.kind == Kind.INTEGER && right.kind == Kind.INTEGER) {
          yield Long.compare(left.asLong(), right.asLong());
        }
        yield Double.compare(left.asDouble(), right.asDouble());
      }
      case TEXT -> ((String) left.value).compareTo((String) right.value);
      case NULL -> 0;
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CellValue other)) {
      return false;
    }
    return compareTo(other) == 0;
  }

  @Override
  public int hashCode() {
    return switch (kind) {
      case NUMBER, INTEGER -> Double.hashCode(asDouble());
      case TEXT -> value.hashCode();
      case NULL -> 0;
    };
  }

  @Override
  public String toString() {
    return kind + "(" + value + ")";
  }
}
