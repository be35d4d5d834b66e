package ru.dimension.pivot.storage.dialect;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.Locale;

/**
 * ANSI flavour used for H2, PostgreSQL and MySQL
 */
public class GenericDialect implements DatabaseDialect {

  @Override
  public String quoteAlias(String alias) {
    return "\"" + alias.replace("\"", "") + "\"";
  }

  @Override
  public String getContainsPredicate(String columnRef) {
    return "LOWER(" + columnRef + ") LIKE ? ESCAPE '!'";
  }

  @Override
  public String containsPattern(String value) {
    String escaped = value.toLowerCase(Locale.ROOT)
        .replace("!", "!!")
        .replace("%", "!%")
        .replace("_", "!_");
    return "%" + escaped + "%";
  }

  @Override
  public String getLimitClass(Integer limit) {
    return limit != null ? " LIMIT " + limit : "";
  }

  @Override
  public void setParameter(PreparedStatement ps, int parameterIndex, Object value) throws SQLException {
    if (value == null) {
      ps.setNull(parameterIndex, Types.NULL);
    } else if (value instanceof LocalDate localDate) {
      ps.setDate(parameterIndex, Date.valueOf(localDate));
    } else if (value instanceof BigDecimal bd) {
      ps.setBigDecimal(parameterIndex, bd);
    } else if (value instanceof Long l) {
      ps.setLong(parameterIndex, l);
    } else if (value instanceof Boolean b) {
      ps.setBoolean(parameterIndex, b);
    } else {
      ps.setString(parameterIndex, value.toString());
    }
  }
}
