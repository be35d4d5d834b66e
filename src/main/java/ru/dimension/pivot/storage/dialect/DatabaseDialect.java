package ru.dimension.pivot.storage.dialect;

import java.sql.PreparedStatement;
import java.sql.SQLException;

public interface DatabaseDialect {

  String quoteAlias(String alias);

  /**
   * Case-insensitive substring predicate with one placeholder, operand built by {@link #containsPattern(String)}
   */
  String getContainsPredicate(String columnRef);

  String containsPattern(String value);

  String getLimitClass(Integer limit);

  void setParameter(PreparedStatement ps, int parameterIndex, Object value) throws SQLException;
}
