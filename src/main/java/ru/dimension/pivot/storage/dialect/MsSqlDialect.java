package ru.dimension.pivot.storage.dialect;

public class MsSqlDialect extends GenericDialect {

  /**
   * Requires an ORDER BY in the statement
   */
  @Override
  public String getLimitClass(Integer limit) {
    return limit != null ? " OFFSET 0 ROWS FETCH NEXT " + limit + " ROWS ONLY" : "";
  }
}
