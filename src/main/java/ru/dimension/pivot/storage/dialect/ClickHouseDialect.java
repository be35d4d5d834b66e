package ru.dimension.pivot.storage.dialect;

public class ClickHouseDialect extends GenericDialect {

  @Override
  public String getContainsPredicate(String columnRef) {
    return columnRef + " ILIKE ?";
  }

  @Override
  public String containsPattern(String value) {
    return "%" + escapeLike(value) + "%";
  }

  private static String escapeLike(String value) {
    return value
        .replace("\\", "\\\\")
        .replace("%", "\\%")
        .replace("_", "\\_");
  }
}
