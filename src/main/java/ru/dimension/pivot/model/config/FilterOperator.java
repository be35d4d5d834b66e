package ru.dimension.pivot.model.config;

import lombok.Getter;

@Getter
public enum FilterOperator {
  EQ("=", 1, 1),
  NE("<>", 1, 1),
  GT(">", 1, 1),
  GTE(">=", 1, 1),
  LT("<", 1, 1),
  LTE("<=", 1, 1),
  IN("IN", 1, Integer.MAX_VALUE),
  NOT_IN("NOT IN", 1, Integer.MAX_VALUE),
  BETWEEN("BETWEEN", 2, 2),
  CONTAINS("LIKE", 1, 1),
  IS_NULL("IS NULL", 0, 0),
  IS_NOT_NULL("IS NOT NULL", 0, 0);

  private final String sql;
  private final int minValues;
  private final int maxValues;

  FilterOperator(String sql, int minValues, int maxValues) {
    this.sql = sql;
    this.minValues = minValues;
    this.maxValues = maxValues;
  }

  public boolean acceptsArity(int count) {
    return count >= minValues && count <= maxValues;
  }
}
