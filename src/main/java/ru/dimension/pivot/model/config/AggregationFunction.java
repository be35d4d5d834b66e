package ru.dimension.pivot.model.config;

import lombok.Getter;

@Getter
public enum AggregationFunction {
  SUM("SUM", true),
  COUNT("COUNT", true),
  AVG("AVG", false),
  MIN("MIN", true),
  MAX("MAX", true);

  private final String sqlName;

  /**
   * Subtotal of a parent can be combined from the finished values of its children
   */
  private final boolean associative;

  AggregationFunction(String sqlName, boolean associative) {
    this.sqlName = sqlName;
    this.associative = associative;
  }

  public String aliasSuffix() {
    return name().toLowerCase();
  }
}
