package ru.dimension.pivot.model.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Measure {

  public static final String ROW_COUNT_ALIAS = "rows__count";

  /**
   * Target field, absent for a plain row count
   */
  String fieldId;
  AggregationFunction aggregation;
  String displayLabel;

  public static Measure of(String fieldId, AggregationFunction aggregation) {
    return Measure.builder().fieldId(fieldId).aggregation(aggregation).build();
  }

  public static Measure rowCount() {
    return Measure.builder().aggregation(AggregationFunction.COUNT).build();
  }

  @JsonIgnore
  public boolean isRowCount() {
    return fieldId == null && aggregation == AggregationFunction.COUNT;
  }

  /**
   * Column alias of this measure in the compiled query and in fetched rows
   */
  @JsonIgnore
  public String alias() {
    if (isRowCount()) {
      return ROW_COUNT_ALIAS;
    }
    return fieldId + "__" + aggregation.aliasSuffix();
  }
}
