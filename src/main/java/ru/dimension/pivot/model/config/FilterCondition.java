package ru.dimension.pivot.model.config;

import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class FilterCondition {

  String fieldId;
  FilterOperator operator;

  /**
   * Literal operands as received on the wire: strings, numbers or booleans
   */
  @Builder.Default
  List<Object> values = List.of();

  /**
   * Only with {@link FilterOperator#BETWEEN} on a date field, replaces the two values
   */
  DatePreset preset;

  public static FilterCondition of(String fieldId, FilterOperator operator, Object... values) {
    return FilterCondition.builder()
        .fieldId(fieldId)
        .operator(operator)
        .values(List.of(values))
        .build();
  }
}
