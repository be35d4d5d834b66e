package ru.dimension.pivot.model.config;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Caller request: how to group, aggregate and filter one data source
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DashboardConfig {

  String dataSourceId;

  /**
   * Ordered, defines nesting depth and order of the result tree
   */
  @Singular
  List<String> groupings;

  @Singular
  List<Measure> measures;

  @Singular
  List<FilterCondition> filters;

  /**
   * Leaf-row-only columns, neither grouped in the tree nor aggregated
   */
  @Singular
  List<String> displayFields;
}
