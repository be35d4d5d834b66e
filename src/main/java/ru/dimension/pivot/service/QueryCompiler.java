package ru.dimension.pivot.service;

import ru.dimension.pivot.exception.ConfigException;
import ru.dimension.pivot.exception.SchemaInconsistencyException;
import ru.dimension.pivot.model.config.DashboardConfig;
import ru.dimension.pivot.model.query.CompiledQuery;

public interface QueryCompiler {

  String SOURCE_ALIAS = "src";
  String LABEL_SUFFIX = "__label";
  String ROW_COUNT_ALIAS = "__row_count";
  String AVG_SUM_SUFFIX = "__sum";
  String AVG_COUNT_SUFFIX = "__count";

  /**
   * Validate the configuration completely, then build the grouped query
   *
   * @param config - Dashboard configuration
   * @return CompiledQuery - SQL text with placeholders and bound values in order
   */
  CompiledQuery compile(DashboardConfig config) throws ConfigException, SchemaInconsistencyException;

  /**
   * Distinct raw values of a field with their labels, ordered and capped
   */
  CompiledQuery compileDistinct(String dataSourceId,
                                String fieldId,
                                int limit) throws ConfigException, SchemaInconsistencyException;
}
