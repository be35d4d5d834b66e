package ru.dimension.pivot.core;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import ru.dimension.pivot.exception.ConfigException;
import ru.dimension.pivot.exception.EngineException;
import ru.dimension.pivot.exception.RollupException;
import ru.dimension.pivot.exception.SchemaInconsistencyException;
import ru.dimension.pivot.model.config.DashboardConfig;
import ru.dimension.pivot.model.output.DistinctValue;
import ru.dimension.pivot.model.output.ExecuteDashboardResponse;
import ru.dimension.pivot.model.output.GeneratedSql;
import ru.dimension.pivot.model.output.PivotRow;
import ru.dimension.pivot.model.query.CompiledQuery;
import ru.dimension.pivot.model.query.Row;
import ru.dimension.pivot.model.schema.DataSourceSchema;
import ru.dimension.pivot.model.schema.SchemaInfo;

/**
 * Main Dimension Pivot API for dashboard queries
 */
public interface DashboardEngine {

  /**
   * List registered data sources
   *
   * @return List<SchemaInfo> - Summary of each data source
   */
  List<SchemaInfo> listSchemas();

  /**
   * Get data source schema
   *
   * @param dataSourceId - Data source id
   * @return Optional<DataSourceSchema> - Schema, empty when not registered
   */
  Optional<DataSourceSchema> getSchema(String dataSourceId);

  /**
   * Validate configuration and compile it into a parameterized query
   *
   * @param config - Dashboard configuration
   * @return CompiledQuery - SQL text and bound values
   */
  CompiledQuery compile(DashboardConfig config) throws ConfigException, SchemaInconsistencyException;

  /**
   * Compiled SQL with a text preview of bound values
   *
   * @param config - Dashboard configuration
   * @return GeneratedSql - SQL text and rendered parameters
   */
  GeneratedSql generateSql(DashboardConfig config) throws ConfigException, SchemaInconsistencyException;

  /**
   * Build the subtotal tree from rows fetched elsewhere
   *
   * @param config - Dashboard configuration
   * @param rows   - Rows keyed by compiled column aliases
   * @return List<PivotRow> - Top level rows of the tree
   */
  List<PivotRow> buildRollup(DashboardConfig config, List<Row> rows) throws ConfigException, RollupException;

  /**
   * Compile, execute and roll up without blocking the caller.
   * Configuration errors fail the future before the query is issued.
   * Cancelling the returned future cancels the running query.
   *
   * @param config - Dashboard configuration
   * @return CompletableFuture<ExecuteDashboardResponse> - Response or typed failure
   */
  CompletableFuture<ExecuteDashboardResponse> executeDashboardAsync(DashboardConfig config);

  /**
   * Blocking variant of {@link #executeDashboardAsync(DashboardConfig)} bounded by the configured query timeout
   *
   * @param config - Dashboard configuration
   * @return ExecuteDashboardResponse - Column headers, tree and grand total
   */
  ExecuteDashboardResponse executeDashboard(DashboardConfig config) throws EngineException;

  /**
   * Distinct values of a field with resolved labels, for filter pickers
   *
   * @param dataSourceId - Data source id
   * @param fieldId      - Field id
   * @param limit        - Maximum number of values, null for the configured default
   * @return List<DistinctValue> - Ordered values
   */
  List<DistinctValue> getDistinctValues(String dataSourceId,
                                        String fieldId,
                                        Integer limit) throws EngineException;
}
