package ru.dimension.pivot.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.log4j.Log4j2;
import ru.dimension.pivot.config.DPivotConfig;
import ru.dimension.pivot.exception.ConfigException;
import ru.dimension.pivot.exception.ConfigRule;
import ru.dimension.pivot.exception.EngineException;
import ru.dimension.pivot.exception.InternalInvariantException;
import ru.dimension.pivot.exception.QueryExecutionException;
import ru.dimension.pivot.exception.RollupException;
import ru.dimension.pivot.exception.SchemaInconsistencyException;
import ru.dimension.pivot.model.config.DashboardConfig;
import ru.dimension.pivot.model.output.CellValue;
import ru.dimension.pivot.model.output.DistinctValue;
import ru.dimension.pivot.model.output.ExecuteDashboardResponse;
import ru.dimension.pivot.model.output.GeneratedSql;
import ru.dimension.pivot.model.output.PivotRow;
import ru.dimension.pivot.model.query.CompiledQuery;
import ru.dimension.pivot.model.query.Row;
import ru.dimension.pivot.model.schema.DataSourceSchema;
import ru.dimension.pivot.model.schema.FieldDef;
import ru.dimension.pivot.model.schema.SchemaInfo;
import ru.dimension.pivot.registry.SchemaRegistry;
import ru.dimension.pivot.service.QueryCompiler;
import ru.dimension.pivot.service.ResponseAssembler;
import ru.dimension.pivot.service.RollupBuilder;
import ru.dimension.pivot.service.rollup.RollupTree;
import ru.dimension.pivot.storage.ExecutionAdapter;

@Log4j2
public class PivotEngine implements DashboardEngine {

  private final DPivotConfig dPivotConfig;
  private final SchemaRegistry schemaRegistry;
  private final QueryCompiler queryCompiler;
  private final RollupBuilder rollupBuilder;
  private final ResponseAssembler responseAssembler;
  private final ExecutionAdapter executionAdapter;

  public PivotEngine(DPivotConfig dPivotConfig,
                     SchemaRegistry schemaRegistry,
                     QueryCompiler queryCompiler,
                     RollupBuilder rollupBuilder,
                     ResponseAssembler responseAssembler,
                     ExecutionAdapter executionAdapter) {
    this.dPivotConfig = dPivotConfig;
    this.schemaRegistry = schemaRegistry;
    this.queryCompiler = queryCompiler;
    this.rollupBuilder = rollupBuilder;
    this.responseAssembler = responseAssembler;
    this.executionAdapter = executionAdapter;
  }

  @Override
  public List<SchemaInfo> listSchemas() {
    return schemaRegistry.listSchemas();
  }

  @Override
  public Optional<DataSourceSchema> getSchema(String dataSourceId) {
    return schemaRegistry.getSchema(dataSourceId);
  }

  @Override
  public CompiledQuery compile(DashboardConfig config) throws ConfigException, SchemaInconsistencyException {
    return queryCompiler.compile(config);
  }

  @Override
  public GeneratedSql generateSql(DashboardConfig config) throws ConfigException, SchemaInconsistencyException {
    CompiledQuery compiledQuery = queryCompiler.compile(config);

    List<String> params = new ArrayList<>(compiledQuery.getParams().size());
    compiledQuery.getParams().forEach(param -> params.add(String.valueOf(param)));

    return GeneratedSql.builder()
        .sql(compiledQuery.getSql())
        .params(params)
        .build();
  }

  @Override
  public List<PivotRow> buildRollup(DashboardConfig config, List<Row> rows) throws ConfigException, RollupException {
    return rollupBuilder.build(schema(config.getDataSourceId()), config, rows).getRows();
  }

  @Override
  public CompletableFuture<ExecuteDashboardResponse> executeDashboardAsync(DashboardConfig config) {
    DataSourceSchema schema;
    CompiledQuery compiledQuery;
    try {
      compiledQuery = queryCompiler.compile(config);
      schema = schema(config.getDataSourceId());
    } catch (ConfigException | SchemaInconsistencyException e) {
      log.warn("Dashboard config rejected: " + e.getMessage());
      return CompletableFuture.failedFuture(e);
    }

    CompletableFuture<List<Row>> pending = executionAdapter.execute(compiledQuery);

    CompletableFuture<ExecuteDashboardResponse> response = pending.thenApply(rows -> {
      try {
        RollupTree tree = rollupBuilder.build(schema, config, rows);
        return responseAssembler.assemble(schema, config, tree);
      } catch (RollupException | InternalInvariantException e) {
        log.error("Rollup failed for data source " + schema.getId() + ": " + e.getMessage());
        throw new CompletionException(e);
      }
    });

    response.whenComplete((result, throwable) -> {
      if (response.isCancelled()) {
        log.info("Dashboard request for " + schema.getId() + " cancelled");
        pending.cancel(true);
      }
    });

    return response;
  }

  @Override
  public ExecuteDashboardResponse executeDashboard(DashboardConfig config) throws EngineException {
    return await(executeDashboardAsync(config), config.getDataSourceId());
  }

  @Override
  public List<DistinctValue> getDistinctValues(String dataSourceId,
                                               String fieldId,
                                               Integer limit) throws EngineException {
    int maxValues = dPivotConfig.getDistinctValuesLimit();
    if (limit != null && limit > 0) {
      maxValues = Math.min(limit, maxValues);
    }

    CompiledQuery compiledQuery = queryCompiler.compileDistinct(dataSourceId, fieldId, maxValues);
    FieldDef field = schemaRegistry.getField(dataSourceId, fieldId)
        .orElseThrow(() -> new ConfigException(fieldId, ConfigRule.UNKNOWN_FIELD, "field not found"));

    List<Row> rows = await(executionAdapter.execute(compiledQuery), dataSourceId);

    List<DistinctValue> values = new ArrayList<>(rows.size());
    for (Row row : rows) {
      CellValue value = row.get(field.getId());
      CellValue display = value;
      if (field.hasReference()) {
        CellValue label = row.get(field.getId() + QueryCompiler.LABEL_SUFFIX);
        display = label.isNull() ? CellValue.text(dPivotConfig.getNoValueLabel()) : label;
      }
      values.add(DistinctValue.builder().value(value).display(display).build());
    }

    return values;
  }

  private DataSourceSchema schema(String dataSourceId) throws ConfigException {
    return schemaRegistry.getSchema(dataSourceId)
        .orElseThrow(() -> new ConfigException(dataSourceId, ConfigRule.UNKNOWN_DATA_SOURCE,
                                               "data source is not registered"));
  }

  private <T> T await(CompletableFuture<T> future, String dataSourceId) throws EngineException {
    long timeoutMs = dPivotConfig.getQueryTimeout().toMillis();
    try {
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Request for data source " + dataSourceId + " timed out after " + timeoutMs + " ms");
      throw new QueryExecutionException(dataSourceId, "Query timed out after " + timeoutMs + " ms");
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new QueryExecutionException(dataSourceId, "Query interrupted");
    } catch (CancellationException e) {
      throw new QueryExecutionException(dataSourceId, "Query cancelled");
    } catch (ExecutionException e) {
      throw unwrap(e.getCause(), dataSourceId);
    }
  }

  private EngineException unwrap(Throwable cause, String dataSourceId) {
    Throwable current = cause;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    if (current instanceof EngineException engineException) {
      return engineException;
    }
    log.catching(current);
    return new QueryExecutionException(dataSourceId, "Unexpected failure for data source " + dataSourceId, current);
  }
}
