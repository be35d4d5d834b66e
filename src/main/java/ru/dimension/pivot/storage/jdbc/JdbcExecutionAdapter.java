package ru.dimension.pivot.storage.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.dbcp2.BasicDataSource;
import ru.dimension.pivot.exception.QueryExecutionException;
import ru.dimension.pivot.model.output.CellValue;
import ru.dimension.pivot.model.query.CompiledQuery;
import ru.dimension.pivot.model.query.Row;
import ru.dimension.pivot.storage.ExecutionAdapter;
import ru.dimension.pivot.storage.dialect.DatabaseDialect;

@Log4j2
public class JdbcExecutionAdapter implements ExecutionAdapter {

  private final BasicDataSource basicDataSource;
  private final DatabaseDialect databaseDialect;
  private final ExecutorService executorService;
  private final Duration queryTimeout;

  public JdbcExecutionAdapter(BasicDataSource basicDataSource,
                              DatabaseDialect databaseDialect,
                              ExecutorService executorService,
                              Duration queryTimeout) {
    this.basicDataSource = basicDataSource;
    this.databaseDialect = databaseDialect;
    this.executorService = executorService;
    this.queryTimeout = queryTimeout;
  }

  @Override
  public CompletableFuture<List<Row>> execute(CompiledQuery query) {
    CompletableFuture<List<Row>> result = new CompletableFuture<>();
    AtomicReference<Statement> running = new AtomicReference<>();

    Future<?> task;
    try {
      task = executorService.submit(() -> run(query, running, result));
    } catch (RejectedExecutionException e) {
      log.error("Query for data source " + query.getDataSourceId() + " rejected: " + e.getMessage());
      result.completeExceptionally(new QueryExecutionException(query.getDataSourceId(),
                                                               "Query executor is not accepting work"));
      return result;
    }

    result.whenComplete((rows, throwable) -> {
      if (result.isCancelled()) {
        task.cancel(true);
        cancelStatement(query, running.get());
      }
    });

    return result;
  }

  private void run(CompiledQuery query,
                   AtomicReference<Statement> running,
                   CompletableFuture<List<Row>> result) {
    if (result.isDone()) {
      return;
    }

    try (Connection conn = basicDataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(query.getSql())) {
      running.set(ps);

      if (queryTimeout != null && !queryTimeout.isZero()) {
        ps.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
      }

      int paramIndex = 1;
      for (Object param : query.getParams()) {
        databaseDialect.setParameter(ps, paramIndex++, param);
      }

      List<Row> rows = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();

        while (rs.next()) {
          if (result.isDone()) {
            return;
          }
          Map<String, CellValue> values = new LinkedHashMap<>();
          for (int i = 1; i <= columnCount; i++) {
            values.put(metaData.getColumnLabel(i), CellValue.of(rs.getObject(i)));
          }
          rows.add(new Row(values));
        }
      }

      log.debug("Fetched " + rows.size() + " rows for data source " + query.getDataSourceId());
      result.complete(rows);
    } catch (SQLException e) {
      if (result.isCancelled()) {
        log.info("Query for data source " + query.getDataSourceId() + " stopped after cancellation");
        return;
      }
      log.error("Query failed for data source " + query.getDataSourceId() + ": " + e.getMessage());
      log.info("Query: " + query.getSql());
      log.debug("Params: " + query.getParams());
      result.completeExceptionally(
          new QueryExecutionException(query.getDataSourceId(),
                                      "Query execution failed for data source " + query.getDataSourceId()
                                          + " (SQLState " + e.getSQLState() + ")"));
    } catch (RuntimeException e) {
      log.catching(e);
      result.completeExceptionally(
          new QueryExecutionException(query.getDataSourceId(),
                                      "Unexpected failure for data source " + query.getDataSourceId()));
    } finally {
      running.set(null);
    }
  }

  private void cancelStatement(CompiledQuery query, Statement statement) {
    if (statement == null) {
      return;
    }
    try {
      statement.cancel();
      log.info("Cancelled running query for data source " + query.getDataSourceId());
    } catch (SQLException e) {
      log.warn("Could not cancel query for data source " + query.getDataSourceId() + ": " + e.getMessage());
    }
  }
}
