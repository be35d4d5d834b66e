package ru.dimension.pivot.storage.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import ru.dimension.pivot.common.AbstractH2Test;
import ru.dimension.pivot.exception.QueryExecutionException;
import ru.dimension.pivot.model.output.CellValue;
import ru.dimension.pivot.model.query.CompiledQuery;
import ru.dimension.pivot.model.query.Row;
import ru.dimension.pivot.storage.ExecutionAdapter;
import ru.dimension.pivot.storage.dialect.GenericDialect;

public class JdbcExecutionAdapterTest extends AbstractH2Test {

  @Test
  public void rowsKeyedByAliasTest() throws Exception {
    ExecutorService executorService = Executors.newSingleThreadExecutor();
    ExecutionAdapter adapter = new JdbcExecutionAdapter(basicDataSource, new GenericDialect(),
                                                        executorService, Duration.ofSeconds(5));

    CompiledQuery query = CompiledQuery.builder()
        .dataSourceId("sales")
        .sql("SELECT src.city AS \"city\", SUM(src.qty) AS \"qty__sum\" FROM sales src "
                 + "WHERE src.sale_date >= ? GROUP BY src.city ORDER BY src.city ASC")
        .params(List.of(LocalDate.of(2024, 2, 1)))
        .build();

    List<Row> rows = adapter.execute(query).get(5, TimeUnit.SECONDS);

    assertEquals(2, rows.size());
    assertEquals(CellValue.text("Omsk"), rows.get(0).get("city"));
    assertEquals(CellValue.integer(4), rows.get(0).get("qty__sum"));
    assertEquals(CellValue.text("Sochi"), rows.get(1).get("city"));
    assertTrue(rows.get(1).has("qty__sum"));

    executorService.shutdown();
  }

  @Test
  public void failureIsSanitizedTest() {
    ExecutorService executorService = Executors.newSingleThreadExecutor();
    ExecutionAdapter adapter = new JdbcExecutionAdapter(basicDataSource, new GenericDialect(),
                                                        executorService, Duration.ofSeconds(5));

    CompiledQuery query = CompiledQuery.builder()
        .dataSourceId("sales")
        .sql("SELECT secret_column FROM sales WHERE id = ?")
        .params(List.of(42L))
        .build();

    ExecutionException e = assertThrows(ExecutionException.class, () -> adapter.execute(query).get(5, TimeUnit.SECONDS));
    assertInstanceOf(QueryExecutionException.class, e.getCause());
    assertFalse(e.getCause().getMessage().contains("secret_column"));

    executorService.shutdown();
  }

  @Test
  public void stoppedExecutorTest() {
    ExecutorService executorService = Executors.newSingleThreadExecutor();
    executorService.shutdown();
    ExecutionAdapter adapter = new JdbcExecutionAdapter(basicDataSource, new GenericDialect(),
                                                        executorService, Duration.ofSeconds(5));

    CompiledQuery query = CompiledQuery.builder()
        .dataSourceId("sales")
        .sql("SELECT 1")
        .params(List.of())
        .build();

    ExecutionException e = assertThrows(ExecutionException.class, () -> adapter.execute(query).get());
    assertInstanceOf(QueryExecutionException.class, e.getCause());
  }
}
