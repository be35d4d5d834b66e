package ru.dimension.pivot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.junit.jupiter.api.Test;
import ru.dimension.pivot.common.AbstractH2Test;
import ru.dimension.pivot.exception.QueryExecutionException;
import ru.dimension.pivot.model.config.AggregationFunction;
import ru.dimension.pivot.model.config.DashboardConfig;
import ru.dimension.pivot.model.config.FilterCondition;
import ru.dimension.pivot.model.config.FilterOperator;
import ru.dimension.pivot.model.config.Measure;
import ru.dimension.pivot.model.output.CellValue;
import ru.dimension.pivot.model.output.DistinctValue;
import ru.dimension.pivot.model.output.ExecuteDashboardResponse;
import ru.dimension.pivot.model.output.PivotRow;
import ru.dimension.pivot.model.output.SchemaValidationResult;
import ru.dimension.pivot.model.output.SchemaValidationSummary;

@Log4j2
public class DPivotH2Test extends AbstractH2Test {

  @Test
  public void regionCategoryRollupTest() throws Exception {
    DashboardConfig config = DashboardConfig.builder()
        .dataSourceId("sales")
        .grouping("region")
        .grouping("category")
        .measure(Measure.of("qty", AggregationFunction.SUM))
        .measure(Measure.of("amount", AggregationFunction.AVG))
        .measure(Measure.rowCount())
        .build();

    ExecuteDashboardResponse response = engine.executeDashboard(config);

    List<PivotRow> rows = response.getRows();
    assertEquals(4, rows.size());
    assertEquals(List.of("North", "South", "(no value)", "(no value)"),
                 rows.stream().map(r -> r.getGroupLabel().asText()).toList());
    assertEquals(CellValue.text("X"), rows.get(2).getGroupValue());
    assertEquals(CellValue.text("Y"), rows.get(3).getGroupValue());

    PivotRow north = rows.get(0);
    assertEquals(CellValue.integer(6), north.getMeasures().get(0));
    assertEquals(20.0, north.getMeasures().get(1).asDouble(), 1e-9);
    assertEquals(CellValue.integer(3), north.getMeasures().get(2));
    assertEquals(3, north.getRowCount());

    PivotRow northFood = north.getChildren().get(0);
    assertEquals(CellValue.text("Food"), northFood.getGroupLabel());
    assertEquals(15.0, northFood.getMeasures().get(1).asDouble(), 1e-9);
    assertEquals(2, northFood.getRowCount());

    assertEquals(CellValue.integer(10), response.getTotals().get(0));
    assertEquals(80.0 / 6, response.getTotals().get(1).asDouble(), 1e-9);
    assertEquals(6, response.getTotalRowCount());
  }

  @Test
  public void containsFilterIsCaseInsensitiveAndEscapedTest() throws Exception {
    DashboardConfig discount = DashboardConfig.builder()
        .dataSourceId("sales")
        .grouping("category")
        .measure(Measure.of("qty", AggregationFunction.SUM))
        .filter(FilterCondition.of("note", FilterOperator.CONTAINS, "DISCOUNT"))
        .build();

    ExecuteDashboardResponse response = engine.executeDashboard(discount);
    assertEquals(1, response.getRows().size());
    assertEquals(2, response.getTotalRowCount());

    DashboardConfig percent = discount.toBuilder()
        .clearFilters()
        .filter(FilterCondition.of("note", FilterOperator.CONTAINS, "50%"))
        .build();

    assertEquals(1, engine.executeDashboard(percent).getTotalRowCount());
  }

  @Test
  public void dateAndInFiltersTest() throws Exception {
    DashboardConfig config = DashboardConfig.builder()
        .dataSourceId("sales")
        .grouping("category")
        .measure(Measure.of("qty", AggregationFunction.SUM))
        .filter(FilterCondition.of("sale_date", FilterOperator.BETWEEN, "2024-02-01", "2024-02-28"))
        .filter(FilterCondition.of("region", FilterOperator.NOT_IN, "X", "Y"))
        .build();

    ExecuteDashboardResponse response = engine.executeDashboard(config);

    assertEquals(2, response.getRows().size());
    assertEquals(CellValue.text("Food"), response.getRows().get(0).getGroupLabel());
    assertEquals(CellValue.integer(1), response.getRows().get(0).getMeasures().get(0));
    assertEquals(CellValue.text("Tools"), response.getRows().get(1).getGroupLabel());
    assertEquals(CellValue.integer(3), response.getRows().get(1).getMeasures().get(0));
  }

  @Test
  public void displayFieldLeavesTest() throws Exception {
    DashboardConfig config = DashboardConfig.builder()
        .dataSourceId("sales")
        .grouping("category")
        .measure(Measure.of("qty", AggregationFunction.SUM))
        .displayField("city")
        .build();

    ExecuteDashboardResponse response = engine.executeDashboard(config);

    PivotRow food = response.getRows().get(0);
    assertEquals(CellValue.integer(6), food.getMeasures().get(0));
    assertEquals(4, food.getRowCount());

    Map<String, PivotRow> leaves = food.getChildren().stream()
        .collect(Collectors.toMap(leaf -> leaf.getDisplayValues().get(0).asText(), leaf -> leaf));
    assertEquals(3, leaves.size());
    assertEquals(CellValue.integer(3), leaves.get("Sochi").getMeasures().get(0));
    assertEquals(2, leaves.get("Sochi").getRowCount());
    assertEquals(1, leaves.get("Omsk").getLevel());
  }

  @Test
  public void measuresOnlyTest() throws Exception {
    DashboardConfig config = DashboardConfig.builder()
        .dataSourceId("sales")
        .measure(Measure.of("amount", AggregationFunction.MAX))
        .measure(Measure.of("qty", AggregationFunction.MIN))
        .build();

    ExecuteDashboardResponse response = engine.executeDashboard(config);

    assertEquals(1, response.getRows().size());
    assertEquals(30.0, response.getRows().get(0).getMeasures().get(0).asDouble(), 1e-9);
    assertEquals(CellValue.integer(1), response.getRows().get(0).getMeasures().get(1));
    assertEquals(6, response.getTotalRowCount());
  }

  @Test
  public void distinctValuesTest() throws Exception {
    List<DistinctValue> regions = engine.getDistinctValues("sales", "region", null);

    Map<String, String> byCode = regions.stream()
        .collect(Collectors.toMap(v -> v.getValue().asText(), v -> v.getDisplay().asText()));
    assertEquals(Map.of("N", "North", "S", "South", "X", "(no value)", "Y", "(no value)"), byCode);

    List<DistinctValue> categories = engine.getDistinctValues("sales", "category", 1);
    assertEquals(1, categories.size());
    assertEquals(CellValue.text("Food"), categories.get(0).getValue());
  }

  @Test
  public void missingTableFailsWithSanitizedMessageTest() {
    DashboardConfig config = DashboardConfig.builder()
        .dataSourceId("broken")
        .grouping("code")
        .build();

    QueryExecutionException e = assertThrows(QueryExecutionException.class, () -> engine.executeDashboard(config));

    log.info("Sanitized error: " + e.getMessage());
    assertEquals("broken", e.getDataSourceId());
    assertFalse(e.getMessage().contains("SELECT"));
    assertFalse(e.getMessage().contains("missing_table"));
  }

  @Test
  public void schemaValidationTest() {
    SchemaValidationSummary summary = dPivot.getSchemaValidationService().orElseThrow().validateAll();

    assertEquals(2, summary.getTotalSchemas());
    assertEquals(1, summary.getValidCount());
    assertEquals(1, summary.getInvalidCount());

    SchemaValidationResult sales = summary.getResults().get(0);
    assertTrue(sales.isValid());
    assertEquals(6L, sales.getRowCount());
    assertTrue(sales.getWarnings().isEmpty());

    SchemaValidationResult broken = summary.getResults().get(1);
    assertFalse(broken.isValid());
    assertEquals(1, broken.getErrors().size());
  }

  @Test
  public void savedConfigRunsAfterLoadTest() throws Exception {
    DashboardConfig config = DashboardConfig.builder()
        .dataSourceId("sales")
        .grouping("category")
        .measure(Measure.rowCount())
        .build();

    String id = dPivot.getConfigRepository().save("By category", null, config).getId();

    DashboardConfig loaded = dPivot.getConfigRepository().load(id).orElseThrow().getConfig();
    ExecuteDashboardResponse response = engine.executeDashboard(loaded);

    assertEquals(2, response.getRows().size());
    assertEquals(6, response.getTotalRowCount());
    assertTrue(dPivot.getConfigRepository().delete(id));
    assertTrue(dPivot.getConfigRepository().list().isEmpty());
  }
}
