package ru.dimension.pivot.service.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestInstance.Lifecycle;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import ru.dimension.pivot.common.TestSchemas;
import ru.dimension.pivot.exception.ConfigException;
import ru.dimension.pivot.exception.ConfigRule;
import ru.dimension.pivot.exception.SchemaInconsistencyException;
import ru.dimension.pivot.model.config.AggregationFunction;
import ru.dimension.pivot.model.config.DashboardConfig;
import ru.dimension.pivot.model.config.DatePreset;
import ru.dimension.pivot.model.config.FilterCondition;
import ru.dimension.pivot.model.config.FilterOperator;
import ru.dimension.pivot.model.config.Measure;
import ru.dimension.pivot.model.query.CompiledQuery;
import ru.dimension.pivot.registry.SchemaRegistry;
import ru.dimension.pivot.registry.SchemaRegistryImpl;
import ru.dimension.pivot.service.QueryCompiler;
import ru.dimension.pivot.storage.dialect.GenericDialect;
import ru.dimension.pivot.storage.dialect.OracleDialect;

@TestInstance(Lifecycle.PER_CLASS)
public class QueryCompilerImplTest {

  private QueryCompiler queryCompiler;

  @BeforeAll
  public void init() {
    Clock clock = Clock.fixed(Instant.parse("2024-05-15T10:00:00Z"), ZoneOffset.UTC);
    queryCompiler = new QueryCompilerImpl(TestSchemas.registry(), new GenericDialect(), clock);
  }

  @Test
  public void groupedQueryWithReferenceJoinTest() throws Exception {
    DashboardConfig config = DashboardConfig.builder()
        .dataSourceId("sales")
        .grouping("region")
        .grouping("category")
        .measure(Measure.of("amount", AggregationFunction.SUM))
        .build();

    CompiledQuery query = queryCompiler.compile(config);

    assertEquals("SELECT src.region_code AS \"region\", r_region.name AS \"region__label\", "
                     + "src.category AS \"category\", SUM(src.amount) AS \"amount__sum\", "
                     + "COUNT(*) AS \"__row_count\" "
                     + "FROM sales src LEFT JOIN region r_region ON src.region_code = r_region.code "
                     + "GROUP BY src.region_code, r_region.name, src.category "
                     + "ORDER BY r_region.name ASC, src.region_code ASC, src.category ASC",
                 query.getSql());
    assertTrue(query.getParams().isEmpty());
    assertEquals("sales", query.getDataSourceId());
  }

  @Test
  public void avgEmitsSupportColumnsTest() throws Exception {
    DashboardConfig config = DashboardConfig.builder()
        .dataSourceId("sales")
        .grouping("category")
        .measure(Measure.of("amount", AggregationFunction.AVG))
        .measure(Measure.rowCount())
        .build();

    String sql = queryCompiler.compile(config).getSql();

    assertEquals("SELECT src.category AS \"category\", AVG(src.amount) AS \"amount__avg\", "
                     + "SUM(src.amount) AS \"amount__avg__sum\", COUNT(src.amount) AS \"amount__avg__count\", "
                     + "COUNT(*) AS \"rows__count\", COUNT(*) AS \"__row_count\" "
                     + "FROM sales src GROUP BY src.category ORDER BY src.category ASC",
                 sql);
  }

  @Test
  public void measuresOnlyHasNoGroupByTest() throws Exception {
    DashboardConfig config = DashboardConfig.builder()
        .dataSourceId("sales")
        .measure(Measure.of("qty", AggregationFunction.MAX))
        .build();

    String sql = queryCompiler.compile(config).getSql();

    assertEquals("SELECT MAX(src.qty) AS \"qty__max\", COUNT(*) AS \"__row_count\" FROM sales src", sql);
  }

  @Test
  public void displayFieldsAreGroupedAndOrderedLastTest() throws Exception {
    DashboardConfig config = DashboardConfig.builder()
        .dataSourceId("sales")
        .grouping("category")
        .measure(Measure.of("qty", AggregationFunction.SUM))
        .displayField("city")
        .build();

    String sql = queryCompiler.compile(config).getSql();

    assertTrue(sql.contains("src.city AS \"city\""));
    assertTrue(sql.endsWith("GROUP BY src.category, src.city ORDER BY src.category ASC, src.city ASC"));
  }

  @Test
  public void filtersAreParameterizedTest() throws Exception {
    DashboardConfig config = DashboardConfig.builder()
        .dataSourceId("sales")
        .grouping("category")
        .measure(Measure.of("qty", AggregationFunction.SUM))
        .filter(FilterCondition.of("qty", FilterOperator.GT, 5))
        .filter(FilterCondition.of("region", FilterOperator.IN, "N", "S"))
        .filter(FilterCondition.of("amount", FilterOperator.BETWEEN, "1.5", 10))
        .filter(FilterCondition.of("note", FilterOperator.CONTAINS, "50%_off"))
        .filter(FilterCondition.of("city", FilterOperator.IS_NOT_NULL))
        .build();

    CompiledQuery query = queryCompiler.compile(config);

    assertTrue(query.getSql().contains(
        " WHERE src.qty > ? AND src.region_code IN (?, ?) AND src.amount BETWEEN ? AND ? "
            + "AND LOWER(src.note) LIKE ? ESCAPE '!' AND src.city IS NOT NULL GROUP BY"));
    assertEquals(List.of(5L, "N", "S", new BigDecimal("1.5"), new BigDecimal("10"), "%50!%!_off%"),
                 query.getParams());
  }

  @Test
  public void injectionStaysInParametersTest() throws Exception {
    String hostile = "x' OR '1'='1";
    DashboardConfig config = DashboardConfig.builder()
        .dataSourceId("sales")
        .grouping("category")
        .filter(FilterCondition.of("category", FilterOperator.EQ, hostile))
        .build();

    CompiledQuery query = queryCompiler.compile(config);

    assertFalse(query.getSql().contains(hostile));
    assertEquals(List.of(hostile), query.getParams());
  }

  @Test
  public void datePresetResolvedWithClockTest() throws Exception {
    DashboardConfig config = DashboardConfig.builder()
        .dataSourceId("sales")
        .grouping("category")
        .filter(FilterCondition.builder()
                    .fieldId("sale_date")
                    .operator(FilterOperator.BETWEEN)
                    .preset(DatePreset.LAST_MONTH)
                    .build())
        .build();

    CompiledQuery query = queryCompiler.compile(config);

    assertTrue(query.getSql().contains("src.sale_date BETWEEN ? AND ?"));
    assertEquals(List.of(LocalDate.of(2024, 4, 1), LocalDate.of(2024, 4, 30)), query.getParams());
  }

  @Test
  public void distinctQueryTest() throws Exception {
    CompiledQuery plain = queryCompiler.compileDistinct("sales", "category", 50);
    assertEquals("SELECT DISTINCT src.category AS \"category\" FROM sales src ORDER BY src.category ASC LIMIT 50",
                 plain.getSql());

    CompiledQuery referenced = queryCompiler.compileDistinct("sales", "region", 10);
    assertEquals("SELECT DISTINCT src.region_code AS \"region\", r_region.name AS \"region__label\" "
                     + "FROM sales src LEFT JOIN region r_region ON src.region_code = r_region.code "
                     + "ORDER BY r_region.name ASC, src.region_code ASC LIMIT 10",
                 referenced.getSql());
  }

  @Test
  public void oracleDistinctLimitTest() throws Exception {
    QueryCompiler oracle = new QueryCompilerImpl(TestSchemas.registry(), new OracleDialect(), Clock.systemUTC());

    String sql = oracle.compileDistinct("sales", "category", 5).getSql();

    assertTrue(sql.endsWith("ORDER BY src.category ASC FETCH FIRST 5 ROWS ONLY"));
  }

  @Test
  public void unregisteredReferenceTableTest() {
    SchemaRegistry registry = new SchemaRegistryImpl(List.of(TestSchemas.sales()), List.of());
    QueryCompiler compiler = new QueryCompilerImpl(registry, new GenericDialect(), Clock.systemUTC());

    DashboardConfig config = DashboardConfig.builder()
        .dataSourceId("sales")
        .grouping("region")
        .build();

    SchemaInconsistencyException e = assertThrows(SchemaInconsistencyException.class, () -> compiler.compile(config));
    assertTrue(e.getMessage().contains("region"));
  }

  @ParameterizedTest(name = "{0}")
  @MethodSource("invalidConfigs")
  public void invalidConfigRejectedTest(ConfigRule expected, DashboardConfig config) {
    ConfigException e = assertThrows(ConfigException.class, () -> queryCompiler.compile(config));
    assertEquals(expected, e.getRule());
  }

  private Stream<Arguments> invalidConfigs() {
    return Stream.of(
        Arguments.of(ConfigRule.UNKNOWN_DATA_SOURCE, base().dataSourceId("nope").build()),
        Arguments.of(ConfigRule.EMPTY_CONFIG, DashboardConfig.builder().dataSourceId("sales").build()),
        Arguments.of(ConfigRule.UNKNOWN_FIELD, base().grouping("nope").build()),
        Arguments.of(ConfigRule.UNKNOWN_FIELD, base().measure(Measure.of(null, AggregationFunction.SUM)).build()),
        Arguments.of(ConfigRule.NOT_GROUPABLE, base().grouping("amount").build()),
        Arguments.of(ConfigRule.DUPLICATE_GROUPING, base().grouping("category").grouping("category").build()),
        Arguments.of(ConfigRule.NOT_AGGREGATABLE, base().measure(Measure.of("city", AggregationFunction.SUM)).build()),
        Arguments.of(ConfigRule.NOT_AGGREGATABLE, base().measure(Measure.of("note", AggregationFunction.MIN)).build()),
        Arguments.of(ConfigRule.DUPLICATE_MEASURE, base()
            .measure(Measure.of("qty", AggregationFunction.SUM))
            .measure(Measure.of("qty", AggregationFunction.SUM))
            .build()),
        Arguments.of(ConfigRule.UNSUPPORTED_OPERATOR, base().measure(Measure.builder().fieldId("qty").build()).build()),
        Arguments.of(ConfigRule.DISPLAY_FIELD_IS_GROUPING, base().grouping("category").displayField("category").build()),
        Arguments.of(ConfigRule.DUPLICATE_DISPLAY_FIELD, base().grouping("category")
            .displayField("city").displayField("city").build()),
        Arguments.of(ConfigRule.INVALID_FILTER_ARITY, base().grouping("category")
            .filter(FilterCondition.of("qty", FilterOperator.BETWEEN, 1)).build()),
        Arguments.of(ConfigRule.INVALID_FILTER_ARITY, base().grouping("category")
            .filter(FilterCondition.of("qty", FilterOperator.IN)).build()),
        Arguments.of(ConfigRule.INVALID_FILTER_ARITY, base().grouping("category")
            .filter(FilterCondition.of("qty", FilterOperator.IS_NULL, 1)).build()),
        Arguments.of(ConfigRule.INVALID_FILTER_VALUE, base().grouping("category")
            .filter(FilterCondition.of("qty", FilterOperator.EQ, "ten")).build()),
        Arguments.of(ConfigRule.INVALID_FILTER_VALUE, base().grouping("category")
            .filter(FilterCondition.of("qty", FilterOperator.EQ, 2.5)).build()),
        Arguments.of(ConfigRule.INVALID_FILTER_VALUE, base().grouping("category")
            .filter(FilterCondition.of("sale_date", FilterOperator.GTE, "15.05.2024")).build()),
        Arguments.of(ConfigRule.UNSUPPORTED_OPERATOR, base().grouping("category")
            .filter(FilterCondition.of("qty", FilterOperator.CONTAINS, "1")).build()),
        Arguments.of(ConfigRule.UNSUPPORTED_OPERATOR, base().grouping("category")
            .filter(FilterCondition.builder().fieldId("qty").operator(FilterOperator.BETWEEN)
                        .preset(DatePreset.TODAY).build()).build()),
        Arguments.of(ConfigRule.UNKNOWN_FIELD, base().grouping("category")
            .filter(FilterCondition.of("nope", FilterOperator.EQ, 1)).build())
    );
  }

  private static DashboardConfig.DashboardConfigBuilder base() {
    return DashboardConfig.builder().dataSourceId("sales");
  }
}
