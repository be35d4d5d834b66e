package ru.dimension.pivot.service.impl;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import ru.dimension.pivot.exception.ConfigException;
import ru.dimension.pivot.exception.ConfigRule;
import ru.dimension.pivot.exception.SchemaInconsistencyException;
import ru.dimension.pivot.model.config.AggregationFunction;
import ru.dimension.pivot.model.config.DashboardConfig;
import ru.dimension.pivot.model.config.FieldRole;
import ru.dimension.pivot.model.config.FilterCondition;
import ru.dimension.pivot.model.config.FilterOperator;
import ru.dimension.pivot.model.config.Measure;
import ru.dimension.pivot.model.query.CompiledQuery;
import ru.dimension.pivot.model.schema.DataSourceSchema;
import ru.dimension.pivot.model.schema.FieldDef;
import ru.dimension.pivot.model.schema.FieldReference;
import ru.dimension.pivot.model.schema.ValueType;
import ru.dimension.pivot.registry.SchemaRegistry;
import ru.dimension.pivot.service.QueryCompiler;
import ru.dimension.pivot.storage.Converter;
import ru.dimension.pivot.storage.dialect.DatabaseDialect;

@Log4j2
public class QueryCompilerImpl implements QueryCompiler {

  private final SchemaRegistry schemaRegistry;
  private final DatabaseDialect databaseDialect;
  private final Clock clock;

  public QueryCompilerImpl(SchemaRegistry schemaRegistry,
                           DatabaseDialect databaseDialect,
                           Clock clock) {
    this.schemaRegistry = schemaRegistry;
    this.databaseDialect = databaseDialect;
    this.clock = clock;
  }

  @Override
  public CompiledQuery compile(DashboardConfig config) throws ConfigException, SchemaInconsistencyException {
    DataSourceSchema schema = resolveSchema(config.getDataSourceId());

    if (config.getGroupings().isEmpty() && config.getMeasures().isEmpty()) {
      throw new ConfigException(null, ConfigRule.EMPTY_CONFIG, "neither groupings nor measures are configured");
    }

    List<FieldDef> groupingFields = resolveGroupings(schema, config);
    List<FieldDef> measureFields = resolveMeasures(schema, config);
    List<FieldDef> displayFields = resolveDisplayFields(schema, config);

    List<String> predicates = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    for (FilterCondition filter : config.getFilters()) {
      FieldDef field = resolveField(schema, filter.getFieldId());
      predicates.add(buildPredicate(field, filter, params));
    }

    for (FieldDef field : groupingFields) {
      checkReference(schema, field);
    }
    for (FieldDef field : displayFields) {
      checkReference(schema, field);
    }

    List<String> select = new ArrayList<>();
    List<String> joins = new ArrayList<>();
    List<String> groupBy = new ArrayList<>();
    List<String> orderBy = new ArrayList<>();

    for (FieldDef field : groupingFields) {
      String column = columnRef(field);
      select.add(column + " AS " + databaseDialect.quoteAlias(field.getId()));
      groupBy.add(column);

      if (field.hasReference()) {
        String label = labelRef(field);
        joins.add(joinClause(field));
        select.add(label + " AS " + databaseDialect.quoteAlias(field.getId() + LABEL_SUFFIX));
        groupBy.add(label);
        orderBy.add(label + " ASC");
      }
      orderBy.add(column + " ASC");
    }

    for (int i = 0; i < config.getMeasures().size(); i++) {
      Measure measure = config.getMeasures().get(i);
      FieldDef field = measureFields.get(i);
      String alias = measure.alias();

      if (measure.isRowCount()) {
        select.add("COUNT(*) AS " + databaseDialect.quoteAlias(alias));
        continue;
      }

      String column = columnRef(field);
      select.add(measure.getAggregation().getSqlName() + "(" + column + ") AS " + databaseDialect.quoteAlias(alias));

      if (measure.getAggregation() == AggregationFunction.AVG) {
        select.add("SUM(" + column + ") AS " + databaseDialect.quoteAlias(alias + AVG_SUM_SUFFIX));
        select.add("COUNT(" + column + ") AS " + databaseDialect.quoteAlias(alias + AVG_COUNT_SUFFIX));
      }
    }

    select.add("COUNT(*) AS " + databaseDialect.quoteAlias(ROW_COUNT_ALIAS));

    for (FieldDef field : displayFields) {
      String column = columnRef(field);
      select.add(column + " AS " + databaseDialect.quoteAlias(field.getId()));
      groupBy.add(column);

      if (field.hasReference()) {
        String label = labelRef(field);
        joins.add(joinClause(field));
        select.add(label + " AS " + databaseDialect.quoteAlias(field.getId() + LABEL_SUFFIX));
        groupBy.add(label);
      }
      orderBy.add(column + " ASC");
    }

    StringBuilder sql = new StringBuilder("SELECT ")
        .append(String.join(", ", select))
        .append(" FROM ").append(schema.getTable()).append(" ").append(SOURCE_ALIAS);

    joins.forEach(join -> sql.append(" ").append(join));

    if (!predicates.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", predicates));
    }
    if (!groupBy.isEmpty()) {
      sql.append(" GROUP BY ").append(String.join(", ", groupBy));
    }
    if (!orderBy.isEmpty()) {
      sql.append(" ORDER BY ").append(String.join(", ", orderBy));
    }

    CompiledQuery compiledQuery = CompiledQuery.builder()
        .dataSourceId(schema.getId())
        .sql(sql.toString())
        .params(List.copyOf(params))
        .build();

    log.info("Query: " + compiledQuery.getSql());
    log.debug("Params: " + compiledQuery.getParams());

    return compiledQuery;
  }

  @Override
  public CompiledQuery compileDistinct(String dataSourceId,
                                       String fieldId,
                                       int limit) throws ConfigException, SchemaInconsistencyException {
    DataSourceSchema schema = resolveSchema(dataSourceId);
    FieldDef field = resolveField(schema, fieldId);
    checkReference(schema, field);

    String column = columnRef(field);
    StringBuilder sql = new StringBuilder("SELECT DISTINCT ")
        .append(column).append(" AS ").append(databaseDialect.quoteAlias(field.getId()));

    String orderBy = column + " ASC";
    if (field.hasReference()) {
      String label = labelRef(field);
      sql.append(", ").append(label).append(" AS ").append(databaseDialect.quoteAlias(field.getId() + LABEL_SUFFIX));
      orderBy = label + " ASC, " + orderBy;
    }

    sql.append(" FROM ").append(schema.getTable()).append(" ").append(SOURCE_ALIAS);
    if (field.hasReference()) {
      sql.append(" ").append(joinClause(field));
    }
    sql.append(" ORDER BY ").append(orderBy);
    sql.append(databaseDialect.getLimitClass(limit));

    log.info("Query: " + sql);

    return CompiledQuery.builder()
        .dataSourceId(schema.getId())
        .sql(sql.toString())
        .params(List.of())
        .build();
  }

  private DataSourceSchema resolveSchema(String dataSourceId) throws ConfigException {
    return schemaRegistry.getSchema(dataSourceId)
        .orElseThrow(() -> new ConfigException(dataSourceId, ConfigRule.UNKNOWN_DATA_SOURCE,
                                               "data source is not registered"));
  }

  private FieldDef resolveField(DataSourceSchema schema, String fieldId) throws ConfigException {
    return schemaRegistry.getField(schema.getId(), fieldId)
        .orElseThrow(() -> new ConfigException(fieldId, ConfigRule.UNKNOWN_FIELD,
                                               "field not found in data source " + schema.getId()));
  }

  private List<FieldDef> resolveGroupings(DataSourceSchema schema, DashboardConfig config) throws ConfigException {
    List<FieldDef> fields = new ArrayList<>();
    Set<String> seen = new HashSet<>();

    for (String fieldId : config.getGroupings()) {
      FieldDef field = resolveField(schema, fieldId);
      if (!field.supports(FieldRole.GROUPING, null)) {
        throw new ConfigException(fieldId, ConfigRule.NOT_GROUPABLE, "field can not be used for grouping");
      }
      if (!seen.add(fieldId)) {
        throw new ConfigException(fieldId, ConfigRule.DUPLICATE_GROUPING, "field is grouped more than once");
      }
      fields.add(field);
    }

    return fields;
  }

  /**
   * @return one entry per measure, null for a plain row count
   */
  private List<FieldDef> resolveMeasures(DataSourceSchema schema, DashboardConfig config) throws ConfigException {
    List<FieldDef> fields = new ArrayList<>();
    Set<String> aliases = new HashSet<>();

    for (Measure measure : config.getMeasures()) {
      AggregationFunction aggregation = measure.getAggregation();
      if (aggregation == null) {
        throw new ConfigException(measure.getFieldId(), ConfigRule.UNSUPPORTED_OPERATOR, "measure has no aggregation");
      }

      FieldDef field = null;
      if (!measure.isRowCount()) {
        if (measure.getFieldId() == null) {
          throw new ConfigException(null, ConfigRule.UNKNOWN_FIELD, aggregation + " requires a target field");
        }
        field = resolveField(schema, measure.getFieldId());
        if (!field.supports(FieldRole.MEASURE, aggregation)) {
          throw new ConfigException(field.getId(), ConfigRule.NOT_AGGREGATABLE, "field can not be aggregated");
        }
        if ((aggregation == AggregationFunction.SUM || aggregation == AggregationFunction.AVG)
            && !field.getValueType().isNumeric()) {
          throw new ConfigException(field.getId(), ConfigRule.NOT_AGGREGATABLE,
                                    aggregation + " needs a numeric field, got " + field.getValueType());
        }
      }

      if (!aliases.add(measure.alias())) {
        throw new ConfigException(measure.getFieldId(), ConfigRule.DUPLICATE_MEASURE,
                                  "measure " + measure.alias() + " is configured more than once");
      }
      fields.add(field);
    }

    return fields;
  }

  private List<FieldDef> resolveDisplayFields(DataSourceSchema schema, DashboardConfig config) throws ConfigException {
    List<FieldDef> fields = new ArrayList<>();
    Set<String> seen = new HashSet<>();

    for (String fieldId : config.getDisplayFields()) {
      FieldDef field = resolveField(schema, fieldId);
      if (config.getGroupings().contains(fieldId)) {
        throw new ConfigException(fieldId, ConfigRule.DISPLAY_FIELD_IS_GROUPING,
                                  "field is already used as a grouping");
      }
      if (!seen.add(fieldId)) {
        throw new ConfigException(fieldId, ConfigRule.DUPLICATE_DISPLAY_FIELD, "field is displayed more than once");
      }
      fields.add(field);
    }

    return fields;
  }

  private String buildPredicate(FieldDef field,
                                FilterCondition filter,
                                List<Object> params) throws ConfigException {
    FilterOperator operator = filter.getOperator();
    if (operator == null) {
      throw new ConfigException(field.getId(), ConfigRule.UNSUPPORTED_OPERATOR, "filter has no operator");
    }

    List<Object> values = filter.getValues() == null ? List.of() : filter.getValues();

    if (filter.getPreset() != null) {
      if (operator != FilterOperator.BETWEEN || field.getValueType() != ValueType.DATE) {
        throw new ConfigException(field.getId(), ConfigRule.UNSUPPORTED_OPERATOR,
                                  "date preset applies only to BETWEEN on a date field");
      }
      if (!values.isEmpty()) {
        throw new ConfigException(field.getId(), ConfigRule.INVALID_FILTER_ARITY,
                                  "date preset replaces explicit values, got " + values.size());
      }
      LocalDate[] range = filter.getPreset().resolve(LocalDate.now(clock));
      values = List.of(range[0], range[1]);
    }

    if (!operator.acceptsArity(values.size())) {
      throw new ConfigException(field.getId(), ConfigRule.INVALID_FILTER_ARITY,
                                operator + " does not accept " + values.size() + " value(s)");
    }

    if (operator == FilterOperator.CONTAINS && field.getValueType() != ValueType.TEXT) {
      throw new ConfigException(field.getId(), ConfigRule.UNSUPPORTED_OPERATOR,
                                "CONTAINS applies only to text fields");
    }

    List<Object> converted = new ArrayList<>(values.size());
    for (Object value : values) {
      try {
        converted.add(Converter.convertLiteral(value, field.getValueType()));
      } catch (IllegalArgumentException | ArithmeticException e) {
        throw new ConfigException(field.getId(), ConfigRule.INVALID_FILTER_VALUE, e.getMessage());
      }
    }

    String column = columnRef(field);

    return switch (operator) {
      case EQ, NE, GT, GTE, LT, LTE -> {
        params.add(converted.get(0));
        yield column + " " + operator.getSql() + " ?";
      }
      case IN, NOT_IN -> {
        params.addAll(converted);
        String placeholders = converted.stream().map(v -> "?").collect(Collectors.joining(", "));
        yield column + " " + operator.getSql() + " (" + placeholders + ")";
      }
      case BETWEEN -> {
        params.add(converted.get(0));
        params.add(converted.get(1));
        yield column + " BETWEEN ? AND ?";
      }
      case CONTAINS -> {
        params.add(databaseDialect.containsPattern((String) converted.get(0)));
        yield databaseDialect.getContainsPredicate(column);
      }
      case IS_NULL, IS_NOT_NULL -> column + " " + operator.getSql();
    };
  }

  private void checkReference(DataSourceSchema schema, FieldDef field) throws SchemaInconsistencyException {
    if (!field.hasReference()) {
      return;
    }
    FieldReference reference = field.getReference();
    if (!schemaRegistry.hasColumn(reference.getRefTable(), reference.getRefKeyColumn())) {
      throw new SchemaInconsistencyException(schema.getId(), field.getId(),
                                             "reference key " + reference.getRefTable() + "."
                                                 + reference.getRefKeyColumn() + " is not registered");
    }
    if (!schemaRegistry.hasColumn(reference.getRefTable(), reference.getRefDisplayColumn())) {
      throw new SchemaInconsistencyException(schema.getId(), field.getId(),
                                             "reference label " + reference.getRefTable() + "."
                                                 + reference.getRefDisplayColumn() + " is not registered");
    }
  }

  private static String columnRef(FieldDef field) {
    return SOURCE_ALIAS + "." + field.getSourceColumn();
  }

  private static String referenceAlias(FieldDef field) {
    return "r_" + field.getId();
  }

  private static String labelRef(FieldDef field) {
    return referenceAlias(field) + "." + field.getReference().getRefDisplayColumn();
  }

  private static String joinClause(FieldDef field) {
    FieldReference reference = field.getReference();
    String alias = referenceAlias(field);
    return "LEFT JOIN " + reference.getRefTable() + " " + alias
        + " ON " + columnRef(field) + " = " + alias + "." + reference.getRefKeyColumn();
  }
}
