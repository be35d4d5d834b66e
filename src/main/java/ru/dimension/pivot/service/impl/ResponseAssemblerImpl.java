package ru.dimension.pivot.service.impl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import ru.dimension.pivot.exception.InternalInvariantException;
import ru.dimension.pivot.model.config.AggregationFunction;
import ru.dimension.pivot.model.config.DashboardConfig;
import ru.dimension.pivot.model.config.FieldRole;
import ru.dimension.pivot.model.config.Measure;
import ru.dimension.pivot.model.output.ColumnHeader;
import ru.dimension.pivot.model.output.ExecuteDashboardResponse;
import ru.dimension.pivot.model.output.PivotRow;
import ru.dimension.pivot.model.schema.DataSourceSchema;
import ru.dimension.pivot.model.schema.FieldDef;
import ru.dimension.pivot.model.schema.ValueType;
import ru.dimension.pivot.service.ResponseAssembler;
import ru.dimension.pivot.service.rollup.RollupTree;

public class ResponseAssemblerImpl implements ResponseAssembler {

  @Override
  public List<ColumnHeader> buildHeaders(DataSourceSchema schema, DashboardConfig config) {
    List<ColumnHeader> headers = new ArrayList<>();

    for (String fieldId : config.getGroupings()) {
      FieldDef field = field(schema, fieldId);
      headers.add(ColumnHeader.builder()
                      .id(field.getId())
                      .displayName(field.getDisplayName())
                      .valueType(field.hasReference() ? ValueType.TEXT : field.getValueType())
                      .role(FieldRole.GROUPING)
                      .measure(false)
                      .build());
    }

    for (Measure measure : config.getMeasures()) {
      FieldDef field = measure.isRowCount() ? null : field(schema, measure.getFieldId());
      headers.add(ColumnHeader.builder()
                      .id(measure.alias())
                      .displayName(measureLabel(measure, field))
                      .valueType(measureType(measure, field))
                      .role(FieldRole.MEASURE)
                      .measure(true)
                      .build());
    }

    for (String fieldId : config.getDisplayFields()) {
      FieldDef field = field(schema, fieldId);
      headers.add(ColumnHeader.builder()
                      .id(field.getId())
                      .displayName(field.getDisplayName())
                      .valueType(field.hasReference() ? ValueType.TEXT : field.getValueType())
                      .role(FieldRole.DISPLAY)
                      .measure(false)
                      .build());
    }

    return headers;
  }

  @Override
  public ExecuteDashboardResponse assemble(DataSourceSchema schema,
                                           DashboardConfig config,
                                           RollupTree tree) throws InternalInvariantException {
    int measureCount = config.getMeasures().size();
    int displayCount = config.getDisplayFields().size();

    checkWidth(tree.getTotal(), measureCount, 0);

    Deque<PivotRow> stack = new ArrayDeque<>(tree.getRows());
    while (!stack.isEmpty()) {
      PivotRow row = stack.pop();
      boolean leaf = row.getGroupFieldId() == null;
      checkWidth(row, measureCount, leaf ? displayCount : 0);
      row.getChildren().forEach(stack::push);
    }

    return ExecuteDashboardResponse.builder()
        .dataSourceId(schema.getId())
        .columns(buildHeaders(schema, config))
        .rows(tree.getRows())
        .totals(tree.getTotal().getMeasures())
        .totalRowCount(tree.getTotal().getRowCount())
        .build();
  }

  private static void checkWidth(PivotRow row, int measureCount, int displayCount) throws InternalInvariantException {
    if (row.getMeasures().size() != measureCount) {
      throw new InternalInvariantException("Row at level " + row.getLevel() + " has " + row.getMeasures().size()
                                               + " measure values, expected " + measureCount);
    }
    if (row.getDisplayValues().size() != displayCount) {
      throw new InternalInvariantException("Row at level " + row.getLevel() + " has " + row.getDisplayValues().size()
                                               + " display values, expected " + displayCount);
    }
  }

  private static String measureLabel(Measure measure, FieldDef field) {
    if (measure.getDisplayLabel() != null) {
      return measure.getDisplayLabel();
    }
    if (field == null) {
      return "Row count";
    }
    String function = measure.getAggregation().name();
    return function.charAt(0) + function.substring(1).toLowerCase() + " of " + field.getDisplayName();
  }

  private static ValueType measureType(Measure measure, FieldDef field) {
    if (measure.getAggregation() == AggregationFunction.COUNT) {
      return ValueType.INTEGER;
    }
    if (measure.getAggregation() == AggregationFunction.AVG) {
      return ValueType.NUMBER;
    }
    return field.getValueType();
  }

  private static FieldDef field(DataSourceSchema schema, String fieldId) {
    return schema.findField(fieldId)
        .orElseThrow(() -> new IllegalArgumentException("Unknown field " + fieldId + " in " + schema.getId()));
  }
}
