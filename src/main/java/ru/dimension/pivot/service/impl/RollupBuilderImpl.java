package ru.dimension.pivot.service.impl;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import ru.dimension.pivot.exception.RollupException;
import ru.dimension.pivot.model.config.DashboardConfig;
import ru.dimension.pivot.model.config.Measure;
import ru.dimension.pivot.model.output.CellValue;
import ru.dimension.pivot.model.output.PivotRow;
import ru.dimension.pivot.model.query.Row;
import ru.dimension.pivot.model.schema.DataSourceSchema;
import ru.dimension.pivot.model.schema.FieldDef;
import ru.dimension.pivot.service.QueryCompiler;
import ru.dimension.pivot.service.RollupBuilder;
import ru.dimension.pivot.service.rollup.Accumulator;
import ru.dimension.pivot.service.rollup.Accumulators;
import ru.dimension.pivot.service.rollup.GroupFrame;
import ru.dimension.pivot.service.rollup.RollupTree;

/**
 * Single pass control-break over rows ordered by grouping keys.
 * Closed frames hand their partial state to the parent, so every subtotal
 * is computed from the rows it covers and never from already finished averages.
 */
@Log4j2
public class RollupBuilderImpl implements RollupBuilder {

  private final String noValueLabel;

  public RollupBuilderImpl(String noValueLabel) {
    this.noValueLabel = noValueLabel;
  }

  @Override
  public RollupTree build(DataSourceSchema schema,
                          DashboardConfig config,
                          List<Row> rows) throws RollupException {
    List<FieldDef> levels = resolve(schema, config.getGroupings());
    List<FieldDef> displays = resolve(schema, config.getDisplayFields());
    List<Measure> measures = config.getMeasures();

    for (int i = 0; i < rows.size(); i++) {
      checkColumns(i, rows.get(i), levels, measures, displays);
    }

    GroupFrame root = new GroupFrame(-1, null, CellValue.NULL, CellValue.NULL, measures);

    if (levels.isEmpty()) {
      for (Row row : rows) {
        root.fold(row, weight(row));
        root.addLeaf(leaf(row, 0, measures, displays));
      }
      return toTree(root);
    }

    int depth = levels.size();
    GroupFrame[] open = new GroupFrame[depth];
    int openDepth = 0;

    for (Row row : sortByGroupingKeys(rows, levels)) {
      int common = 0;
      while (common < openDepth && open[common].getKey().compareTo(key(row, levels.get(common))) == 0) {
        common++;
      }

      close(open, openDepth, common, root);

      for (int level = common; level < depth; level++) {
        FieldDef field = levels.get(level);
        open[level] = new GroupFrame(level, field.getId(), key(row, field), label(row, field), measures);
      }
      openDepth = depth;

      GroupFrame deepest = open[depth - 1];
      deepest.fold(row, weight(row));
      if (!displays.isEmpty()) {
        deepest.addLeaf(leaf(row, depth, measures, displays));
      }
    }

    close(open, openDepth, 0, root);

    log.debug("Rollup of " + rows.size() + " rows over " + depth + " level(s) done");

    return toTree(root);
  }

  /**
   * Stable sort by (label, raw key) per level, a no-op for rows already in compiled order
   */
  private List<Row> sortByGroupingKeys(List<Row> rows, List<FieldDef> levels) {
    Comparator<Row> comparator = null;
    for (FieldDef field : levels) {
      Comparator<Row> byLevel = Comparator
          .comparing((Row row) -> sortLabel(row, field))
          .thenComparing(row -> key(row, field));
      comparator = comparator == null ? byLevel : comparator.thenComparing(byLevel);
    }

    List<Row> sorted = new ArrayList<>(rows);
    sorted.sort(comparator);
    return sorted;
  }

  private void close(GroupFrame[] open, int from, int downTo, GroupFrame root) throws RollupException {
    for (int level = from - 1; level >= downTo; level--) {
      GroupFrame frame = open[level];
      GroupFrame parent = level == 0 ? root : open[level - 1];
      parent.absorb(frame, frame.toPivotRow());
      open[level] = null;
    }
  }

  /**
   * Leaf measures go through the same accumulators as the groups, so an average
   * comes from its (sum, count) pair and not from the database AVG column
   */
  private PivotRow leaf(Row row, int level, List<Measure> measures, List<FieldDef> displays) throws RollupException {
    List<CellValue> values = new ArrayList<>(measures.size());
    for (Measure measure : measures) {
      Accumulator accumulator = Accumulators.create(measure);
      accumulator.add(row);
      values.add(accumulator.value());
    }

    List<CellValue> displayValues = new ArrayList<>(displays.size());
    displays.forEach(field -> displayValues.add(field.hasReference() ? label(row, field) : key(row, field)));

    return PivotRow.builder()
        .level(level)
        .measures(values)
        .displayValues(displayValues)
        .rowCount(weight(row))
        .build();
  }

  private RollupTree toTree(GroupFrame root) {
    PivotRow total = root.toPivotRow();
    return new RollupTree(total.getChildren(), total);
  }

  private void checkColumns(int index,
                            Row row,
                            List<FieldDef> levels,
                            List<Measure> measures,
                            List<FieldDef> displays) throws RollupException {
    List<String> required = new ArrayList<>();
    for (FieldDef field : levels) {
      required.add(field.getId());
      if (field.hasReference()) {
        required.add(field.getId() + QueryCompiler.LABEL_SUFFIX);
      }
    }
    measures.forEach(measure -> required.add(measure.alias()));
    displays.forEach(field -> required.add(field.getId()));

    for (String alias : required) {
      if (!row.has(alias)) {
        throw new RollupException("Row " + index + " has no column " + alias);
      }
    }
  }

  private List<FieldDef> resolve(DataSourceSchema schema, List<String> fieldIds) throws RollupException {
    List<FieldDef> fields = new ArrayList<>(fieldIds.size());
    for (String fieldId : fieldIds) {
      fields.add(schema.findField(fieldId)
                     .orElseThrow(() -> new RollupException("Unknown field " + fieldId + " in " + schema.getId())));
    }
    return fields;
  }

  private static CellValue key(Row row, FieldDef field) {
    return row.get(field.getId());
  }

  private static CellValue sortLabel(Row row, FieldDef field) {
    return field.hasReference() ? row.get(field.getId() + QueryCompiler.LABEL_SUFFIX) : key(row, field);
  }

  /**
   * Reference label, or the placeholder when the key has no match in the reference table
   */
  private CellValue label(Row row, FieldDef field) {
    if (!field.hasReference()) {
      return key(row, field);
    }
    CellValue label = row.get(field.getId() + QueryCompiler.LABEL_SUFFIX);
    return label.isNull() ? CellValue.text(noValueLabel) : label;
  }

  private static long weight(Row row) {
    CellValue count = row.get(QueryCompiler.ROW_COUNT_ALIAS);
    return count.isNumeric() ? count.asLong() : 1L;
  }
}
