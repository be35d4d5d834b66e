package ru.dimension.pivot.service.rollup;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import ru.dimension.pivot.exception.RollupException;
import ru.dimension.pivot.model.config.Measure;
import ru.dimension.pivot.model.output.CellValue;
import ru.dimension.pivot.model.output.PivotRow;
import ru.dimension.pivot.model.query.Row;

/**
 * Open group on the control-break stack
 */
public class GroupFrame {

  @Getter
  private final int level;
  private final String fieldId;
  @Getter
  private final CellValue key;
  private final CellValue label;

  private final List<Accumulator> accumulators;
  private final List<PivotRow> children = new ArrayList<>();
  private long rowCount;

  public GroupFrame(int level,
                    String fieldId,
                    CellValue key,
                    CellValue label,
                    List<Measure> measures) {
    this.level = level;
    this.fieldId = fieldId;
    this.key = key;
    this.label = label;
    this.accumulators = measures.stream().map(Accumulators::create).toList();
  }

  public void fold(Row row, long weight) throws RollupException {
    for (Accumulator accumulator : accumulators) {
      accumulator.add(row);
    }
    rowCount += weight;
  }

  /**
   * Attach a closed child frame and combine its partial state into this one
   */
  public void absorb(GroupFrame child, PivotRow childRow) throws RollupException {
    for (int i = 0; i < accumulators.size(); i++) {
      accumulators.get(i).merge(child.accumulators.get(i));
    }
    rowCount += child.rowCount;
    children.add(childRow);
  }

  public void addLeaf(PivotRow leaf) {
    children.add(leaf);
  }

  public PivotRow toPivotRow() {
    List<CellValue> values = new ArrayList<>(accumulators.size());
    accumulators.forEach(accumulator -> values.add(accumulator.value()));

    return PivotRow.builder()
        .level(level)
        .groupFieldId(fieldId)
        .groupValue(key)
        .groupLabel(label)
        .measures(values)
        .children(children)
        .rowCount(rowCount)
        .build();
  }
}
