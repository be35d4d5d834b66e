package ru.dimension.pivot.model.output;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Node of the result tree. Level 0 holds the first grouping, the synthetic root is level -1.
 */
@AllArgsConstructor
@NoArgsConstructor
@Accessors(chain = true)
@Data
@Builder(toBuilder = true)
public class PivotRow {

  private int level;
  private String groupFieldId;

  @Builder.Default
  private CellValue groupValue = CellValue.NULL;
  @Builder.Default
  private CellValue groupLabel = CellValue.NULL;

  /**
   * One cell per configured measure, in configuration order
   */
  @Builder.Default
  private List<CellValue> measures = new ArrayList<>();

  /**
   * One cell per display field, filled on leaf rows only
   */
  @Builder.Default
  private List<CellValue> displayValues = new ArrayList<>();

  @Builder.Default
  private List<PivotRow> children = new ArrayList<>();

  private long rowCount;
}
