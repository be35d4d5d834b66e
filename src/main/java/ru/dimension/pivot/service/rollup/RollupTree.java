package ru.dimension.pivot.service.rollup;

import java.util.List;
import lombok.Value;
import ru.dimension.pivot.model.output.PivotRow;

@Value
public class RollupTree {

  List<PivotRow> rows;

  /**
   * Synthetic root, level -1, holding the grand total
   */
  PivotRow total;
}
