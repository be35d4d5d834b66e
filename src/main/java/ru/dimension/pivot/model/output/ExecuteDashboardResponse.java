package ru.dimension.pivot.model.output;

import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ExecuteDashboardResponse {

  String dataSourceId;
  List<ColumnHeader> columns;
  List<PivotRow> rows;

  /**
   * Grand total, one cell per measure
   */
  List<CellValue> totals;
  long totalRowCount;
}
