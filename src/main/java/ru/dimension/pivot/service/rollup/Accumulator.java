package ru.dimension.pivot.service.rollup;

import ru.dimension.pivot.exception.RollupException;
import ru.dimension.pivot.model.output.CellValue;
import ru.dimension.pivot.model.query.Row;

/**
 * Running state of one measure inside one group
 */
public interface Accumulator {

  /**
   * Fold a fetched row, which may itself be a partial aggregate
   */
  void add(Row row) throws RollupException;

  /**
   * Combine the state of a closed child group of the same measure
   */
  void merge(Accumulator child) throws RollupException;

  CellValue value();
}
