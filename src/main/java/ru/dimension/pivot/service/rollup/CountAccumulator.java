package ru.dimension.pivot.service.rollup;

import ru.dimension.pivot.exception.RollupException;
import ru.dimension.pivot.model.output.CellValue;
import ru.dimension.pivot.model.query.Row;

/**
 * Adds up partial counts
 */
class CountAccumulator implements Accumulator {

  private final String alias;
  private long count;

  CountAccumulator(String alias) {
    this.alias = alias;
  }

  @Override
  public void add(Row row) throws RollupException {
    CellValue value = Accumulators.numeric(row, alias);
    if (!value.isNull()) {
      count = Accumulators.addCount(alias, count, value.asLong());
    }
  }

  @Override
  public void merge(Accumulator child) throws RollupException {
    count = Accumulators.addCount(alias, count, ((CountAccumulator) child).count);
  }

  @Override
  public CellValue value() {
    return CellValue.integer(count);
  }
}
