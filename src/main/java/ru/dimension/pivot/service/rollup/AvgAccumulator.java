package ru.dimension.pivot.service.rollup;

import ru.dimension.pivot.exception.RollupException;
import ru.dimension.pivot.model.output.CellValue;
import ru.dimension.pivot.model.query.Row;
import ru.dimension.pivot.service.QueryCompiler;

/**
 * Keeps a (sum, count) pair. Parents merge the pairs of their children, never the divided averages.
 */
class AvgAccumulator implements Accumulator {

  private final String alias;
  private final String sumAlias;
  private final String countAlias;

  private double sum;
  private long count;

  AvgAccumulator(String alias) {
    this.alias = alias;
    this.sumAlias = alias + QueryCompiler.AVG_SUM_SUFFIX;
    this.countAlias = alias + QueryCompiler.AVG_COUNT_SUFFIX;
  }

  @Override
  public void add(Row row) throws RollupException {
    if (row.has(sumAlias) && row.has(countAlias)) {
      CellValue partialCount = Accumulators.numeric(row, countAlias);
      CellValue partialSum = Accumulators.numeric(row, sumAlias);
      if (!partialCount.isNull() && partialCount.asLong() > 0 && !partialSum.isNull()) {
        sum += partialSum.asDouble();
        count = Accumulators.addCount(alias, count, partialCount.asLong());
      }
      return;
    }

    CellValue value = Accumulators.numeric(row, alias);
    if (!value.isNull()) {
      sum += value.asDouble();
      count = Accumulators.addCount(alias, count, 1);
    }
  }

  @Override
  public void merge(Accumulator child) throws RollupException {
    AvgAccumulator other = (AvgAccumulator) child;
    sum += other.sum;
    count = Accumulators.addCount(alias, count, other.count);
  }

  @Override
  public CellValue value() {
    return count == 0 ? CellValue.NULL : CellValue.number(sum / count);
  }
}
