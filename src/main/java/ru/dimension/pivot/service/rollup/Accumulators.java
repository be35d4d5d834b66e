package ru.dimension.pivot.service.rollup;

import ru.dimension.pivot.exception.RollupException;
import ru.dimension.pivot.model.config.Measure;
import ru.dimension.pivot.model.output.CellValue;
import ru.dimension.pivot.model.query.Row;

public final class Accumulators {

  private Accumulators() {}

  public static Accumulator create(Measure measure) {
    String alias = measure.alias();
    return switch (measure.getAggregation()) {
      case SUM -> new SumAccumulator(alias);
      case COUNT -> new CountAccumulator(alias);
      case AVG -> new AvgAccumulator(alias);
      case MIN -> new MinMaxAccumulator(alias, true);
      case MAX -> new MinMaxAccumulator(alias, false);
    };
  }

  static CellValue numeric(Row row, String alias) throws RollupException {
    CellValue value = row.get(alias);
    if (!value.isNull() && !value.isNumeric()) {
      throw new RollupException("Column " + alias + " holds a non-numeric value: " + value);
    }
    return value;
  }

  static long addCount(String alias, long count, long addend) throws RollupException {
    try {
      return Math.addExact(count, addend);
    } catch (ArithmeticException e) {
      throw new RollupException("Count of " + alias + " exceeds the long range", e);
    }
  }
}
