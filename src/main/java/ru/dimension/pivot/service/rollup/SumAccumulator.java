package ru.dimension.pivot.service.rollup;

import lombok.extern.log4j.Log4j2;
import ru.dimension.pivot.exception.RollupException;
import ru.dimension.pivot.model.output.CellValue;
import ru.dimension.pivot.model.query.Row;

/**
 * Stays integral while every input is an integer and the total fits in a long
 */
@Log4j2
class SumAccumulator implements Accumulator {

  private final String alias;

  private boolean seen;
  private boolean integral = true;
  private long longSum;
  private double doubleSum;

  SumAccumulator(String alias) {
    this.alias = alias;
  }

  @Override
  public void add(Row row) throws RollupException {
    CellValue value = Accumulators.numeric(row, alias);
    if (value.isNull()) {
      return;
    }
    seen = true;
    if (value.getKind() == CellValue.Kind.INTEGER) {
      addIntegral(value.asLong());
    } else {
      integral = false;
      doubleSum += value.asDouble();
    }
  }

  @Override
  public void merge(Accumulator child) {
    SumAccumulator other = (SumAccumulator) child;
    if (!other.seen) {
      return;
    }
    seen = true;
    integral &= other.integral;
    addIntegral(other.longSum);
    doubleSum += other.doubleSum;
  }

  private void addIntegral(long addend) {
    try {
      longSum = Math.addExact(longSum, addend);
    } catch (ArithmeticException e) {
      log.debug("Sum of " + alias + " exceeds the long range, continuing in floating point");
      doubleSum += (double) longSum + addend;
      longSum = 0;
      integral = false;
    }
  }

  @Override
  public CellValue value() {
    if (!seen) {
      return CellValue.NULL;
    }
    return integral ? CellValue.integer(longSum) : CellValue.number(longSum + doubleSum);
  }
}
