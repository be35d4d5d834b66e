package ru.dimension.pivot.service.rollup;

import ru.dimension.pivot.model.output.CellValue;
import ru.dimension.pivot.model.query.Row;

class MinMaxAccumulator implements Accumulator {

  private final String alias;
  private final boolean min;

  private CellValue best = CellValue.NULL;

  MinMaxAccumulator(String alias, boolean min) {
    this.alias = alias;
    this.min = min;
  }

  @Override
  public void add(Row row) {
    offer(row.get(alias));
  }

  @Override
  public void merge(Accumulator child) {
    offer(((MinMaxAccumulator) child).best);
  }

  @Override
  public CellValue value() {
    return best;
  }

  private void offer(CellValue candidate) {
    if (candidate.isNull()) {
      return;
    }
    if (best.isNull()) {
      best = candidate;
      return;
    }
    int cmp = candidate.compareTo(best);
    if (min ? cmp < 0 : cmp > 0) {
      best = candidate;
    }
  }
}
