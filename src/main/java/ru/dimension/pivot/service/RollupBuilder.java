package ru.dimension.pivot.service;

import java.util.List;
import ru.dimension.pivot.exception.RollupException;
import ru.dimension.pivot.model.config.DashboardConfig;
import ru.dimension.pivot.model.query.Row;
import ru.dimension.pivot.model.schema.DataSourceSchema;
import ru.dimension.pivot.service.rollup.RollupTree;

public interface RollupBuilder {

  /**
   * Turn flat rows into the grouping hierarchy with subtotals at every level, in one pass
   *
   * @param schema - Data source schema the config was validated against
   * @param config - Validated dashboard configuration
   * @param rows   - Rows keyed by the aliases emitted by the query compiler
   * @return RollupTree - Top level rows and the grand total
   */
  RollupTree build(DataSourceSchema schema,
                   DashboardConfig config,
                   List<Row> rows) throws RollupException;
}
