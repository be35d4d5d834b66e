package ru.dimension.pivot.service;

import java.util.List;
import ru.dimension.pivot.exception.InternalInvariantException;
import ru.dimension.pivot.model.config.DashboardConfig;
import ru.dimension.pivot.model.output.ColumnHeader;
import ru.dimension.pivot.model.output.ExecuteDashboardResponse;
import ru.dimension.pivot.model.schema.DataSourceSchema;
import ru.dimension.pivot.service.rollup.RollupTree;

public interface ResponseAssembler {

  /**
   * Column headers in order: groupings, measures, display fields
   */
  List<ColumnHeader> buildHeaders(DataSourceSchema schema, DashboardConfig config);

  /**
   * Package the rollup tree with its column headers
   *
   * @param schema - Data source schema
   * @param config - Validated dashboard configuration
   * @param tree   - Rollup result
   * @return ExecuteDashboardResponse - Headers, tree rows and grand total
   * @throws InternalInvariantException when a row measure vector does not match the configured measures
   */
  ExecuteDashboardResponse assemble(DataSourceSchema schema,
                                    DashboardConfig config,
                                    RollupTree tree) throws InternalInvariantException;
}
