package ru.dimension.pivot.registry;

import java.util.List;
import java.util.Optional;
import ru.dimension.pivot.model.schema.DataSourceSchema;
import ru.dimension.pivot.model.schema.FieldDef;
import ru.dimension.pivot.model.schema.SchemaInfo;

/**
 * Read-only catalog of data sources, shared by all requests
 */
public interface SchemaRegistry {

  Optional<DataSourceSchema> getSchema(String dataSourceId);

  Optional<FieldDef> getField(String dataSourceId, String fieldId);

  List<SchemaInfo> listSchemas();

  List<DataSourceSchema> getSchemas();

  /**
   * Whether the table is known (as a data source or a reference table) and has the column
   */
  boolean hasColumn(String table, String column);
}
