package ru.dimension.pivot.registry;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.log4j.Log4j2;
import ru.dimension.pivot.model.config.Measure;
import ru.dimension.pivot.model.schema.DataSourceSchema;
import ru.dimension.pivot.model.schema.FieldDef;
import ru.dimension.pivot.model.schema.ReferenceTable;
import ru.dimension.pivot.model.schema.SchemaInfo;

@Log4j2
public class SchemaRegistryImpl implements SchemaRegistry {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
  private static final Pattern FIELD_ID = Pattern.compile("[A-Za-z0-9_]+");

  /**
   * Separates a field id from the suffixes of generated column aliases
   */
  private static final String ALIAS_DELIMITER = "__";
  private static final String ROW_COUNT_FIELD_ID =
      Measure.ROW_COUNT_ALIAS.substring(0, Measure.ROW_COUNT_ALIAS.indexOf(ALIAS_DELIMITER));

  private final Map<String, DataSourceSchema> schemas;
  private final Map<String, Map<String, FieldDef>> fields;
  private final Map<String, Set<String>> tableColumns;

  public SchemaRegistryImpl(List<DataSourceSchema> dataSources,
                            List<ReferenceTable> referenceTables) {
    Map<String, DataSourceSchema> schemaMap = new LinkedHashMap<>();
    Map<String, Map<String, FieldDef>> fieldMap = new HashMap<>();
    Map<String, Set<String>> columnMap = new HashMap<>();

    for (DataSourceSchema schema : dataSources) {
      if (schemaMap.containsKey(schema.getId())) {
        throw new IllegalArgumentException("Duplicate data source id: " + schema.getId());
      }
      checkIdentifier(schema.getTable(), "table of " + schema.getId());

      Map<String, FieldDef> byId = new LinkedHashMap<>();
      for (FieldDef field : schema.getFields()) {
        if (field.getId() == null || !FIELD_ID.matcher(field.getId()).matches()) {
          throw new IllegalArgumentException("Invalid field id in " + schema.getId() + ": " + field.getId());
        }
        checkNotReserved(schema.getId(), field.getId());
        if (byId.put(field.getId(), field) != null) {
          throw new IllegalArgumentException("Duplicate field id " + field.getId() + " in " + schema.getId());
        }
        if (field.getValueType() == null) {
          throw new IllegalArgumentException("Missing value type for " + schema.getId() + "." + field.getId());
        }
        checkIdentifier(field.getSourceColumn(), "column of " + schema.getId() + "." + field.getId());
        if (field.hasReference()) {
          checkIdentifier(field.getReference().getRefTable(), "reference table of " + field.getId());
          checkIdentifier(field.getReference().getRefKeyColumn(), "reference key of " + field.getId());
          checkIdentifier(field.getReference().getRefDisplayColumn(), "reference label of " + field.getId());
        }
        columns(columnMap, schema.getTable()).add(normalize(field.getSourceColumn()));
      }

      schemaMap.put(schema.getId(), schema);
      fieldMap.put(schema.getId(), Collections.unmodifiableMap(byId));
    }

    for (ReferenceTable referenceTable : referenceTables) {
      checkIdentifier(referenceTable.getTable(), "reference table");
      Set<String> set = columns(columnMap, referenceTable.getTable());
      referenceTable.getColumns().forEach(column -> {
        checkIdentifier(column, "column of " + referenceTable.getTable());
        set.add(normalize(column));
      });
    }

    this.schemas = Collections.unmodifiableMap(schemaMap);
    this.fields = Collections.unmodifiableMap(fieldMap);
    this.tableColumns = Collections.unmodifiableMap(columnMap);

    log.info("Schema registry loaded: " + schemas.size() + " data sources, "
                 + referenceTables.size() + " reference tables");
  }

  @Override
  public Optional<DataSourceSchema> getSchema(String dataSourceId) {
    return Optional.ofNullable(dataSourceId).map(schemas::get);
  }

  @Override
  public Optional<FieldDef> getField(String dataSourceId, String fieldId) {
    if (dataSourceId == null || fieldId == null) {
      return Optional.empty();
    }
    Map<String, FieldDef> byId = fields.get(dataSourceId);
    return byId == null ? Optional.empty() : Optional.ofNullable(byId.get(fieldId));
  }

  @Override
  public List<SchemaInfo> listSchemas() {
    return schemas.values().stream()
        .map(schema -> SchemaInfo.builder()
            .id(schema.getId())
            .displayName(schema.getDisplayName())
            .table(schema.getTable())
            .fieldCount(schema.getFields().size())
            .build())
        .toList();
  }

  @Override
  public List<DataSourceSchema> getSchemas() {
    return List.copyOf(schemas.values());
  }

  @Override
  public boolean hasColumn(String table, String column) {
    if (table == null || column == null) {
      return false;
    }
    Set<String> set = tableColumns.get(normalize(table));
    return set != null && set.contains(normalize(column));
  }

  private static Set<String> columns(Map<String, Set<String>> columnMap, String table) {
    return columnMap.computeIfAbsent(normalize(table), k -> new HashSet<>());
  }

  private static String normalize(String identifier) {
    return identifier.toLowerCase(Locale.ROOT);
  }

  private static void checkNotReserved(String dataSourceId, String fieldId) {
    if (fieldId.contains(ALIAS_DELIMITER)) {
      throw new IllegalArgumentException("Field id " + fieldId + " in " + dataSourceId
                                             + " contains the reserved delimiter " + ALIAS_DELIMITER);
    }
    if (fieldId.equals(ROW_COUNT_FIELD_ID)) {
      throw new IllegalArgumentException("Field id " + fieldId + " in " + dataSourceId
                                             + " is reserved for the row count measure");
    }
  }

  private static void checkIdentifier(String identifier, String what) {
    if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
      throw new IllegalArgumentException("Unsafe or empty SQL identifier for " + what + ": " + identifier);
    }
  }
}
