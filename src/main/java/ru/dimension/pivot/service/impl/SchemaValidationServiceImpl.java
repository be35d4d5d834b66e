package ru.dimension.pivot.service.impl;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.dbcp2.BasicDataSource;
import ru.dimension.pivot.model.output.SchemaValidationResult;
import ru.dimension.pivot.model.output.SchemaValidationSummary;
import ru.dimension.pivot.model.schema.DataSourceSchema;
import ru.dimension.pivot.model.schema.FieldDef;
import ru.dimension.pivot.model.schema.FieldReference;
import ru.dimension.pivot.registry.SchemaRegistry;
import ru.dimension.pivot.service.SchemaValidationService;

@Log4j2
public class SchemaValidationServiceImpl implements SchemaValidationService {

  private final SchemaRegistry schemaRegistry;
  private final BasicDataSource basicDataSource;

  public SchemaValidationServiceImpl(SchemaRegistry schemaRegistry,
                                     BasicDataSource basicDataSource) {
    this.schemaRegistry = schemaRegistry;
    this.basicDataSource = basicDataSource;
  }

  @Override
  public SchemaValidationResult validate(String dataSourceId) {
    DataSourceSchema schema = schemaRegistry.getSchema(dataSourceId)
        .orElseThrow(() -> new IllegalArgumentException("Data source is not registered: " + dataSourceId));
    return validate(schema);
  }

  @Override
  public SchemaValidationSummary validateAll() {
    long start = System.nanoTime();

    List<SchemaValidationResult> results = new ArrayList<>();
    schemaRegistry.getSchemas().forEach(schema -> results.add(validate(schema)));

    int validCount = (int) results.stream().filter(SchemaValidationResult::isValid).count();

    return SchemaValidationSummary.builder()
        .results(results)
        .totalSchemas(results.size())
        .validCount(validCount)
        .invalidCount(results.size() - validCount)
        .totalTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start))
        .build();
  }

  private SchemaValidationResult validate(DataSourceSchema schema) {
    long start = System.nanoTime();

    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    Long rowCount = null;

    try (Connection connection = basicDataSource.getConnection()) {
      Set<String> columns = tableColumns(connection, schema.getTable());

      if (columns == null) {
        errors.add("Table " + schema.getTable() + " does not exist or is not accessible");
      } else {
        for (FieldDef field : schema.getFields()) {
          if (!columns.contains(upper(field.getSourceColumn()))) {
            errors.add("Column " + field.getSourceColumn() + " of field " + field.getId()
                           + " not found in table " + schema.getTable());
          }
          if (field.hasReference()) {
            checkReference(connection, field, warnings);
          }
        }

        if (errors.isEmpty()) {
          rowCount = countRows(connection, schema.getTable());
        }
      }
    } catch (SQLException e) {
      log.error("Schema validation of " + schema.getId() + " failed: " + e.getMessage());
      errors.add("Database error (SQLState " + e.getSQLState() + ")");
    }

    long elapsedUs = TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - start);

    if (!errors.isEmpty()) {
      log.warn("Schema " + schema.getId() + " is invalid: " + errors);
    }

    return SchemaValidationResult.builder()
        .schemaId(schema.getId())
        .schemaName(schema.getDisplayName())
        .table(schema.getTable())
        .valid(errors.isEmpty())
        .errors(errors)
        .warnings(warnings)
        .executionTimeUs(elapsedUs)
        .rowCount(rowCount)
        .build();
  }

  private void checkReference(Connection connection, FieldDef field, List<String> warnings) throws SQLException {
    FieldReference reference = field.getReference();
    Set<String> refColumns = tableColumns(connection, reference.getRefTable());

    if (refColumns == null) {
      warnings.add("Reference table " + reference.getRefTable() + " of field " + field.getId() + " not found");
      return;
    }
    for (String column : List.of(reference.getRefKeyColumn(), reference.getRefDisplayColumn())) {
      if (!refColumns.contains(upper(column))) {
        warnings.add("Reference column " + reference.getRefTable() + "." + column + " of field "
                         + field.getId() + " not found");
      }
    }
  }

  /**
   * @return upper-cased column names, null when the table can not be queried
   */
  private Set<String> tableColumns(Connection connection, String table) {
    String select = "SELECT * FROM " + table + " WHERE 1 = 0";

    try (Statement statement = connection.createStatement();
        ResultSet resultSet = statement.executeQuery(select)) {

      ResultSetMetaData metaData = resultSet.getMetaData();
      Set<String> columns = new HashSet<>();
      for (int i = 1; i <= metaData.getColumnCount(); i++) {
        columns.add(upper(metaData.getColumnName(i)));
      }
      return columns;
    } catch (SQLException e) {
      log.info("Table " + table + " is not accessible: " + e.getMessage());
      return null;
    }
  }

  private Long countRows(Connection connection, String table) throws SQLException {
    try (Statement statement = connection.createStatement();
        ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM " + table)) {
      return resultSet.next() ? resultSet.getLong(1) : 0L;
    }
  }

  private static String upper(String name) {
    return name.toUpperCase(Locale.ROOT);
  }
}
