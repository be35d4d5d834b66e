package ru.dimension.pivot.exception;

import lombok.Getter;

@Getter
public class SchemaInconsistencyException extends EngineException {

  private final String dataSourceId;
  private final String fieldId;

  public SchemaInconsistencyException(String dataSourceId, String fieldId, String message) {
    super("Schema " + dataSourceId + ", field " + fieldId + ": " + message);
    this.dataSourceId = dataSourceId;
    this.fieldId = fieldId;
  }
}
