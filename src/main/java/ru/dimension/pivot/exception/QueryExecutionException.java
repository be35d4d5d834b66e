package ru.dimension.pivot.exception;

import lombok.Getter;

/**
 * Failure reported by the execution adapter. The message never carries query text or bound values.
 */
@Getter
public class QueryExecutionException extends EngineException {

  private final String dataSourceId;

  public QueryExecutionException(String dataSourceId, String message) {
    super(message);
    this.dataSourceId = dataSourceId;
  }

  public QueryExecutionException(String dataSourceId, String message, Throwable cause) {
    super(message, cause);
    this.dataSourceId = dataSourceId;
  }
}
