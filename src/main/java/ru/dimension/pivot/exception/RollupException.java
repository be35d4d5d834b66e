package ru.dimension.pivot.exception;

public class RollupException extends EngineException {

  public RollupException(String message) {
    super(message);
  }

  public RollupException(String message, Throwable cause) {
    super(message, cause);
  }
}
