package ru.dimension.pivot.exception;

public class InternalInvariantException extends EngineException {

  public InternalInvariantException(String message) {
    super(message);
  }
}
