package ru.dimension.pivot.model.schema;

public enum ValueType {
  TEXT,
  INTEGER,
  NUMBER,
  BOOLEAN,
  DATE;

  public boolean isNumeric() {
    return this == INTEGER || this == NUMBER;
  }
}
