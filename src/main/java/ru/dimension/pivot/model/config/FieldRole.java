package ru.dimension.pivot.model.config;

/**
 * Place of a field in a dashboard configuration
 */
public enum FieldRole {
  GROUPING,
  MEASURE,
  FILTER,
  DISPLAY
}
