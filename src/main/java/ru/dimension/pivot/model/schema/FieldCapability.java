package ru.dimension.pivot.model.schema;

/**
 * Roles a field may take beyond filtering and display, which every field supports
 */
public enum FieldCapability {
  GROUP,
  AGGREGATE
}
