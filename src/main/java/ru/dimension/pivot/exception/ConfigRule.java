package ru.dimension.pivot.exception;

public enum ConfigRule {
  UNKNOWN_DATA_SOURCE,
  UNKNOWN_FIELD,
  NOT_GROUPABLE,
  NOT_AGGREGATABLE,
  DUPLICATE_GROUPING,
  DUPLICATE_MEASURE,
  DISPLAY_FIELD_IS_GROUPING,
  DUPLICATE_DISPLAY_FIELD,
  INVALID_FILTER_ARITY,
  INVALID_FILTER_VALUE,
  UNSUPPORTED_OPERATOR,
  EMPTY_CONFIG
}
