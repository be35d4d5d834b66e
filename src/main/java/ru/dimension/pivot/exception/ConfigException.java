package ru.dimension.pivot.exception;

import lombok.Getter;

/**
 * Dashboard configuration rejected before any query is issued
 */
@Getter
public class ConfigException extends EngineException {

  private final String fieldId;
  private final ConfigRule rule;

  public ConfigException(String fieldId, ConfigRule rule, String message) {
    super(rule + (fieldId == null ? "" : " [" + fieldId + "]") + ": " + message);
    this.fieldId = fieldId;
    this.rule = rule;
  }
}
