package ru.dimension.pivot.service;

import ru.dimension.pivot.model.output.SchemaValidationResult;
import ru.dimension.pivot.model.output.SchemaValidationSummary;

/**
 * Checks registered schemas against the live database
 */
public interface SchemaValidationService {

  SchemaValidationResult validate(String dataSourceId);

  SchemaValidationSummary validateAll();
}
