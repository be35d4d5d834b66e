package ru.dimension.pivot.model.output;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SchemaValidationSummary {

  List<SchemaValidationResult> results;
  int totalSchemas;
  int validCount;
  int invalidCount;
  long totalTimeMs;
}
