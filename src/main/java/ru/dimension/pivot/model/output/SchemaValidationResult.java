package ru.dimension.pivot.model.output;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SchemaValidationResult {

  String schemaId;
  String schemaName;
  String table;
  boolean valid;
  List<String> errors;
  List<String> warnings;
  long executionTimeUs;
  Long rowCount;
}
