package ru.dimension.pivot.model.schema;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SchemaInfo {

  String id;
  String displayName;
  String table;
  int fieldCount;
}
