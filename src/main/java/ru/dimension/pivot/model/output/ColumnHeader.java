package ru.dimension.pivot.model.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import ru.dimension.pivot.model.config.FieldRole;
import ru.dimension.pivot.model.schema.ValueType;

@Value
@Builder
@Jacksonized
public class ColumnHeader {

  String id;
  String displayName;
  ValueType valueType;
  FieldRole role;

  @JsonProperty("is_measure")
  boolean measure;
}
