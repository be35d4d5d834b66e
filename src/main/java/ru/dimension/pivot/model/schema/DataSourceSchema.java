package ru.dimension.pivot.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class DataSourceSchema {

  String id;
  String displayName;
  String table;

  @Singular
  List<FieldDef> fields;

  @JsonIgnore
  public Optional<FieldDef> findField(String fieldId) {
    return fields.stream()
        .filter(f -> f.getId().equals(fieldId))
        .findFirst();
  }
}
