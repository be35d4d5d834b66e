package ru.dimension.pivot.model.schema;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Lookup table known to the registry, target of {@link FieldReference}
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ReferenceTable {

  String table;

  @Singular
  List<String> columns;
}
