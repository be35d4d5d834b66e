package ru.dimension.pivot.model.schema;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Foreign-key style link to the table holding the human-readable label of a field
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FieldReference {

  String refTable;
  String refKeyColumn;
  String refDisplayColumn;
}
