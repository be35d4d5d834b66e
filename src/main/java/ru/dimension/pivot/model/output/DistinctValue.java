package ru.dimension.pivot.model.output;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DistinctValue {

  CellValue value;
  CellValue display;
}
