package ru.dimension.pivot.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.EnumSet;
import java.util.Set;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import ru.dimension.pivot.model.config.AggregationFunction;
import ru.dimension.pivot.model.config.FieldRole;

@Value
@Builder(toBuilder = true)
@Jacksonized
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class FieldDef {

  @EqualsAndHashCode.Include
  String id;
  String displayName;
  String sourceColumn;
  ValueType valueType;

  @Builder.Default
  Set<FieldCapability> capabilities = EnumSet.noneOf(FieldCapability.class);

  FieldReference reference;

  @JsonIgnore
  public boolean canGroup() {
    return capabilities != null && capabilities.contains(FieldCapability.GROUP);
  }

  @JsonIgnore
  public boolean canAggregate() {
    return capabilities != null && capabilities.contains(FieldCapability.AGGREGATE);
  }

  @JsonIgnore
  public boolean hasReference() {
    return reference != null;
  }

  /**
   * Whether this field may be used in the given configuration role.
   * Count is accepted for any field, other aggregations need the AGGREGATE capability.
   */
  public boolean supports(FieldRole role, AggregationFunction aggregation) {
    return switch (role) {
      case GROUPING -> canGroup();
      case MEASURE -> aggregation == AggregationFunction.COUNT || canAggregate();
      default -> true;
    };
  }
}
