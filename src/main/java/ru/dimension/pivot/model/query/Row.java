package ru.dimension.pivot.model.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import ru.dimension.pivot.model.output.CellValue;

/**
 * Flat row returned by the execution adapter, keyed by column alias
 */
@EqualsAndHashCode
@ToString
public class Row {

  private final Map<String, CellValue> values;

  public Row(Map<String, CellValue> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * @param aliasAndValues alternating alias and raw value
   */
  public static Row of(Object... aliasAndValues) {
    if (aliasAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected alias/value pairs, got " + aliasAndValues.length + " items");
    }
    Map<String, CellValue> map = new LinkedHashMap<>();
    for (int i = 0; i < aliasAndValues.length; i += 2) {
      map.put((String) aliasAndValues[i], CellValue.of(aliasAndValues[i + 1]));
    }
    return new Row(map);
  }

  public boolean has(String alias) {
    return values.containsKey(alias);
  }

  public CellValue get(String alias) {
    return values.getOrDefault(alias, CellValue.NULL);
  }

  public Map<String, CellValue> asMap() {
    return values;
  }
}
