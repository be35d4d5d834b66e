package ru.dimension.pivot.config;

import java.time.Duration;
import java.time.ZoneId;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@AllArgsConstructor
@NoArgsConstructor
@Accessors(chain = true)
@Data
@Builder(toBuilder = true)
public class DPivotConfig {

  /**
   * Label shown for reference keys without a matching row in the reference table
   */
  @Builder.Default
  private String noValueLabel = "(no value)";

  @Builder.Default
  private Duration queryTimeout = Duration.ofSeconds(30);

  @Builder.Default
  private int executorThreads = 4;

  @Builder.Default
  private int distinctValuesLimit = 1000;

  /**
   * Zone used to resolve relative date presets
   */
  @Builder.Default
  private ZoneId defaultZone = ZoneId.systemDefault();
}
