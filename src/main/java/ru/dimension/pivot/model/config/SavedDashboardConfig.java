package ru.dimension.pivot.model.config;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class SavedDashboardConfig {

  String id;
  String name;
  String description;
  DashboardConfig config;
  Instant createdAt;
  Instant updatedAt;
}
