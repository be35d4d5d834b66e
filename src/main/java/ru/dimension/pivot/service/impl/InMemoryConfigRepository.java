package ru.dimension.pivot.service.impl;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.log4j.Log4j2;
import ru.dimension.pivot.model.config.DashboardConfig;
import ru.dimension.pivot.model.config.SavedDashboardConfig;
import ru.dimension.pivot.service.ConfigRepository;

@Log4j2
public class InMemoryConfigRepository implements ConfigRepository {

  private final Map<String, SavedDashboardConfig> configs = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryConfigRepository() {
    this(Clock.systemUTC());
  }

  public InMemoryConfigRepository(Clock clock) {
    this.clock = clock;
  }

  @Override
  public SavedDashboardConfig save(String name, String description, DashboardConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Dashboard config is required");
    }
    Instant now = clock.instant();
    SavedDashboardConfig saved = SavedDashboardConfig.builder()
        .id(UUID.randomUUID().toString())
        .name(name)
        .description(description)
        .config(config)
        .createdAt(now)
        .updatedAt(now)
        .build();
    configs.put(saved.getId(), saved);

    log.info("Saved dashboard config " + saved.getId() + " (" + name + ")");
    return saved;
  }

  @Override
  public Optional<SavedDashboardConfig> load(String id) {
    return Optional.ofNullable(configs.get(id));
  }

  @Override
  public Optional<SavedDashboardConfig> update(String id, String name, String description, DashboardConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Dashboard config is required");
    }
    return Optional.ofNullable(configs.computeIfPresent(id, (key, existing) -> existing.toBuilder()
        .name(name)
        .description(description)
        .config(config)
        .updatedAt(clock.instant())
        .build()));
  }

  @Override
  public boolean delete(String id) {
    return configs.remove(id) != null;
  }

  @Override
  public List<SavedDashboardConfig> list() {
    return configs.values().stream()
        .sorted(Comparator.comparing(SavedDashboardConfig::getCreatedAt)
                    .thenComparing(SavedDashboardConfig::getId))
        .toList();
  }
}
