package ru.dimension.pivot.service;

import java.util.List;
import java.util.Optional;
import ru.dimension.pivot.model.config.DashboardConfig;
import ru.dimension.pivot.model.config.SavedDashboardConfig;

/**
 * Storage of named dashboard configurations. The engine itself only receives complete configs.
 */
public interface ConfigRepository {

  SavedDashboardConfig save(String name, String description, DashboardConfig config);

  Optional<SavedDashboardConfig> load(String id);

  /**
   * @return updated entry, empty when the id is unknown
   */
  Optional<SavedDashboardConfig> update(String id, String name, String description, DashboardConfig config);

  boolean delete(String id);

  /**
   * All entries, oldest first
   */
  List<SavedDashboardConfig> list();
}
