package io.b2mash.maxify.configimport;

import io.b2mash.maxify.project.Project;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds candidate projects from an external definition. Candidates carry their metrics but are
 * not persisted, and loading never consults the store.
 */
public interface ProjectDefinitionLoader {

  /**
   * @throws io.b2mash.maxify.exception.ConfigException if the source is missing, unreadable or
   *     does not describe valid projects
   */
  List<Project> load(Path source);
}
