package io.b2mash.maxify.configimport;

import io.b2mash.maxify.config.MaxifyProperties;
import io.b2mash.maxify.exception.ProjectConflictException;
import io.b2mash.maxify.project.Project;
import io.b2mash.maxify.project.ProjectStore;
import io.b2mash.maxify.project.QualifiedName;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Imports project definitions into the store under an {@link ImportStrategy}. Conflict detection
 * and every write happen in one scoped transaction, so a failed import leaves the store unchanged.
 */
@Service
@EnableConfigurationProperties(MaxifyProperties.class)
public class ConfigImportService {

  private static final Logger log = LoggerFactory.getLogger(ConfigImportService.class);

  private final ProjectDefinitionLoader loader;
  private final ProjectStore projectStore;
  private final ProjectMerger projectMerger;
  private final MaxifyProperties properties;

  public ConfigImportService(
      ProjectDefinitionLoader loader,
      ProjectStore projectStore,
      ProjectMerger projectMerger,
      MaxifyProperties properties) {
    this.loader = loader;
    this.projectStore = projectStore;
    this.projectMerger = projectMerger;
    this.properties = properties;
  }

  /**
   * Loads the definitions at {@code source} and writes them to the store.
   *
   * @param source definition file, or {@code null} for the configured default
   * @param strategy conflict strategy, or {@code null} for the configured default
   * @throws io.b2mash.maxify.exception.ConfigException if the source is missing or invalid
   * @throws ProjectConflictException under {@link ImportStrategy#ABORT} when projects collide
   */
  public ImportResult importConfig(String source, ImportStrategy strategy) {
    var settings = properties.importSettings();
    String resolvedSource = source == null || source.isBlank() ? settings.defaultSource() : source;
    var resolvedStrategy = strategy != null ? strategy : settings.defaultStrategy();

    var candidates = loader.load(Path.of(resolvedSource));

    var result =
        projectStore.scopedTransaction(
            scope -> {
              var existing = existingByKey(candidates);
              return switch (resolvedStrategy) {
                case ABORT -> abortOnConflict(candidates, existing);
                case OVERWRITE -> overwrite(candidates, existing);
                case MERGE -> merge(candidates, existing);
              };
            });

    log.info(
        "Imported {} projects from {} with strategy {} ({} warnings)",
        result.projects().size(),
        resolvedSource,
        resolvedStrategy,
        result.warnings().size());
    return result;
  }

  private ImportResult abortOnConflict(List<Project> candidates, Map<String, Project> existing) {
    if (!existing.isEmpty()) {
      throw new ProjectConflictException(
          existing.values().stream().map(Project::getQualifiedName).toList());
    }
    return new ImportResult(saveAll(candidates), List.of());
  }

  private ImportResult overwrite(List<Project> candidates, Map<String, Project> existing) {
    if (!existing.isEmpty()) {
      projectStore.delete(existing.values().toArray(new Project[0]));
    }
    return new ImportResult(saveAll(candidates), List.of());
  }

  private ImportResult merge(List<Project> candidates, Map<String, Project> existing) {
    var imported = new ArrayList<Project>(candidates.size());
    var warnings = new ArrayList<String>();
    for (var candidate : candidates) {
      var current = existing.get(key(candidate));
      if (current == null) {
        imported.add(projectStore.save(candidate));
      } else {
        warnings.addAll(projectMerger.merge(current, candidate));
        imported.add(projectStore.save(current));
      }
    }
    return new ImportResult(imported, warnings);
  }

  private List<Project> saveAll(List<Project> candidates) {
    return candidates.stream().map(projectStore::save).toList();
  }

  private Map<String, Project> existingByKey(List<Project> candidates) {
    var found =
        projectStore.getAllByQualifiedName(
            candidates.stream().map(Project::getQualifiedName).toList());
    var byKey = new LinkedHashMap<String, Project>();
    found.forEach(project -> byKey.put(key(project), project));
    return byKey;
  }

  private static String key(Project project) {
    return QualifiedName.parse(project.getQualifiedName()).canonical().toString();
  }
}
