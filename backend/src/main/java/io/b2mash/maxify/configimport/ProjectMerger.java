package io.b2mash.maxify.configimport;

import io.b2mash.maxify.project.Project;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reconciles a freshly loaded project definition into a persisted project with the same qualified
 * name. The persisted project keeps its tasks and data points; only its schema is refreshed.
 */
@Component
public class ProjectMerger {

  private static final Logger log = LoggerFactory.getLogger(ProjectMerger.class);

  /**
   * Merges {@code candidate} into {@code existing}:
   *
   * <ul>
   *   <li>the description is replaced by the candidate's,
   *   <li>metrics missing from the existing project are added,
   *   <li>metrics with the same name and value kind get the candidate's description, allowed values
   *       and default value,
   *   <li>metrics with the same name but another value kind are left untouched and reported.
   * </ul>
   *
   * @return one warning per metric that was skipped
   */
  public List<String> merge(Project existing, Project candidate) {
    var warnings = new ArrayList<String>();
    existing.updateDescription(candidate.getDescription());

    for (var incoming : candidate.getMetrics()) {
      var current = existing.findMetric(incoming.getName()).orElse(null);
      if (current == null) {
        existing.addMetric(incoming.copyDefinition());
        log.debug("Added metric {} to project {}", incoming.getName(), existing.getQualifiedName());
      } else if (current.getValueKind() == incoming.getValueKind()) {
        current.updateDefinition(
            incoming.getDescription(), incoming.getAllowedValues(), incoming.getDefaultValue());
      } else {
        var warning =
            String.format(
                "Metric %s of project %s was not merged: its type cannot change from %s to %s",
                current.getName(),
                existing.getQualifiedName(),
                current.getValueKind().label(),
                incoming.getValueKind().label());
        log.warn(warning);
        warnings.add(warning);
      }
    }
    return warnings;
  }
}
