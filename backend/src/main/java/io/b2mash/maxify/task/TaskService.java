package io.b2mash.maxify.task;

import io.b2mash.maxify.exception.ModelException;
import io.b2mash.maxify.exception.ResourceNotFoundException;
import io.b2mash.maxify.metric.Metric;
import io.b2mash.maxify.project.Project;
import io.b2mash.maxify.project.ProjectStore;
import io.b2mash.maxify.util.NamePattern;
import io.b2mash.maxify.util.NaturalOrderComparator;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Task operations on top of {@link ProjectStore}. Raw text values are parsed before the store is
 * touched, so a value that fails to parse never reaches a transaction.
 */
@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private final ProjectStore projectStore;

  public TaskService(ProjectStore projectStore) {
    this.projectStore = projectStore;
  }

  /** Tasks of a project whose names match the wildcard pattern, in natural name order. */
  public List<Task> listTasks(String qualifiedName, String pattern) {
    var project = projectStore.requireByQualifiedName(qualifiedName);
    var matcher = NamePattern.of(pattern);
    return project.getTasks().stream()
        .filter(task -> matcher.test(task.getName()))
        .sorted(Comparator.comparing(Task::getName, NaturalOrderComparator.INSTANCE))
        .toList();
  }

  public TaskView getTask(String qualifiedName, String taskName) {
    var project = projectStore.requireByQualifiedName(qualifiedName);
    var task =
        project
            .findTask(taskName)
            .orElseThrow(() -> new ResourceNotFoundException("Task", taskName));
    return new TaskView(project, task);
  }

  /**
   * Records raw text values against a task, creating the task if needed. Metric names are resolved
   * through {@link Project#metric(String)}, so {@code compile_time} finds {@code Compile Time}.
   *
   * @param description new task description, or {@code null} to keep the current one
   * @param rawValues text value per metric name; may be empty to only create or describe the task
   * @throws ResourceNotFoundException if the project or one of the metrics does not exist
   * @throws io.b2mash.maxify.exception.ValueParsingException if a value does not parse
   * @throws ModelException if a value is rejected by its metric, or two keys name the same metric
   */
  public TaskView recordValues(
      String qualifiedName, String taskName, String description, Map<String, String> rawValues) {
    var project = projectStore.requireByQualifiedName(qualifiedName);

    var parsed = new LinkedHashMap<Metric, Object>();
    var keys = new HashMap<Metric, String>();
    if (rawValues != null) {
      for (var entry : rawValues.entrySet()) {
        var metric =
            project
                .metric(entry.getKey())
                .orElseThrow(() -> new ResourceNotFoundException("Metric", entry.getKey()));
        var previousKey = keys.putIfAbsent(metric, entry.getKey());
        if (previousKey != null) {
          throw new ModelException(
              "Duplicate metric",
              "Values '"
                  + previousKey
                  + "' and '"
                  + entry.getKey()
                  + "' both refer to metric "
                  + metric.getName());
        }
        parsed.put(metric, metric.getValueKind().parse(entry.getValue()));
      }
    }

    var task = project.task(taskName);
    task.recordAll(parsed);
    if (description != null) {
      task.updateDescription(description);
    }
    projectStore.save(project);

    log.info(
        "Recorded {} values for task {} in project {}",
        parsed.size(),
        task.getName(),
        project.getQualifiedName());
    return new TaskView(project, task);
  }

  /** A task together with the project that defines its metrics. */
  public record TaskView(Project project, Task task) {

    /** Formatted totals per metric name, in metric order, for metrics with recorded data. */
    public Map<String, String> formattedTotals() {
      var totals = new LinkedHashMap<String, String>();
      for (var metric : project.getMetrics()) {
        if (task.dataPoints(metric).isEmpty()) {
          continue;
        }
        task.total(metric)
            .ifPresent(total -> totals.put(metric.getName(), metric.getValueKind().format(total)));
      }
      return totals;
    }
  }
}
