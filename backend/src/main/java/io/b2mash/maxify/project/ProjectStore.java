package io.b2mash.maxify.project;

import io.b2mash.maxify.exception.ResourceConflictException;
import io.b2mash.maxify.exception.ResourceNotFoundException;
import io.b2mash.maxify.metric.Metric;
import io.b2mash.maxify.metric.MetricRepository;
import io.b2mash.maxify.task.DataPoint;
import io.b2mash.maxify.task.DataPointRepository;
import io.b2mash.maxify.task.Task;
import io.b2mash.maxify.task.TaskRepository;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Durable storage of project aggregates. A project is always loaded and saved together with its
 * metrics, tasks and data points.
 *
 * <p>Identity fields are stored lowercase, which makes qualified name lookups case-insensitive.
 * Deleting a project removes its data points, tasks and metrics explicitly, in dependency order,
 * within the same transaction.
 */
@Service
public class ProjectStore {

  private static final Logger log = LoggerFactory.getLogger(ProjectStore.class);

  private final ProjectRepository projectRepository;
  private final MetricRepository metricRepository;
  private final TaskRepository taskRepository;
  private final DataPointRepository dataPointRepository;
  private final TransactionTemplate transactionTemplate;

  public ProjectStore(
      ProjectRepository projectRepository,
      MetricRepository metricRepository,
      TaskRepository taskRepository,
      DataPointRepository dataPointRepository,
      TransactionTemplate transactionTemplate) {
    this.projectRepository = projectRepository;
    this.metricRepository = metricRepository;
    this.taskRepository = taskRepository;
    this.dataPointRepository = dataPointRepository;
    this.transactionTemplate = transactionTemplate;
  }

  @Transactional(readOnly = true)
  public List<Project> listAll() {
    return unpack(projectRepository.findAllOrdered());
  }

  @Transactional(readOnly = true)
  public Optional<Project> getByQualifiedName(String qualifiedName) {
    var key = QualifiedName.parse(qualifiedName).canonical();
    log.debug("Looking up project {}", key);
    return projectRepository
        .findByQualifiedName(key.organization(), key.name())
        .map(project -> unpack(List.of(project)).get(0));
  }

  /** Like {@link #getByQualifiedName(String)} but fails when the project does not exist. */
  @Transactional(readOnly = true)
  public Project requireByQualifiedName(String qualifiedName) {
    return getByQualifiedName(qualifiedName)
        .orElseThrow(() -> new ResourceNotFoundException("Project", qualifiedName));
  }

  /** Loads every existing project among the given qualified names; unknown names are skipped. */
  @Transactional(readOnly = true)
  public List<Project> getAllByQualifiedName(Collection<String> qualifiedNames) {
    var found = new ArrayList<Project>();
    for (String qualifiedName : qualifiedNames) {
      var key = QualifiedName.parse(qualifiedName).canonical();
      projectRepository.findByQualifiedName(key.organization(), key.name()).ifPresent(found::add);
    }
    return unpack(found);
  }

  /** Qualified names that start with the given prefix, compared case-insensitively. */
  @Transactional(readOnly = true)
  public List<String> matchingQualifiedNames(String prefix) {
    String lowered = prefix == null ? "" : prefix.toLowerCase(Locale.ROOT);
    var matches =
        projectRepository.findAllOrdered().stream()
            .map(Project::getQualifiedName)
            .filter(name -> name.startsWith(lowered))
            .toList();
    log.debug("Projects matching '{}': {}", prefix, matches);
    return matches;
  }

  /**
   * Inserts or updates a project together with its metrics, tasks and data points. The project's
   * name and organization are lowercased once the save goes ahead; a rejected save leaves the
   * project untouched.
   *
   * @throws ResourceConflictException if another project already uses the same qualified name
   */
  @Transactional
  public Project save(Project project) {
    var key = QualifiedName.parse(project.getQualifiedName()).canonical();
    projectRepository
        .findByQualifiedName(key.organization(), key.name())
        .filter(other -> !other.getId().equals(project.getId()))
        .ifPresent(
            other -> {
              throw new ResourceConflictException(
                  "Project already exists",
                  "Another project is already named " + key);
            });

    project.normalizeIdentity();
    projectRepository.save(project);
    metricRepository.saveAll(project.getMetrics());
    taskRepository.saveAll(project.getTasks());
    dataPointRepository.saveAll(project.allDataPoints());

    log.info(
        "Saved project {} ({} metrics, {} tasks)",
        project.getQualifiedName(),
        project.getMetrics().size(),
        project.getTasks().size());
    return project;
  }

  /** Deletes projects with all of their metrics, tasks and data points. */
  @Transactional
  public void delete(Project... projects) {
    var projectIds = Arrays.stream(projects).map(Project::getId).toList();
    if (projectIds.isEmpty()) {
      return;
    }

    var taskIds = taskRepository.findIdsByProjectIdIn(projectIds);
    var metricIds = metricRepository.findIdsByProjectIdIn(projectIds);
    int dataPoints = 0;
    if (!taskIds.isEmpty()) {
      dataPoints += dataPointRepository.deleteByTaskIdIn(taskIds);
    }
    if (!metricIds.isEmpty()) {
      dataPoints += dataPointRepository.deleteByMetricIdIn(metricIds);
    }
    int tasks = taskRepository.deleteByProjectIdIn(projectIds);
    int metrics = metricRepository.deleteByProjectIdIn(projectIds);
    projectRepository.deleteByIdIn(projectIds);

    log.info(
        "Deleted projects {} with {} metrics, {} tasks and {} data points",
        Arrays.stream(projects).map(Project::getQualifiedName).toList(),
        metrics,
        tasks,
        dataPoints);
  }

  /**
   * Removes one metric from a project and deletes every data point recorded for it.
   *
   * @throws ResourceNotFoundException if the project has no metric of that name
   */
  @Transactional
  public Metric deleteMetric(Project project, String metricName) {
    var metric =
        project
            .removeMetric(metricName)
            .orElseThrow(() -> new ResourceNotFoundException("Metric", metricName));
    int dataPoints = dataPointRepository.deleteByMetricIdIn(List.of(metric.getId()));
    metricRepository.deleteOneById(metric.getId());
    log.info(
        "Deleted metric {} from project {} with {} data points",
        metric.getName(),
        project.getQualifiedName(),
        dataPoints);
    return metric;
  }

  /**
   * Runs work in one transaction. Every store change made by the work is committed when it returns
   * normally, and discarded when it throws or calls {@link TransactionScope#abort()}. Scopes cannot
   * be nested.
   *
   * @throws IllegalStateException if a transaction is already active on this thread
   */
  public <T> T scopedTransaction(ScopedWork<T> work) {
    if (TransactionSynchronizationManager.isActualTransactionActive()) {
      throw new IllegalStateException("A scoped transaction is already active");
    }
    return transactionTemplate.execute(status -> work.execute(new StatusScope(status)));
  }

  private List<Project> unpack(List<Project> projects) {
    if (projects.isEmpty()) {
      return projects;
    }
    var projectIds = projects.stream().map(Project::getId).toList();

    Map<UUID, List<Metric>> metricsByProject =
        metricRepository.findByProjectIdInOrderBySortOrder(projectIds).stream()
            .collect(Collectors.groupingBy(Metric::getProjectId));
    var tasks = taskRepository.findByProjectIdIn(projectIds);
    Map<UUID, List<Task>> tasksByProject =
        tasks.stream().collect(Collectors.groupingBy(Task::getProjectId));

    if (!tasks.isEmpty()) {
      Map<UUID, List<DataPoint>> pointsByTask =
          dataPointRepository.findByTaskIdIn(tasks.stream().map(Task::getId).toList()).stream()
              .collect(Collectors.groupingBy(DataPoint::getTaskId));
      tasks.forEach(t -> t.attachDataPoints(pointsByTask.getOrDefault(t.getId(), List.of())));
    }

    for (var project : projects) {
      project.unpack(
          metricsByProject.getOrDefault(project.getId(), List.of()),
          tasksByProject.getOrDefault(project.getId(), List.of()));
    }
    return projects;
  }

  private static final class StatusScope implements TransactionScope {

    private final TransactionStatus status;

    private StatusScope(TransactionStatus status) {
      this.status = status;
    }

    @Override
    public void abort() {
      status.setRollbackOnly();
    }

    @Override
    public boolean isAborted() {
      return status.isRollbackOnly();
    }
  }
}
