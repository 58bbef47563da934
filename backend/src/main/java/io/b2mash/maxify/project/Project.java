package io.b2mash.maxify.project;

import io.b2mash.maxify.exception.ConfigException;
import io.b2mash.maxify.exception.ModelException;
import io.b2mash.maxify.metric.Metric;
import io.b2mash.maxify.task.DataPoint;
import io.b2mash.maxify.task.Task;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A named schema container that owns its metric definitions and the tasks recorded against them.
 *
 * <p>Only the project row itself is mapped by JPA. Metrics, tasks and their data points are held in
 * memory and are loaded and written together with the project by {@link ProjectStore}, which treats
 * the project as one aggregate.
 */
@Entity
@Table(name = "projects")
public class Project {

  @Id private UUID id;

  @Column(name = "name", nullable = false, length = 256)
  private String name;

  @Column(name = "organization", length = 100)
  private String organization;

  @Column(name = "description")
  private String description;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Transient private Map<String, Metric> metrics = new LinkedHashMap<>();

  @Transient private Map<String, Task> tasks = new LinkedHashMap<>();

  protected Project() {}

  public Project(String name) {
    this(name, null, null);
  }

  public Project(String name, String organization, String description) {
    requireValidPart("name", name);
    if (organization != null && !organization.isEmpty()) {
      requireValidPart("organization", organization);
    }
    this.id = UUID.randomUUID();
    this.name = name;
    this.organization = organization == null || organization.isEmpty() ? null : organization;
    this.description = description;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  /**
   * Adds a metric definition. Names are compared exactly, without case or punctuation
   * normalization.
   *
   * @throws ConfigException if a metric with the same name already exists; the project is left
   *     unchanged
   */
  public Metric addMetric(Metric metric) {
    if (metrics.containsKey(metric.getName())) {
      throw new ConfigException(
          "A metric named " + metric.getName() + " already exists in project " + getQualifiedName());
    }
    metric.bindTo(id, metrics.size());
    metrics.put(metric.getName(), metric);
    this.updatedAt = Instant.now();
    return metric;
  }

  /**
   * Looks a metric up by exact name first, then by its normalized form (lowercase, underscores as
   * spaces).
   */
  public Optional<Metric> metric(String lookupName) {
    if (lookupName == null) {
      return Optional.empty();
    }
    var exact = metrics.get(lookupName);
    if (exact != null) {
      return Optional.of(exact);
    }
    String normalized = Metric.normalizeName(lookupName);
    return metrics.values().stream()
        .filter(m -> Metric.normalizeName(m.getName()).equals(normalized))
        .findFirst();
  }

  /** Exact-name lookup, without the normalization {@link #metric(String)} applies. */
  public Optional<Metric> findMetric(String name) {
    return Optional.ofNullable(metrics.get(name));
  }

  /** Metrics in insertion order. */
  public List<Metric> getMetrics() {
    return List.copyOf(metrics.values());
  }

  /**
   * Removes a metric together with every data point recorded for it. Persist the removal with
   * {@link ProjectStore#deleteMetric(Project, String)}.
   */
  Optional<Metric> removeMetric(String name) {
    var removed = metrics.remove(name);
    if (removed != null) {
      tasks.values().forEach(t -> t.discardDataPoints(removed));
      this.updatedAt = Instant.now();
    }
    return Optional.ofNullable(removed);
  }

  /** Returns the task with the given name, creating it when it does not exist yet. */
  public Task task(String taskName) {
    var existing = tasks.get(taskName);
    if (existing != null) {
      return existing;
    }
    var task = new Task(id, taskName);
    tasks.put(taskName, task);
    return task;
  }

  public Optional<Task> findTask(String taskName) {
    return Optional.ofNullable(tasks.get(taskName));
  }

  public List<Task> getTasks() {
    return List.copyOf(tasks.values());
  }

  public String getQualifiedName() {
    return new QualifiedName(organization, name).toString();
  }

  public void updateDescription(String description) {
    this.description = description;
    this.updatedAt = Instant.now();
  }

  /** Lowercases name and organization, the identity fields, before the project is persisted. */
  void normalizeIdentity() {
    this.name = name.toLowerCase(Locale.ROOT);
    if (organization != null) {
      this.organization = organization.toLowerCase(Locale.ROOT);
    }
  }

  /** Attaches the persisted parts of the aggregate after the project row has been loaded. */
  void unpack(Collection<Metric> loadedMetrics, Collection<Task> loadedTasks) {
    this.metrics = new LinkedHashMap<>();
    loadedMetrics.forEach(m -> metrics.put(m.getName(), m));
    this.tasks = new LinkedHashMap<>();
    loadedTasks.forEach(t -> tasks.put(t.getName(), t));
  }

  /** All data points of all tasks, in task order. */
  List<DataPoint> allDataPoints() {
    return tasks.values().stream()
        .flatMap(t -> t.getDataPoints().stream())
        .collect(Collectors.toCollection(ArrayList::new));
  }

  private static void requireValidPart(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new ModelException("Invalid project", "Project " + field + " must not be blank");
    }
    if (value.contains(QualifiedName.SEPARATOR)) {
      throw new ModelException(
          "Invalid project",
          "Project " + field + " must not contain '" + QualifiedName.SEPARATOR + "': " + value);
    }
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getOrganization() {
    return organization;
  }

  public String getDescription() {
    return description;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
