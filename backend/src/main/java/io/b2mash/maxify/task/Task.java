package io.b2mash.maxify.task;

import io.b2mash.maxify.exception.ModelException;
import io.b2mash.maxify.metric.AggregationPolicy;
import io.b2mash.maxify.metric.Metric;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A unit of work inside a project, owning the data points recorded for it.
 *
 * <p>Every write validates the complete request before touching any state, so a rejected value
 * leaves both the data points and {@link #getLastUpdatedAt()} exactly as they were.
 */
@Entity
@Table(name = "tasks")
public class Task {

  @Id private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "name", nullable = false, length = 256)
  private String name;

  @Column(name = "description")
  private String description;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "last_updated_at", nullable = false)
  private Instant lastUpdatedAt;

  @Transient private List<DataPoint> dataPoints = new ArrayList<>();

  protected Task() {}

  public Task(UUID projectId, String name) {
    if (name == null || name.isBlank()) {
      throw new ModelException("Invalid task", "Task name must not be blank");
    }
    this.id = UUID.randomUUID();
    this.projectId = projectId;
    this.name = name;
    this.createdAt = Instant.now();
    this.lastUpdatedAt = this.createdAt;
  }

  /**
   * Records a value according to the metric's aggregation policy: accumulating scalars are added
   * to the current value, overwriting scalars are replaced and histogram metrics get a new entry.
   *
   * @param value the value in parsed form
   * @throws ModelException if the metric belongs to another project, the value has the wrong type
   *     or is not one of the metric's allowed values
   */
  public DataPoint record(Metric metric, Object value) {
    var write = plan(metric, value, metric.getAggregationPolicy());
    var dataPoint = apply(write);
    touch();
    return dataPoint;
  }

  /**
   * Records several values at once. All of them are validated before the first is applied.
   *
   * @see #record(Metric, Object)
   */
  public List<DataPoint> recordAll(Map<Metric, ?> values) {
    var writes = new ArrayList<PendingWrite>(values.size());
    for (var entry : values.entrySet()) {
      var metric = entry.getKey();
      writes.add(plan(metric, entry.getValue(), metric.getAggregationPolicy()));
    }

    var written = new ArrayList<DataPoint>(writes.size());
    for (var write : writes) {
      written.add(apply(write));
    }
    if (!written.isEmpty()) {
      touch();
    }
    return written;
  }

  /**
   * Replaces the current value of a scalar metric regardless of its aggregation policy.
   *
   * @throws ModelException for histogram metrics, whose entries are immutable
   */
  public DataPoint replace(Metric metric, Object value) {
    if (metric.getAggregationPolicy().isCumulative()) {
      throw new ModelException(
          "Unsupported operation",
          "Histogram metric " + metric.getName() + " cannot have its value replaced");
    }
    var write = plan(metric, value, AggregationPolicy.SCALAR_OVERWRITE);
    var dataPoint = apply(write);
    touch();
    return dataPoint;
  }

  /**
   * Total recorded for a metric. Scalar metrics yield their current value, or empty if nothing was
   * recorded. Histogram metrics yield the sum of their entries, which is zero when there are none.
   */
  public Optional<Object> total(Metric metric) {
    if (metric.getAggregationPolicy().isCumulative()) {
      var kind = metric.getValueKind();
      Object sum = kind.zero();
      for (var dataPoint : dataPoints(metric)) {
        sum = kind.add(sum, dataPoint.getValue());
      }
      return Optional.of(sum);
    }
    return dataPoint(metric).map(DataPoint::getValue);
  }

  /** The current value holder of a scalar metric. */
  public Optional<DataPoint> dataPoint(Metric metric) {
    return dataPoints.stream()
        .filter(dp -> dp.getMetricId().equals(metric.getId()) && !dp.isHistogramEntry())
        .findFirst();
  }

  public List<DataPoint> dataPoints(Metric metric) {
    return dataPoints.stream().filter(dp -> dp.getMetricId().equals(metric.getId())).toList();
  }

  public List<DataPoint> getDataPoints() {
    return List.copyOf(dataPoints);
  }

  /** Drops in-memory data points of a metric that is being removed from the project. */
  public void discardDataPoints(Metric metric) {
    dataPoints.removeIf(dp -> dp.getMetricId().equals(metric.getId()));
  }

  /** Attaches data points loaded from the store. */
  public void attachDataPoints(Collection<DataPoint> loaded) {
    this.dataPoints = new ArrayList<>(loaded);
  }

  public void updateDescription(String description) {
    this.description = description;
    touch();
  }

  private PendingWrite plan(Metric metric, Object value, AggregationPolicy policy) {
    if (metric.getProjectId() == null || !metric.getProjectId().equals(projectId)) {
      throw new ModelException(
          "Invalid metric reference",
          "Metric " + metric.getName() + " does not belong to the project of task " + name);
    }

    var kind = metric.getValueKind();
    Object parsed = kind.coerce(value);
    if (!metric.isAllowed(parsed)) {
      throw new ModelException(
          "Value not allowed",
          "Value "
              + kind.format(parsed)
              + " is not one of the allowed values of metric "
              + metric.getName());
    }

    return switch (policy) {
      case SCALAR_ACCUMULATE -> {
        var existing = dataPoint(metric).orElse(null);
        Object next = existing != null ? kind.add(existing.getValue(), parsed) : parsed;
        yield new PendingWrite(metric, existing, next, false);
      }
      case SCALAR_OVERWRITE -> new PendingWrite(metric, dataPoint(metric).orElse(null), parsed, false);
      case HISTOGRAM_APPEND -> new PendingWrite(metric, null, parsed, true);
    };
  }

  private DataPoint apply(PendingWrite write) {
    if (write.existing() != null) {
      write.existing().update(write.value());
      return write.existing();
    }
    var dataPoint =
        write.histogramEntry()
            ? DataPoint.histogramEntry(this, write.metric(), write.value())
            : DataPoint.scalar(this, write.metric(), write.value());
    dataPoints.add(dataPoint);
    return dataPoint;
  }

  private void touch() {
    var now = Instant.now();
    if (now.isAfter(lastUpdatedAt)) {
      this.lastUpdatedAt = now;
    }
  }

  private record PendingWrite(
      Metric metric, DataPoint existing, Object value, boolean histogramEntry) {}

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getLastUpdatedAt() {
    return lastUpdatedAt;
  }
}
