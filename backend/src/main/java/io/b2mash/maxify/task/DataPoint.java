package io.b2mash.maxify.task;

import io.b2mash.maxify.metric.Metric;
import io.b2mash.maxify.unit.ValueKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * One recorded value of a metric for a task.
 *
 * <p>Scalar values use {@link #SCALAR_ENTRY} as entry id, so the primary key {@code (task, metric,
 * entry)} allows at most one current value per task and metric. Histogram entries get a random
 * entry id each, which lets any number of them coexist.
 */
@Entity
@Table(name = "data_points")
@IdClass(DataPointId.class)
public class DataPoint {

  public static final UUID SCALAR_ENTRY = new UUID(0L, 0L);

  @Id
  @Column(name = "task_id")
  private UUID taskId;

  @Id
  @Column(name = "metric_id")
  private UUID metricId;

  @Id
  @Column(name = "entry_id")
  private UUID entryId;

  @Enumerated(EnumType.STRING)
  @Column(name = "value_kind", nullable = false, length = 20)
  private ValueKind valueKind;

  @Column(name = "value_text", nullable = false)
  private String encodedValue;

  @Column(name = "recorded_at", nullable = false)
  private Instant timestamp;

  protected DataPoint() {}

  private DataPoint(UUID taskId, Metric metric, UUID entryId, Object value) {
    this.taskId = taskId;
    this.metricId = metric.getId();
    this.entryId = entryId;
    this.valueKind = metric.getValueKind();
    this.encodedValue = valueKind.encode(value);
    this.timestamp = Instant.now();
  }

  static DataPoint scalar(Task task, Metric metric, Object value) {
    return new DataPoint(task.getId(), metric, SCALAR_ENTRY, value);
  }

  static DataPoint histogramEntry(Task task, Metric metric, Object value) {
    return new DataPoint(task.getId(), metric, UUID.randomUUID(), value);
  }

  void update(Object value) {
    this.encodedValue = valueKind.encode(value);
    this.timestamp = Instant.now();
  }

  public boolean isHistogramEntry() {
    return !SCALAR_ENTRY.equals(entryId);
  }

  public UUID getTaskId() {
    return taskId;
  }

  public UUID getMetricId() {
    return metricId;
  }

  public UUID getEntryId() {
    return entryId;
  }

  public ValueKind getValueKind() {
    return valueKind;
  }

  /** The value in parsed form. */
  public Object getValue() {
    return valueKind.decode(encodedValue);
  }

  public Instant getTimestamp() {
    return timestamp;
  }
}
