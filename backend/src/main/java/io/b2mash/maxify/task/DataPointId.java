package io.b2mash.maxify.task;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

/** Composite key of a {@link DataPoint}: task, metric and histogram entry. */
public class DataPointId implements Serializable {

  private UUID taskId;
  private UUID metricId;
  private UUID entryId;

  public DataPointId() {}

  public DataPointId(UUID taskId, UUID metricId, UUID entryId) {
    this.taskId = taskId;
    this.metricId = metricId;
    this.entryId = entryId;
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

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DataPointId other)) {
      return false;
    }
    return Objects.equals(taskId, other.taskId)
        && Objects.equals(metricId, other.metricId)
        && Objects.equals(entryId, other.entryId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(taskId, metricId, entryId);
  }
}
