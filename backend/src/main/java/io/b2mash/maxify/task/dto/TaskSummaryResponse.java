package io.b2mash.maxify.task.dto;

import io.b2mash.maxify.task.Task;
import java.time.Instant;

public record TaskSummaryResponse(String name, String description, Instant lastUpdatedAt) {

  public static TaskSummaryResponse from(Task task) {
    return new TaskSummaryResponse(task.getName(), task.getDescription(), task.getLastUpdatedAt());
  }
}
