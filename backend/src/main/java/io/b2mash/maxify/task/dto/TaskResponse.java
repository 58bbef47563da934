package io.b2mash.maxify.task.dto;

import io.b2mash.maxify.task.TaskService.TaskView;
import java.time.Instant;
import java.util.Map;

public record TaskResponse(
    String name,
    String description,
    Instant createdAt,
    Instant lastUpdatedAt,
    Map<String, String> totals) {

  public static TaskResponse from(TaskView view) {
    var task = view.task();
    return new TaskResponse(
        task.getName(),
        task.getDescription(),
        task.getCreatedAt(),
        task.getLastUpdatedAt(),
        view.formattedTotals());
  }
}
