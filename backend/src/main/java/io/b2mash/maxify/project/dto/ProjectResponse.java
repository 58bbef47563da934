package io.b2mash.maxify.project.dto;

import io.b2mash.maxify.metric.dto.MetricResponse;
import io.b2mash.maxify.project.Project;
import java.time.Instant;
import java.util.List;

public record ProjectResponse(
    String qualifiedName,
    String name,
    String organization,
    String description,
    List<MetricResponse> metrics,
    int taskCount,
    Instant createdAt,
    Instant updatedAt) {

  public static ProjectResponse from(Project project) {
    return new ProjectResponse(
        project.getQualifiedName(),
        project.getName(),
        project.getOrganization(),
        project.getDescription(),
        project.getMetrics().stream().map(MetricResponse::from).toList(),
        project.getTasks().size(),
        project.getCreatedAt(),
        project.getUpdatedAt());
  }
}
