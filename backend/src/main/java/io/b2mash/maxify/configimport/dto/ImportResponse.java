package io.b2mash.maxify.configimport.dto;

import io.b2mash.maxify.configimport.ImportResult;
import io.b2mash.maxify.project.dto.ProjectResponse;
import java.util.List;

public record ImportResponse(List<ProjectResponse> projects, List<String> warnings) {

  public static ImportResponse from(ImportResult result) {
    return new ImportResponse(
        result.projects().stream().map(ProjectResponse::from).toList(), result.warnings());
  }
}
