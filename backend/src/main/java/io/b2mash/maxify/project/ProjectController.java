package io.b2mash.maxify.project;

import io.b2mash.maxify.project.dto.ProjectResponse;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Project endpoints. Qualified names contain a {@code /}, so they are passed as the {@code name}
 * query parameter rather than as a path segment.
 */
@RestController
@RequestMapping("/api/projects")
public class ProjectController {

  private final ProjectStore projectStore;

  public ProjectController(ProjectStore projectStore) {
    this.projectStore = projectStore;
  }

  @GetMapping
  public ResponseEntity<List<ProjectResponse>> list() {
    return ResponseEntity.ok(projectStore.listAll().stream().map(ProjectResponse::from).toList());
  }

  @GetMapping("/names")
  public ResponseEntity<List<String>> matchingNames(
      @RequestParam(defaultValue = "") String prefix) {
    return ResponseEntity.ok(projectStore.matchingQualifiedNames(prefix));
  }

  @GetMapping("/lookup")
  public ResponseEntity<ProjectResponse> get(@RequestParam String name) {
    return ResponseEntity.ok(ProjectResponse.from(projectStore.requireByQualifiedName(name)));
  }

  @DeleteMapping
  public ResponseEntity<Void> delete(@RequestParam String name) {
    projectStore.delete(projectStore.requireByQualifiedName(name));
    return ResponseEntity.noContent().build();
  }
}
