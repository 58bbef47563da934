package io.b2mash.maxify.task;

import io.b2mash.maxify.task.dto.RecordValuesRequest;
import io.b2mash.maxify.task.dto.TaskResponse;
import io.b2mash.maxify.task.dto.TaskSummaryResponse;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

  private final TaskService taskService;

  public TaskController(TaskService taskService) {
    this.taskService = taskService;
  }

  @GetMapping
  public ResponseEntity<List<TaskSummaryResponse>> listTasks(
      @RequestParam String project, @RequestParam(required = false) String pattern) {
    return ResponseEntity.ok(
        taskService.listTasks(project, pattern).stream().map(TaskSummaryResponse::from).toList());
  }

  @GetMapping("/{task}")
  public ResponseEntity<TaskResponse> getTask(
      @PathVariable("task") String taskName, @RequestParam String project) {
    return ResponseEntity.ok(TaskResponse.from(taskService.getTask(project, taskName)));
  }

  @PostMapping("/{task}/values")
  public ResponseEntity<TaskResponse> recordValues(
      @PathVariable("task") String taskName,
      @RequestParam String project,
      @Valid @RequestBody RecordValuesRequest request) {
    var view = taskService.recordValues(project, taskName, request.description(), request.values());
    return ResponseEntity.ok(TaskResponse.from(view));
  }
}
