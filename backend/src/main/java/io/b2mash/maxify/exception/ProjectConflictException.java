package io.b2mash.maxify.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when incoming projects collide with projects that already exist in the store. Carries
 * every conflicting qualified name so the caller can retry with a different import strategy.
 */
public class ProjectConflictException extends ErrorResponseException {

  private final List<String> conflictingNames;

  public ProjectConflictException(List<String> conflictingNames) {
    super(HttpStatus.CONFLICT, createProblem(conflictingNames), null);
    this.conflictingNames = List.copyOf(conflictingNames);
  }

  public List<String> getConflictingNames() {
    return conflictingNames;
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(List<String> conflictingNames) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Project conflict");
    problem.setDetail("Projects already exist: " + String.join(", ", conflictingNames));
    problem.setProperty("conflictingNames", conflictingNames);
    return problem;
  }
}
