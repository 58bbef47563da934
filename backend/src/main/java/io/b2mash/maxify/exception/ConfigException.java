package io.b2mash.maxify.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Raised when a project definition source is unreadable or structurally invalid. */
public class ConfigException extends ErrorResponseException {

  public ConfigException(String detail) {
    this(detail, null);
  }

  public ConfigException(String detail, Throwable cause) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(detail), cause);
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Invalid configuration");
    problem.setDetail(detail);
    return problem;
  }
}
