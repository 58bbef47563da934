package io.b2mash.maxify.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when user or config supplied text does not match the grammar of its value kind. Local to
 * one value: the caller decides whether to retry, skip or abort.
 */
public class ValueParsingException extends ErrorResponseException {

  private final String input;

  public ValueParsingException(String detail, String input) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail, input), null);
    this.input = input;
  }

  public String getInput() {
    return input;
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(String detail, String input) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid value");
    problem.setDetail(detail);
    problem.setProperty("input", input);
    return problem;
  }
}
