package io.b2mash.maxify.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ProjectConflictException.class)
  public ResponseEntity<ProblemDetail> handleProjectConflict(ProjectConflictException ex) {
    log.warn("Import rejected, conflicting projects: {}", ex.getConflictingNames());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(ex.getBody());
  }

  @ExceptionHandler(ConfigException.class)
  public ResponseEntity<ProblemDetail> handleConfig(ConfigException ex) {
    log.warn("Configuration error: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(ex.getBody());
  }

  @ExceptionHandler(ValueParsingException.class)
  public ResponseEntity<ProblemDetail> handleParsing(ValueParsingException ex) {
    log.debug("Rejected value '{}': {}", ex.getInput(), ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ex.getBody());
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleDataIntegrity(DataIntegrityViolationException ex) {
    log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Data integrity violation");
    problem.setDetail("The change conflicts with data already in the store.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
