package io.pipetrak.progress.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvariantViolationException.class)
  public ResponseEntity<ProblemDetail> handleInvariantViolation(InvariantViolationException ex) {
    log.error(
        "Data integrity alert: item={}, earnedHours={}, categorySum={}",
        ex.getItemId(),
        ex.getEarnedHours(),
        ex.getCategorySum());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ex.getBody());
  }

  @ExceptionHandler(SchemaInvalidException.class)
  public ResponseEntity<ProblemDetail> handleSchemaInvalid(SchemaInvalidException ex) {
    log.warn(
        "Rejected milestone schedule: project={}, itemType={}, weightSum={}",
        ex.getProjectId(),
        ex.getItemType(),
        ex.getWeightSum());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(ex.getBody());
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail("Resource was modified concurrently. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
