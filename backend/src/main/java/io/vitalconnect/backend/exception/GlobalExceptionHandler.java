package io.vitalconnect.backend.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidTransitionException.class)
  public ResponseEntity<ProblemDetail> handleInvalidTransition(
      InvalidTransitionException ex, HttpServletRequest request) {
    log.info(
        "Rejected status change: path={}, from={}, to={}, allowed={}",
        request.getRequestURI(),
        ex.getCurrentStatus(),
        ex.getTargetStatus(),
        ex.getAllowedTargets());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ex.getBody());
  }

  @ExceptionHandler(UnauthenticatedException.class)
  public ResponseEntity<ProblemDetail> handleUnauthenticated(
      UnauthenticatedException ex, HttpServletRequest request) {
    log.warn(
        "Unauthenticated request: path={}, method={}",
        request.getRequestURI(),
        request.getMethod());
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ex.getBody());
  }

  @ExceptionHandler(PessimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handlePessimisticLock(
      PessimisticLockingFailureException ex) {
    log.warn("Lock acquisition failure: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail("Occurrence is being modified by another operator. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
