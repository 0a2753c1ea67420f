package io.vitalconnect.backend.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A status change the transition table does not allow. The problem body carries the current
 * status, the requested target and the targets that are allowed from the current status (empty
 * for terminal statuses).
 */
public class InvalidTransitionException extends ErrorResponseException {

  private final String currentStatus;
  private final String targetStatus;
  private final List<String> allowedTargets;

  public InvalidTransitionException(
      String currentStatus, String targetStatus, List<String> allowedTargets) {
    super(
        HttpStatus.BAD_REQUEST,
        createProblem(currentStatus, targetStatus, allowedTargets),
        null);
    this.currentStatus = currentStatus;
    this.targetStatus = targetStatus;
    this.allowedTargets = List.copyOf(allowedTargets);
  }

  public String getCurrentStatus() {
    return currentStatus;
  }

  public String getTargetStatus() {
    return targetStatus;
  }

  public List<String> getAllowedTargets() {
    return allowedTargets;
  }

  private static ProblemDetail createProblem(
      String currentStatus, String targetStatus, List<String> allowedTargets) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid status transition");
    problem.setDetail(
        allowedTargets.isEmpty()
            ? "Occurrence is in terminal status " + currentStatus + " and cannot change"
            : "Cannot change status from " + currentStatus + " to " + targetStatus);
    problem.setProperty("currentStatus", currentStatus);
    problem.setProperty("targetStatus", targetStatus);
    problem.setProperty("allowedTransitions", List.copyOf(allowedTargets));
    return problem;
  }
}
