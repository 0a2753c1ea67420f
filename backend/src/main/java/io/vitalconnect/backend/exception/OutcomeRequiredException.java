package io.vitalconnect.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class OutcomeRequiredException extends ErrorResponseException {

  public OutcomeRequiredException(Object occurrenceId) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(occurrenceId), null);
  }

  private static ProblemDetail createProblem(Object occurrenceId) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Outcome required");
    problem.setDetail(
        "Occurrence " + occurrenceId + " needs a registered outcome before it can be concluded");
    return problem;
  }
}
