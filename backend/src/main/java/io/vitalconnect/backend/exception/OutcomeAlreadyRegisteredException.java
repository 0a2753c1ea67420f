package io.vitalconnect.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class OutcomeAlreadyRegisteredException extends ErrorResponseException {

  public OutcomeAlreadyRegisteredException(Object occurrenceId) {
    super(HttpStatus.CONFLICT, createProblem(occurrenceId), null);
  }

  private static ProblemDetail createProblem(Object occurrenceId) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Outcome already registered");
    problem.setDetail("Occurrence " + occurrenceId + " already has an outcome");
    return problem;
  }
}
