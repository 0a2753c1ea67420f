package io.vitalconnect.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class OutcomeNotAllowedException extends ErrorResponseException {

  public OutcomeNotAllowedException(String currentStatus) {
    super(HttpStatus.BAD_REQUEST, createProblem(currentStatus), null);
  }

  private static ProblemDetail createProblem(String currentStatus) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Outcome not allowed");
    problem.setDetail(
        "Outcomes can only be registered for ACCEPTED or REFUSED occurrences, current status is "
            + currentStatus);
    return problem;
  }
}
