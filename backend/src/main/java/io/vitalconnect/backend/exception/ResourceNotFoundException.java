package io.vitalconnect.backend.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** 404 for an occurrence id the operator asked for that does not exist. */
public class ResourceNotFoundException extends ErrorResponseException {

  private final UUID resourceId;

  public ResourceNotFoundException(String resourceType, UUID resourceId) {
    super(HttpStatus.NOT_FOUND, problemFor(resourceType, resourceId), null);
    this.resourceId = resourceId;
  }

  public static ResourceNotFoundException occurrence(UUID occurrenceId) {
    return new ResourceNotFoundException("Occurrence", occurrenceId);
  }

  public UUID getResourceId() {
    return resourceId;
  }

  private static ProblemDetail problemFor(String resourceType, UUID resourceId) {
    var problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.NOT_FOUND,
            "No " + resourceType.toLowerCase() + " found with id " + resourceId);
    problem.setTitle(resourceType + " not found");
    problem.setProperty("resourceId", resourceId);
    return problem;
  }
}
