package io.vitalconnect.backend.occurrence;

import io.vitalconnect.backend.identity.OperatorIdentityResolver;
import io.vitalconnect.backend.urgency.UrgencyClassifier;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/occurrences")
public class OccurrenceController {

  private final OccurrenceService occurrenceService;
  private final OccurrenceLifecycleService lifecycleService;
  private final UrgencyClassifier urgencyClassifier;
  private final OperatorIdentityResolver identityResolver;
  private final Clock clock;

  public OccurrenceController(
      OccurrenceService occurrenceService,
      OccurrenceLifecycleService lifecycleService,
      UrgencyClassifier urgencyClassifier,
      OperatorIdentityResolver identityResolver,
      Clock clock) {
    this.occurrenceService = occurrenceService;
    this.lifecycleService = lifecycleService;
    this.urgencyClassifier = urgencyClassifier;
    this.identityResolver = identityResolver;
    this.clock = clock;
  }

  @GetMapping("/{id}")
  public ResponseEntity<OccurrenceResponse> getOccurrence(@PathVariable UUID id) {
    return ResponseEntity.ok(toResponse(occurrenceService.getOccurrence(id)));
  }

  @GetMapping("/{id}/history")
  public ResponseEntity<List<HistoryResponse>> getHistory(@PathVariable UUID id) {
    return ResponseEntity.ok(
        occurrenceService.getHistory(id).stream().map(HistoryResponse::from).toList());
  }

  @PatchMapping("/{id}/status")
  public ResponseEntity<OccurrenceResponse> changeStatus(
      @PathVariable UUID id,
      @Valid @RequestBody StatusChangeRequest request,
      HttpServletRequest httpRequest) {
    var operator = identityResolver.require(httpRequest);
    var occurrence =
        lifecycleService.transition(id, request.status(), operator.userId(), request.notes());
    return ResponseEntity.ok(toResponse(occurrence));
  }

  @PostMapping("/{id}/outcome")
  public ResponseEntity<OccurrenceResponse> registerOutcome(
      @PathVariable UUID id,
      @Valid @RequestBody OutcomeRequest request,
      HttpServletRequest httpRequest) {
    var operator = identityResolver.require(httpRequest);
    var occurrence =
        lifecycleService.registerOutcome(id, request.outcome(), operator.userId(), request.notes());
    return ResponseEntity.ok(toResponse(occurrence));
  }

  private OccurrenceResponse toResponse(Occurrence occurrence) {
    Instant now = clock.instant();
    return new OccurrenceResponse(
        occurrence.getId(),
        occurrence.getHospitalId(),
        occurrence.getStatus(),
        occurrence.getPriorityScore(),
        occurrence.getMaskedPatientName(),
        occurrence.getSector(),
        occurrence.getDeathAt(),
        occurrence.getWindowExpiresAt(),
        occurrence.getOutcome(),
        occurrence.getNotifiedAt(),
        urgencyClassifier.classify(occurrence.getWindowExpiresAt(), now).name(),
        urgencyClassifier.formatRemaining(occurrence.getWindowExpiresAt(), now),
        occurrence.getStatus().allowedTargetNames(),
        occurrence.getCreatedAt());
  }

  // --- DTOs ---

  public record StatusChangeRequest(
      @NotNull(message = "status is required") OccurrenceStatus status,
      @Size(max = 2000) String notes) {}

  public record OutcomeRequest(
      @NotNull(message = "outcome is required") OutcomeType outcome,
      @Size(max = 2000) String notes) {}

  public record OccurrenceResponse(
      UUID id,
      UUID hospitalId,
      OccurrenceStatus status,
      int priorityScore,
      String maskedPatientName,
      String sector,
      Instant deathAt,
      Instant windowExpiresAt,
      OutcomeType outcome,
      Instant notifiedAt,
      String urgency,
      String remainingTime,
      List<String> allowedTransitions,
      Instant createdAt) {}

  public record HistoryResponse(
      UUID id,
      UUID actorId,
      String action,
      OccurrenceStatus previousStatus,
      OccurrenceStatus newStatus,
      String notes,
      OutcomeType outcome,
      Instant createdAt) {

    public static HistoryResponse from(OccurrenceHistory history) {
      return new HistoryResponse(
          history.getId(),
          history.getActorId(),
          history.getAction(),
          history.getPreviousStatus(),
          history.getNewStatus(),
          history.getNotes(),
          history.getOutcome(),
          history.getCreatedAt());
    }
  }
}
