package io.vitalconnect.backend.occurrence;

import io.vitalconnect.backend.audit.AuditEventBuilder;
import io.vitalconnect.backend.audit.AuditService;
import io.vitalconnect.backend.event.OccurrenceOutcomeRegisteredEvent;
import io.vitalconnect.backend.event.OccurrenceStatusChangedEvent;
import io.vitalconnect.backend.exception.InvalidTransitionException;
import io.vitalconnect.backend.exception.OutcomeAlreadyRegisteredException;
import io.vitalconnect.backend.exception.OutcomeNotAllowedException;
import io.vitalconnect.backend.exception.OutcomeRequiredException;
import io.vitalconnect.backend.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * The only writer of occurrence status and outcome. Each write locks the occurrence row for the
 * duration of its transaction, so writes to one occurrence are serialized and its events are
 * published in transition order.
 *
 * <p>Transition history rows are appended after the status commit and may be lost without failing
 * the transition. Outcome history rows are written in the same transaction as the outcome.
 */
@Service
public class OccurrenceLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(OccurrenceLifecycleService.class);

  private final OccurrenceRepository occurrenceRepository;
  private final OccurrenceHistoryRepository historyRepository;
  private final OccurrenceHistoryRecorder historyRecorder;
  private final ApplicationEventPublisher eventPublisher;
  private final AuditService auditService;
  private final TransactionTemplate txTemplate;
  private final Clock clock;

  public OccurrenceLifecycleService(
      OccurrenceRepository occurrenceRepository,
      OccurrenceHistoryRepository historyRepository,
      OccurrenceHistoryRecorder historyRecorder,
      ApplicationEventPublisher eventPublisher,
      AuditService auditService,
      PlatformTransactionManager txManager,
      Clock clock) {
    this.occurrenceRepository = occurrenceRepository;
    this.historyRepository = historyRepository;
    this.historyRecorder = historyRecorder;
    this.eventPublisher = eventPublisher;
    this.auditService = auditService;
    this.txTemplate = new TransactionTemplate(txManager);
    this.clock = clock;
  }

  public Occurrence transition(
      UUID occurrenceId, OccurrenceStatus target, UUID actorId, String notes) {
    var applied =
        txTemplate.execute(
            tx -> {
              var occurrence = lockOccurrence(occurrenceId);
              var current = occurrence.getStatus();
              if (!current.canTransitionTo(target)) {
                throw new InvalidTransitionException(
                    current.name(), target.name(), current.allowedTargetNames());
              }
              if (target == OccurrenceStatus.CONCLUDED && !occurrence.hasOutcome()) {
                throw new OutcomeRequiredException(occurrenceId);
              }
              Instant now = clock.instant();
              occurrence.changeStatus(target, now);
              occurrenceRepository.save(occurrence);
              eventPublisher.publishEvent(
                  new OccurrenceStatusChangedEvent(
                      "occurrence.status_changed",
                      occurrence.getId(),
                      occurrence.getHospitalId(),
                      occurrence.getTenantId(),
                      actorId,
                      now,
                      notes != null ? Map.of("notes", notes) : Map.of(),
                      current.name(),
                      target.name(),
                      occurrence.getSector(),
                      occurrence.getMaskedPatientName(),
                      occurrence.getPriorityScore(),
                      occurrence.getDeathAt(),
                      occurrence.getWindowExpiresAt()));
              return new AppliedTransition(occurrence, current, now);
            });

    log.info(
        "Occurrence {} moved {} -> {} by {}", occurrenceId, applied.previous(), target, actorId);
    historyRecorder.append(
        OccurrenceHistory.transition(
            occurrenceId, actorId, applied.previous(), target, notes, applied.at()));
    auditService.log(
        AuditEventBuilder.forOccurrence("status_changed", occurrenceId)
            .actorId(actorId)
            .detail("from", applied.previous().name())
            .detail("to", target.name())
            .build());
    return applied.occurrence();
  }

  public Occurrence registerOutcome(
      UUID occurrenceId, OutcomeType outcome, UUID actorId, String notes) {
    var occurrence =
        txTemplate.execute(
            tx -> {
              var locked = lockOccurrence(occurrenceId);
              var current = locked.getStatus();
              if (current.isTerminal()) {
                throw new InvalidTransitionException(current.name(), current.name(), List.of());
              }
              if (!current.acceptsOutcome()) {
                throw new OutcomeNotAllowedException(current.name());
              }
              if (locked.hasOutcome()) {
                throw new OutcomeAlreadyRegisteredException(occurrenceId);
              }
              Instant now = clock.instant();
              locked.recordOutcome(outcome, now);
              occurrenceRepository.save(locked);
              historyRepository.save(
                  OccurrenceHistory.outcome(occurrenceId, actorId, current, outcome, notes, now));
              eventPublisher.publishEvent(
                  new OccurrenceOutcomeRegisteredEvent(
                      "occurrence.outcome_registered",
                      locked.getId(),
                      locked.getHospitalId(),
                      locked.getTenantId(),
                      actorId,
                      now,
                      notes != null ? Map.of("notes", notes) : Map.of(),
                      outcome.name(),
                      current.name(),
                      locked.getWindowExpiresAt()));
              return locked;
            });

    log.info("Outcome {} registered for occurrence {} by {}", outcome, occurrenceId, actorId);
    auditService.log(
        AuditEventBuilder.forOccurrence("outcome_registered", occurrenceId)
            .actorId(actorId)
            .detail("outcome", outcome.name())
            .build());
    return occurrence;
  }

  private Occurrence lockOccurrence(UUID occurrenceId) {
    return occurrenceRepository
        .findByIdForUpdate(occurrenceId)
        .orElseThrow(() -> ResourceNotFoundException.occurrence(occurrenceId));
  }

  private record AppliedTransition(Occurrence occurrence, OccurrenceStatus previous, Instant at) {}
}
