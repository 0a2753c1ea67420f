package io.vitalconnect.backend.occurrence;

import io.vitalconnect.backend.event.OccurrenceCreatedEvent;
import io.vitalconnect.backend.exception.ResourceNotFoundException;
import io.vitalconnect.backend.ingestion.RawDeathEvent;
import io.vitalconnect.backend.triage.TriageVerdict;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Creation and read access for occurrences. Status writes go through the lifecycle service. */
@Service
public class OccurrenceService {

  private static final Logger log = LoggerFactory.getLogger(OccurrenceService.class);

  private final OccurrenceRepository occurrenceRepository;
  private final OccurrenceHistoryRepository historyRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public OccurrenceService(
      OccurrenceRepository occurrenceRepository,
      OccurrenceHistoryRepository historyRepository,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.occurrenceRepository = occurrenceRepository;
    this.historyRepository = historyRepository;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public boolean existsForEvent(String sourceEventId) {
    return occurrenceRepository.existsBySourceEventId(sourceEventId);
  }

  /**
   * Creates the PENDING occurrence for an accepted death report and publishes {@link
   * OccurrenceCreatedEvent} for delivery after commit. A unique-key violation on the source event
   * id surfaces as a {@link org.springframework.dao.DataIntegrityViolationException}.
   */
  @Transactional
  public Occurrence createFromTriage(RawDeathEvent event, TriageVerdict verdict, int windowHours) {
    Instant now = clock.instant();
    var occurrence =
        new Occurrence(
            event.tenantId(),
            event.eventId(),
            event.hospitalId(),
            verdict.score(),
            PatientNameMasker.mask(event.patientName(), event.identityUnknown()),
            patientPayload(event),
            event.sector(),
            event.deathAt().toInstant(),
            event.windowExpiresAt(windowHours),
            now);
    occurrence = occurrenceRepository.saveAndFlush(occurrence);
    log.info(
        "Created occurrence {} for event {} hospital={} score={}",
        occurrence.getId(),
        event.eventId(),
        event.hospitalId(),
        occurrence.getPriorityScore());

    var details = new LinkedHashMap<String, Object>();
    details.put("sourceEventId", event.eventId());
    details.put("alerts", verdict.alerts());
    details.put("rulesApplied", verdict.rulesApplied());
    eventPublisher.publishEvent(
        new OccurrenceCreatedEvent(
            "occurrence.created",
            occurrence.getId(),
            occurrence.getHospitalId(),
            occurrence.getTenantId(),
            null,
            now,
            details,
            occurrence.getStatus().name(),
            occurrence.getSector(),
            occurrence.getMaskedPatientName(),
            occurrence.getPriorityScore(),
            occurrence.getDeathAt(),
            occurrence.getWindowExpiresAt()));
    return occurrence;
  }

  @Transactional(readOnly = true)
  public Occurrence getOccurrence(UUID id) {
    return occurrenceRepository
        .findById(id)
        .orElseThrow(() -> ResourceNotFoundException.occurrence(id));
  }

  @Transactional(readOnly = true)
  public List<OccurrenceHistory> getHistory(UUID occurrenceId) {
    if (!occurrenceRepository.existsById(occurrenceId)) {
      throw ResourceNotFoundException.occurrence(occurrenceId);
    }
    return historyRepository.findByOccurrenceIdOrderByCreatedAtAsc(occurrenceId);
  }

  /** Sets the notified-at stamp once; later calls leave it unchanged. */
  @Transactional
  public void markNotified(UUID occurrenceId) {
    occurrenceRepository
        .findByIdForUpdate(occurrenceId)
        .ifPresent(
            occurrence -> {
              if (occurrence.markNotified(clock.instant())) {
                occurrenceRepository.save(occurrence);
              }
            });
  }

  private static Map<String, Object> patientPayload(RawDeathEvent event) {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("eventId", event.eventId());
    payload.put("patientName", event.patientName());
    payload.put("birthDate", event.birthDate() != null ? event.birthDate().toString() : null);
    event.ageAtDeath().ifPresent(age -> payload.put("age", age));
    payload.put("deathAt", event.deathAt().toString());
    payload.put("detectedAt", event.detectedAt().toString());
    payload.put("causeOfDeath", event.causeOfDeath());
    payload.put("sector", event.sector());
    payload.put("bed", event.bed());
    payload.put("medicalRecord", event.medicalRecord());
    payload.put("identityUnknown", event.identityUnknown());
    payload.put("origin", event.origin().name());
    return payload;
  }
}
