package io.vitalconnect.backend.notification.live;

import io.vitalconnect.backend.event.OccurrenceCreatedEvent;
import io.vitalconnect.backend.event.OccurrenceOutcomeRegisteredEvent;
import io.vitalconnect.backend.event.OccurrenceStatusChangedEvent;
import io.vitalconnect.backend.hospital.HospitalDirectory;
import io.vitalconnect.backend.urgency.UrgencyClassifier;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Turns committed occurrence events into live dashboard messages. */
@Component
public class LiveEventFactory {

  private final HospitalDirectory hospitalDirectory;
  private final UrgencyClassifier urgencyClassifier;
  private final Clock clock;

  public LiveEventFactory(
      HospitalDirectory hospitalDirectory, UrgencyClassifier urgencyClassifier, Clock clock) {
    this.hospitalDirectory = hospitalDirectory;
    this.urgencyClassifier = urgencyClassifier;
    this.clock = clock;
  }

  public LiveEvent newOccurrence(OccurrenceCreatedEvent event) {
    Instant now = clock.instant();
    var payload = base(event.occurrenceId(), event.hospitalId());
    putIfPresent(payload, "sector", event.sector());
    putIfPresent(payload, "patientName", event.maskedPatientName());
    payload.put("priorityScore", event.priorityScore());
    payload.put("status", event.status());
    putTimes(payload, event.deathAt(), event.windowExpiresAt(), now);
    return LiveEvent.forHospital(LiveEventType.NEW_OCCURRENCE, event.hospitalId(), payload, now);
  }

  public LiveEvent occurrenceUpdated(OccurrenceStatusChangedEvent event) {
    Instant now = clock.instant();
    var payload = base(event.occurrenceId(), event.hospitalId());
    putIfPresent(payload, "sector", event.sector());
    putIfPresent(payload, "patientName", event.maskedPatientName());
    payload.put("priorityScore", event.priorityScore());
    payload.put("previousStatus", event.oldStatus());
    payload.put("status", event.newStatus());
    putIfPresent(payload, "actorId", event.actorId());
    putTimes(payload, event.deathAt(), event.windowExpiresAt(), now);
    return LiveEvent.forHospital(
        LiveEventType.OCCURRENCE_UPDATED, event.hospitalId(), payload, now);
  }

  public LiveEvent outcomeRegistered(OccurrenceOutcomeRegisteredEvent event) {
    Instant now = clock.instant();
    var payload = base(event.occurrenceId(), event.hospitalId());
    payload.put("outcome", event.outcome());
    payload.put("status", event.status());
    putIfPresent(payload, "actorId", event.actorId());
    return LiveEvent.forHospital(
        LiveEventType.OUTCOME_REGISTERED, event.hospitalId(), payload, now);
  }

  private Map<String, Object> base(UUID occurrenceId, UUID hospitalId) {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("occurrenceId", occurrenceId.toString());
    payload.put("hospitalId", hospitalId.toString());
    payload.put("hospitalName", hospitalDirectory.nameOf(hospitalId));
    return payload;
  }

  private void putTimes(
      Map<String, Object> payload, Instant deathAt, Instant windowExpiresAt, Instant now) {
    putIfPresent(payload, "deathAt", deathAt);
    payload.put("windowExpiresAt", windowExpiresAt.toString());
    payload.put("remainingTime", urgencyClassifier.formatRemaining(windowExpiresAt, now));
    payload.put("urgency", urgencyClassifier.classify(windowExpiresAt, now).code());
  }

  // Live payloads are immutable maps and cannot hold nulls.
  private static void putIfPresent(Map<String, Object> payload, String key, Object value) {
    if (value != null) {
      payload.put(key, value.toString());
    }
  }
}
