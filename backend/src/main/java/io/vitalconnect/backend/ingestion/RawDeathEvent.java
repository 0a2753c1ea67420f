package io.vitalconnect.backend.ingestion;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * A death report as read from the detection stream, before triage.
 *
 * @param eventId external id of the report, the deduplication key
 * @param tenantId owning tenant; null when the feed does not carry one
 * @param hospitalId reporting hospital
 * @param patientName full patient name as reported
 * @param birthDate birth date; null when unknown
 * @param reportedAge age reported by the feed; only used when the birth date is missing
 * @param deathAt time of death
 * @param detectedAt time the report reached the pipeline
 * @param causeOfDeath free-text cause of death
 * @param sector hospital sector (ICU, emergency, ...)
 * @param bed bed identifier; nullable
 * @param medicalRecord medical record number; nullable
 * @param identityUnknown true when the patient could not be identified
 * @param origin where the report came from
 */
public record RawDeathEvent(
    String eventId,
    UUID tenantId,
    UUID hospitalId,
    String patientName,
    LocalDate birthDate,
    Integer reportedAge,
    OffsetDateTime deathAt,
    OffsetDateTime detectedAt,
    String causeOfDeath,
    String sector,
    String bed,
    String medicalRecord,
    boolean identityUnknown,
    EventOrigin origin) {

  public RawDeathEvent {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(hospitalId, "hospitalId");
    Objects.requireNonNull(deathAt, "deathAt");
    Objects.requireNonNull(detectedAt, "detectedAt");
    Objects.requireNonNull(causeOfDeath, "causeOfDeath");
    origin = origin != null ? origin : EventOrigin.EXTERNAL_FEED;
  }

  /**
   * Age in whole years at the time of death: the difference in calendar years, minus one when the
   * death falls earlier in the year than the birthday. Falls back to the reported age; empty when
   * neither is known.
   */
  public OptionalInt ageAtDeath() {
    if (birthDate != null) {
      LocalDate deathDate = deathAt.toLocalDate();
      int years = deathDate.getYear() - birthDate.getYear();
      if (deathDate.getDayOfYear() < birthDate.getDayOfYear()) {
        years--;
      }
      return OptionalInt.of(years);
    }
    return reportedAge != null ? OptionalInt.of(reportedAge) : OptionalInt.empty();
  }

  public Instant windowExpiresAt(int windowHours) {
    return deathAt.toInstant().plus(Duration.ofHours(windowHours));
  }
}
