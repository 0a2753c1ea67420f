package io.vitalconnect.backend.notification;

import io.vitalconnect.backend.urgency.UrgencyLevel;
import java.time.Instant;
import java.util.UUID;

/** What operators are told about a newly eligible occurrence, on every channel. */
public record OccurrenceAlert(
    UUID occurrenceId,
    UUID hospitalId,
    String hospitalName,
    String sector,
    String maskedPatientName,
    int priorityScore,
    Instant deathAt,
    Instant windowExpiresAt,
    UrgencyLevel urgency,
    long remainingMinutes,
    String remainingText,
    String link) {

  /** Whole hours left in the capture window, never negative. */
  public long remainingHours() {
    return Math.max(0, remainingMinutes / 60);
  }

  public String sectorOrUnknown() {
    return sector != null && !sector.isBlank() ? sector : "Nao informado";
  }
}
