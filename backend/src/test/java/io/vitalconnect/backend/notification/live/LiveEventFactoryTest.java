package io.vitalconnect.backend.notification.live;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.vitalconnect.backend.event.OccurrenceCreatedEvent;
import io.vitalconnect.backend.event.OccurrenceOutcomeRegisteredEvent;
import io.vitalconnect.backend.event.OccurrenceStatusChangedEvent;
import io.vitalconnect.backend.hospital.HospitalDirectory;
import io.vitalconnect.backend.urgency.UrgencyClassifier;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LiveEventFactoryTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
  private static final Instant DEATH_AT = Instant.parse("2026-03-10T07:30:00Z");
  private static final UUID HOSPITAL = UUID.randomUUID();
  private static final UUID OCCURRENCE = UUID.randomUUID();

  private LiveEventFactory factory;

  @BeforeEach
  void setUp() {
    var directory = mock(HospitalDirectory.class);
    when(directory.nameOf(HOSPITAL)).thenReturn("Hospital Central");
    var clock = Clock.fixed(NOW, ZoneOffset.UTC);
    factory = new LiveEventFactory(directory, new UrgencyClassifier(clock), clock);
  }

  @Test
  void newOccurrencePayloadCarriesUrgency() {
    var event =
        factory.newOccurrence(
            new OccurrenceCreatedEvent(
                "occurrence.created",
                OCCURRENCE,
                HOSPITAL,
                null,
                null,
                DEATH_AT,
                Map.of(),
                "PENDING",
                null,
                "Maria S.",
                50,
                DEATH_AT,
                DEATH_AT.plus(Duration.ofHours(6))));

    assertThat(event.type()).isEqualTo(LiveEventType.NEW_OCCURRENCE);
    assertThat(event.hospitalId()).isEqualTo(HOSPITAL);
    assertThat(event.payload())
        .containsEntry("occurrenceId", OCCURRENCE.toString())
        .containsEntry("hospitalName", "Hospital Central")
        .containsEntry("remainingTime", "1h 30min")
        .containsEntry("urgency", "red")
        .containsEntry("status", "PENDING")
        .doesNotContainKey("sector");
  }

  @Test
  void statusChangePayloadCarriesBothStatuses() {
    var actor = UUID.randomUUID();

    var event =
        factory.occurrenceUpdated(
            new OccurrenceStatusChangedEvent(
                "occurrence.status_changed",
                OCCURRENCE,
                HOSPITAL,
                null,
                actor,
                NOW,
                Map.of(),
                "PENDING",
                "IN_PROGRESS",
                "UTI",
                "Maria S.",
                100,
                DEATH_AT,
                DEATH_AT.plus(Duration.ofHours(6))));

    assertThat(event.type()).isEqualTo(LiveEventType.OCCURRENCE_UPDATED);
    assertThat(event.payload())
        .containsEntry("previousStatus", "PENDING")
        .containsEntry("status", "IN_PROGRESS")
        .containsEntry("actorId", actor.toString())
        .containsEntry("sector", "UTI");
  }

  @Test
  void outcomePayloadHasNoTimes() {
    var event =
        factory.outcomeRegistered(
            new OccurrenceOutcomeRegisteredEvent(
                "occurrence.outcome_registered",
                OCCURRENCE,
                HOSPITAL,
                null,
                null,
                NOW,
                Map.of(),
                "FAMILY_REFUSED",
                "REFUSED",
                DEATH_AT.plus(Duration.ofHours(6))));

    assertThat(event.type()).isEqualTo(LiveEventType.OUTCOME_REGISTERED);
    assertThat(event.payload())
        .containsEntry("outcome", "FAMILY_REFUSED")
        .containsEntry("status", "REFUSED")
        .doesNotContainKeys("actorId", "remainingTime");
  }
}
