package io.vitalconnect.backend.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.vitalconnect.backend.event.OccurrenceCreatedEvent;
import io.vitalconnect.backend.hospital.HospitalDirectory;
import io.vitalconnect.backend.identity.OperatorRole;
import io.vitalconnect.backend.notification.channel.NotificationDispatcher;
import io.vitalconnect.backend.occurrence.OccurrenceService;
import io.vitalconnect.backend.shift.OnDutyOperator;
import io.vitalconnect.backend.shift.OnDutyRoster;
import io.vitalconnect.backend.urgency.UrgencyClassifier;
import io.vitalconnect.backend.urgency.UrgencyLevel;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.QueryTimeoutException;

class AlertDispatchServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
  private static final Instant DEATH_AT = Instant.parse("2026-03-10T11:00:00Z");

  private NotificationDispatcher dispatcher;
  private OnDutyRoster roster;
  private NotificationRecordRepository recordRepository;
  private OccurrenceService occurrenceService;
  private AlertDispatchService service;

  @BeforeEach
  void setUp() {
    dispatcher = mock(NotificationDispatcher.class);
    roster = mock(OnDutyRoster.class);
    recordRepository = mock(NotificationRecordRepository.class);
    occurrenceService = mock(OccurrenceService.class);
    var hospitalDirectory = mock(HospitalDirectory.class);
    when(hospitalDirectory.nameOf(NotificationFixtures.HOSPITAL)).thenReturn("Hospital Central");
    var clock = Clock.fixed(NOW, ZoneOffset.UTC);
    service =
        new AlertDispatchService(
            dispatcher,
            roster,
            recordRepository,
            occurrenceService,
            hospitalDirectory,
            new UrgencyClassifier(clock),
            NotificationFixtures.properties(),
            clock);
  }

  @AfterEach
  void tearDown() {
    service.shutdown();
  }

  private static OccurrenceCreatedEvent created() {
    return new OccurrenceCreatedEvent(
        "occurrence.created",
        NotificationFixtures.OCCURRENCE,
        NotificationFixtures.HOSPITAL,
        null,
        null,
        DEATH_AT.plus(Duration.ofMinutes(20)),
        Map.of(),
        "PENDING",
        "UTI",
        "Maria S.",
        100,
        DEATH_AT,
        DEATH_AT.plus(Duration.ofHours(6)));
  }

  private static OnDutyOperator operator(String name) {
    return new OnDutyOperator(
        UUID.randomUUID(), name, name + "@hospital.org", null, OperatorRole.OPERATOR);
  }

  @Test
  void alertCarriesUrgencyRemainingTimeAndLink() {
    var alert = service.alertFor(created());

    assertThat(alert.hospitalName()).isEqualTo("Hospital Central");
    assertThat(alert.urgency()).isEqualTo(UrgencyLevel.GREEN);
    assertThat(alert.remainingMinutes()).isEqualTo(300);
    assertThat(alert.remainingText()).isEqualTo("5h");
    assertThat(alert.link())
        .isEqualTo(
            "http://localhost:3000/dashboard/occurrences?id=" + NotificationFixtures.OCCURRENCE);
  }

  @Test
  void dispatchRecordsDashboardAlertsEachOperatorAndMarksNotified() {
    var ana = operator("ana");
    var bia = operator("bia");
    when(roster.onDutyOperators(NotificationFixtures.HOSPITAL, DEATH_AT))
        .thenReturn(List.of(ana, bia));
    when(dispatcher.dispatch(any(), any())).thenReturn(List.of());

    service.dispatchNow(created());

    var saved = ArgumentCaptor.forClass(NotificationRecord.class);
    verify(recordRepository).save(saved.capture());
    assertThat(saved.getValue().getChannel()).isEqualTo(NotificationChannelType.DASHBOARD);
    assertThat(saved.getValue().getStatus()).isEqualTo(NotificationStatus.SENT);
    assertThat(saved.getValue().getTarget()).isEqualTo(AlertDispatchService.DASHBOARD_TARGET);
    verify(dispatcher).dispatch(any(), eq(ana));
    verify(dispatcher).dispatch(any(), eq(bia));
    verify(occurrenceService).markNotified(NotificationFixtures.OCCURRENCE);
  }

  @Test
  void nobodyOnDutyStillMarksNotified() {
    when(roster.onDutyOperators(any(), any())).thenReturn(List.of());

    service.dispatchNow(created());

    verify(dispatcher, never()).dispatch(any(), any());
    verify(occurrenceService).markNotified(NotificationFixtures.OCCURRENCE);
  }

  @Test
  void failingOperatorDoesNotStopAlertsToTheNext() {
    var ana = operator("ana");
    var bia = operator("bia");
    when(roster.onDutyOperators(NotificationFixtures.HOSPITAL, DEATH_AT))
        .thenReturn(List.of(ana, bia));
    when(dispatcher.dispatch(any(), eq(ana))).thenThrow(new QueryTimeoutException("db timeout"));
    when(dispatcher.dispatch(any(), eq(bia))).thenReturn(List.of());

    service.dispatchNow(created());

    verify(dispatcher).dispatch(any(), eq(bia));
    verify(occurrenceService).markNotified(NotificationFixtures.OCCURRENCE);
  }

  @Test
  void dashboardRecordFailureStillAlertsOperators() {
    var ana = operator("ana");
    when(recordRepository.save(any())).thenThrow(new QueryTimeoutException("db timeout"));
    when(roster.onDutyOperators(any(), any())).thenReturn(List.of(ana));
    when(dispatcher.dispatch(any(), any())).thenReturn(List.of());

    service.dispatchNow(created());

    verify(dispatcher).dispatch(any(), eq(ana));
    verify(occurrenceService).markNotified(NotificationFixtures.OCCURRENCE);
  }

  @Test
  void rosterFailureLeavesOccurrenceUnnotified() {
    when(roster.onDutyOperators(any(), any())).thenThrow(new QueryTimeoutException("db timeout"));

    service.dispatchNow(created());

    verify(dispatcher, never()).dispatch(any(), any());
    verify(occurrenceService, never()).markNotified(any());
  }
}
