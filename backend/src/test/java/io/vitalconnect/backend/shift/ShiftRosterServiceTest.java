package io.vitalconnect.backend.shift;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.vitalconnect.backend.identity.OperatorRole;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ShiftRosterServiceTest {

  private static final UUID HOSPITAL = UUID.randomUUID();
  // Saturday
  private static final Instant SATURDAY_3AM = Instant.parse("2026-03-14T03:00:00Z");

  private ShiftRepository shiftRepository;
  private OperatorRepository operatorRepository;
  private ShiftRosterService roster;

  @BeforeEach
  void setUp() {
    shiftRepository = mock(ShiftRepository.class);
    operatorRepository = mock(OperatorRepository.class);
    roster =
        new ShiftRosterService(shiftRepository, operatorRepository, "UTC", Duration.ofMinutes(5));
  }

  private static Operator operator(OperatorRole role, boolean active) {
    return new Operator(
        UUID.randomUUID(), "op@hospital.org", "Operador", role, active, "+5511999990000");
  }

  @Test
  void returnsActiveOperatorsOnOvernightShift() {
    var onShift = operator(OperatorRole.OPERATOR, true);
    var inactive = operator(OperatorRole.OPERATOR, false);
    when(shiftRepository.findByHospitalIdAndDayOfWeekIn(eq(HOSPITAL), anyCollection()))
        .thenReturn(
            List.of(
                new Shift(
                    UUID.randomUUID(),
                    HOSPITAL,
                    onShift.getId(),
                    5,
                    LocalTime.of(22, 0),
                    LocalTime.of(6, 0)),
                new Shift(
                    UUID.randomUUID(),
                    HOSPITAL,
                    inactive.getId(),
                    6,
                    LocalTime.of(0, 0),
                    LocalTime.of(12, 0))));
    when(operatorRepository.findAllById(any())).thenReturn(List.of(onShift, inactive));

    var result = roster.onDutyOperators(HOSPITAL, SATURDAY_3AM);

    assertThat(result).extracting(OnDutyOperator::userId).containsExactly(onShift.getId());
    verify(operatorRepository, never()).findActiveManagersByHospitalId(any());
  }

  @Test
  void fallsBackToManagersWhenNobodyIsOnShift() {
    var manager = operator(OperatorRole.MANAGER, true);
    when(shiftRepository.findByHospitalIdAndDayOfWeekIn(eq(HOSPITAL), anyCollection()))
        .thenReturn(List.of());
    when(operatorRepository.findAllById(any())).thenReturn(List.of());
    when(operatorRepository.findActiveManagersByHospitalId(HOSPITAL)).thenReturn(List.of(manager));

    var result = roster.onDutyOperators(HOSPITAL, SATURDAY_3AM);

    assertThat(result).extracting(OnDutyOperator::role).containsExactly(OperatorRole.MANAGER);
  }

  @Test
  void cachesLookupsPerHospitalAndMinute() {
    when(shiftRepository.findByHospitalIdAndDayOfWeekIn(eq(HOSPITAL), anyCollection()))
        .thenReturn(List.of());
    when(operatorRepository.findAllById(any())).thenReturn(List.of());
    when(operatorRepository.findActiveManagersByHospitalId(HOSPITAL)).thenReturn(List.of());

    roster.onDutyOperators(HOSPITAL, SATURDAY_3AM);
    roster.onDutyOperators(HOSPITAL, SATURDAY_3AM.plusSeconds(30));
    roster.onDutyOperators(HOSPITAL, SATURDAY_3AM.plusSeconds(60));

    verify(shiftRepository, times(2)).findByHospitalIdAndDayOfWeekIn(eq(HOSPITAL), anyCollection());

    roster.invalidateAll();
    roster.onDutyOperators(HOSPITAL, SATURDAY_3AM);

    verify(shiftRepository, times(3)).findByHospitalIdAndDayOfWeekIn(eq(HOSPITAL), anyCollection());
  }
}
