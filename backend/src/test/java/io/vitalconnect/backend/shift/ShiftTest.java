package io.vitalconnect.backend.shift;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ShiftTest {

  private static final int FRIDAY = Shift.dayIndex(DayOfWeek.FRIDAY);
  private static final int SATURDAY = Shift.dayIndex(DayOfWeek.SATURDAY);

  private static Shift shift(int day, String start, String end) {
    return new Shift(
        UUID.randomUUID(),
        UUID.randomUUID(),
        UUID.randomUUID(),
        day,
        LocalTime.parse(start),
        LocalTime.parse(end));
  }

  @Test
  void dayIndexStartsOnSunday() {
    assertThat(Shift.dayIndex(DayOfWeek.SUNDAY)).isZero();
    assertThat(Shift.dayIndex(DayOfWeek.MONDAY)).isEqualTo(1);
    assertThat(Shift.dayIndex(DayOfWeek.SATURDAY)).isEqualTo(6);
  }

  @Test
  void daytimeShiftCoversHalfOpenInterval() {
    var shift = shift(FRIDAY, "08:00", "14:00");

    assertThat(shift.isOvernight()).isFalse();
    assertThat(shift.covers(FRIDAY, LocalTime.of(8, 0))).isTrue();
    assertThat(shift.covers(FRIDAY, LocalTime.of(13, 59))).isTrue();
    assertThat(shift.covers(FRIDAY, LocalTime.of(14, 0))).isFalse();
    assertThat(shift.covers(SATURDAY, LocalTime.of(9, 0))).isFalse();
  }

  @Test
  void overnightShiftCoversEarlyHoursOfNextDay() {
    var shift = shift(FRIDAY, "22:00", "06:00");

    assertThat(shift.isOvernight()).isTrue();
    assertThat(shift.covers(FRIDAY, LocalTime.of(23, 30))).isTrue();
    assertThat(shift.covers(SATURDAY, LocalTime.of(3, 0))).isTrue();
    assertThat(shift.covers(SATURDAY, LocalTime.of(7, 0))).isFalse();
    assertThat(shift.covers(FRIDAY, LocalTime.of(3, 0))).isFalse();
  }

  @Test
  void saturdayNightShiftWrapsIntoSunday() {
    var shift = shift(SATURDAY, "20:00", "02:00");

    assertThat(shift.covers(Shift.dayIndex(DayOfWeek.SUNDAY), LocalTime.of(1, 0))).isTrue();
  }
}
