package io.vitalconnect.backend.shift;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * Weekly duty slot of an operator at a hospital. {@code dayOfWeek} follows the 0 = Sunday
 * convention of the scheduling data; a slot whose end is before its start runs past midnight.
 */
@Entity
@Immutable
@Table(name = "shifts")
public class Shift {

  @Id private UUID id;

  @Column(name = "hospital_id", nullable = false)
  private UUID hospitalId;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "day_of_week", nullable = false)
  private int dayOfWeek;

  @Column(name = "start_time", nullable = false)
  private LocalTime startTime;

  @Column(name = "end_time", nullable = false)
  private LocalTime endTime;

  protected Shift() {}

  public Shift(
      UUID id,
      UUID hospitalId,
      UUID userId,
      int dayOfWeek,
      LocalTime startTime,
      LocalTime endTime) {
    this.id = id;
    this.hospitalId = hospitalId;
    this.userId = userId;
    this.dayOfWeek = dayOfWeek;
    this.startTime = startTime;
    this.endTime = endTime;
  }

  /** Converts {@link DayOfWeek} (Monday = 1 .. Sunday = 7) to the stored 0 = Sunday index. */
  public static int dayIndex(DayOfWeek day) {
    return day.getValue() % 7;
  }

  public boolean isOvernight() {
    return endTime.isBefore(startTime);
  }

  /**
   * Whether the slot covers {@code time} on the day with index {@code day}. Overnight slots cover
   * the evening of their own day and the early hours of the next one.
   */
  public boolean covers(int day, LocalTime time) {
    int previousDay = (day + 6) % 7;
    if (!isOvernight()) {
      return dayOfWeek == day && !time.isBefore(startTime) && time.isBefore(endTime);
    }
    return (dayOfWeek == day && !time.isBefore(startTime))
        || (dayOfWeek == previousDay && time.isBefore(endTime));
  }

  public UUID getId() {
    return id;
  }

  public UUID getHospitalId() {
    return hospitalId;
  }

  public UUID getUserId() {
    return userId;
  }

  public int getDayOfWeek() {
    return dayOfWeek;
  }

  public LocalTime getStartTime() {
    return startTime;
  }

  public LocalTime getEndTime() {
    return endTime;
  }
}
