package io.vitalconnect.backend.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class NotificationRecordTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

  private static NotificationRecord pending() {
    return new NotificationRecord(
        UUID.randomUUID(), UUID.randomUUID(), NotificationChannelType.SMS, "+5511999990000", NOW);
  }

  @Test
  void newRecordIsPending() {
    var record = pending();

    assertThat(record.getStatus()).isEqualTo(NotificationStatus.PENDING);
    assertThat(record.getCompletedAt()).isNull();
  }

  @Test
  void failedRecordKeepsErrorText() {
    var record = pending();

    record.markFailed("timeout", NOW.plusSeconds(5));

    assertThat(record.getStatus()).isEqualTo(NotificationStatus.FAILED);
    assertThat(record.getErrorMessage()).isEqualTo("timeout");
    assertThat(record.getCompletedAt()).isEqualTo(NOW.plusSeconds(5));
  }

  @Test
  void terminalRecordCannotChange() {
    var record = pending();
    record.markSent(NOW);

    assertThatThrownBy(() -> record.markFailed("late", NOW))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> record.markSent(NOW)).isInstanceOf(IllegalStateException.class);
  }
}
