package io.vitalconnect.backend.notification.channel;

import static org.assertj.core.api.Assertions.assertThat;

import io.vitalconnect.backend.notification.NotificationFixtures;
import io.vitalconnect.backend.notification.OccurrenceAlert;
import io.vitalconnect.backend.urgency.UrgencyLevel;
import org.junit.jupiter.api.Test;

class SmsNotificationChannelTest {

  private static OccurrenceAlert alert(String hospital, String link) {
    var base = NotificationFixtures.alert(hospital, UrgencyLevel.RED, 250);
    return new OccurrenceAlert(
        base.occurrenceId(),
        base.hospitalId(),
        base.hospitalName(),
        base.sector(),
        base.maskedPatientName(),
        base.priorityScore(),
        base.deathAt(),
        base.windowExpiresAt(),
        base.urgency(),
        base.remainingMinutes(),
        base.remainingText(),
        link);
  }

  @Test
  void shortMessageIsSentAsIs() {
    String message = SmsNotificationChannel.message(alert("HC", "https://vc.app/o/1"));

    assertThat(message)
        .isEqualTo(
            "[VitalConnect] ALERTA RED: obito elegivel. Hosp: HC Janela: 4h restantes."
                + " Acao: https://vc.app/o/1");
  }

  @Test
  void longHospitalNameIsShortenedFirst() {
    String hospital = "Hospital das Clinicas da Faculdade de Medicina da Universidade de Sao Paulo";

    String message = SmsNotificationChannel.message(alert(hospital, "https://vc.app/o/1"));

    assertThat(message).hasSizeLessThanOrEqualTo(SmsNotificationChannel.MAX_LENGTH);
    assertThat(message).contains("Hosp: Hospital das").contains("... Janela: 4h restantes.");
    assertThat(message).endsWith("Acao: https://vc.app/o/1");
  }

  @Test
  void oversizedTextIsCutAsLastResort() {
    var link = "http://localhost:3000/dashboard/occurrences?id=" + NotificationFixtures.OCCURRENCE;

    String message = SmsNotificationChannel.message(alert("Hospital Municipal", link));

    assertThat(message).hasSize(SmsNotificationChannel.MAX_LENGTH).endsWith("...");
  }

  @Test
  void phoneNumbersAreMaskedInLogs() {
    assertThat(SmsNotificationChannel.maskPhone("+5511999990000")).isEqualTo("+55119****0000");
    assertThat(SmsNotificationChannel.maskPhone("1234")).isEqualTo("****");
    assertThat(SmsNotificationChannel.maskPhone(null)).isEqualTo("****");
  }

  @Test
  void unconfiguredChannelIsDisabled() {
    var channel = new SmsNotificationChannel(NotificationFixtures.properties());

    assertThat(channel.isEnabled()).isFalse();
    assertThat(channel.deliver(alert("HC", "https://vc.app/o/1"), "+5511999990000").success())
        .isFalse();
  }
}
