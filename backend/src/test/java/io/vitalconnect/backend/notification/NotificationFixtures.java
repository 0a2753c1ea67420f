package io.vitalconnect.backend.notification;

import io.vitalconnect.backend.urgency.UrgencyLevel;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public final class NotificationFixtures {

  public static final UUID HOSPITAL = UUID.fromString("2f1d7c7e-6a55-4c1e-9a5b-0d3c9b1e7a10");
  public static final UUID OCCURRENCE = UUID.fromString("0b6f4e1a-3c2d-4e5f-8a9b-1c2d3e4f5a6b");

  private NotificationFixtures() {}

  public static NotificationProperties properties() {
    return properties(
        new NotificationProperties.Sms(
            "", "", "", "https://api.twilio.com", Duration.ofSeconds(5), Duration.ofSeconds(10)));
  }

  public static NotificationProperties properties(NotificationProperties.Sms sms) {
    return new NotificationProperties(
        100,
        Duration.ofSeconds(30),
        Duration.ofMillis(50),
        Duration.ofMinutes(30),
        2,
        10,
        "http://localhost:3000",
        new NotificationProperties.Mail("alertas@vitalconnect.local"),
        sms,
        new NotificationProperties.Push(
            "",
            "https://fcm.googleapis.com/fcm/send",
            Duration.ofSeconds(5),
            Duration.ofSeconds(10)));
  }

  public static OccurrenceAlert alert(String hospitalName, UrgencyLevel urgency, long minutes) {
    Instant deathAt = Instant.parse("2026-03-10T11:00:00Z");
    return new OccurrenceAlert(
        OCCURRENCE,
        HOSPITAL,
        hospitalName,
        "UTI",
        "Maria S.",
        100,
        deathAt,
        deathAt.plus(Duration.ofHours(6)),
        urgency,
        minutes,
        minutes / 60 + "h " + minutes % 60 + "min",
        "http://localhost:3000/dashboard/occurrences?id=" + OCCURRENCE);
  }
}
