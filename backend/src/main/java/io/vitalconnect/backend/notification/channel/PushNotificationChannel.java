package io.vitalconnect.backend.notification.channel;

import io.vitalconnect.backend.notification.NotificationChannelType;
import io.vitalconnect.backend.notification.NotificationProperties;
import io.vitalconnect.backend.notification.OccurrenceAlert;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Sends push alerts to registered device tokens through the FCM HTTP API. */
@Component
public class PushNotificationChannel implements NotificationChannel {

  private static final Logger log = LoggerFactory.getLogger(PushNotificationChannel.class);

  private final NotificationProperties.Push settings;
  private final RestClient restClient;

  public PushNotificationChannel(NotificationProperties properties) {
    this.settings = properties.push();
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(settings.connectTimeout());
    requestFactory.setReadTimeout(settings.readTimeout());
    this.restClient = RestClient.builder().requestFactory(requestFactory).build();
  }

  @Override
  public NotificationChannelType channelType() {
    return NotificationChannelType.PUSH;
  }

  @Override
  public boolean isEnabled() {
    return settings.isConfigured();
  }

  @Override
  public DeliveryResult deliver(OccurrenceAlert alert, String target) {
    if (!settings.isConfigured()) {
      return DeliveryResult.failure("push channel not configured");
    }
    try {
      FcmResponse response =
          restClient
              .post()
              .uri(settings.url())
              .header(HttpHeaders.AUTHORIZATION, "key=" + settings.serverKey())
              .contentType(MediaType.APPLICATION_JSON)
              .body(message(alert, target))
              .retrieve()
              .body(FcmResponse.class);
      String error = response != null ? response.firstError() : null;
      if (error != null) {
        log.warn("FCM rejected alert for occurrence {}: {}", alert.occurrenceId(), error);
        return DeliveryResult.failure("FCM error: " + error);
      }
      return DeliveryResult.sent();
    } catch (RestClientException e) {
      log.error("Failed to send push for occurrence {}: {}", alert.occurrenceId(), e.getMessage());
      return DeliveryResult.failure(e.getMessage());
    }
  }

  static Map<String, Object> message(OccurrenceAlert alert, String token) {
    return Map.of(
        "to",
        token,
        "notification",
        Map.of(
            "title", "Nova ocorrencia - " + alert.hospitalName(),
            "body",
                "Setor: "
                    + alert.sectorOrUnknown()
                    + " | Tempo restante: "
                    + alert.remainingText()),
        "data",
        Map.of(
            "occurrenceId", alert.occurrenceId().toString(),
            "hospitalId", alert.hospitalId().toString(),
            "urgency", alert.urgency().code()),
        "webpush",
        Map.of("fcm_options", Map.of("link", alert.link())));
  }

  record FcmResponse(int success, int failure, List<FcmResult> results) {

    String firstError() {
      if (failure == 0 || results == null) {
        return null;
      }
      return results.stream()
          .map(FcmResult::error)
          .filter(error -> error != null && !error.isBlank())
          .findFirst()
          .orElse(null);
    }
  }

  record FcmResult(String error) {}
}
