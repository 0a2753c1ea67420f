package io.vitalconnect.backend.notification.channel;

import io.vitalconnect.backend.notification.NotificationChannelType;
import io.vitalconnect.backend.notification.NotificationProperties;
import io.vitalconnect.backend.notification.OccurrenceAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Sends SMS alerts through the Twilio Messages API. */
@Component
public class SmsNotificationChannel implements NotificationChannel {

  private static final Logger log = LoggerFactory.getLogger(SmsNotificationChannel.class);
  static final int MAX_LENGTH = 160;
  private static final String ELLIPSIS = "...";

  private final NotificationProperties.Sms settings;
  private final RestClient restClient;

  public SmsNotificationChannel(NotificationProperties properties) {
    this.settings = properties.sms();
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(settings.connectTimeout());
    requestFactory.setReadTimeout(settings.readTimeout());
    this.restClient =
        RestClient.builder()
            .baseUrl(settings.baseUrl())
            .requestFactory(requestFactory)
            .defaultHeaders(
                headers -> headers.setBasicAuth(settings.accountSid(), settings.authToken()))
            .build();
  }

  @Override
  public NotificationChannelType channelType() {
    return NotificationChannelType.SMS;
  }

  @Override
  public boolean isEnabled() {
    return settings.isConfigured();
  }

  @Override
  public DeliveryResult deliver(OccurrenceAlert alert, String target) {
    if (!settings.isConfigured()) {
      return DeliveryResult.failure("sms channel not configured");
    }
    var form = new LinkedMultiValueMap<String, String>();
    form.add("To", target);
    form.add("From", settings.fromNumber());
    form.add("Body", message(alert));
    try {
      restClient
          .post()
          .uri("/2010-04-01/Accounts/{sid}/Messages.json", settings.accountSid())
          .contentType(MediaType.APPLICATION_FORM_URLENCODED)
          .body(form)
          .retrieve()
          .toBodilessEntity();
      log.debug("Alert SMS for occurrence {} sent to {}", alert.occurrenceId(), maskPhone(target));
      return DeliveryResult.sent();
    } catch (RestClientException e) {
      log.error(
          "Failed to send alert SMS for occurrence {} to {}: {}",
          alert.occurrenceId(),
          maskPhone(target),
          e.getMessage());
      return DeliveryResult.failure(e.getMessage());
    }
  }

  /**
   * Builds a single-segment message. The hospital name is shortened first when the text would
   * exceed {@value #MAX_LENGTH} characters; the whole text is cut as a last resort.
   */
  static String message(OccurrenceAlert alert) {
    String hospital = alert.hospitalName();
    String text = format(alert, hospital);
    if (text.length() > MAX_LENGTH) {
      int excess = text.length() - MAX_LENGTH + ELLIPSIS.length();
      int keep = Math.max(10, hospital.length() - excess);
      if (keep < hospital.length()) {
        text = format(alert, hospital.substring(0, keep) + ELLIPSIS);
      }
    }
    if (text.length() > MAX_LENGTH) {
      text = text.substring(0, MAX_LENGTH - ELLIPSIS.length()) + ELLIPSIS;
    }
    return text;
  }

  private static String format(OccurrenceAlert alert, String hospital) {
    return String.format(
        "[VitalConnect] ALERTA %s: obito elegivel. Hosp: %s Janela: %dh restantes. Acao: %s",
        alert.urgency().name(), hospital, alert.remainingHours(), alert.link());
  }

  static String maskPhone(String phone) {
    if (phone == null || phone.length() < 8) {
      return "****";
    }
    return phone.substring(0, phone.length() - 8) + "****" + phone.substring(phone.length() - 4);
  }
}
