package io.vitalconnect.backend.notification;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;

/**
 * Live hub and alert channel settings.
 *
 * @param sessionBufferSize pending events kept per live session before the oldest is dropped
 * @param heartbeatInterval idle time after which a session receives a heartbeat
 * @param pollInterval upper bound on how long hub threads block before re-checking for shutdown
 * @param streamTimeout lifetime of one SSE connection; clients reconnect after it
 * @param dispatchThreads threads sending email, SMS and push alerts
 * @param dispatchQueueCapacity alerts waiting for a dispatch thread before new ones are refused
 * @param appBaseUrl base URL of the operator dashboard, used in alert links
 */
@ConfigurationProperties(prefix = "vitalconnect.notification")
public record NotificationProperties(
    @DefaultValue("100") int sessionBufferSize,
    @DefaultValue("30s") Duration heartbeatInterval,
    @DefaultValue("1s") Duration pollInterval,
    @DefaultValue("30m") Duration streamTimeout,
    @DefaultValue("4") int dispatchThreads,
    @DefaultValue("500") int dispatchQueueCapacity,
    @DefaultValue("http://localhost:3000") String appBaseUrl,
    @DefaultValue Mail mail,
    @DefaultValue Sms sms,
    @DefaultValue Push push) {

  /** @param senderAddress From address of alert emails */
  public record Mail(@DefaultValue("alertas@vitalconnect.local") String senderAddress) {}

  /** Twilio account used for SMS alerts. SMS is disabled while any credential is blank. */
  public record Sms(
      @DefaultValue("") String accountSid,
      @DefaultValue("") String authToken,
      @DefaultValue("") String fromNumber,
      @DefaultValue("https://api.twilio.com") String baseUrl,
      @DefaultValue("5s") Duration connectTimeout,
      @DefaultValue("10s") Duration readTimeout) {

    public boolean isConfigured() {
      return StringUtils.hasText(accountSid)
          && StringUtils.hasText(authToken)
          && StringUtils.hasText(fromNumber);
    }
  }

  /** FCM credentials used for push alerts. Push is disabled while the server key is blank. */
  public record Push(
      @DefaultValue("") String serverKey,
      @DefaultValue("https://fcm.googleapis.com/fcm/send") String url,
      @DefaultValue("5s") Duration connectTimeout,
      @DefaultValue("10s") Duration readTimeout) {

    public boolean isConfigured() {
      return StringUtils.hasText(serverKey);
    }
  }
}
