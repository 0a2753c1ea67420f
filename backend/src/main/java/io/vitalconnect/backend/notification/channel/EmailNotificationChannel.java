package io.vitalconnect.backend.notification.channel;

import io.vitalconnect.backend.notification.NotificationChannelType;
import io.vitalconnect.backend.notification.NotificationProperties;
import io.vitalconnect.backend.notification.OccurrenceAlert;
import io.vitalconnect.backend.notification.template.EmailTemplateRenderer;
import io.vitalconnect.backend.notification.template.RenderedEmail;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * Sends the new-occurrence email through {@link JavaMailSender}. Disabled when no mail sender is
 * configured ({@code spring.mail.host} unset).
 */
@Component
public class EmailNotificationChannel implements NotificationChannel {

  private static final Logger log = LoggerFactory.getLogger(EmailNotificationChannel.class);
  static final String TEMPLATE = "new-occurrence";
  private static final DateTimeFormatter DEATH_TIME =
      DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");

  private final ObjectProvider<JavaMailSender> mailSender;
  private final EmailTemplateRenderer renderer;
  private final NotificationProperties properties;
  private final ZoneId zone;

  public EmailNotificationChannel(
      ObjectProvider<JavaMailSender> mailSender,
      EmailTemplateRenderer renderer,
      NotificationProperties properties,
      @Value("${vitalconnect.zone:America/Sao_Paulo}") String zone) {
    this.mailSender = mailSender;
    this.renderer = renderer;
    this.properties = properties;
    this.zone = ZoneId.of(zone);
  }

  @Override
  public NotificationChannelType channelType() {
    return NotificationChannelType.EMAIL;
  }

  @Override
  public boolean isEnabled() {
    return mailSender.getIfAvailable() != null;
  }

  @Override
  public DeliveryResult deliver(OccurrenceAlert alert, String target) {
    JavaMailSender sender = mailSender.getIfAvailable();
    if (sender == null) {
      return DeliveryResult.failure("email channel not configured");
    }
    RenderedEmail email = renderer.render(TEMPLATE, templateContext(alert));
    try {
      MimeMessage message = sender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
      helper.setFrom(properties.mail().senderAddress());
      helper.setTo(target);
      helper.setSubject(email.subject());
      helper.setText(email.plainTextBody(), email.htmlBody());
      sender.send(message);
      log.debug("Alert email for occurrence {} sent", alert.occurrenceId());
      return DeliveryResult.sent();
    } catch (MailException | MessagingException e) {
      log.error(
          "Failed to send alert email for occurrence {}: {}", alert.occurrenceId(), e.getMessage());
      return DeliveryResult.failure(e.getMessage());
    }
  }

  Map<String, Object> templateContext(OccurrenceAlert alert) {
    var context = new HashMap<String, Object>();
    context.put("subject", "[URGENTE] Nova ocorrencia elegivel - " + alert.hospitalName());
    context.put("hospitalName", alert.hospitalName());
    context.put("sector", alert.sectorOrUnknown());
    context.put("patientName", alert.maskedPatientName());
    context.put("deathTime", DEATH_TIME.format(alert.deathAt().atZone(zone)));
    context.put("remaining", alert.remainingText());
    context.put("urgency", alert.urgency().code());
    context.put("priorityScore", alert.priorityScore());
    context.put("link", alert.link());
    return context;
  }
}
