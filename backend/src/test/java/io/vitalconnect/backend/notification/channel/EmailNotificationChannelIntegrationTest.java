package io.vitalconnect.backend.notification.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.icegreen.greenmail.junit5.GreenMailExtension;
import com.icegreen.greenmail.util.ServerSetupTest;
import io.vitalconnect.backend.notification.NotificationFixtures;
import io.vitalconnect.backend.notification.template.EmailTemplateRenderer;
import io.vitalconnect.backend.urgency.UrgencyLevel;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

class EmailNotificationChannelIntegrationTest {

  @RegisterExtension
  static GreenMailExtension greenMail = new GreenMailExtension(ServerSetupTest.SMTP);

  private EmailNotificationChannel channel;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    var mailSender = new JavaMailSenderImpl();
    mailSender.setHost(greenMail.getSmtp().getBindTo());
    mailSender.setPort(greenMail.getSmtp().getPort());
    ObjectProvider<JavaMailSender> provider = mock(ObjectProvider.class);
    when(provider.getIfAvailable()).thenReturn(mailSender);
    channel =
        new EmailNotificationChannel(
            provider,
            new EmailTemplateRenderer(),
            NotificationFixtures.properties(),
            "America/Sao_Paulo");
  }

  @Test
  void deliverSendsAlertEmailToSmtpServer() throws Exception {
    var alert = NotificationFixtures.alert("Hospital Central", UrgencyLevel.RED, 90);

    var result = channel.deliver(alert, "ana@hospital.org");

    assertThat(result.success()).isTrue();
    MimeMessage[] received = greenMail.getReceivedMessages();
    assertThat(received).hasSize(1);
    assertThat(received[0].getSubject())
        .isEqualTo("[URGENTE] Nova ocorrencia elegivel - Hospital Central");
    assertThat(received[0].getAllRecipients()[0].toString()).isEqualTo("ana@hospital.org");
    assertThat(received[0].getFrom()[0].toString()).isEqualTo("alertas@vitalconnect.local");
  }
}
