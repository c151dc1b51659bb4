package org.croniq.notifications.email;

import jakarta.mail.BodyPart;
import jakarta.mail.Message;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.croniq.config.XmlConfiguration;
import org.croniq.notifications.ChannelType;
import org.croniq.notifications.EventKind;
import org.croniq.notifications.NotificationChannel;
import org.croniq.notifications.NotificationPayload;
import org.croniq.notifications.TemplateLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EmailSenderTest {

    private static final Instant NOW = Instant.parse("2023-01-01T10:25:00Z");

    private EmailSender sender;

    @BeforeEach
    void setUp() {
        XmlConfiguration.Notification.Email config = new XmlConfiguration.Notification.Email();
        config.smtpHost = "localhost";
        config.smtpPort = 2525;
        config.useTLS = false;
        config.fromAddress = "alerts@croniq.test";
        config.connectionTimeout = 500;
        sender = new EmailSender(config, new TemplateLoader());
    }

    private static NotificationPayload payload(String log) {
        return new NotificationPayload(12L, "reports & exports", "interval", "1h", "errored", EventKind.FAILURE,
                null, Instant.parse("2023-01-01T10:00:00Z"), log, NOW);
    }

    @Test
    void buildsMultipartAlert() throws Exception {
        MimeMessage message = sender.buildMessage("ops@example.org", payload("Job detected as errored by scheduler."));
        message.saveChanges();

        assertThat(message.getSubject()).isEqualTo("[Croniq] FAILURE: reports & exports is errored");
        assertThat(((InternetAddress) message.getFrom()[0]).getAddress()).isEqualTo("alerts@croniq.test");
        assertThat(((InternetAddress) message.getFrom()[0]).getPersonal()).isEqualTo("Croniq Alerts");
        assertThat(message.getRecipients(Message.RecipientType.TO)).extracting(Object::toString)
                .containsExactly("ops@example.org");

        MimeMultipart multipart = (MimeMultipart) message.getContent();
        assertThat(multipart.getContentType()).startsWith("multipart/alternative");
        assertThat(multipart.getCount()).isEqualTo(2);

        String text = (String) multipart.getBodyPart(0).getContent();
        assertThat(text)
                .contains("Job:            reports & exports (ID 12)")
                .contains("Last pinged:    Never")
                .contains("Expected at:    2023-01-01T10:00:00Z")
                .contains("Job detected as errored by scheduler.");

        BodyPart html = multipart.getBodyPart(1);
        assertThat(html.getContentType()).startsWith("text/html");
        assertThat((String) html.getContent())
                .contains("reports &amp; exports")
                .contains("<h3>Details</h3>");
    }

    @Test
    void detailsSectionIsOmittedWithoutLog() throws Exception {
        MimeMultipart multipart = (MimeMultipart) sender.buildMessage("ops@example.org", payload(null)).getContent();

        assertThat((String) multipart.getBodyPart(0).getContent()).doesNotContain("Details:");
    }

    @Test
    void templateDataCarriesDisplayDefaults() {
        Map<String, Object> data = EmailSender.templateData(payload(null));

        assertThat(data)
                .containsEntry("event_upper", "FAILURE")
                .containsEntry("last_pinged_display", "Never")
                .containsEntry("expected_display", "2023-01-01T10:00:00Z")
                .containsEntry("job_name", "reports & exports");
    }

    @Test
    void missingAddressIsAFailure() {
        NotificationChannel channel = new NotificationChannel(1L, 7L, ChannelType.EMAIL, "mail", Map.of(), true, NOW);

        assertThat(sender.send(channel, payload(null))).isFalse();
    }
}
