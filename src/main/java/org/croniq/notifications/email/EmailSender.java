package org.croniq.notifications.email;

import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.jetbrains.annotations.NotNull;
import org.croniq.config.XmlConfiguration;
import org.croniq.notifications.ChannelType;
import org.croniq.notifications.NotificationChannel;
import org.croniq.notifications.NotificationPayload;
import org.croniq.notifications.NotificationSender;
import org.croniq.notifications.TemplateLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UnsupportedEncodingException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

public class EmailSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(EmailSender.class);

    static final String SUBJECT_TEMPLATE = "job-alert-subject.mustache";
    static final String TEXT_TEMPLATE = "job-alert.txt";
    static final String HTML_TEMPLATE = "job-alert.html";

    private final XmlConfiguration.Notification.Email config;
    private final Session session;
    private final TemplateLoader templates;

    public EmailSender(XmlConfiguration.Notification.Email config, TemplateLoader templates) {
        this.config = config;
        this.templates = templates;

        Properties props = getProperties(config);
        if (config.username != null && !config.username.isBlank()) {
            this.session = Session.getInstance(props, new Authenticator() {
                @Override
                protected PasswordAuthentication getPasswordAuthentication() {
                    return new PasswordAuthentication(config.username, config.password);
                }
            });
        } else {
            this.session = Session.getInstance(props);
        }
        logger.info("[---------- EmailSender initialized for host {}:{} ----------]", config.smtpHost, config.smtpPort);
    }

    @NotNull
    private static Properties getProperties(XmlConfiguration.Notification.Email config) {
        Properties props = new Properties();
        props.put("mail.smtp.auth", String.valueOf(config.username != null && !config.username.isBlank()));
        props.put("mail.smtp.starttls.enable", String.valueOf(config.useTLS));
        props.put("mail.smtp.host", config.smtpHost != null ? config.smtpHost : "localhost");
        props.put("mail.smtp.port", String.valueOf(config.smtpPort));
        props.put("mail.smtp.connectiontimeout", String.valueOf(config.connectionTimeout));
        props.put("mail.smtp.timeout", String.valueOf(config.connectionTimeout));
        props.put("mail.smtp.writetimeout", String.valueOf(config.connectionTimeout));
        return props;
    }

    @Override
    public ChannelType channelType() {
        return ChannelType.EMAIL;
    }

    @Override
    public boolean send(NotificationChannel channel, NotificationPayload payload) {
        String destination = channel.configString("email");
        if (destination == null || destination.isBlank()) {
            logger.error("Missing email address in configuration for email channel {}", channel.id());
            return false;
        }

        try {
            Transport.send(buildMessage(destination, payload));
            logger.info("Email sent successfully to {} for job {} ({})", destination, payload.jobId(), payload.eventKind());
            return true;
        } catch (MessagingException e) {
            logger.error("Failed to send email to {} via SMTP host {}:{}", destination, config.smtpHost, config.smtpPort, e);
            return false;
        } catch (UnsupportedEncodingException e) {
            logger.error("Invalid sender name '{}' for email channel {}", config.fromName, channel.id(), e);
            return false;
        }
    }

    MimeMessage buildMessage(String destination, NotificationPayload payload)
            throws MessagingException, UnsupportedEncodingException {
        Map<String, Object> data = templateData(payload);

        MimeMessage msg = new MimeMessage(session);
        msg.setFrom(new InternetAddress(config.fromAddress, config.fromName));
        msg.setRecipients(Message.RecipientType.TO, InternetAddress.parse(destination));
        msg.setSubject(templates.render(SUBJECT_TEMPLATE, data).trim(), "UTF-8");

        MimeBodyPart textPart = new MimeBodyPart();
        textPart.setText(templates.render(TEXT_TEMPLATE, data), "UTF-8");
        MimeBodyPart htmlPart = new MimeBodyPart();
        htmlPart.setContent(templates.render(HTML_TEMPLATE, data), "text/html; charset=UTF-8");

        MimeMultipart multipart = new MimeMultipart("alternative");
        multipart.addBodyPart(textPart);
        multipart.addBodyPart(htmlPart);
        msg.setContent(multipart);
        return msg;
    }

    static Map<String, Object> templateData(NotificationPayload payload) {
        Map<String, Object> data = new HashMap<>(payload.toMap());
        data.put("event_upper", payload.eventKind().code().toUpperCase(Locale.ROOT));
        data.put("expected_display", payload.expectedNextPingAt() != null ? payload.expectedNextPingAt().toString() : "N/A");
        data.put("last_pinged_display", payload.lastPingedAt() != null ? payload.lastPingedAt().toString() : "Never");
        return data;
    }
}
