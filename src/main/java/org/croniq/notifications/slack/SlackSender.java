package org.croniq.notifications.slack;

import org.croniq.notifications.ChannelType;
import org.croniq.notifications.JsonHttpPoster;
import org.croniq.notifications.NotificationChannel;
import org.croniq.notifications.NotificationPayload;
import org.croniq.notifications.NotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Posts an attachment-style message to a Slack incoming webhook.
 */
public class SlackSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(SlackSender.class);

    private final JsonHttpPoster poster;

    public SlackSender(JsonHttpPoster poster) {
        this.poster = poster;
    }

    @Override
    public ChannelType channelType() {
        return ChannelType.SLACK;
    }

    @Override
    public boolean send(NotificationChannel channel, NotificationPayload payload) {
        String webhookUrl = channel.configString("webhookUrl");
        if (webhookUrl == null || webhookUrl.isBlank()) {
            logger.error("Missing webhookUrl in configuration for Slack channel {}", channel.id());
            return false;
        }

        try {
            int status = poster.post(webhookUrl, buildMessage(payload), Map.of());
            if (!JsonHttpPoster.isSuccess(status)) {
                logger.error("Slack rejected notification for job {} with HTTP {}", payload.jobId(), status);
                return false;
            }
            logger.info("Slack notification sent for job {} - event {}", payload.jobId(), payload.eventKind());
            return true;
        } catch (IOException e) {
            logger.error("Error sending Slack notification for job {}: {}", payload.jobId(), e.getMessage(), e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Slack notification for job {} interrupted", payload.jobId());
            return false;
        }
    }

    static Map<String, Object> buildMessage(NotificationPayload payload) {
        String event = payload.eventKind().code().toUpperCase(Locale.ROOT);
        String color = payload.eventKind().isAlert() ? "danger" : "good";

        StringBuilder text = new StringBuilder()
                .append("Croniq Alert: Job \"").append(payload.jobName()).append("\" (ID: ").append(payload.jobId())
                .append(") reported event: ").append(event).append('.');
        if (payload.executionLog() != null) {
            text.append("\n```\n").append(payload.executionLog()).append("\n```");
        }
        text.append("\nExpected at: ").append(payload.expectedNextPingAt() != null ? payload.expectedNextPingAt() : "N/A")
                .append("\nLast pinged: ").append(payload.lastPingedAt() != null ? payload.lastPingedAt() : "Never");

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", color);
        attachment.put("title", "Croniq Job Event: " + payload.jobName() + " - " + event);
        attachment.put("text", text.toString());
        attachment.put("fields", List.of(
                field("Job ID", String.valueOf(payload.jobId())),
                field("Schedule", payload.scheduleDescription()),
                field("Status", payload.currentStatus()),
                field("Event Type", event)
        ));
        attachment.put("footer", "Croniq Monitoring");
        attachment.put("ts", payload.occurredAt().getEpochSecond());

        return Map.of("attachments", List.of(attachment));
    }

    private static Map<String, Object> field(String title, String value) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", true);
        return field;
    }
}
