package org.croniq.notifications.pagerduty;

import org.croniq.notifications.ChannelType;
import org.croniq.notifications.EventKind;
import org.croniq.notifications.JsonHttpPoster;
import org.croniq.notifications.NotificationChannel;
import org.croniq.notifications.NotificationPayload;
import org.croniq.notifications.NotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * PagerDuty Events API v2. Failures and lateness trigger an incident, recovery resolves it;
 * both use the same dedup key so PagerDuty pairs them.
 */
public class PagerDutySender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(PagerDutySender.class);

    public static final String DEFAULT_EVENTS_URL = "https://events.pagerduty.com/v2/enqueue";

    private final JsonHttpPoster poster;
    private final String eventsUrl;

    public PagerDutySender(JsonHttpPoster poster, String eventsUrl) {
        this.poster = poster;
        this.eventsUrl = eventsUrl != null && !eventsUrl.isBlank() ? eventsUrl : DEFAULT_EVENTS_URL;
    }

    @Override
    public ChannelType channelType() {
        return ChannelType.PAGERDUTY;
    }

    @Override
    public boolean send(NotificationChannel channel, NotificationPayload payload) {
        String routingKey = channel.configString("routingKey");
        if (routingKey == null || routingKey.isBlank()) {
            logger.error("Missing routingKey in configuration for PagerDuty channel {}", channel.id());
            return false;
        }

        try {
            int status = poster.post(eventsUrl, buildEvent(routingKey, payload), Map.of());
            if (!JsonHttpPoster.isSuccess(status)) {
                logger.error("PagerDuty rejected event for job {} with HTTP {}", payload.jobId(), status);
                return false;
            }
            logger.info("PagerDuty notification sent for job {} - event {}", payload.jobId(), payload.eventKind());
            return true;
        } catch (IOException e) {
            logger.error("Error sending PagerDuty notification for job {}: {}", payload.jobId(), e.getMessage(), e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("PagerDuty notification for job {} interrupted", payload.jobId());
            return false;
        }
    }

    static Map<String, Object> buildEvent(String routingKey, NotificationPayload payload) {
        EventKind kind = payload.eventKind();
        String group = "croniq_job_" + payload.jobId();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("job_id", payload.jobId());
        details.put("job_name", payload.jobName());
        details.put("schedule", payload.scheduleDescription());
        details.put("status", payload.currentStatus());
        details.put("event_type", kind.code());
        details.put("last_pinged_at", payload.lastPingedAt() != null ? payload.lastPingedAt().toString() : null);
        details.put("expected_next_ping_at", payload.expectedNextPingAt() != null ? payload.expectedNextPingAt().toString() : null);
        details.put("output_log", payload.executionLog());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("summary", "Croniq: Job \"" + payload.jobName() + "\" (ID: " + payload.jobId() + ") "
                + kind.code().toUpperCase(Locale.ROOT));
        body.put("timestamp", payload.occurredAt().toString());
        body.put("severity", kind.isAlert() ? "critical" : "info");
        body.put("source", "Croniq_Job_" + payload.jobId());
        body.put("component", "Croniq Monitoring System");
        body.put("group", group);
        body.put("class", kind.isAlert() ? "job_failure_or_late" : "job_recovery");
        body.put("custom_details", details);

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("routing_key", routingKey);
        event.put("event_action", kind.isAlert() ? "trigger" : "resolve");
        event.put("dedup_key", group);
        event.put("payload", body);
        return event;
    }
}
