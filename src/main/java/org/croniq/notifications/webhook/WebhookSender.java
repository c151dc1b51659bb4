package org.croniq.notifications.webhook;

import org.croniq.notifications.ChannelType;
import org.croniq.notifications.JsonHttpPoster;
import org.croniq.notifications.NotificationChannel;
import org.croniq.notifications.NotificationPayload;
import org.croniq.notifications.NotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Generic outbound webhook: the normalized payload as JSON, with the channel's custom headers.
 */
public class WebhookSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(WebhookSender.class);

    private final JsonHttpPoster poster;

    public WebhookSender(JsonHttpPoster poster) {
        this.poster = poster;
    }

    @Override
    public ChannelType channelType() {
        return ChannelType.WEBHOOK;
    }

    @Override
    public boolean send(NotificationChannel channel, NotificationPayload payload) {
        String url = channel.configString("url");
        if (url == null || url.isBlank()) {
            logger.error("Missing url in configuration for webhook channel {}", channel.id());
            return false;
        }

        try {
            int status = poster.post(url, payload.toMap(), channel.configStringMap("headers"));
            if (!JsonHttpPoster.isSuccess(status)) {
                logger.error("Webhook {} answered HTTP {} for job {}", url, status, payload.jobId());
                return false;
            }
            logger.info("Webhook notification sent for job {} - event {} to {}", payload.jobId(), payload.eventKind(), url);
            return true;
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Error sending webhook for job {} to {}: {}", payload.jobId(), url, e.getMessage(), e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Webhook notification for job {} interrupted", payload.jobId());
            return false;
        }
    }
}
