package org.croniq.notifications;

/**
 * A notification setting joined with its channel.
 */
public record ChannelBinding(JobNotificationSetting setting, NotificationChannel channel) {
}
