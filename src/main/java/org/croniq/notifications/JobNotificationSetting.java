package org.croniq.notifications;

import java.time.Instant;

/**
 * Binds one job to one channel with independent trigger flags.
 */
public record JobNotificationSetting(
        long id,
        long jobId,
        long channelId,
        boolean notifyOnFailure,
        boolean notifyOnLateness,
        boolean notifyOnRecovery,
        Instant createdAt
) {

    public boolean triggersOn(EventKind kind) {
        return switch (kind) {
            case FAILURE -> notifyOnFailure;
            case LATENESS -> notifyOnLateness;
            case RECOVERY -> notifyOnRecovery;
        };
    }
}
