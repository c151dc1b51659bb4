package org.croniq.support;

import org.croniq.monitoring.JobStatus;
import org.croniq.monitoring.MonitoredJob;
import org.croniq.monitoring.ScheduleType;
import org.croniq.notifications.ChannelType;
import org.croniq.notifications.JobNotificationSetting;
import org.croniq.notifications.NotificationChannel;

import java.time.Instant;
import java.util.Map;

public final class Fixtures {

    public static final long OWNER = 7L;
    public static final long OTHER_OWNER = 8L;

    private Fixtures() {}

    /** A never-pinged interval job created at {@code createdAt}, next ping due one interval later. */
    public static MonitoredJob intervalJob(long id, String interval, int grace, Instant createdAt, Instant expected) {
        return new MonitoredJob(id, OWNER, "job-" + id, ScheduleType.INTERVAL, interval, token(id), grace,
                JobStatus.ACTIVE, null, expected, createdAt, 0L);
    }

    public static MonitoredJob withStatus(MonitoredJob job, JobStatus status) {
        return new MonitoredJob(job.id(), job.ownerId(), job.name(), job.scheduleType(), job.scheduleValue(),
                job.webhookToken(), job.gracePeriodSeconds(), status, job.lastPingedAt(), job.expectedNextPingAt(),
                job.createdAt(), job.version());
    }

    public static String token(long id) {
        return String.format("%064x", id);
    }

    public static NotificationChannel channel(InMemoryNotificationStore store, ChannelType type, boolean verified,
                                              Map<String, Object> config) {
        return store.insertChannel(new NotificationChannel(0L, OWNER, type, type.code() + "-channel", config,
                verified, Instant.EPOCH));
    }

    public static JobNotificationSetting bind(InMemoryNotificationStore store, long jobId, long channelId,
                                              boolean onFailure, boolean onLateness, boolean onRecovery) {
        return store.upsertSetting(new JobNotificationSetting(0L, jobId, channelId, onFailure, onLateness, onRecovery,
                Instant.EPOCH));
    }
}
