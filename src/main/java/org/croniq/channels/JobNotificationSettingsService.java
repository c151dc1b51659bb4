package org.croniq.channels;

import org.croniq.errors.NotFoundException;
import org.croniq.errors.ValidationException;
import org.croniq.notifications.JobNotificationSetting;
import org.croniq.notifications.NotificationChannel;
import org.croniq.store.JobStore;
import org.croniq.store.NotificationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Binds jobs to channels. Both sides must belong to the caller.
 */
public class JobNotificationSettingsService {

    private static final Logger logger = LoggerFactory.getLogger(JobNotificationSettingsService.class);

    static final String JOB_NOT_FOUND = "Monitored job not found.";
    static final String SETTING_NOT_FOUND = "Notification setting not found.";

    private final JobStore jobs;
    private final NotificationStore notifications;
    private final Clock clock;

    public JobNotificationSettingsService(JobStore jobs, NotificationStore notifications, Clock clock) {
        this.jobs = jobs;
        this.notifications = notifications;
        this.clock = clock;
    }

    /**
     * Creates the binding, or updates the flags of the existing one for the same job and channel.
     * Null flags take the defaults: failure and lateness on, recovery off.
     */
    public JobNotificationSetting bind(long ownerId, long jobId, long channelId,
                                       Boolean notifyOnFailure, Boolean notifyOnLateness, Boolean notifyOnRecovery) {
        requireJob(jobId, ownerId);
        NotificationChannel channel = notifications.findChannel(channelId, ownerId)
                .orElseThrow(() -> new NotFoundException(NotificationChannelService.CHANNEL_NOT_FOUND));
        if (!channel.verified()) {
            throw new ValidationException("Notification channel \"" + channel.name() + "\" is not verified.");
        }

        JobNotificationSetting setting = notifications.upsertSetting(new JobNotificationSetting(0L, jobId, channelId,
                notifyOnFailure == null || notifyOnFailure,
                notifyOnLateness == null || notifyOnLateness,
                notifyOnRecovery != null && notifyOnRecovery,
                clock.instant()));
        logger.info("Bound job {} to channel {} ({}): failure={}, lateness={}, recovery={}",
                jobId, channelId, channel.type(), setting.notifyOnFailure(), setting.notifyOnLateness(),
                setting.notifyOnRecovery());
        return setting;
    }

    public List<JobNotificationSetting> list(long jobId, long ownerId) {
        requireJob(jobId, ownerId);
        return notifications.findSettings(jobId);
    }

    public void remove(long settingId, long ownerId) {
        JobNotificationSetting setting = notifications.findSetting(settingId)
                .orElseThrow(() -> new NotFoundException(SETTING_NOT_FOUND));
        if (jobs.findByIdForOwner(setting.jobId(), ownerId).isEmpty()) {
            throw new NotFoundException(SETTING_NOT_FOUND);
        }
        if (!notifications.deleteSetting(settingId)) {
            throw new NotFoundException(SETTING_NOT_FOUND);
        }
        logger.info("Removed notification setting {} from job {}", settingId, setting.jobId());
    }

    private void requireJob(long jobId, long ownerId) {
        if (jobs.findByIdForOwner(jobId, ownerId).isEmpty()) {
            throw new NotFoundException(JOB_NOT_FOUND);
        }
    }
}
