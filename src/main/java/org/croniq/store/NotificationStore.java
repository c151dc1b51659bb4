package org.croniq.store;

import org.croniq.notifications.ChannelBinding;
import org.croniq.notifications.JobNotificationSetting;
import org.croniq.notifications.NotificationChannel;

import java.util.List;
import java.util.Optional;

/**
 * Channels and job-to-channel bindings.
 * All methods throw {@link StoreException} on infrastructure failure.
 */
public interface NotificationStore {

    /** Bindings for the job whose channel is verified. */
    List<ChannelBinding> findVerifiedBindings(long jobId);

    NotificationChannel insertChannel(NotificationChannel channel);

    Optional<NotificationChannel> findChannel(long channelId, long ownerId);

    List<NotificationChannel> findChannels(long ownerId);

    /** Writes name, configuration and verification flag; matched on id and owner. */
    Optional<NotificationChannel> updateChannel(NotificationChannel channel);

    boolean deleteChannel(long channelId, long ownerId);

    /** Inserts, or updates the flags of the existing row for the same (job, channel). */
    JobNotificationSetting upsertSetting(JobNotificationSetting setting);

    List<JobNotificationSetting> findSettings(long jobId);

    Optional<JobNotificationSetting> findSetting(long settingId);

    boolean deleteSetting(long settingId);
}
