package org.croniq.channels;

import org.croniq.errors.NotFoundException;
import org.croniq.errors.ValidationException;
import org.croniq.notifications.ChannelType;
import org.croniq.notifications.NotificationChannel;
import org.croniq.store.NotificationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class NotificationChannelService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationChannelService.class);

    static final String CHANNEL_NOT_FOUND = "Notification channel not found.";

    private final NotificationStore store;
    private final Clock clock;

    public NotificationChannelService(NotificationStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Email channels start unverified; every other type is usable immediately.
     */
    public NotificationChannel create(long ownerId, ChannelType type, String name, Map<String, Object> configuration) {
        if (type == null) {
            throw new ValidationException("Channel type is required.");
        }
        String trimmedName = requireName(name);
        ChannelConfigValidator.validate(type, configuration);

        NotificationChannel channel = store.insertChannel(new NotificationChannel(0L, ownerId, type, trimmedName,
                new LinkedHashMap<>(configuration), !type.requiresVerification(), clock.instant()));
        logger.info("Created {} channel {} ({}) for owner {}, verified={}",
                type, channel.id(), channel.name(), ownerId, channel.verified());
        return channel;
    }

    public NotificationChannel get(long channelId, long ownerId) {
        return store.findChannel(channelId, ownerId)
                .orElseThrow(() -> new NotFoundException(CHANNEL_NOT_FOUND));
    }

    public List<NotificationChannel> list(long ownerId) {
        return store.findChannels(ownerId);
    }

    /**
     * A new configuration on an email channel sends it back through verification.
     */
    public NotificationChannel update(long channelId, long ownerId, ChannelUpdate update) {
        NotificationChannel current = get(channelId, ownerId);

        String name = update.name() != null ? requireName(update.name()) : current.name();
        Map<String, Object> configuration = current.configurationDetails();
        boolean verified = current.verified();
        if (update.configurationDetails() != null) {
            ChannelConfigValidator.validate(current.type(), update.configurationDetails());
            configuration = new LinkedHashMap<>(update.configurationDetails());
            if (current.type().requiresVerification()) {
                verified = false;
            }
        }

        NotificationChannel edited = new NotificationChannel(current.id(), ownerId, current.type(), name,
                configuration, verified, current.createdAt());
        NotificationChannel written = store.updateChannel(edited)
                .orElseThrow(() -> new NotFoundException(CHANNEL_NOT_FOUND));
        if (current.verified() && !written.verified()) {
            logger.info("Channel {} ({}) configuration changed, verification reset", channelId, written.name());
        }
        return written;
    }

    public void delete(long channelId, long ownerId) {
        if (!store.deleteChannel(channelId, ownerId)) {
            throw new NotFoundException(CHANNEL_NOT_FOUND);
        }
        logger.info("Deleted channel {} for owner {}", channelId, ownerId);
    }

    public NotificationChannel markVerified(long channelId, long ownerId) {
        NotificationChannel current = get(channelId, ownerId);
        if (current.verified()) {
            return current;
        }
        NotificationChannel verified = new NotificationChannel(current.id(), ownerId, current.type(), current.name(),
                current.configurationDetails(), true, current.createdAt());
        NotificationChannel written = store.updateChannel(verified)
                .orElseThrow(() -> new NotFoundException(CHANNEL_NOT_FOUND));
        logger.info("Channel {} ({}) verified", channelId, written.name());
        return written;
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Channel name is required.");
        }
        return name.trim();
    }
}
