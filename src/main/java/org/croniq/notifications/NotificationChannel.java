package org.croniq.notifications;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A destination for alerts. {@code configurationDetails} holds the type-specific settings
 * (email address, webhook URL, routing key, headers) and is copied on construction.
 */
public record NotificationChannel(
        long id,
        long ownerId,
        ChannelType type,
        String name,
        Map<String, Object> configurationDetails,
        boolean verified,
        Instant createdAt
) {

    public NotificationChannel {
        // JSON nulls are legal values, so no Map.copyOf
        configurationDetails = configurationDetails == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(configurationDetails));
    }

    public String configString(String key) {
        Object value = configurationDetails.get(key);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, String> configStringMap(String key) {
        Object value = configurationDetails.get(key);
        if (value instanceof Map) {
            return Collections.unmodifiableMap(new LinkedHashMap<>((Map<String, String>) value));
        }
        return Map.of();
    }
}
