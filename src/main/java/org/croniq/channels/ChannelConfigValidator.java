package org.croniq.channels;

import org.croniq.errors.ValidationException;
import org.croniq.notifications.ChannelType;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks a channel's configuration object against the fields its type needs.
 */
public final class ChannelConfigValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern ROUTING_KEY = Pattern.compile("^[A-Za-z0-9]{32}$");
    private static final Pattern HTTP_URL = Pattern.compile("^https?://\\S+$", Pattern.CASE_INSENSITIVE);
    private static final String SLACK_PREFIX = "https://hooks.slack.com/";
    // set by the HTTP client itself
    private static final Set<String> RESERVED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private ChannelConfigValidator() {}

    public static void validate(ChannelType type, Map<String, Object> config) {
        if (config == null) {
            throw invalid(type, "configuration is required");
        }
        switch (type) {
            case EMAIL -> requireMatch(type, config, "email", EMAIL);
            case SLACK -> {
                String url = requireString(type, config, "webhookUrl");
                if (!url.startsWith(SLACK_PREFIX)) {
                    throw invalid(type, "webhookUrl must start with " + SLACK_PREFIX);
                }
            }
            case PAGERDUTY -> requireMatch(type, config, "routingKey", ROUTING_KEY);
            case WEBHOOK -> {
                requireMatch(type, config, "url", HTTP_URL);
                Object headers = config.get("headers");
                if (headers != null) {
                    if (!(headers instanceof Map<?, ?> map)) {
                        throw invalid(type, "headers must be an object");
                    }
                    for (Map.Entry<?, ?> header : map.entrySet()) {
                        if (!(header.getValue() instanceof String)) {
                            throw invalid(type, "header '" + header.getKey() + "' must have a string value");
                        }
                        if (RESERVED_HEADERS.contains(String.valueOf(header.getKey()).toLowerCase(Locale.ROOT))) {
                            throw invalid(type, "header '" + header.getKey() + "' cannot be overridden");
                        }
                    }
                }
            }
        }
    }

    private static void requireMatch(ChannelType type, Map<String, Object> config, String key, Pattern pattern) {
        String value = requireString(type, config, key);
        if (!pattern.matcher(value).matches()) {
            throw invalid(type, key + " is malformed");
        }
    }

    private static String requireString(ChannelType type, Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (!(value instanceof String s) || s.isBlank()) {
            throw invalid(type, key + " is required");
        }
        return s;
    }

    private static ValidationException invalid(ChannelType type, String detail) {
        return new ValidationException("Invalid configuration_details for type " + type.code() + ": " + detail + ".");
    }
}
