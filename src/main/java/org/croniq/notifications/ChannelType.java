package org.croniq.notifications;

import org.croniq.errors.ValidationException;

import java.util.Locale;

public enum ChannelType {
    EMAIL("email"),
    SLACK("slack"),
    PAGERDUTY("pagerduty"),
    WEBHOOK("webhook");

    private final String code;

    ChannelType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Email addresses must be confirmed before they receive alerts. */
    public boolean requiresVerification() {
        return this == EMAIL;
    }

    public static ChannelType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (ChannelType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ValidationException("Invalid channel type '" + code + "'. Must be one of email, slack, pagerduty, webhook.");
    }

    @Override
    public String toString() {
        return code;
    }
}
