package org.croniq.monitoring;

import java.util.Locale;

/**
 * How a job's schedule value is interpreted.
 */
public enum ScheduleType {
    CRON("cron"),
    INTERVAL("interval");

    private final String code;

    ScheduleType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ScheduleType fromCode(String code) throws ScheduleException {
        if (code == null) {
            throw new ScheduleException("schedule type is required");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ScheduleType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new ScheduleException("Invalid schedule type '" + code + "'. Must be 'cron' or 'interval'.");
    }

    @Override
    public String toString() {
        return code;
    }
}
