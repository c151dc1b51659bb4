package org.croniq.monitoring;

import java.util.Locale;

/**
 * Job status state machine.
 *
 *   active  --ping-->  healthy
 *   healthy --scan-->  late | errored
 *   late    --scan-->  late | errored
 *   late    --ping-->  healthy   (recovery)
 *   errored --ping-->  healthy   (recovery)
 *   paused is only entered and left through CRUD, the scanner ignores it.
 */
public enum JobStatus {
    ACTIVE("active"),
    HEALTHY("healthy"),
    LATE("late"),
    ERRORED("errored"),
    PAUSED("paused");

    private final String code;

    JobStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** A ping arriving in one of these states is a recovery. */
    public boolean isAlerting() {
        return this == LATE || this == ERRORED;
    }

    /** The late-job scanner never re-evaluates jobs in these states. */
    public boolean isExcludedFromScan() {
        return this == PAUSED || this == ERRORED;
    }

    public static JobStatus fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("status code is null");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (JobStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
