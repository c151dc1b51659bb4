package org.croniq.monitoring;

import java.util.Locale;

public enum ExecutionStatus {
    SUCCESS("success"),
    FAILED("failed"),
    LATE("late"),
    SKIPPED("skipped"),
    ERRORED("errored");

    private final String code;

    ExecutionStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ExecutionStatus forDetection(JobStatus status) {
        return switch (status) {
            case LATE -> LATE;
            case ERRORED -> ERRORED;
            default -> throw new IllegalArgumentException("No detection execution for status " + status);
        };
    }

    public static ExecutionStatus fromCode(String code) {
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ExecutionStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown execution status: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
