package org.croniq.notifications;

import org.croniq.monitoring.JobStatus;

public enum EventKind {
    FAILURE("failure"),
    LATENESS("lateness"),
    RECOVERY("recovery");

    private final String code;

    EventKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isAlert() {
        return this != RECOVERY;
    }

    /** Event raised by the scanner when a job enters {@code status}. */
    public static EventKind forDetectedStatus(JobStatus status) {
        return status == JobStatus.ERRORED ? FAILURE : LATENESS;
    }

    @Override
    public String toString() {
        return code;
    }
}
