package org.croniq.services;

public interface ScheduledTask {
    /**
     * A short name used for logging and the health report.
     */
    String name();

    /**
     * Interval in seconds between executions.
     */
    long intervalSeconds();

    /**
     * The work to do. Implementations should catch exceptions and log them.
     */
    void execute();
}
