package org.croniq.monitoring;

/**
 * A schedule definition could not be parsed or evaluated.
 */
public class ScheduleException extends Exception {

    public ScheduleException(String message) {
        super(message);
    }

    public ScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
