package org.croniq.jobs;

import org.croniq.monitoring.JobStatus;
import org.croniq.monitoring.ScheduleType;

/**
 * Partial edit of a monitored job. Null fields are left unchanged.
 */
public record JobUpdate(
        String name,
        ScheduleType scheduleType,
        String scheduleValue,
        JobStatus status,
        Integer gracePeriodSeconds
) {

    public boolean changesSchedule() {
        return scheduleType != null || scheduleValue != null;
    }

    public boolean isEmpty() {
        return name == null && !changesSchedule() && status == null && gracePeriodSeconds == null;
    }
}
