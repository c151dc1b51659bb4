package org.croniq.store;

import org.croniq.monitoring.JobExecution;
import org.croniq.monitoring.MonitoredJob;

/**
 * Result of a successful status transition: the row as written and the execution appended with it.
 */
public record StateChange(MonitoredJob job, JobExecution execution) {
}
