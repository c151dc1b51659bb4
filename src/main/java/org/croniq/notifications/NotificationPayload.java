package org.croniq.notifications;

import org.croniq.monitoring.JobExecution;
import org.croniq.monitoring.MonitoredJob;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized message handed to every channel sender, whatever its transport.
 */
public record NotificationPayload(
        long jobId,
        String jobName,
        String scheduleType,
        String scheduleValue,
        String currentStatus,
        EventKind eventKind,
        Instant lastPingedAt,
        Instant expectedNextPingAt,
        String executionLog,
        Instant occurredAt
) {

    public static NotificationPayload of(MonitoredJob job, EventKind kind, JobExecution execution, Instant occurredAt) {
        return new NotificationPayload(
                job.id(),
                job.name(),
                job.scheduleType().code(),
                job.scheduleValue(),
                job.status().code(),
                kind,
                job.lastPingedAt(),
                job.expectedNextPingAt(),
                execution != null ? execution.outputLog() : null,
                occurredAt
        );
    }

    public String scheduleDescription() {
        return scheduleType + " (" + scheduleValue + ")";
    }

    /** Snake-case view used for JSON bodies and template rendering. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("job_id", jobId);
        map.put("job_name", jobName);
        map.put("schedule_type", scheduleType);
        map.put("schedule_value", scheduleValue);
        map.put("schedule", scheduleDescription());
        map.put("current_status", currentStatus);
        map.put("event_kind", eventKind.code());
        map.put("last_pinged_at", lastPingedAt != null ? lastPingedAt.toString() : null);
        map.put("expected_next_ping_at", expectedNextPingAt != null ? expectedNextPingAt.toString() : null);
        map.put("execution_log", executionLog);
        map.put("occurred_at", occurredAt.toString());
        return map;
    }
}
