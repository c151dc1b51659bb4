package org.croniq.monitoring;

import java.time.Instant;

/**
 * A job whose heartbeats are being watched.
 *
 * @param version row version, bumped on every state write; used for compare-and-swap updates
 */
public record MonitoredJob(
        long id,
        long ownerId,
        String name,
        ScheduleType scheduleType,
        String scheduleValue,
        String webhookToken,
        int gracePeriodSeconds,
        JobStatus status,
        Instant lastPingedAt,
        Instant expectedNextPingAt,
        Instant createdAt,
        long version
) {

    /** The instant the current expectation was computed from: last ping, otherwise creation. */
    public Instant scheduleAnchor() {
        return lastPingedAt != null ? lastPingedAt : createdAt;
    }

    public MonitoredJob withStatus(JobStatus newStatus) {
        return new MonitoredJob(id, ownerId, name, scheduleType, scheduleValue, webhookToken,
                gracePeriodSeconds, newStatus, lastPingedAt, expectedNextPingAt, createdAt, version + 1);
    }

    public MonitoredJob withPing(Instant pingedAt, Instant nextExpected) {
        return new MonitoredJob(id, ownerId, name, scheduleType, scheduleValue, webhookToken,
                gracePeriodSeconds, JobStatus.HEALTHY, pingedAt, nextExpected, createdAt, version + 1);
    }
}
