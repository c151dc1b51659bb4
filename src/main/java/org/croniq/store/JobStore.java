package org.croniq.store;

import org.croniq.monitoring.JobExecution;
import org.croniq.monitoring.MonitoredJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable table of monitored jobs and their execution log.
 * All methods throw {@link StoreException} on infrastructure failure.
 */
public interface JobStore {

    Optional<MonitoredJob> findByWebhookToken(String webhookToken);

    Optional<MonitoredJob> findById(long jobId);

    Optional<MonitoredJob> findByIdForOwner(long jobId, long ownerId);

    List<MonitoredJob> findByOwner(long ownerId);

    /**
     * Jobs not paused or errored whose {@code expectedNextPingAt + gracePeriodSeconds} is before {@code now}.
     */
    List<MonitoredJob> findOverdue(Instant now);

    /** Persists a new job; the returned copy carries the generated id and version 0. */
    MonitoredJob insert(MonitoredJob job);

    /**
     * Writes {@code next} (status, lastPingedAt, expectedNextPingAt) and appends {@code execution}
     * in one transaction, only if the stored row still has {@code current.version()}.
     *
     * @return empty when another writer got there first
     */
    Optional<StateChange> transition(MonitoredJob current, MonitoredJob next, JobExecution execution);

    /**
     * Writes a CRUD edit (name, schedule, grace period, status, expectedNextPingAt) with the same
     * version check as {@link #transition}.
     */
    Optional<MonitoredJob> update(MonitoredJob current, MonitoredJob edited);

    boolean delete(long jobId, long ownerId);

    /** Newest first. */
    List<JobExecution> findExecutions(long jobId, int limit);
}
