package org.croniq.monitoring;

import java.time.Instant;

/**
 * One row of the append-only execution log. {@code id} is 0 until persisted.
 */
public record JobExecution(
        long id,
        long jobId,
        ExecutionStatus status,
        Instant startedAt,
        Instant endedAt,
        String outputLog
) {

    public static JobExecution pending(long jobId, ExecutionStatus status, Instant at, String outputLog) {
        return new JobExecution(0L, jobId, status, at, at, outputLog);
    }

    public JobExecution withId(long newId) {
        return new JobExecution(newId, jobId, status, startedAt, endedAt, outputLog);
    }
}
