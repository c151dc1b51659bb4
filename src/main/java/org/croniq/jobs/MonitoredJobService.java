package org.croniq.jobs;

import org.croniq.errors.NotFoundException;
import org.croniq.errors.ValidationException;
import org.croniq.monitoring.JobExecution;
import org.croniq.monitoring.JobStatus;
import org.croniq.monitoring.MonitoredJob;
import org.croniq.monitoring.ScheduleCalculator;
import org.croniq.monitoring.ScheduleException;
import org.croniq.monitoring.ScheduleType;
import org.croniq.store.JobStore;
import org.croniq.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Account-scoped management of monitored jobs. A job owned by another account is reported
 * exactly like a missing one.
 */
public class MonitoredJobService {

    private static final Logger logger = LoggerFactory.getLogger(MonitoredJobService.class);

    public static final int DEFAULT_GRACE_PERIOD_SECONDS = 60;
    static final String JOB_NOT_FOUND = "Monitored job not found.";
    private static final int TOKEN_BYTES = 32;
    private static final int MAX_UPDATE_ATTEMPTS = 3;

    private final JobStore store;
    private final ScheduleCalculator calculator;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public MonitoredJobService(JobStore store, ScheduleCalculator calculator, Clock clock) {
        this.store = store;
        this.calculator = calculator;
        this.clock = clock;
    }

    public MonitoredJob create(long ownerId, String name, ScheduleType scheduleType, String scheduleValue,
                               Integer gracePeriodSeconds) {
        String trimmedName = requireName(name);
        int grace = gracePeriodSeconds != null ? requireGrace(gracePeriodSeconds) : DEFAULT_GRACE_PERIOD_SECONDS;
        Instant now = clock.instant();
        Instant expected = expectedFrom(scheduleType, scheduleValue, now);

        MonitoredJob job = store.insert(new MonitoredJob(0L, ownerId, trimmedName, scheduleType, scheduleValue,
                generateWebhookToken(), grace, JobStatus.ACTIVE, null, expected, now, 0L));
        logger.info("Created job {} ({}) for owner {}: {} '{}', first ping expected at {}",
                job.id(), job.name(), ownerId, scheduleType, scheduleValue, expected);
        return job;
    }

    public MonitoredJob get(long jobId, long ownerId) {
        return store.findByIdForOwner(jobId, ownerId)
                .orElseThrow(() -> new NotFoundException(JOB_NOT_FOUND));
    }

    public List<MonitoredJob> list(long ownerId) {
        return store.findByOwner(ownerId);
    }

    public MonitoredJob update(long jobId, long ownerId, JobUpdate update) {
        if (update.name() != null) {
            requireName(update.name());
        }
        if (update.gracePeriodSeconds() != null) {
            requireGrace(update.gracePeriodSeconds());
        }
        if (update.status() != null && update.status() != JobStatus.ACTIVE && update.status() != JobStatus.PAUSED) {
            throw new ValidationException("Status can only be set to 'active' or 'paused'.");
        }

        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            MonitoredJob current = get(jobId, ownerId);
            if (update.isEmpty()) {
                return current;
            }
            MonitoredJob edited = apply(current, update);
            Optional<MonitoredJob> written = store.update(current, edited);
            if (written.isPresent()) {
                logger.info("Updated job {} ({}): status={}, schedule={} '{}', next expected at {}",
                        jobId, edited.name(), edited.status(), edited.scheduleType(), edited.scheduleValue(),
                        edited.expectedNextPingAt());
                return written.get();
            }
            logger.debug("Version conflict updating job {} (attempt {})", jobId, attempt);
        }
        throw new StoreException("Job " + jobId + " was modified concurrently, update abandoned");
    }

    public void delete(long jobId, long ownerId) {
        if (!store.delete(jobId, ownerId)) {
            throw new NotFoundException(JOB_NOT_FOUND);
        }
        logger.info("Deleted job {} for owner {}", jobId, ownerId);
    }

    /** Most recent executions first. */
    public List<JobExecution> executions(long jobId, long ownerId, int limit) {
        get(jobId, ownerId);
        return store.findExecutions(jobId, Math.max(1, limit));
    }

    private MonitoredJob apply(MonitoredJob current, JobUpdate update) {
        String name = update.name() != null ? update.name().trim() : current.name();
        ScheduleType type = update.scheduleType() != null ? update.scheduleType() : current.scheduleType();
        String value = update.scheduleValue() != null ? update.scheduleValue() : current.scheduleValue();
        int grace = update.gracePeriodSeconds() != null ? update.gracePeriodSeconds() : current.gracePeriodSeconds();
        JobStatus status = update.status() != null ? update.status() : current.status();

        Instant expected = current.expectedNextPingAt();
        if (update.changesSchedule()) {
            expected = expectedFrom(type, value, current.scheduleAnchor());
        }
        return new MonitoredJob(current.id(), current.ownerId(), name, type, value, current.webhookToken(),
                grace, status, current.lastPingedAt(), expected, current.createdAt(), current.version());
    }

    private Instant expectedFrom(ScheduleType type, String value, Instant anchor) {
        try {
            return calculator.nextPing(type, value, anchor);
        } catch (ScheduleException e) {
            throw new ValidationException(e.getMessage(), e);
        }
    }

    String generateWebhookToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Job name is required.");
        }
        return name.trim();
    }

    private static int requireGrace(int grace) {
        if (grace < 0) {
            throw new ValidationException("Grace period must be zero or more seconds.");
        }
        return grace;
    }
}
