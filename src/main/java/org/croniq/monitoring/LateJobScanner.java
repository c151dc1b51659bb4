package org.croniq.monitoring;

import org.croniq.notifications.EventKind;
import org.croniq.notifications.NotificationDispatcher;
import org.croniq.store.JobStore;
import org.croniq.store.StateChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One pass over the overdue jobs. A job past its grace window is marked {@code late}; once it is
 * overdue by more than {@code escalationMultiplier * (grace + nominal period)} it is marked
 * {@code errored} and drops out of later scans until it pings again.
 */
public class LateJobScanner {

    private static final Logger logger = LoggerFactory.getLogger(LateJobScanner.class);

    public static final double DEFAULT_ESCALATION_MULTIPLIER = 3.0;

    private final JobStore store;
    private final ScheduleCalculator calculator;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;
    private final double escalationMultiplier;

    public LateJobScanner(JobStore store, ScheduleCalculator calculator, NotificationDispatcher dispatcher,
                          Clock clock, double escalationMultiplier) {
        this.store = store;
        this.calculator = calculator;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.escalationMultiplier = escalationMultiplier > 0 ? escalationMultiplier : DEFAULT_ESCALATION_MULTIPLIER;
    }

    public ScanSummary scan() {
        Instant now = clock.instant();
        List<MonitoredJob> overdue;
        try {
            overdue = store.findOverdue(now);
        } catch (RuntimeException e) {
            logger.error("Late job scan at {} could not load overdue jobs", now, e);
            return ScanSummary.EMPTY;
        }

        int late = 0;
        int errored = 0;
        int skipped = 0;
        for (MonitoredJob job : overdue) {
            try {
                Optional<JobStatus> outcome = evaluate(job, now);
                if (outcome.isEmpty()) {
                    skipped++;
                } else if (outcome.get() == JobStatus.ERRORED) {
                    errored++;
                } else {
                    late++;
                }
            } catch (RuntimeException e) {
                skipped++;
                logger.error("Failed to evaluate job {} ({}) during late job scan", job.id(), job.name(), e);
            }
        }

        ScanSummary summary = new ScanSummary(overdue.size(), late, errored, skipped);
        if (summary.examined() > 0) {
            logger.info("Late job scan at {}: examined={}, late={}, errored={}, skipped={}",
                    now, summary.examined(), summary.late(), summary.errored(), summary.skipped());
        } else {
            logger.debug("Late job scan at {}: no overdue jobs", now);
        }
        return summary;
    }

    /**
     * @return the status written, or empty when the job was not changed on this tick
     */
    private Optional<JobStatus> evaluate(MonitoredJob job, Instant now) {
        if (!isOverdue(job, now)) {
            return Optional.empty();
        }

        JobStatus detected = classify(job, now);
        Instant expected = job.expectedNextPingAt();
        JobExecution execution = JobExecution.pending(job.id(), ExecutionStatus.forDetection(detected), now,
                "Job detected as " + detected.code() + " by scheduler. Expected at " + expected
                        + ", detected at " + now + ".");

        Optional<StateChange> written = store.transition(job, job.withStatus(detected), execution);
        if (written.isEmpty()) {
            logger.info("Job {} ({}) changed while being scanned, leaving it for the next tick", job.id(), job.name());
            return Optional.empty();
        }

        StateChange change = written.get();
        logger.info("Job {} ({}) marked {} (was {}), expected at {}",
                job.id(), job.name(), detected, job.status(), expected);
        dispatcher.dispatch(change.job(), EventKind.forDetectedStatus(detected), change.execution());
        return Optional.of(detected);
    }

    private static boolean isOverdue(MonitoredJob job, Instant now) {
        if (job.status().isExcludedFromScan() || job.expectedNextPingAt() == null) {
            return false;
        }
        return now.isAfter(job.expectedNextPingAt().plusSeconds(job.gracePeriodSeconds()));
    }

    JobStatus classify(MonitoredJob job, Instant now) {
        Duration overdueBy = Duration.between(job.expectedNextPingAt(), now);
        Duration period;
        try {
            period = calculator.nominalPeriod(job.scheduleType(), job.scheduleValue());
        } catch (ScheduleException e) {
            logger.warn("Cannot derive period of job {} ({}), not escalating: {}", job.id(), job.name(), e.getMessage());
            return JobStatus.LATE;
        }

        double windowMillis = escalationMultiplier * (job.gracePeriodSeconds() * 1000.0 + period.toMillis());
        return overdueBy.toMillis() > windowMillis ? JobStatus.ERRORED : JobStatus.LATE;
    }

    public record ScanSummary(int examined, int late, int errored, int skipped) {
        public static final ScanSummary EMPTY = new ScanSummary(0, 0, 0, 0);
    }
}
