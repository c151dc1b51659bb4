package org.croniq.monitoring;

import org.croniq.errors.NotFoundException;
import org.croniq.notifications.EventKind;
import org.croniq.notifications.NotificationDispatcher;
import org.croniq.store.JobStore;
import org.croniq.store.StateChange;
import org.croniq.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Records inbound heartbeats. A ping always moves the job to {@code healthy}; when the job was
 * late or errored beforehand a recovery alert goes out.
 */
public class PingIngestor {

    private static final Logger logger = LoggerFactory.getLogger(PingIngestor.class);

    static final String PING_LOG = "Ping received successfully.";
    static final String UNKNOWN_TOKEN = "Job not found or invalid token.";

    private final JobStore store;
    private final ScheduleCalculator calculator;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;
    private final int maxAttempts;

    public PingIngestor(JobStore store, ScheduleCalculator calculator, NotificationDispatcher dispatcher,
                        Clock clock, int maxAttempts) {
        this.store = store;
        this.calculator = calculator;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public PingResult processPing(String webhookToken) {
        MonitoredJob current = (webhookToken == null || webhookToken.isBlank())
                ? null
                : store.findByWebhookToken(webhookToken).orElse(null);
        if (current == null) {
            logger.warn("Ping received for unknown webhook token {}", mask(webhookToken));
            throw new NotFoundException(UNKNOWN_TOKEN);
        }

        for (int attempt = 1; ; attempt++) {
            JobStatus previousStatus = current.status();
            Instant now = clock.instant();
            if (current.lastPingedAt() != null && now.isBefore(current.lastPingedAt())) {
                now = current.lastPingedAt();
            }

            MonitoredJob pinged = current.withPing(now, nextExpected(current, now));
            JobExecution execution = JobExecution.pending(current.id(), ExecutionStatus.SUCCESS, now, PING_LOG);

            Optional<StateChange> written = store.transition(current, pinged, execution);
            if (written.isPresent()) {
                StateChange change = written.get();
                boolean recovered = previousStatus.isAlerting();
                logger.info("Ping recorded for job {} ({}): {} -> {}, next expected at {}",
                        current.id(), current.name(), previousStatus, change.job().status(),
                        change.job().expectedNextPingAt());
                if (recovered) {
                    logger.info("Job {} ({}) recovered from {}", current.id(), current.name(), previousStatus);
                    dispatcher.dispatch(change.job(), EventKind.RECOVERY, change.execution());
                }
                return new PingResult(change.job(), recovered);
            }

            if (attempt >= maxAttempts) {
                throw new StoreException("Job " + current.id() + " was modified concurrently "
                        + attempt + " times while recording a ping");
            }
            logger.debug("Version conflict recording ping for job {} (attempt {}), retrying", current.id(), attempt);
            long jobId = current.id();
            current = store.findById(jobId).orElseThrow(() -> {
                logger.warn("Job {} was deleted while a ping was being recorded", jobId);
                return new NotFoundException(UNKNOWN_TOKEN);
            });
        }
    }

    private Instant nextExpected(MonitoredJob job, Instant now) {
        try {
            return calculator.nextPing(job.scheduleType(), job.scheduleValue(), now);
        } catch (ScheduleException e) {
            logger.warn("Could not compute next ping for job {} ({}) from schedule {} '{}': {}",
                    job.id(), job.name(), job.scheduleType(), job.scheduleValue(), e.getMessage());
            return null;
        }
    }

    private static String mask(String token) {
        if (token == null || token.length() <= 8) {
            return "****";
        }
        return token.substring(0, 8) + "****";
    }

    /**
     * @param recovered the ping moved the job out of {@code late} or {@code errored}
     */
    public record PingResult(MonitoredJob job, boolean recovered) {
    }
}
