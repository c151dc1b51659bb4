package org.croniq.monitoring;

import org.croniq.notifications.ChannelType;
import org.croniq.notifications.EventKind;
import org.croniq.notifications.NotificationChannel;
import org.croniq.notifications.NotificationDispatcher;
import org.croniq.store.StoreException;
import org.croniq.support.Fixtures;
import org.croniq.support.InMemoryJobStore;
import org.croniq.support.InMemoryNotificationStore;
import org.croniq.support.MutableClock;
import org.croniq.support.RecordingSender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class LateJobScannerTest {

    private static final Instant T0 = Instant.parse("2023-01-01T10:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryJobStore jobs = new InMemoryJobStore();
    private final InMemoryNotificationStore notifications = new InMemoryNotificationStore();
    private final RecordingSender slack = new RecordingSender(ChannelType.SLACK);

    private NotificationDispatcher dispatcher;
    private ScheduleCalculator calculator;
    private LateJobScanner scanner;
    private NotificationChannel channel;

    @BeforeEach
    void setUp() {
        dispatcher = new NotificationDispatcher(notifications, Executors.newSingleThreadExecutor(),
                Duration.ofSeconds(5), clock);
        dispatcher.addSender(slack);
        calculator = new ScheduleCalculator(clock, ZoneOffset.UTC);
        scanner = new LateJobScanner(jobs, calculator, dispatcher, clock, 3.0);
        channel = Fixtures.channel(notifications, ChannelType.SLACK, true,
                Map.of("webhookUrl", "https://hooks.slack.com/services/T/B/X"));
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    private MonitoredJob fiveMinuteJob(long id) {
        MonitoredJob job = jobs.put(Fixtures.intervalJob(id, "5m", 60, T0, T0.plusSeconds(300)));
        Fixtures.bind(notifications, id, channel.id(), true, true, true);
        return job;
    }

    @Test
    void jobInsideGraceWindowIsLeftAlone() {
        fiveMinuteJob(1L);
        clock.set(T0.plusSeconds(360));

        LateJobScanner.ScanSummary summary = scanner.scan();

        assertThat(summary.examined()).isZero();
        assertThat(jobs.get(1L).status()).isEqualTo(JobStatus.ACTIVE);
        assertThat(jobs.executionsOf(1L)).isEmpty();
    }

    @Test
    void jobPastGraceWindowBecomesLate() {
        fiveMinuteJob(1L);
        clock.set(T0.plusSeconds(361));

        LateJobScanner.ScanSummary summary = scanner.scan();

        assertThat(summary).isEqualTo(new LateJobScanner.ScanSummary(1, 1, 0, 0));
        assertThat(jobs.get(1L).status()).isEqualTo(JobStatus.LATE);
        assertThat(jobs.get(1L).expectedNextPingAt()).isEqualTo(T0.plusSeconds(300));
        assertThat(jobs.executionsOf(1L)).singleElement().satisfies(execution -> {
            assertThat(execution.status()).isEqualTo(ExecutionStatus.LATE);
            assertThat(execution.outputLog()).isEqualTo("Job detected as late by scheduler. "
                    + "Expected at 2023-01-01T10:05:00Z, detected at 2023-01-01T10:06:01Z.");
        });
        assertThat(slack.deliveries()).singleElement().satisfies(delivery -> {
            assertThat(delivery.payload().eventKind()).isEqualTo(EventKind.LATENESS);
            assertThat(delivery.payload().currentStatus()).isEqualTo("late");
        });
    }

    @Test
    void lateJobIsReEvaluatedOnEveryTick() {
        fiveMinuteJob(1L);
        clock.set(T0.plusSeconds(361));
        scanner.scan();
        clock.set(T0.plusSeconds(421));

        LateJobScanner.ScanSummary summary = scanner.scan();

        assertThat(summary.late()).isEqualTo(1);
        assertThat(jobs.executionsOf(1L)).hasSize(2);
        assertThat(slack.deliveries()).hasSize(2);
    }

    @Test
    void jobOverdueBeyondEscalationWindowIsErrored() {
        fiveMinuteJob(1L);
        clock.set(T0.plusSeconds(25 * 60));

        LateJobScanner.ScanSummary summary = scanner.scan();

        assertThat(summary).isEqualTo(new LateJobScanner.ScanSummary(1, 0, 1, 0));
        assertThat(jobs.get(1L).status()).isEqualTo(JobStatus.ERRORED);
        assertThat(jobs.executionsOf(1L)).singleElement()
                .extracting(JobExecution::status).isEqualTo(ExecutionStatus.ERRORED);
        assertThat(slack.deliveries()).singleElement()
                .satisfies(delivery -> assertThat(delivery.payload().eventKind()).isEqualTo(EventKind.FAILURE));
    }

    @Test
    void erroredJobIsNotScannedAgain() {
        fiveMinuteJob(1L);
        clock.set(T0.plusSeconds(25 * 60));
        scanner.scan();
        clock.advance(Duration.ofHours(1));

        assertThat(scanner.scan().examined()).isZero();
        assertThat(jobs.executionsOf(1L)).hasSize(1);
        assertThat(slack.deliveries()).hasSize(1);
    }

    @Test
    void escalationBoundaryIsExclusive() {
        fiveMinuteJob(1L);
        // window is 3 * (60s + 300s) = 18 minutes past the expected time
        Instant boundary = T0.plusSeconds(300 + 18 * 60);

        MonitoredJob job = jobs.get(1L);
        assertThat(scanner.classify(job, boundary)).isEqualTo(JobStatus.LATE);
        assertThat(scanner.classify(job, boundary.plusMillis(1))).isEqualTo(JobStatus.ERRORED);
    }

    @Test
    void multiplierIsConfigurable() {
        LateJobScanner eager = new LateJobScanner(jobs, calculator, dispatcher, clock, 1.0);
        MonitoredJob job = fiveMinuteJob(1L);

        assertThat(eager.classify(job, T0.plusSeconds(300 + 360))).isEqualTo(JobStatus.LATE);
        assertThat(eager.classify(job, T0.plusSeconds(300 + 361))).isEqualTo(JobStatus.ERRORED);
    }

    @Test
    void pausedJobsAreIgnored() {
        jobs.put(Fixtures.withStatus(fiveMinuteJob(1L), JobStatus.PAUSED));
        clock.set(T0.plusSeconds(3_600));

        assertThat(scanner.scan().examined()).isZero();
        assertThat(jobs.get(1L).status()).isEqualTo(JobStatus.PAUSED);
    }

    @Test
    void jobWithoutExpectationIsIgnored() {
        jobs.put(new MonitoredJob(1L, Fixtures.OWNER, "no-expectation", ScheduleType.INTERVAL, "5m",
                Fixtures.token(1L), 60, JobStatus.HEALTHY, T0, null, T0, 0L));
        clock.set(T0.plusSeconds(3_600));

        assertThat(scanner.scan().examined()).isZero();
    }

    @Test
    void pingedJobIsNoLongerOverdue() {
        MonitoredJob job = fiveMinuteJob(1L);
        PingIngestor ingestor = new PingIngestor(jobs, calculator, dispatcher, clock, 3);
        clock.set(T0.plusSeconds(290));
        ingestor.processPing(job.webhookToken());
        clock.set(T0.plusSeconds(361));

        assertThat(scanner.scan().examined()).isZero();
        assertThat(jobs.get(1L).status()).isEqualTo(JobStatus.HEALTHY);
    }

    @Test
    void uncomputablePeriodKeepsJobLate() {
        jobs.put(new MonitoredJob(1L, Fixtures.OWNER, "broken", ScheduleType.CRON, "not a cron",
                Fixtures.token(1L), 60, JobStatus.HEALTHY, null, T0, T0, 0L));
        clock.set(T0.plus(Duration.ofDays(3)));

        assertThat(scanner.scan().late()).isEqualTo(1);
        assertThat(jobs.get(1L).status()).isEqualTo(JobStatus.LATE);
    }

    @Test
    void failureOnOneJobDoesNotStopTheOthers() {
        fiveMinuteJob(1L);
        fiveMinuteJob(2L);
        jobs.beforeTransition(current -> {
            if (current.id() == 1L) {
                throw new StoreException("row locked");
            }
        });
        clock.set(T0.plusSeconds(361));

        LateJobScanner.ScanSummary summary = scanner.scan();

        assertThat(summary).isEqualTo(new LateJobScanner.ScanSummary(2, 1, 0, 1));
        assertThat(jobs.get(1L).status()).isEqualTo(JobStatus.ACTIVE);
        assertThat(jobs.get(2L).status()).isEqualTo(JobStatus.LATE);
    }

    @Test
    void concurrentPingWinsOverTheScanner() {
        MonitoredJob job = fiveMinuteJob(1L);
        PingIngestor ingestor = new PingIngestor(jobs, calculator, dispatcher, clock, 3);
        clock.set(T0.plusSeconds(361));
        jobs.beforeTransition(current -> {
            jobs.beforeTransition(ignored -> { });
            // a ping lands after the scanner read the job but before it writes
            ingestor.processPing(job.webhookToken());
        });

        LateJobScanner.ScanSummary summary = scanner.scan();

        assertThat(summary).isEqualTo(new LateJobScanner.ScanSummary(1, 0, 0, 1));
        assertThat(jobs.get(1L).status()).isEqualTo(JobStatus.HEALTHY);
        assertThat(jobs.executionsOf(1L)).singleElement()
                .extracting(JobExecution::status).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(slack.deliveries()).isEmpty();
    }

    @Test
    void unreadableStoreYieldsEmptySummary() {
        fiveMinuteJob(1L);
        jobs.failAll(true);
        clock.set(T0.plusSeconds(361));

        assertThat(scanner.scan()).isEqualTo(LateJobScanner.ScanSummary.EMPTY);
    }

    @Test
    void notificationFailureDoesNotUndoTheTransition() {
        fiveMinuteJob(1L);
        slack.behave(RecordingSender.Behaviour.THROW);
        clock.set(T0.plusSeconds(361));

        assertThat(scanner.scan().late()).isEqualTo(1);
        assertThat(jobs.get(1L).status()).isEqualTo(JobStatus.LATE);
    }
}
