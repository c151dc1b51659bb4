package org.croniq.services;

import org.croniq.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TaskSchedulerTest {

    private static final Instant NOW = Instant.parse("2023-01-01T10:00:00Z");

    private final TaskScheduler scheduler = new TaskScheduler(1, new MutableClock(NOW));

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private static ScheduledTask task(String name, Runnable body) {
        return new ScheduledTask() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public long intervalSeconds() {
                return 30;
            }

            @Override
            public void execute() {
                body.run();
            }
        };
    }

    @Test
    void successfulRunIsRecorded() {
        scheduler.runTaskWithLogging(task("ok", () -> { }));

        assertThat(scheduler.lastRuns()).singleElement().satisfies(run -> {
            assertThat(run.name()).isEqualTo("ok");
            assertThat(run.status()).isEqualTo("SUCCESS");
            assertThat(run.lastRunAt()).isEqualTo(NOW);
            assertThat(run.nextRunAt()).isEqualTo(NOW.plusSeconds(30));
            assertThat(run.errorMessage()).isNull();
        });
    }

    @Test
    void throwingTaskIsRecordedAsFailed() {
        scheduler.runTaskWithLogging(task("boom", () -> {
            throw new IllegalStateException("database unavailable");
        }));

        assertThat(scheduler.lastRuns()).singleElement().satisfies(run -> {
            assertThat(run.status()).isEqualTo("FAILED");
            assertThat(run.errorMessage()).isEqualTo("database unavailable");
        });
    }

    @Test
    void registeredTasksRunAfterStart() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(1);
        scheduler.register(task("tick", ran::countDown));

        scheduler.start();

        assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
    }
}
