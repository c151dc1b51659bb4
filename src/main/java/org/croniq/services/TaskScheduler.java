package org.croniq.services;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs registered {@link ScheduledTask}s at fixed rate and remembers the outcome of each
 * task's latest run for the health endpoint.
 */
public class TaskScheduler {

    private static final Logger logger = LoggerFactory.getLogger(TaskScheduler.class);

    private final ScheduledThreadPoolExecutor executor;
    private final Clock clock;
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();
    private final List<ScheduledTask> tasks = new ArrayList<>();
    private final Map<String, TaskRun> lastRuns = new ConcurrentHashMap<>();

    public TaskScheduler(int poolSize, Clock clock) {
        this.clock = clock;
        this.executor = new ScheduledThreadPoolExecutor(poolSize, runnable -> {
            Thread thread = new Thread(runnable, "croniq-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        this.executor.setRemoveOnCancelPolicy(true);
    }

    public synchronized void register(ScheduledTask task) {
        tasks.add(task);
    }

    public synchronized void start() {
        for (ScheduledTask task : tasks) {
            logger.info("Scheduling task {} every {}s", task.name(), task.intervalSeconds());
            ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                    () -> runTaskWithLogging(task),
                    0,
                    task.intervalSeconds(),
                    TimeUnit.SECONDS
            );
            futures.add(future);
        }
    }

    void runTaskWithLogging(ScheduledTask task) {
        Instant start = clock.instant();
        String errorMessage = null;
        try {
            task.execute();
        } catch (Exception e) {
            // a task that throws would otherwise be cancelled by the executor
            errorMessage = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            logger.error("Error in scheduled task {}: {}", task.name(), errorMessage, e);
        } finally {
            Instant end = clock.instant();
            lastRuns.put(task.name(), new TaskRun(task.name(), errorMessage == null ? "SUCCESS" : "FAILED",
                    start, end, start.plusSeconds(task.intervalSeconds()), errorMessage));
        }
    }

    /** Latest outcome of every task that has run at least once. */
    public Collection<TaskRun> lastRuns() {
        return List.copyOf(lastRuns.values());
    }

    public synchronized void shutdown() {
        logger.info("[--------- Shutting down TaskScheduler ---------]");
        for (ScheduledFuture<?> future : futures) future.cancel(false);
        futures.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("TaskScheduler did not terminate gracefully");
                executor.shutdownNow();
            } else {
                logger.info("[--------- TaskScheduler stopped ---------]");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            logger.warn("TaskScheduler shutdown interrupted.");
        }
    }

    public record TaskRun(String name, String status, Instant lastRunAt, Instant finishedAt,
                          Instant nextRunAt, String errorMessage) {
    }
}
