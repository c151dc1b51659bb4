package org.croniq.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.croniq.config.KeyProvider;
import org.croniq.services.TaskScheduler;
import org.croniq.utils.ResponseUtil;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * HTTP handler for health check endpoint.
 * Returns  -  basic app info,
 *          -  database status,
 *          -  background task statuses.
 */
public class HealthCheckHandler implements HttpHandler {

    static final String APP_NAME = "Croniq Heartbeat Monitor";
    static final String APP_VERSION = "1.0.0";

    private final BooleanSupplier databaseCheck;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Instant startTime;

    public HealthCheckHandler(BooleanSupplier databaseCheck, TaskScheduler scheduler, Clock clock) {
        this.databaseCheck = databaseCheck;
        this.scheduler = scheduler;
        this.clock = clock;
        this.startTime = clock.instant();
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Instant now = clock.instant();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("app", APP_NAME);
        response.put("version", APP_VERSION);
        response.put("environment", KeyProvider.getEnvironment());
        response.put("uptime_seconds", Duration.between(startTime, now).toSeconds());
        response.put("timestamp", now.toString());

        boolean dbOK = databaseCheck.getAsBoolean();
        response.put("database", "PostgreSQL");
        response.put("database_status", dbOK ? "connected" : "unavailable");

        List<Map<String, Object>> tasks = new ArrayList<>();
        scheduler.lastRuns().stream()
                .sorted(Comparator.comparing(TaskScheduler.TaskRun::name))
                .forEach(run -> {
                    Map<String, Object> task = new LinkedHashMap<>();
                    task.put("name", run.name());
                    task.put("status", run.status());
                    task.put("last_run_at", run.lastRunAt().toString());
                    task.put("next_run_at", run.nextRunAt().toString());
                    task.put("error_message", run.errorMessage());
                    tasks.add(task);
                });
        response.put("background_tasks", tasks);

        ResponseUtil.sendSuccess(exchange, "Health check completed", response);
    }
}
