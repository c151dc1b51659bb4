package org.croniq.rest;

import com.fasterxml.jackson.databind.JsonNode;
import org.croniq.config.XmlConfiguration;
import org.croniq.handlers.HealthCheckHandler;
import org.croniq.handlers.PingHandler;
import org.croniq.monitoring.JobStatus;
import org.croniq.monitoring.MonitoredJob;
import org.croniq.monitoring.PingIngestor;
import org.croniq.monitoring.ScheduleCalculator;
import org.croniq.notifications.NotificationDispatcher;
import org.croniq.services.ScheduledTask;
import org.croniq.services.TaskScheduler;
import org.croniq.support.Fixtures;
import org.croniq.support.InMemoryJobStore;
import org.croniq.support.InMemoryNotificationStore;
import org.croniq.support.MutableClock;
import org.croniq.utils.JsonUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class RestApiServerTest {

    private static final Instant T0 = Instant.parse("2023-01-01T10:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryJobStore jobs = new InMemoryJobStore();
    private final HttpClient client = HttpClient.newHttpClient();
    private final AtomicBoolean databaseUp = new AtomicBoolean(true);

    private NotificationDispatcher dispatcher;
    private TaskScheduler scheduler;
    private RestApiServer server;
    private MonitoredJob job;

    @BeforeEach
    void setUp() {
        dispatcher = new NotificationDispatcher(new InMemoryNotificationStore(), Executors.newSingleThreadExecutor(),
                Duration.ofSeconds(1), clock);
        PingIngestor ingestor = new PingIngestor(jobs, new ScheduleCalculator(clock, ZoneOffset.UTC), dispatcher, clock, 3);
        scheduler = new TaskScheduler(1, clock);

        XmlConfiguration.Server cfg = new XmlConfiguration.Server();
        cfg.host = "127.0.0.1";
        cfg.port = 0;
        cfg.basePath = "/api/v1/";
        server = new RestApiServer(cfg, new PingHandler(ingestor),
                new HealthCheckHandler(databaseUp::get, scheduler, clock));
        server.start();

        job = jobs.put(Fixtures.withStatus(Fixtures.intervalJob(1L, "5m", 60, T0, T0.plusSeconds(300)), JobStatus.LATE));
    }

    @AfterEach
    void tearDown() {
        server.stop();
        scheduler.shutdown();
        dispatcher.close();
    }

    private HttpResponse<String> send(String method, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path))
                .method(method, HttpRequest.BodyPublishers.ofString("ignored body"))
                .timeout(Duration.ofSeconds(5))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void pingWithValidTokenReturnsUpdatedJob() throws Exception {
        clock.set(T0.plusSeconds(400));

        HttpResponse<String> response = send("POST", "/api/v1/webhook/ping/" + job.webhookToken());

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = JsonUtil.mapper().readTree(response.body());
        assertThat(body.path("status").asText()).isEqualTo("success");
        assertThat(body.path("message").asText()).isEqualTo("Ping processed successfully.");
        assertThat(body.path("data").path("status").asText()).isEqualTo("healthy");
        assertThat(body.path("data").path("last_pinged_at").asText()).isEqualTo("2023-01-01T10:06:40Z");
        assertThat(body.path("data").path("expected_next_ping_at").asText()).isEqualTo("2023-01-01T10:11:40Z");
        assertThat(body.path("data").has("webhook_token")).isFalse();
        assertThat(jobs.get(1L).status()).isEqualTo(JobStatus.HEALTHY);
    }

    @Test
    void unknownTokenIsNotFound() throws Exception {
        HttpResponse<String> response = send("POST", "/api/v1/webhook/ping/" + Fixtures.token(99L));

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(JsonUtil.mapper().readTree(response.body()).path("message").asText())
                .isEqualTo("Job not found or invalid token.");
    }

    @Test
    void storeFailureIsAServerError() throws Exception {
        jobs.failAll(true);

        HttpResponse<String> response = send("POST", "/api/v1/webhook/ping/" + job.webhookToken());

        assertThat(response.statusCode()).isEqualTo(500);
        assertThat(JsonUtil.mapper().readTree(response.body()).path("message").asText())
                .isEqualTo("Failed to process ping.");
    }

    @Test
    void getOnPingRouteIsMethodNotAllowed() throws Exception {
        HttpResponse<String> response = send("GET", "/api/v1/webhook/ping/" + job.webhookToken());

        assertThat(response.statusCode()).isEqualTo(405);
        assertThat(jobs.get(1L).status()).isEqualTo(JobStatus.LATE);
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        assertThat(send("POST", "/api/v1/nothing/here").statusCode()).isEqualTo(404);
        assertThat(send("POST", "/api/v1/webhook/other").statusCode()).isEqualTo(404);
    }

    @Test
    void healthReportsDatabaseAndTasks() throws Exception {
        ScheduledTask scan = new ScheduledTask() {
            @Override
            public String name() {
                return "LateJobScanTask";
            }

            @Override
            public long intervalSeconds() {
                return 60;
            }

            @Override
            public void execute() {
            }
        };
        scheduler.register(scan);
        scheduler.start();
        databaseUp.set(false);

        JsonNode body = null;
        for (int attempt = 0; attempt < 50; attempt++) {
            body = JsonUtil.mapper().readTree(send("GET", "/api/v1/system/health").body());
            if (body.path("data").path("background_tasks").size() > 0) {
                break;
            }
            Thread.sleep(100);
        }

        JsonNode data = body.path("data");
        assertThat(data.path("app").asText()).isEqualTo("Croniq Heartbeat Monitor");
        assertThat(data.path("database_status").asText()).isEqualTo("unavailable");
        assertThat(data.path("background_tasks").get(0).path("name").asText()).isEqualTo("LateJobScanTask");
        assertThat(data.path("background_tasks").get(0).path("status").asText()).isEqualTo("SUCCESS");
    }

    @Test
    void basePathIsNormalized() {
        assertThat(RestApiServer.normalize("/api/v1/")).isEqualTo("/api/v1");
        assertThat(RestApiServer.normalize("api")).isEqualTo("/api");
        assertThat(RestApiServer.normalize("/")).isEmpty();
        assertThat(RestApiServer.normalize(null)).isEmpty();
    }
}
