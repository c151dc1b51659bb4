package org.croniq.notifications.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.croniq.notifications.ChannelType;
import org.croniq.notifications.EventKind;
import org.croniq.notifications.JsonHttpPoster;
import org.croniq.notifications.NotificationChannel;
import org.croniq.notifications.NotificationPayload;
import org.croniq.utils.JsonUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookSenderTest {

    private static final Instant NOW = Instant.parse("2023-01-01T10:06:01Z");

    private MockWebServer server;
    private WebhookSender sender;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        sender = new WebhookSender(new JsonHttpPoster(Duration.ofSeconds(2)));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static NotificationPayload payload() {
        return new NotificationPayload(5L, "sync", "interval", "1h", "late", EventKind.LATENESS,
                null, Instant.parse("2023-01-01T10:00:00Z"), "Job detected as late by scheduler.", NOW);
    }

    @Test
    void postsPayloadWithCustomHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        Map<String, Object> config = Map.of(
                "url", server.url("/hooks/croniq").toString(),
                "headers", Map.of("X-Auth", "secret"));
        NotificationChannel channel = new NotificationChannel(9L, 7L, ChannelType.WEBHOOK, "hook", config, true, NOW);

        assertThat(sender.send(channel, payload())).isTrue();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("X-Auth")).isEqualTo("secret");
        JsonNode body = JsonUtil.mapper().readTree(request.getBody().readUtf8());
        assertThat(body.path("job_id").asLong()).isEqualTo(5L);
        assertThat(body.path("job_name").asText()).isEqualTo("sync");
        assertThat(body.path("event_kind").asText()).isEqualTo("lateness");
        assertThat(body.path("current_status").asText()).isEqualTo("late");
        assertThat(body.path("last_pinged_at").isNull()).isTrue();
        assertThat(body.path("expected_next_ping_at").asText()).isEqualTo("2023-01-01T10:00:00Z");
    }

    @Test
    void configuredContentTypeReplacesTheDefault() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        Map<String, Object> config = Map.of(
                "url", server.url("/hooks/croniq").toString(),
                "headers", Map.of("Content-Type", "application/vnd.ops+json"));
        NotificationChannel channel = new NotificationChannel(9L, 7L, ChannelType.WEBHOOK, "hook", config, true, NOW);

        assertThat(sender.send(channel, payload())).isTrue();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeaders().values("Content-Type")).containsExactly("application/vnd.ops+json");
    }

    @Test
    void redirectIsNotFollowedAndCountsAsFailure() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(302)
                .setHeader("Location", server.url("/elsewhere").toString()));
        server.enqueue(new MockResponse().setResponseCode(200));
        NotificationChannel channel = new NotificationChannel(9L, 7L, ChannelType.WEBHOOK, "hook",
                Map.of("url", server.url("/hooks/croniq").toString()), true, NOW);

        assertThat(sender.send(channel, payload())).isFalse();

        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(server.takeRequest().getPath()).isEqualTo("/hooks/croniq");
    }

    @Test
    void serverErrorIsAFailure() {
        server.enqueue(new MockResponse().setResponseCode(500));
        NotificationChannel channel = new NotificationChannel(9L, 7L, ChannelType.WEBHOOK, "hook",
                Map.of("url", server.url("/hooks/croniq").toString()), true, NOW);

        assertThat(sender.send(channel, payload())).isFalse();
    }

    @Test
    void malformedUrlIsAFailure() {
        NotificationChannel channel = new NotificationChannel(9L, 7L, ChannelType.WEBHOOK, "hook",
                Map.of("url", "http://bad host/"), true, NOW);

        assertThat(sender.send(channel, payload())).isFalse();
    }
}
