package org.croniq.channels;

import org.croniq.errors.NotFoundException;
import org.croniq.errors.ValidationException;
import org.croniq.notifications.ChannelType;
import org.croniq.notifications.NotificationChannel;
import org.croniq.support.Fixtures;
import org.croniq.support.InMemoryNotificationStore;
import org.croniq.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotificationChannelServiceTest {

    private static final Instant NOW = Instant.parse("2023-01-01T10:00:00Z");

    private final InMemoryNotificationStore store = new InMemoryNotificationStore();
    private final NotificationChannelService service = new NotificationChannelService(store, new MutableClock(NOW));

    @Test
    void emailChannelStartsUnverified() {
        NotificationChannel channel = service.create(Fixtures.OWNER, ChannelType.EMAIL, "ops mail",
                Map.of("email", "ops@example.org"));

        assertThat(channel.verified()).isFalse();
        assertThat(channel.createdAt()).isEqualTo(NOW);
        assertThat(channel.configString("email")).isEqualTo("ops@example.org");
    }

    @Test
    void otherChannelTypesAreVerifiedImmediately() {
        NotificationChannel channel = service.create(Fixtures.OWNER, ChannelType.SLACK, "alerts",
                Map.of("webhookUrl", "https://hooks.slack.com/services/x"));

        assertThat(channel.verified()).isTrue();
    }

    @Test
    void invalidConfigurationIsRejected() {
        assertThatThrownBy(() -> service.create(Fixtures.OWNER, ChannelType.EMAIL, "bad", Map.of("email", "nope")))
                .isInstanceOf(ValidationException.class);
        assertThat(store.findChannels(Fixtures.OWNER)).isEmpty();
    }

    @Test
    void emailConfigurationChangeResetsVerification() {
        NotificationChannel channel = service.create(Fixtures.OWNER, ChannelType.EMAIL, "ops",
                Map.of("email", "ops@example.org"));
        service.markVerified(channel.id(), Fixtures.OWNER);

        NotificationChannel renamed = service.update(channel.id(), Fixtures.OWNER, new ChannelUpdate("ops team", null));
        assertThat(renamed.verified()).isTrue();

        NotificationChannel moved = service.update(channel.id(), Fixtures.OWNER,
                new ChannelUpdate(null, Map.of("email", "oncall@example.org")));
        assertThat(moved.verified()).isFalse();
        assertThat(moved.name()).isEqualTo("ops team");
        assertThat(moved.configString("email")).isEqualTo("oncall@example.org");
    }

    @Test
    void webhookConfigurationChangeKeepsVerification() {
        NotificationChannel channel = service.create(Fixtures.OWNER, ChannelType.WEBHOOK, "hook",
                Map.of("url", "https://example.org/a"));

        NotificationChannel updated = service.update(channel.id(), Fixtures.OWNER,
                new ChannelUpdate(null, Map.of("url", "https://example.org/b")));

        assertThat(updated.verified()).isTrue();
    }

    @Test
    void channelsAreScopedToOwner() {
        NotificationChannel channel = service.create(Fixtures.OWNER, ChannelType.SLACK, "alerts",
                Map.of("webhookUrl", "https://hooks.slack.com/services/x"));

        assertThatThrownBy(() -> service.get(channel.id(), Fixtures.OTHER_OWNER)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.delete(channel.id(), Fixtures.OTHER_OWNER)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.markVerified(channel.id(), Fixtures.OTHER_OWNER))
                .isInstanceOf(NotFoundException.class);
        assertThat(service.list(Fixtures.OTHER_OWNER)).isEmpty();

        service.delete(channel.id(), Fixtures.OWNER);
        assertThat(service.list(Fixtures.OWNER)).isEmpty();
    }
}
