package org.croniq.store.jdbc;

import org.croniq.notifications.ChannelBinding;
import org.croniq.notifications.ChannelType;
import org.croniq.notifications.JobNotificationSetting;
import org.croniq.notifications.NotificationChannel;
import org.croniq.store.NotificationStore;
import org.croniq.store.StoreException;
import org.croniq.utils.JsonUtil;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.croniq.store.jdbc.JdbcSupport.failure;
import static org.croniq.store.jdbc.JdbcSupport.getInstant;
import static org.croniq.store.jdbc.JdbcSupport.jsonb;
import static org.croniq.store.jdbc.JdbcSupport.setInstant;

public class JdbcNotificationStore implements NotificationStore {

    private static final String CHANNEL_COLUMNS =
            "c.id, c.owner_id, c.type, c.name, c.configuration_details::text AS configuration_details, c.is_verified, c.created_at";
    private static final String SETTING_COLUMNS =
            "s.id, s.job_id, s.channel_id, s.notify_on_failure, s.notify_on_lateness, s.notify_on_recovery, s.created_at";

    private final DataSource dataSource;

    public JdbcNotificationStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<ChannelBinding> findVerifiedBindings(long jobId) {
        String sql = """
                SELECT %s,
                       c.id AS c_id, c.owner_id AS c_owner_id, c.type AS c_type, c.name AS c_name,
                       c.configuration_details::text AS c_configuration_details, c.is_verified AS c_is_verified,
                       c.created_at AS c_created_at
                FROM job_notification_settings s
                JOIN notification_channels c ON c.id = s.channel_id
                WHERE s.job_id = ? AND c.is_verified = TRUE
                ORDER BY s.id
                """.formatted(SETTING_COLUMNS);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, jobId);
            List<ChannelBinding> bindings = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    NotificationChannel channel = new NotificationChannel(
                            rs.getLong("c_id"),
                            rs.getLong("c_owner_id"),
                            ChannelType.fromCode(rs.getString("c_type")),
                            rs.getString("c_name"),
                            JsonUtil.toMap(rs.getString("c_configuration_details")),
                            rs.getBoolean("c_is_verified"),
                            getInstant(rs, "c_created_at"));
                    bindings.add(new ChannelBinding(mapSetting(rs), channel));
                }
            }
            return bindings;
        } catch (SQLException e) {
            throw failure("findVerifiedBindings for job " + jobId, e);
        }
    }

    @Override
    public NotificationChannel insertChannel(NotificationChannel channel) {
        String sql = """
                INSERT INTO notification_channels (owner_id, type, name, configuration_details, is_verified, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                RETURNING id
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, channel.ownerId());
            ps.setString(2, channel.type().code());
            ps.setString(3, channel.name());
            ps.setObject(4, jsonb(channel.configurationDetails()));
            ps.setBoolean(5, channel.verified());
            setInstant(ps, 6, channel.createdAt());
            setInstant(ps, 7, channel.createdAt());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new StoreException("Insert into notification_channels returned no id");
                }
                return new NotificationChannel(rs.getLong(1), channel.ownerId(), channel.type(), channel.name(),
                        channel.configurationDetails(), channel.verified(), channel.createdAt());
            }
        } catch (SQLException e) {
            throw failure("insert channel", e);
        }
    }

    @Override
    public Optional<NotificationChannel> findChannel(long channelId, long ownerId) {
        List<NotificationChannel> channels = queryChannels(
                "SELECT " + CHANNEL_COLUMNS + " FROM notification_channels c WHERE c.id = ? AND c.owner_id = ?",
                "findChannel", channelId, ownerId);
        return channels.isEmpty() ? Optional.empty() : Optional.of(channels.get(0));
    }

    @Override
    public List<NotificationChannel> findChannels(long ownerId) {
        return queryChannels(
                "SELECT " + CHANNEL_COLUMNS + " FROM notification_channels c WHERE c.owner_id = ? ORDER BY c.created_at DESC, c.id DESC",
                "findChannels", ownerId);
    }

    @Override
    public Optional<NotificationChannel> updateChannel(NotificationChannel channel) {
        String sql = """
                UPDATE notification_channels
                SET name = ?, configuration_details = ?, is_verified = ?, updated_at = now()
                WHERE id = ? AND owner_id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, channel.name());
            ps.setObject(2, jsonb(channel.configurationDetails()));
            ps.setBoolean(3, channel.verified());
            ps.setLong(4, channel.id());
            ps.setLong(5, channel.ownerId());
            return ps.executeUpdate() > 0 ? Optional.of(channel) : Optional.empty();
        } catch (SQLException e) {
            throw failure("update of channel " + channel.id(), e);
        }
    }

    @Override
    public boolean deleteChannel(long channelId, long ownerId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM notification_channels WHERE id = ? AND owner_id = ?")) {
            ps.setLong(1, channelId);
            ps.setLong(2, ownerId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("delete of channel " + channelId, e);
        }
    }

    @Override
    public JobNotificationSetting upsertSetting(JobNotificationSetting setting) {
        String sql = """
                INSERT INTO job_notification_settings (job_id, channel_id, notify_on_failure, notify_on_lateness,
                    notify_on_recovery, created_at)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT (job_id, channel_id) DO UPDATE SET
                    notify_on_failure = EXCLUDED.notify_on_failure,
                    notify_on_lateness = EXCLUDED.notify_on_lateness,
                    notify_on_recovery = EXCLUDED.notify_on_recovery
                RETURNING id, created_at
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, setting.jobId());
            ps.setLong(2, setting.channelId());
            ps.setBoolean(3, setting.notifyOnFailure());
            ps.setBoolean(4, setting.notifyOnLateness());
            ps.setBoolean(5, setting.notifyOnRecovery());
            setInstant(ps, 6, setting.createdAt());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new StoreException("Upsert into job_notification_settings returned no row");
                }
                return new JobNotificationSetting(rs.getLong("id"), setting.jobId(), setting.channelId(),
                        setting.notifyOnFailure(), setting.notifyOnLateness(), setting.notifyOnRecovery(),
                        getInstant(rs, "created_at"));
            }
        } catch (SQLException e) {
            throw failure("upsert of setting for job " + setting.jobId(), e);
        }
    }

    @Override
    public List<JobNotificationSetting> findSettings(long jobId) {
        return querySettings("SELECT " + SETTING_COLUMNS + " FROM job_notification_settings s WHERE s.job_id = ? ORDER BY s.id",
                "findSettings", jobId);
    }

    @Override
    public Optional<JobNotificationSetting> findSetting(long settingId) {
        List<JobNotificationSetting> settings = querySettings(
                "SELECT " + SETTING_COLUMNS + " FROM job_notification_settings s WHERE s.id = ?", "findSetting", settingId);
        return settings.isEmpty() ? Optional.empty() : Optional.of(settings.get(0));
    }

    @Override
    public boolean deleteSetting(long settingId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM job_notification_settings WHERE id = ?")) {
            ps.setLong(1, settingId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("delete of setting " + settingId, e);
        }
    }

    private List<NotificationChannel> queryChannels(String sql, String operation, long... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setLong(i + 1, params[i]);
            }
            List<NotificationChannel> channels = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    channels.add(new NotificationChannel(
                            rs.getLong("id"),
                            rs.getLong("owner_id"),
                            ChannelType.fromCode(rs.getString("type")),
                            rs.getString("name"),
                            JsonUtil.toMap(rs.getString("configuration_details")),
                            rs.getBoolean("is_verified"),
                            getInstant(rs, "created_at")));
                }
            }
            return channels;
        } catch (SQLException e) {
            throw failure(operation, e);
        }
    }

    private List<JobNotificationSetting> querySettings(String sql, String operation, long param) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, param);
            List<JobNotificationSetting> settings = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    settings.add(mapSetting(rs));
                }
            }
            return settings;
        } catch (SQLException e) {
            throw failure(operation, e);
        }
    }

    private static JobNotificationSetting mapSetting(ResultSet rs) throws SQLException {
        return new JobNotificationSetting(
                rs.getLong("id"),
                rs.getLong("job_id"),
                rs.getLong("channel_id"),
                rs.getBoolean("notify_on_failure"),
                rs.getBoolean("notify_on_lateness"),
                rs.getBoolean("notify_on_recovery"),
                getInstant(rs, "created_at"));
    }
}
