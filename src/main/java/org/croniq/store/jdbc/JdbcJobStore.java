package org.croniq.store.jdbc;

import org.croniq.monitoring.ExecutionStatus;
import org.croniq.monitoring.JobExecution;
import org.croniq.monitoring.JobStatus;
import org.croniq.monitoring.MonitoredJob;
import org.croniq.monitoring.ScheduleException;
import org.croniq.monitoring.ScheduleType;
import org.croniq.store.JobStore;
import org.croniq.store.StateChange;
import org.croniq.store.StoreException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.croniq.store.jdbc.JdbcSupport.failure;
import static org.croniq.store.jdbc.JdbcSupport.getInstant;
import static org.croniq.store.jdbc.JdbcSupport.rollbackQuietly;
import static org.croniq.store.jdbc.JdbcSupport.setInstant;

public class JdbcJobStore implements JobStore {

    private static final String JOB_COLUMNS = """
            id, owner_id, name, schedule_type, schedule_value, webhook_token, grace_period_seconds,
            status, last_pinged_at, expected_next_ping_at, created_at, version
            """;

    private final DataSource dataSource;

    public JdbcJobStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<MonitoredJob> findByWebhookToken(String webhookToken) {
        return findOne("SELECT " + JOB_COLUMNS + " FROM monitored_jobs WHERE webhook_token = ?",
                "findByWebhookToken", ps -> ps.setString(1, webhookToken));
    }

    @Override
    public Optional<MonitoredJob> findById(long jobId) {
        return findOne("SELECT " + JOB_COLUMNS + " FROM monitored_jobs WHERE id = ?",
                "findById", ps -> ps.setLong(1, jobId));
    }

    @Override
    public Optional<MonitoredJob> findByIdForOwner(long jobId, long ownerId) {
        return findOne("SELECT " + JOB_COLUMNS + " FROM monitored_jobs WHERE id = ? AND owner_id = ?",
                "findByIdForOwner", ps -> {
                    ps.setLong(1, jobId);
                    ps.setLong(2, ownerId);
                });
    }

    @Override
    public List<MonitoredJob> findByOwner(long ownerId) {
        return findMany("SELECT " + JOB_COLUMNS + " FROM monitored_jobs WHERE owner_id = ? ORDER BY created_at DESC, id DESC",
                "findByOwner", ps -> ps.setLong(1, ownerId));
    }

    @Override
    public List<MonitoredJob> findOverdue(Instant now) {
        return findMany("""
                SELECT %s FROM monitored_jobs
                WHERE status NOT IN ('paused', 'errored')
                  AND expected_next_ping_at IS NOT NULL
                  AND expected_next_ping_at + grace_period_seconds * INTERVAL '1 second' < ?
                ORDER BY expected_next_ping_at
                """.formatted(JOB_COLUMNS), "findOverdue", ps -> setInstant(ps, 1, now));
    }

    @Override
    public MonitoredJob insert(MonitoredJob job) {
        String sql = """
                INSERT INTO monitored_jobs (owner_id, name, schedule_type, schedule_value, webhook_token,
                    grace_period_seconds, status, last_pinged_at, expected_next_ping_at, created_at, updated_at, version)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0)
                RETURNING id
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, job.ownerId());
            ps.setString(2, job.name());
            ps.setString(3, job.scheduleType().code());
            ps.setString(4, job.scheduleValue());
            ps.setString(5, job.webhookToken());
            ps.setInt(6, job.gracePeriodSeconds());
            ps.setString(7, job.status().code());
            setInstant(ps, 8, job.lastPingedAt());
            setInstant(ps, 9, job.expectedNextPingAt());
            setInstant(ps, 10, job.createdAt());
            setInstant(ps, 11, job.createdAt());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new StoreException("Insert into monitored_jobs returned no id");
                }
                return new MonitoredJob(rs.getLong(1), job.ownerId(), job.name(), job.scheduleType(),
                        job.scheduleValue(), job.webhookToken(), job.gracePeriodSeconds(), job.status(),
                        job.lastPingedAt(), job.expectedNextPingAt(), job.createdAt(), 0L);
            }
        } catch (SQLException e) {
            throw failure("insert job", e);
        }
    }

    @Override
    public Optional<StateChange> transition(MonitoredJob current, MonitoredJob next, JobExecution execution) {
        String update = """
                UPDATE monitored_jobs
                SET status = ?, last_pinged_at = ?, expected_next_ping_at = ?, version = version + 1, updated_at = now()
                WHERE id = ? AND version = ?
                """;
        String insert = """
                INSERT INTO job_executions (job_id, status, started_at, ended_at, output_log)
                VALUES (?, ?, ?, ?, ?)
                RETURNING id
                """;
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(update)) {
                    ps.setString(1, next.status().code());
                    setInstant(ps, 2, next.lastPingedAt());
                    setInstant(ps, 3, next.expectedNextPingAt());
                    ps.setLong(4, current.id());
                    ps.setLong(5, current.version());
                    updated = ps.executeUpdate();
                }
                if (updated == 0) {
                    conn.rollback();
                    return Optional.empty();
                }

                long executionId;
                try (PreparedStatement ps = conn.prepareStatement(insert)) {
                    ps.setLong(1, execution.jobId());
                    ps.setString(2, execution.status().code());
                    setInstant(ps, 3, execution.startedAt());
                    setInstant(ps, 4, execution.endedAt());
                    ps.setString(5, execution.outputLog());
                    try (ResultSet rs = ps.executeQuery()) {
                        rs.next();
                        executionId = rs.getLong(1);
                    }
                }
                conn.commit();

                MonitoredJob written = new MonitoredJob(next.id(), next.ownerId(), next.name(), next.scheduleType(),
                        next.scheduleValue(), next.webhookToken(), next.gracePeriodSeconds(), next.status(),
                        next.lastPingedAt(), next.expectedNextPingAt(), next.createdAt(), current.version() + 1);
                return Optional.of(new StateChange(written, execution.withId(executionId)));
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw failure("transition of job " + current.id(), e);
        }
    }

    @Override
    public Optional<MonitoredJob> update(MonitoredJob current, MonitoredJob edited) {
        String sql = """
                UPDATE monitored_jobs
                SET name = ?, schedule_type = ?, schedule_value = ?, grace_period_seconds = ?, status = ?,
                    expected_next_ping_at = ?, version = version + 1, updated_at = now()
                WHERE id = ? AND owner_id = ? AND version = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, edited.name());
            ps.setString(2, edited.scheduleType().code());
            ps.setString(3, edited.scheduleValue());
            ps.setInt(4, edited.gracePeriodSeconds());
            ps.setString(5, edited.status().code());
            setInstant(ps, 6, edited.expectedNextPingAt());
            ps.setLong(7, current.id());
            ps.setLong(8, current.ownerId());
            ps.setLong(9, current.version());
            if (ps.executeUpdate() == 0) {
                return Optional.empty();
            }
            return Optional.of(new MonitoredJob(current.id(), current.ownerId(), edited.name(), edited.scheduleType(),
                    edited.scheduleValue(), current.webhookToken(), edited.gracePeriodSeconds(), edited.status(),
                    current.lastPingedAt(), edited.expectedNextPingAt(), current.createdAt(), current.version() + 1));
        } catch (SQLException e) {
            throw failure("update of job " + current.id(), e);
        }
    }

    @Override
    public boolean delete(long jobId, long ownerId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM monitored_jobs WHERE id = ? AND owner_id = ?")) {
            ps.setLong(1, jobId);
            ps.setLong(2, ownerId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("delete of job " + jobId, e);
        }
    }

    @Override
    public List<JobExecution> findExecutions(long jobId, int limit) {
        String sql = """
                SELECT id, job_id, status, started_at, ended_at, output_log
                FROM job_executions WHERE job_id = ?
                ORDER BY started_at DESC, id DESC
                LIMIT ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, jobId);
            ps.setInt(2, limit);
            List<JobExecution> executions = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    executions.add(new JobExecution(
                            rs.getLong("id"),
                            rs.getLong("job_id"),
                            ExecutionStatus.fromCode(rs.getString("status")),
                            getInstant(rs, "started_at"),
                            getInstant(rs, "ended_at"),
                            rs.getString("output_log")));
                }
            }
            return executions;
        } catch (SQLException e) {
            throw failure("findExecutions for job " + jobId, e);
        }
    }

    private Optional<MonitoredJob> findOne(String sql, String operation, Binder binder) {
        List<MonitoredJob> jobs = findMany(sql, operation, binder);
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    private List<MonitoredJob> findMany(String sql, String operation, Binder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            List<MonitoredJob> jobs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapJob(rs));
                }
            }
            return jobs;
        } catch (SQLException e) {
            throw failure(operation, e);
        }
    }

    private static MonitoredJob mapJob(ResultSet rs) throws SQLException {
        ScheduleType type;
        try {
            type = ScheduleType.fromCode(rs.getString("schedule_type"));
        } catch (ScheduleException e) {
            throw new SQLException("Unknown schedule_type for job " + rs.getLong("id"), e);
        }
        return new MonitoredJob(
                rs.getLong("id"),
                rs.getLong("owner_id"),
                rs.getString("name"),
                type,
                rs.getString("schedule_value"),
                rs.getString("webhook_token"),
                rs.getInt("grace_period_seconds"),
                JobStatus.fromCode(rs.getString("status")),
                getInstant(rs, "last_pinged_at"),
                getInstant(rs, "expected_next_ping_at"),
                getInstant(rs, "created_at"),
                rs.getLong("version"));
    }

    @FunctionalInterface
    interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
