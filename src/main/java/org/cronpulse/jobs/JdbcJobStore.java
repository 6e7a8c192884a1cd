package org.cronpulse.jobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.cronpulse.errors.StoreException;
import org.cronpulse.utils.ConnectionSource;
import org.cronpulse.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.cronpulse.utils.JdbcUtils.getInstant;
import static org.cronpulse.utils.JdbcUtils.setInstant;

/**
 * PostgreSQL backed {@link JobStore}. Every mutation is a single UPDATE/INSERT statement,
 * so each one is atomic on its own.
 */
public class JdbcJobStore implements JobStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcJobStore.class);

    private static final String COLUMNS = """
            job_id, owner_id, name, cron_expression, timezone, job_type, integration, action::text AS action,
            enabled, last_run, next_run, error_count, backoff_until, created_at
            """;

    static final String FETCH_DUE_SQL = "SELECT " + COLUMNS + """
            FROM scheduled_jobs
            WHERE enabled = TRUE
              AND deleted_at IS NULL
              AND next_run IS NOT NULL
              AND next_run <= ?
              AND (backoff_until IS NULL OR backoff_until <= ?)
            ORDER BY next_run ASC
            LIMIT ?
            """;

    static final String RECORD_SUCCESS_SQL = """
            UPDATE scheduled_jobs
            SET last_run = ?, next_run = ?, error_count = 0, backoff_until = NULL
            WHERE job_id = ? AND deleted_at IS NULL
            """;

    static final String RECORD_FAILURE_SQL = """
            UPDATE scheduled_jobs
            SET error_count = ?, backoff_until = ?, last_run = ?
            WHERE job_id = ? AND deleted_at IS NULL
            """;

    private final ConnectionSource connections;

    public JdbcJobStore(ConnectionSource connections) {
        this.connections = connections;
    }

    @Override
    public ScheduledJob insert(ScheduledJob job) {
        String sql = """
                INSERT INTO scheduled_jobs (
                    job_id, owner_id, name, cron_expression, timezone, job_type, integration,
                    action, enabled, last_run, next_run, error_count, backoff_until, created_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?)
                """;
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, job.id());
            ps.setString(2, job.ownerId());
            ps.setString(3, job.name());
            ps.setString(4, job.cronExpression());
            ps.setString(5, job.timezone());
            ps.setString(6, job.jobType());
            ps.setString(7, job.integration());
            ps.setString(8, JsonUtil.toJson(job.action()));
            ps.setBoolean(9, job.enabled());
            setInstant(ps, 10, job.lastRun());
            setInstant(ps, 11, job.nextRun());
            ps.setInt(12, job.errorCount());
            setInstant(ps, 13, job.backoffUntil());
            setInstant(ps, 14, job.createdAt());
            ps.executeUpdate();
            logger.debug("Inserted job {} for owner {}", job.id(), job.ownerId());
            return job;
        } catch (SQLException | JsonProcessingException e) {
            throw new StoreException("Failed to insert job " + job.id(), e);
        }
    }

    @Override
    public List<ScheduledJob> list(String ownerId) {
        String sql = "SELECT " + COLUMNS + """
                FROM scheduled_jobs
                WHERE owner_id = ? AND deleted_at IS NULL
                ORDER BY created_at DESC
                """;
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ownerId);
            return readAll(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list jobs for owner " + ownerId, e);
        }
    }

    @Override
    public Optional<ScheduledJob> find(String ownerId, UUID id) {
        String sql = "SELECT " + COLUMNS + """
                FROM scheduled_jobs
                WHERE job_id = ? AND owner_id = ? AND deleted_at IS NULL
                """;
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, id);
            ps.setString(2, ownerId);
            List<ScheduledJob> rows = readAll(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException e) {
            throw new StoreException("Failed to load job " + id, e);
        }
    }

    @Override
    public boolean delete(String ownerId, UUID id) {
        String sql = """
                UPDATE scheduled_jobs
                SET deleted_at = NOW(), enabled = FALSE
                WHERE job_id = ? AND owner_id = ? AND deleted_at IS NULL
                """;
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, id);
            ps.setString(2, ownerId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete job " + id, e);
        }
    }

    @Override
    public boolean setEnabled(String ownerId, UUID id, boolean enabled) {
        String sql = """
                UPDATE scheduled_jobs
                SET enabled = ?
                WHERE job_id = ? AND owner_id = ? AND deleted_at IS NULL
                """;
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setBoolean(1, enabled);
            ps.setObject(2, id);
            ps.setString(3, ownerId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update job " + id, e);
        }
    }

    @Override
    public List<ScheduledJob> fetchDue(Instant now, int limit) {
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(FETCH_DUE_SQL)) {
            setInstant(ps, 1, now);
            setInstant(ps, 2, now);
            ps.setInt(3, limit);
            return readAll(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to fetch due jobs", e);
        }
    }

    @Override
    public boolean recordSuccess(UUID id, Instant lastRun, Instant nextRun) {
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(RECORD_SUCCESS_SQL)) {
            setInstant(ps, 1, lastRun);
            setInstant(ps, 2, nextRun);
            ps.setObject(3, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to record success for job " + id, e);
        }
    }

    @Override
    public boolean recordFailure(UUID id, int errorCount, Instant backoffUntil, Instant attemptedAt) {
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(RECORD_FAILURE_SQL)) {
            ps.setInt(1, errorCount);
            setInstant(ps, 2, backoffUntil);
            setInstant(ps, 3, attemptedAt);
            ps.setObject(4, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to record failure for job " + id, e);
        }
    }

    private static List<ScheduledJob> readAll(PreparedStatement ps) throws SQLException {
        List<ScheduledJob> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(map(rs));
            }
        }
        return jobs;
    }

    private static ScheduledJob map(ResultSet rs) throws SQLException {
        return new ScheduledJob(
                rs.getObject("job_id", UUID.class),
                rs.getString("owner_id"),
                rs.getString("name"),
                rs.getString("cron_expression"),
                rs.getString("timezone"),
                rs.getString("job_type"),
                rs.getString("integration"),
                parseAction(rs.getString("action")),
                rs.getBoolean("enabled"),
                getInstant(rs, "last_run"),
                getInstant(rs, "next_run"),
                rs.getInt("error_count"),
                getInstant(rs, "backoff_until"),
                getInstant(rs, "created_at")
        );
    }

    private static Map<String, Object> parseAction(String json) throws SQLException {
        if (json == null) return Map.of();
        try {
            return JsonUtil.toMap(json);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt action payload: " + e.getOriginalMessage(), e);
        }
    }
}
