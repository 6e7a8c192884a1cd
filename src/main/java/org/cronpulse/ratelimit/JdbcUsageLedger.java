package org.cronpulse.ratelimit;

import org.cronpulse.errors.StoreException;
import org.cronpulse.utils.ConnectionSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

import static org.cronpulse.utils.JdbcUtils.setInstant;

/**
 * PostgreSQL usage counters. Increments are a single upsert per window, never read-then-write.
 */
public class JdbcUsageLedger implements UsageLedger {

    static final String COUNT_SQL = """
            SELECT call_count FROM scheduler_usage
            WHERE owner_id = ? AND integration = ? AND period_type = ? AND period_start = ?
            """;

    static final String INCREMENT_SQL = """
            INSERT INTO scheduler_usage (owner_id, integration, period_type, period_start, call_count)
            VALUES (?, ?, ?, ?, 1)
            ON CONFLICT (owner_id, integration, period_type, period_start)
            DO UPDATE SET call_count = scheduler_usage.call_count + 1
            """;

    private final ConnectionSource connections;

    public JdbcUsageLedger(ConnectionSource connections) {
        this.connections = connections;
    }

    @Override
    public long count(String ownerId, String integration, PeriodType period, Instant periodStart) {
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(COUNT_SQL)) {
            ps.setString(1, ownerId);
            ps.setString(2, integration);
            ps.setString(3, period.dbValue());
            setInstant(ps, 4, periodStart);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong("call_count") : 0L;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read usage for " + ownerId + "/" + integration, e);
        }
    }

    @Override
    public void recordUsage(String ownerId, String integration, Instant now) {
        try (Connection c = connections.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(INCREMENT_SQL)) {
                for (PeriodType period : PeriodType.values()) {
                    ps.setString(1, ownerId);
                    ps.setString(2, integration);
                    ps.setString(3, period.dbValue());
                    setInstant(ps, 4, period.windowStart(now));
                    ps.executeUpdate();
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to record usage for " + ownerId + "/" + integration, e);
        }
    }
}
