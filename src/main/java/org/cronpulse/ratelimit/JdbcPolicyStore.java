package org.cronpulse.ratelimit;

import org.cronpulse.errors.StoreException;
import org.cronpulse.utils.ConnectionSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

public class JdbcPolicyStore implements PolicyStore {

    private final ConnectionSource connections;

    public JdbcPolicyStore(ConnectionSource connections) {
        this.connections = connections;
    }

    @Override
    public Optional<RateLimitOverride> find(String ownerId, String integration) {
        String sql = """
                SELECT owner_id, integration, max_calls_per_hour, max_calls_per_day
                FROM scheduler_rate_limits
                WHERE owner_id = ? AND integration = ?
                """;
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ownerId);
            ps.setString(2, integration);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new RateLimitOverride(
                        rs.getString("owner_id"),
                        rs.getString("integration"),
                        rs.getInt("max_calls_per_hour"),
                        rs.getInt("max_calls_per_day")));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read rate limit for " + ownerId + "/" + integration, e);
        }
    }

    @Override
    public void upsert(RateLimitOverride override) {
        String sql = """
                INSERT INTO scheduler_rate_limits (owner_id, integration, max_calls_per_hour, max_calls_per_day, updated_at)
                VALUES (?, ?, ?, ?, NOW())
                ON CONFLICT (owner_id, integration)
                DO UPDATE SET max_calls_per_hour = EXCLUDED.max_calls_per_hour,
                              max_calls_per_day = EXCLUDED.max_calls_per_day,
                              updated_at = NOW()
                """;
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, override.ownerId());
            ps.setString(2, override.integration());
            ps.setInt(3, override.maxCallsPerHour());
            ps.setInt(4, override.maxCallsPerDay());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to save rate limit for " + override.ownerId() + "/" + override.integration(), e);
        }
    }

    @Override
    public boolean delete(String ownerId, String integration) {
        String sql = "DELETE FROM scheduler_rate_limits WHERE owner_id = ? AND integration = ?";
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ownerId);
            ps.setString(2, integration);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete rate limit for " + ownerId + "/" + integration, e);
        }
    }
}
