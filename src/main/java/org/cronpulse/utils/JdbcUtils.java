package org.cronpulse.utils;


import org.cronpulse.config.database.DatabaseManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public final class JdbcUtils {
    private JdbcUtils() {}

    public static Connection getConnection() throws SQLException {
        DataSource ds = DatabaseManager.getDataSource();
        if (ds == null) {
            throw new SQLException("Database is not initialized");
        }
        return ds.getConnection();
    }

    // timestamptz columns are bound as OffsetDateTime so the JVM zone never leaks in
    public static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(index, OffsetDateTime.ofInstant(value, ZoneOffset.UTC));
        }
    }

    public static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
