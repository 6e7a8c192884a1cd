package org.cronpulse.utils;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Hands out pooled connections. Production code uses {@code JdbcUtils::getConnection}.
 */
@FunctionalInterface
public interface ConnectionSource {
    Connection getConnection() throws SQLException;
}
