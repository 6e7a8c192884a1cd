package org.cronpulse.config.database;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.cronpulse.config.XmlConfiguration;
import org.cronpulse.config.utils.LogContext;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Owns the HikariCP pool behind the job store, usage ledger and policy store.
 * <p>
 * The scheduler may start without a database; {@link #getDataSource()} is then {@code null}
 * and store calls fail with a {@link SQLException} until a reconnect succeeds.
 */
public final class DatabaseManager {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseManager.class);

    private static final String DEFAULT_DRIVER = "org.postgresql.Driver";
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private static volatile HikariDataSource dataSource;

    private DatabaseManager() {}

    /**
     * Opens a new pool and swaps it in only after one connection validated. A previous pool is closed.
     */
    public static synchronized void initialize(XmlConfiguration cfg) throws SQLException {
        LogContext.start("DatabaseManager");
        try {
            if (cfg == null || cfg.dataSource == null || cfg.connectionPool == null) {
                throw new SQLException("Configuration has no <dataSource>/<connectionPool> section");
            }
            logger.info("Opening connection pool to {}", cfg.dataSource.jdbcUrl);

            HikariDataSource fresh;
            try {
                fresh = new HikariDataSource(poolConfig(cfg));
            } catch (RuntimeException e) {
                throw new SQLException("Connection pool could not be created: " + e.getMessage(), e);
            }
            if (!validate(fresh)) {
                fresh.close();
                throw new SQLException("Database rejected the validation query");
            }

            HikariDataSource previous = dataSource;
            dataSource = fresh;
            if (previous != null) {
                previous.close();
            }
            logger.info("Database ready (pool {}, max {} connections)", fresh.getPoolName(), fresh.getMaximumPoolSize());
        } finally {
            LogContext.clear();
        }
    }

    public static boolean isInitialized() {
        return dataSource != null;
    }

    @Nullable
    public static HikariDataSource getDataSource() {
        return dataSource;
    }

    /**
     * {@code connected}, or {@code unavailable} when there is no pool or it cannot hand out a valid connection.
     */
    public static String status() {
        HikariDataSource ds = dataSource;
        if (ds == null) return "unavailable";
        try {
            return validate(ds) ? "connected" : "unavailable";
        } catch (SQLException e) {
            logger.debug("Database probe failed: {}", e.getMessage());
            return "unavailable";
        }
    }

    public static synchronized void shutdown() {
        HikariDataSource ds = dataSource;
        dataSource = null;
        if (ds != null) {
            ds.close();
            logger.info("Connection pool closed");
        }
    }

    private static boolean validate(HikariDataSource ds) throws SQLException {
        try (Connection conn = ds.getConnection()) {
            return conn.isValid(VALIDATION_TIMEOUT_SECONDS);
        }
    }

    @NotNull
    private static HikariConfig poolConfig(XmlConfiguration cfg) {
        XmlConfiguration.DataSource db = cfg.dataSource;
        XmlConfiguration.ConnectionPool pool = cfg.connectionPool;

        HikariConfig hc = new HikariConfig();
        hc.setPoolName("cronpulse-pool");
        hc.setDriverClassName(db.driverClassName != null ? db.driverClassName : DEFAULT_DRIVER);
        hc.setJdbcUrl(db.jdbcUrl);
        hc.setUsername(db.username);
        hc.setPassword(db.password);
        hc.setMaximumPoolSize(pool.maximumPoolSize);
        hc.setMinimumIdle(pool.minimumIdle);
        hc.setIdleTimeout(pool.idleTimeout);
        hc.setConnectionTimeout(pool.connectionTimeout);
        hc.setMaxLifetime(pool.maxLifetime);
        hc.addDataSourceProperty("ssl", String.valueOf(db.encrypt));
        if (db.encrypt) {
            hc.addDataSourceProperty("sslmode", "require");
        }
        return hc;
    }
}
