package org.cronpulse;

import io.undertow.Undertow;
import org.cronpulse.config.ConfigLoader;
import org.cronpulse.config.XmlConfiguration;
import org.cronpulse.config.database.DBTaskScheduler;
import org.cronpulse.config.database.DatabaseManager;
import org.cronpulse.config.database.SchemaInitializer;
import org.cronpulse.config.utils.EnvironmentBootstrap;
import org.cronpulse.config.utils.LogContext;
import org.cronpulse.rest.RestApiServer;
import org.cronpulse.utils.JdbcUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Entry point
 * Load Configuration from Xml
 * Connect to Database (or continue degraded and reconnect in the background)
 * Start REST API and the dispatch loop
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        EnvironmentBootstrap.init();
        LogContext.start("Main");

        try {
            logger.info("[------------ Starting CronPulse Scheduler ------------]");

            String configPath = (args.length > 0) ? args[0] : EnvironmentBootstrap.get("CRONPULSE_CONFIG", "config.xml");
            XmlConfiguration cfg = ConfigLoader.loadConfig(configPath);
            logger.debug("Configuration loaded from {}", configPath);

            if (ConfigLoader.STORAGE_POSTGRES.equals(cfg.storage.mode)) {
                try {
                    connect(cfg);
                } catch (Exception e) {
                    logger.error("Database initialization failed: {}", e.getMessage());
                    logger.warn("[------------ Continuing in DEGRADED MODE, database unavailable ------------]");
                    DBTaskScheduler.scheduleReconnect(() -> connect(cfg));
                }
            } else {
                logger.warn("[------------ Storage mode '{}': jobs and usage are NOT durable ------------]", cfg.storage.mode);
            }

            AppContext ctx = AppContext.create(cfg, Clock.systemUTC());

            logger.info("[------------ Starting Undertow server ------------]");
            Undertow server = RestApiServer.start(cfg, ctx);

            ctx.dispatchLoop().start();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("[------------ Shutdown initiated ------------]");
                ctx.dispatchLoop().stop();
                server.stop();
                DBTaskScheduler.shutdown();
                DatabaseManager.shutdown();
                logger.info("[------------ CronPulse shutdown complete ------------]");
            }, "cronpulse-shutdown"));

        } catch (Exception e) {
            logger.error("[------------ System startup failed: {} ------------]", e.getMessage(), e);
            System.exit(1);
        } finally {
            LogContext.clear();
        }
    }

    private static void connect(XmlConfiguration cfg) throws Exception {
        DatabaseManager.initialize(cfg);
        if (cfg.storage.initSchema) {
            SchemaInitializer.apply(JdbcUtils::getConnection);
        }
    }
}
