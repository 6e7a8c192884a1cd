package org.cronpulse.config.database;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background database reconnection while running in degraded mode.
 * The task is cancelled as soon as one attempt succeeds.
 */
public class DBTaskScheduler {
    private static final Logger logger = LoggerFactory.getLogger(DBTaskScheduler.class);
    private static final ScheduledExecutorService executor =
            Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "db-reconnect");
                t.setDaemon(true);
                return t;
            });

    private static ScheduledFuture<?> reconnectFuture;

    private DBTaskScheduler() {}

    public interface ReconnectAttempt {
        void run() throws Exception;
    }

    public static synchronized void scheduleReconnect(ReconnectAttempt attempt) {
        if (reconnectFuture != null && !reconnectFuture.isDone()) {
            return;
        }
        reconnectFuture = executor.scheduleAtFixedRate(() -> {
            try {
                attempt.run();
                logger.info("[------------ Database reconnected successfully ------------]");
                cancel();
            } catch (Exception e) {
                logger.warn("Database still unavailable: {}", e.getMessage());
            }
        }, 10, 20, TimeUnit.SECONDS);
    }

    private static synchronized void cancel() {
        if (reconnectFuture != null) {
            reconnectFuture.cancel(false);
        }
    }

    public static void shutdown() {
        try {
            executor.shutdownNow();
            logger.info("Reconnect scheduler stopped.");
        } catch (Exception e) {
            logger.warn("Error shutting down reconnect scheduler: {}", e.getMessage());
        }
    }
}
