package org.cronpulse.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.cronpulse.AppContext;
import org.cronpulse.config.database.DatabaseManager;
import org.cronpulse.config.utils.EnvironmentBootstrap;
import org.cronpulse.services.DispatchLoop;
import org.cronpulse.utils.ResponseUtil;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET /system/health: storage reachability, dispatch loop state and the last cycle's counters.
 */
public class HealthCheckHandler implements HttpHandler {

    private final AppContext ctx;
    private final Instant startedAt = Instant.now();

    public HealthCheckHandler(AppContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        DispatchLoop loop = ctx.dispatchLoop();
        Instant now = Instant.now();

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("app", "CronPulse Scheduler");
        health.put("version", "1.0.0");
        health.put("environment", EnvironmentBootstrap.getEnvironment());
        health.put("uptime_seconds", Duration.between(startedAt, now).toSeconds());
        health.put("timestamp", now.toString());
        health.put("storage", ctx.config().storage.mode);
        health.put("storage_status", ctx.isPersistent() ? DatabaseManager.status() : "in-memory");
        health.put("scheduler_running", loop.isRunning());
        health.put("handlers", ctx.handlers().registeredTypes());
        health.put("last_cycle", loop.lastCycle());

        ResponseUtil.sendSuccess(exchange, "Health check completed", health);
    }
}
