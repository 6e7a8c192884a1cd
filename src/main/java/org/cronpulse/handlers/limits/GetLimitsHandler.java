package org.cronpulse.handlers.limits;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.cronpulse.ratelimit.PeriodType;
import org.cronpulse.ratelimit.PolicyStore;
import org.cronpulse.ratelimit.RateLimitDefaults;
import org.cronpulse.ratelimit.RateLimitPolicy;
import org.cronpulse.ratelimit.RateLimiter;
import org.cronpulse.utils.HttpRequestUtil;
import org.cronpulse.utils.ResponseUtil;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET /limits?owner_id=&integration=
 * <p>
 * Without {@code owner_id} the integration default table is returned.
 * With it, the effective policy for the pair plus current hourly and daily usage.
 */
public class GetLimitsHandler implements HttpHandler {

    private final RateLimiter rateLimiter;
    private final PolicyStore policies;
    private final Clock clock;

    public GetLimitsHandler(RateLimiter rateLimiter, PolicyStore policies, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.policies = policies;
        this.clock = clock;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String ownerId = HttpRequestUtil.queryParam(exchange, "owner_id");
        if (ownerId == null) {
            ResponseUtil.sendSuccess(exchange, "Integration defaults", rateLimiter.defaults().table());
            return;
        }
        String integration = RateLimitDefaults.normalize(HttpRequestUtil.queryParam(exchange, "integration"));

        RateLimitPolicy policy = rateLimiter.effectivePolicy(ownerId, integration);
        boolean overridden = policies.find(ownerId, integration).isPresent();
        Map<PeriodType, Long> usage = rateLimiter.currentUsage(ownerId, integration, clock.instant());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("owner_id", ownerId);
        data.put("integration", integration);
        data.put("source", overridden ? "override" : "default");
        data.put("max_calls_per_hour", policy.maxCallsPerHour());
        data.put("max_calls_per_day", policy.maxCallsPerDay());
        data.put("fail_closed", policy.failClosed());
        Map<String, Long> used = new LinkedHashMap<>();
        usage.forEach((period, count) -> used.put(period.dbValue(), count));
        data.put("usage", used);

        ResponseUtil.sendSuccess(exchange, "Effective rate limit", data);
    }
}
