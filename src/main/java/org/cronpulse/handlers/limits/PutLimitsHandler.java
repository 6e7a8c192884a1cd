package org.cronpulse.handlers.limits;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.cronpulse.errors.ValidationException;
import org.cronpulse.ratelimit.PolicyStore;
import org.cronpulse.ratelimit.RateLimitDefaults;
import org.cronpulse.ratelimit.RateLimitOverride;
import org.cronpulse.ratelimit.RateLimiter;
import org.cronpulse.utils.HttpRequestUtil;
import org.cronpulse.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * PUT /limits: create or replace a per-owner override. Takes effect on the next rate limit check.
 */
public class PutLimitsHandler implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(PutLimitsHandler.class);

    private final RateLimiter rateLimiter;
    private final PolicyStore policies;

    public PutLimitsHandler(RateLimiter rateLimiter, PolicyStore policies) {
        this.rateLimiter = rateLimiter;
        this.policies = policies;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Map<String, Object> body = HttpRequestUtil.parseJson(exchange);

        String ownerId = HttpRequestUtil.getString(body, "owner_id");
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("owner_id", "owner_id is required");
        }
        int perHour = HttpRequestUtil.getNonNegativeInt(body, "max_calls_per_hour");
        int perDay = HttpRequestUtil.getNonNegativeInt(body, "max_calls_per_day");
        String integration = RateLimitDefaults.normalize(HttpRequestUtil.getString(body, "integration"));

        RateLimitOverride override = new RateLimitOverride(ownerId.trim(), integration, perHour, perDay);
        policies.upsert(override);
        rateLimiter.invalidate(override.ownerId(), integration);

        logger.info("Rate limit override for {}/{} set to {}/h {}/d", override.ownerId(), integration, perHour, perDay);
        ResponseUtil.sendSuccess(exchange, "Rate limit saved", override);
    }
}
