package org.cronpulse.handlers.limits;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.cronpulse.ratelimit.PolicyStore;
import org.cronpulse.ratelimit.RateLimitDefaults;
import org.cronpulse.ratelimit.RateLimiter;
import org.cronpulse.utils.HttpRequestUtil;
import org.cronpulse.utils.ResponseUtil;

import java.util.Map;

/**
 * DELETE /limits?owner_id=&integration=, reverting the pair to its integration default.
 */
public class DeleteLimitsHandler implements HttpHandler {

    private final RateLimiter rateLimiter;
    private final PolicyStore policies;

    public DeleteLimitsHandler(RateLimiter rateLimiter, PolicyStore policies) {
        this.rateLimiter = rateLimiter;
        this.policies = policies;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String ownerId = HttpRequestUtil.requireParam(exchange, "owner_id");
        String integration = RateLimitDefaults.normalize(HttpRequestUtil.queryParam(exchange, "integration"));

        if (!policies.delete(ownerId, integration)) {
            ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND,
                    "No rate limit override for " + ownerId + "/" + integration);
            return;
        }
        rateLimiter.invalidate(ownerId, integration);
        ResponseUtil.sendSuccess(exchange, "Rate limit override removed",
                Map.of("owner_id", ownerId, "integration", integration));
    }
}
