package org.cronpulse.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.cronpulse.config.utils.LogContext;
import org.cronpulse.errors.StoreException;
import org.cronpulse.errors.ValidationException;
import org.cronpulse.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates exceptions escaping a route handler into the JSON error envelope:
 * validation → 400, store outage → 503, anything else → 500.
 */
public class ErrorMapper implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(ErrorMapper.class);

    private final HttpHandler next;

    public ErrorMapper(HttpHandler next) {
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        LogContext.start("RestApi");
        try {
            next.handleRequest(exchange);
        } catch (ValidationException e) {
            logger.debug("Rejected {} {}: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage());
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (StoreException e) {
            logger.error("Store unavailable for {} {}: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage(), e);
            ResponseUtil.sendError(exchange, StatusCodes.SERVICE_UNAVAILABLE, "Storage temporarily unavailable");
        } catch (Exception e) {
            logger.error("Request {} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage(), e);
            ResponseUtil.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Internal Server Error");
        } finally {
            LogContext.clear();
        }
    }
}
