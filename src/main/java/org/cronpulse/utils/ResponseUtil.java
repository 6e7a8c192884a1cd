package org.cronpulse.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the API envelope {@code {"status": "success"|"error", "message": ..., "data": ...}}.
 */
public final class ResponseUtil {
    private static final Logger logger = LoggerFactory.getLogger(ResponseUtil.class);

    private static final String JSON = "application/json; charset=utf-8";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Envelope(String status, String message, Object data) {}

    private ResponseUtil() {}

    public static void sendSuccess(HttpServerExchange exchange, String message, Object data) {
        send(exchange, StatusCodes.OK, new Envelope("success", message, data));
    }

    public static void sendCreated(HttpServerExchange exchange, String message, Object data) {
        send(exchange, StatusCodes.CREATED, new Envelope("success", message, data));
    }

    public static void sendError(HttpServerExchange exchange, int status, String message) {
        send(exchange, status, new Envelope("error", message, null));
    }

    private static void send(HttpServerExchange exchange, int status, Envelope envelope) {
        if (exchange.isResponseStarted()) {
            logger.warn("Response already started for {}, dropping '{}'", exchange.getRequestPath(), envelope.message());
            return;
        }
        String json;
        try {
            json = JsonUtil.toJson(envelope);
        } catch (JsonProcessingException e) {
            logger.error("Response for {} could not be serialized: {}", exchange.getRequestPath(), e.getOriginalMessage(), e);
            status = StatusCodes.INTERNAL_SERVER_ERROR;
            json = "{\"status\":\"error\",\"message\":\"Internal Server Error\"}";
        }
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON);
        exchange.getResponseSender().send(json);
        logger.debug("{} {} -> {}", exchange.getRequestMethod(), exchange.getRequestPath(), status);
    }
}
