package org.cronpulse.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.undertow.server.HttpServerExchange;
import org.cronpulse.errors.ValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Deque;
import java.util.Map;
import java.util.UUID;

/**
 * Request parsing for the REST handlers. Every bad input surfaces as a {@link ValidationException},
 * which the route's error mapper turns into a 400.
 */
public final class HttpRequestUtil {

    private static final TypeReference<Map<String, Object>> BODY = new TypeReference<>() {};

    private HttpRequestUtil() {}

    /**
     * JSON object body. Requires a blocking exchange.
     */
    public static Map<String, Object> parseJson(HttpServerExchange exchange) {
        Map<String, Object> body;
        try (InputStream is = exchange.getInputStream()) {
            body = JsonUtil.mapper().readValue(is, BODY);
        } catch (JsonProcessingException e) {
            throw new ValidationException("body", "Invalid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ValidationException("body", "Unreadable request body", e);
        }
        if (body == null) {
            throw new ValidationException("body", "Request body must be a JSON object");
        }
        return body;
    }

    /** Trimmed query (or path) parameter, {@code null} when absent or blank. */
    public static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty()) return null;
        String value = values.peekFirst();
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static String requireParam(HttpServerExchange exchange, String name) {
        String value = queryParam(exchange, name);
        if (value == null) {
            throw new ValidationException(name, name + " is required");
        }
        return value;
    }

    /** The {@code {id}} path segment as a job id. */
    public static UUID pathId(HttpServerExchange exchange) {
        String raw = requireParam(exchange, "id");
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("id", "'" + raw + "' is not a valid job id", e);
        }
    }

    public static String getString(Map<String, Object> body, String field) {
        Object value = body.get(field);
        return value != null ? value.toString() : null;
    }

    /**
     * Whole number {@code >= 0}, given either as a JSON number or a numeric string.
     */
    public static int getNonNegativeInt(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) {
            throw new ValidationException(field, field + " is required");
        }
        long parsed;
        if (value instanceof Integer || value instanceof Long) {
            parsed = ((Number) value).longValue();
        } else {
            try {
                parsed = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(field, field + " must be a whole number", e);
            }
        }
        if (parsed < 0 || parsed > Integer.MAX_VALUE) {
            throw new ValidationException(field, field + " must be between 0 and " + Integer.MAX_VALUE);
        }
        return (int) parsed;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<String, Object> body, String field) {
        Object value = body.get(field);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }
}
