package org.cronpulse.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HeaderMap;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Adds CORS headers for configured origins ({@code server.allowedOrigins}, comma separated, {@code *} for any)
 * and answers preflight requests without reaching the routes.
 */
public class CORSHandler implements HttpHandler {

    private static final HttpString ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString MAX_AGE = new HttpString("Access-Control-Max-Age");

    private static final String METHODS = "GET, POST, PUT, DELETE, OPTIONS";
    private static final String PREFLIGHT_MAX_AGE = "86400";

    private final HttpHandler next;
    private final Set<String> origins;
    private final boolean anyOrigin;

    public CORSHandler(HttpHandler next, String allowedOrigins) {
        this.next = next;
        this.origins = allowedOrigins == null ? Set.of()
                : Arrays.stream(allowedOrigins.split(","))
                        .map(o -> o.trim().toLowerCase(Locale.ROOT))
                        .filter(o -> !o.isEmpty())
                        .collect(Collectors.toUnmodifiableSet());
        this.anyOrigin = origins.contains("*");
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String origin = exchange.getRequestHeaders().getFirst(Headers.ORIGIN);
        boolean allowed = origin != null && (anyOrigin || origins.contains(origin.toLowerCase(Locale.ROOT)));

        if (allowed) {
            HeaderMap headers = exchange.getResponseHeaders();
            headers.put(ALLOW_ORIGIN, origin);
            headers.put(ALLOW_METHODS, METHODS);
            headers.put(ALLOW_HEADERS, "Content-Type, Accept");
            headers.put(MAX_AGE, PREFLIGHT_MAX_AGE);
            headers.put(Headers.VARY, "Origin");
        }

        if (Methods.OPTIONS.equals(exchange.getRequestMethod())) {
            exchange.setStatusCode(allowed ? StatusCodes.NO_CONTENT : StatusCodes.FORBIDDEN);
            exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, "0");
            exchange.endExchange();
            return;
        }
        next.handleRequest(exchange);
    }
}
