package org.cronpulse.services.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.cronpulse.errors.ValidationException;
import org.cronpulse.services.HandlerException;
import org.cronpulse.services.JobHandler;
import org.cronpulse.utils.HttpRequestUtil;
import org.cronpulse.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Built-in handler: the action is {@code {method, url, body?, headers?}} and is sent as one HTTP request.
 * Any status outside 2xx is a failure. Timeouts are bounded by the configured handler timeout.
 */
public class HttpJobHandler implements JobHandler {

    private static final Logger logger = LoggerFactory.getLogger(HttpJobHandler.class);

    public static final String TYPE = "http";

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD");
    private static final int MAX_ERROR_BODY = 200;

    private final HttpClient client;
    private final Duration timeout;

    public HttpJobHandler(Duration timeout) {
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public void validate(Map<String, Object> action) {
        method(action);
        uri(action);
        Object headers = action.get("headers");
        if (headers != null && !(headers instanceof Map)) {
            throw new ValidationException("action", "action.headers must be an object");
        }
    }

    @Override
    public void handle(String ownerId, Map<String, Object> action) throws HandlerException, InterruptedException {
        String method;
        URI uri;
        String body;
        try {
            method = method(action);
            uri = uri(action);
            body = body(action.get("body"));
        } catch (ValidationException | JsonProcessingException e) {
            throw new HandlerException("Invalid http action: " + e.getMessage(), e);
        }

        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (body != null) {
            request.header("Content-Type", "application/json");
        }
        Map<String, Object> headers = HttpRequestUtil.getMap(action, "headers");
        if (headers != null) {
            headers.forEach((name, value) -> request.setHeader(name, String.valueOf(value)));
        }

        HttpResponse<String> response;
        try {
            response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new HandlerException(method + " " + uri + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new HandlerException(method + " " + uri + " failed: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new HandlerException(method + " " + uri + " returned HTTP " + status + ": " + abbreviate(response.body()));
        }
        logger.debug("{} {} for owner {} returned {}", method, uri, ownerId, status);
    }

    private static String method(Map<String, Object> action) {
        String raw = HttpRequestUtil.getString(action, "method");
        String method = raw == null || raw.isBlank() ? "GET" : raw.trim().toUpperCase(Locale.ROOT);
        if (!METHODS.contains(method)) {
            throw new ValidationException("action", "Unsupported action.method '" + raw + "'");
        }
        return method;
    }

    private static URI uri(Map<String, Object> action) {
        String url = HttpRequestUtil.getString(action, "url");
        if (url == null || url.isBlank()) {
            throw new ValidationException("action", "action.url is required");
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (!uri.isAbsolute() || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ValidationException("action", "action.url must be an absolute http(s) URL: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ValidationException("action", "action.url is not a valid URL: " + url, e);
        }
    }

    private static String body(Object body) throws JsonProcessingException {
        if (body == null) return null;
        if (body instanceof String s) return s;
        return JsonUtil.toJson(body);
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() <= MAX_ERROR_BODY ? text : text.substring(0, MAX_ERROR_BODY) + "...";
    }
}
