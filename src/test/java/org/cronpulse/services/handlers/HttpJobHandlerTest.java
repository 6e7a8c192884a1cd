package org.cronpulse.services.handlers;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.cronpulse.errors.ValidationException;
import org.cronpulse.services.HandlerException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpJobHandlerTest {

    private HttpServer server;
    private ExecutorService executor;
    private String baseUrl;
    private HttpJobHandler handler;

    private final AtomicReference<String> lastMethod = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastContentType = new AtomicReference<>();
    private final AtomicReference<String> lastToken = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", exchange -> {
            lastMethod.set(exchange.getRequestMethod());
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            lastToken.set(exchange.getRequestHeaders().getFirst("X-Token"));
            respond(exchange, 200, "{\"ok\":true}");
        });
        server.createContext("/fail", exchange -> respond(exchange, 500, "upstream exploded"));
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "late");
        });
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        handler = new HttpJobHandler(Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        executor.shutdownNow();
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    void handle_shouldDefaultToGet() throws Exception {
        handler.handle("owner-1", Map.of("url", baseUrl + "/ok"));

        assertEquals("GET", lastMethod.get());
    }

    @Test
    void handle_shouldSendObjectBodyAsJsonWithHeaders() throws Exception {
        handler.handle("owner-1", Map.of(
                "method", "post",
                "url", baseUrl + "/ok",
                "body", Map.of("city", "Paris"),
                "headers", Map.of("X-Token", "abc")));

        assertEquals("POST", lastMethod.get());
        assertEquals("{\"city\":\"Paris\"}", lastBody.get());
        assertEquals("application/json", lastContentType.get());
        assertEquals("abc", lastToken.get());
    }

    @Test
    void handle_shouldFailOnNon2xxStatus() {
        HandlerException e = assertThrows(HandlerException.class,
                () -> handler.handle("owner-1", Map.of("url", baseUrl + "/fail")));

        assertTrue(e.getMessage().contains("500"));
        assertTrue(e.getMessage().contains("upstream exploded"));
    }

    @Test
    void handle_shouldFailWhenTimeoutElapses() {
        HandlerException e = assertThrows(HandlerException.class,
                () -> handler.handle("owner-1", Map.of("url", baseUrl + "/slow")));

        assertTrue(e.getMessage().contains("timed out"));
    }

    @Test
    void handle_shouldFailForInvalidActionInsteadOfThrowingValidation() {
        assertThrows(HandlerException.class, () -> handler.handle("owner-1", Map.of("method", "GET")));
    }

    @Test
    void validate_shouldAcceptWellFormedAction() {
        assertDoesNotThrow(() -> handler.validate(Map.of("method", "DELETE", "url", "https://example.com/x")));
    }

    @Test
    void validate_shouldRejectMissingOrNonHttpUrl() {
        assertThrows(ValidationException.class, () -> handler.validate(Map.of("method", "GET")));
        assertThrows(ValidationException.class, () -> handler.validate(Map.of("url", "ftp://example.com/file")));
        assertThrows(ValidationException.class, () -> handler.validate(Map.of("url", "/relative/path")));
        assertThrows(ValidationException.class, () -> handler.validate(Map.of("url", "http://exa mple.com")));
    }

    @Test
    void validate_shouldRejectUnsupportedMethodAndBadHeaders() {
        assertThrows(ValidationException.class,
                () -> handler.validate(Map.of("method", "TRACE", "url", "https://example.com")));
        assertThrows(ValidationException.class,
                () -> handler.validate(Map.of("url", "https://example.com", "headers", "X-Token: abc")));
    }
}
