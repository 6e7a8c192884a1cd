package org.cronpulse.rest;

import com.fasterxml.jackson.databind.JsonNode;
import io.undertow.Undertow;
import org.cronpulse.AppContext;
import org.cronpulse.MutableClock;
import org.cronpulse.config.ConfigLoader;
import org.cronpulse.config.XmlConfiguration;
import org.cronpulse.utils.JsonUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RestApiServerTest {

    private static final String CREATE_BODY = """
            {
              "owner_id": "user-1",
              "name": "Morning digest",
              "cron_expression": "*/30 * * * *",
              "job_type": "http",
              "integration": "Gmail",
              "action": {"method": "POST", "url": "https://example.com/digest"}
            }
            """;

    private final HttpClient client = HttpClient.newHttpClient();
    private AppContext ctx;
    private Undertow server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        XmlConfiguration cfg;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("config/memory.xml")) {
            cfg = ConfigLoader.load(in);
        }
        ctx = AppContext.create(cfg, new MutableClock(Instant.parse("2024-05-01T10:05:00Z")));
        server = RestApiServer.start(cfg, ctx);
        int port = ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
        baseUrl = "http://127.0.0.1:" + port + "/api/v1";
    }

    @AfterEach
    void tearDown() {
        ctx.dispatchLoop().stop();
        server.stop();
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .method(method, body == null ? HttpRequest.BodyPublishers.noBody() : HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return JsonUtil.mapper().readTree(response.body());
    }

    private String createJob() throws Exception {
        HttpResponse<String> created = send("POST", "/jobs", CREATE_BODY);
        assertEquals(201, created.statusCode(), created.body());
        return json(created).path("data").path("id").asText();
    }

    @Test
    void createJob_shouldReturnCreatedJobWithFirstRun() throws Exception {
        HttpResponse<String> response = send("POST", "/jobs", CREATE_BODY);

        assertEquals(201, response.statusCode());
        JsonNode body = json(response);
        assertEquals("success", body.path("status").asText());
        JsonNode job = body.path("data");
        assertEquals("user-1", job.path("owner_id").asText());
        assertEquals("mail", job.path("integration").asText());
        assertEquals("UTC", job.path("timezone").asText());
        assertEquals("2024-05-01T10:30:00Z", job.path("next_run").asText());
        assertEquals(0, job.path("error_count").asInt());
        assertTrue(job.path("enabled").asBoolean());
    }

    @Test
    void createJob_shouldRejectMalformedCronAndPersistNothing() throws Exception {
        HttpResponse<String> response = send("POST", "/jobs", CREATE_BODY.replace("*/30 * * * *", "* * *"));

        assertEquals(400, response.statusCode());
        assertEquals("error", json(response).path("status").asText());

        HttpResponse<String> list = send("GET", "/jobs?owner_id=user-1", null);
        assertEquals(200, list.statusCode());
        assertEquals(0, json(list).path("data").size());
    }

    @Test
    void createJob_shouldRejectClientSuppliedIdAndInvalidJson() throws Exception {
        assertEquals(400, send("POST", "/jobs", CREATE_BODY.replace("{\n", "{\"id\":\"x\",\n")).statusCode());
        assertEquals(400, send("POST", "/jobs", "{not json").statusCode());
    }

    @Test
    void jobLifecycle_shouldBeScopedToOwner() throws Exception {
        String id = createJob();

        HttpResponse<String> list = send("GET", "/jobs?owner_id=user-1", null);
        assertEquals(1, json(list).path("data").size());

        assertEquals(200, send("GET", "/jobs/" + id + "?owner_id=user-1", null).statusCode());
        assertEquals(404, send("GET", "/jobs/" + id + "?owner_id=someone-else", null).statusCode());
        assertEquals(400, send("GET", "/jobs/not-a-uuid?owner_id=user-1", null).statusCode());
        assertEquals(400, send("GET", "/jobs/" + id, null).statusCode());

        HttpResponse<String> disabled = send("POST", "/jobs/" + id + "/disable?owner_id=user-1", null);
        assertEquals(200, disabled.statusCode());
        assertFalse(json(disabled).path("data").path("enabled").asBoolean());

        HttpResponse<String> enabled = send("POST", "/jobs/" + id + "/enable?owner_id=user-1", null);
        assertTrue(json(enabled).path("data").path("enabled").asBoolean());

        assertEquals(404, send("DELETE", "/jobs/" + id + "?owner_id=someone-else", null).statusCode());
        assertEquals(200, send("DELETE", "/jobs/" + id + "?owner_id=user-1", null).statusCode());
        assertEquals(404, send("GET", "/jobs/" + id + "?owner_id=user-1", null).statusCode());
        assertEquals(404, send("DELETE", "/jobs/" + id + "?owner_id=user-1", null).statusCode());
    }

    @Test
    void limits_shouldExposeDefaultsAndOverrides() throws Exception {
        HttpResponse<String> defaults = send("GET", "/limits", null);
        assertEquals(200, defaults.statusCode());
        assertEquals(6, json(defaults).path("data").path("weather").path("max_calls_per_hour").asInt());

        HttpResponse<String> effective = send("GET", "/limits?owner_id=user-1&integration=gmail", null);
        JsonNode data = json(effective).path("data");
        assertEquals("mail", data.path("integration").asText());
        assertEquals("default", data.path("source").asText());
        assertEquals(10, data.path("max_calls_per_hour").asInt());
        assertEquals(0, data.path("usage").path("hourly").asInt());

        HttpResponse<String> put = send("PUT", "/limits",
                "{\"owner_id\":\"user-1\",\"integration\":\"mail\",\"max_calls_per_hour\":3,\"max_calls_per_day\":30}");
        assertEquals(200, put.statusCode());

        JsonNode overridden = json(send("GET", "/limits?owner_id=user-1&integration=mail", null)).path("data");
        assertEquals("override", overridden.path("source").asText());
        assertEquals(3, overridden.path("max_calls_per_hour").asInt());

        assertEquals(400, send("PUT", "/limits",
                "{\"owner_id\":\"user-1\",\"integration\":\"mail\",\"max_calls_per_hour\":-1,\"max_calls_per_day\":30}").statusCode());

        assertEquals(200, send("DELETE", "/limits?owner_id=user-1&integration=mail", null).statusCode());
        assertEquals(404, send("DELETE", "/limits?owner_id=user-1&integration=mail", null).statusCode());
        assertEquals(10, json(send("GET", "/limits?owner_id=user-1&integration=mail", null))
                .path("data").path("max_calls_per_hour").asInt());
    }

    @Test
    void health_shouldReportInMemoryStorage() throws Exception {
        HttpResponse<String> response = send("GET", "/system/health", null);

        assertEquals(200, response.statusCode());
        JsonNode data = json(response).path("data");
        assertEquals("memory", data.path("storage").asText());
        assertEquals("in-memory", data.path("storage_status").asText());
        assertFalse(data.path("scheduler_running").asBoolean());
        assertEquals("http", data.path("handlers").get(0).asText());
    }

    @Test
    void unknownRouteAndWrongMethod_shouldUseErrorEnvelope() throws Exception {
        HttpResponse<String> missing = send("GET", "/nope", null);
        assertEquals(404, missing.statusCode());
        assertEquals("error", json(missing).path("status").asText());

        assertEquals(405, send("PATCH", "/jobs", "{}").statusCode());
    }
}
