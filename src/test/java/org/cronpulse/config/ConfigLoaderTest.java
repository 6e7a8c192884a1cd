package org.cronpulse.config;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {

    private static XmlConfiguration parse(String xml) {
        return ConfigLoader.load(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void load_shouldReadMemoryModeConfiguration() throws Exception {
        XmlConfiguration cfg;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("config/memory.xml")) {
            assertNotNull(in);
            cfg = ConfigLoader.load(in);
        }

        assertEquals(ConfigLoader.STORAGE_MEMORY, cfg.storage.mode);
        assertEquals("127.0.0.1", cfg.server.host);
        assertEquals(0, cfg.server.port);
        assertEquals(3600, cfg.scheduler.pollIntervalSeconds);
        assertEquals("30,60,300", cfg.scheduler.backoffScheduleSeconds);
        assertEquals(1, cfg.rateLimits.size());
        XmlConfiguration.IntegrationLimit weather = cfg.rateLimits.get(0);
        assertEquals("Weather", weather.name);
        assertEquals(6, weather.maxCallsPerHour);
        assertTrue(weather.failClosed);
    }

    @Test
    void load_shouldApplyDefaultsForMissingSections() {
        XmlConfiguration cfg = parse("<configuration><storage><mode>memory</mode></storage></configuration>");

        assertEquals(8090, cfg.server.port);
        assertEquals("/api/v1", cfg.server.basePath);
        assertEquals(60, cfg.scheduler.pollIntervalSeconds);
        assertEquals(50, cfg.scheduler.batchLimit);
        assertEquals(30, cfg.scheduler.handlerTimeoutSeconds);
        assertNotNull(cfg.connectionPool);
        assertNotNull(cfg.rateLimits);
    }

    @Test
    void load_shouldRequireDataSourceForPostgres() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> parse("<configuration><storage><mode>postgres</mode></storage></configuration>"));
        assertTrue(e.getMessage().contains("dataSource"));
    }

    @Test
    void load_shouldRejectUnknownStorageMode() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> parse("<configuration><storage><mode>redis</mode></storage></configuration>"));
        assertTrue(e.getMessage().contains("redis"));
    }

    @Test
    void load_shouldRejectNonPositiveSchedulerSettings() {
        assertThrows(IllegalStateException.class, () -> parse("""
                <configuration>
                    <storage><mode>memory</mode></storage>
                    <scheduler><batchLimit>0</batchLimit></scheduler>
                </configuration>
                """));
    }

    @Test
    void load_shouldRejectMalformedXml() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> parse("<configuration><server>"));
        assertTrue(e.getMessage().startsWith("Failed to parse configuration"));
    }

    @Test
    void loadConfig_shouldFailForMissingFile() {
        assertThrows(IllegalStateException.class, () -> ConfigLoader.loadConfig("does/not/exist.xml"));
    }
}
