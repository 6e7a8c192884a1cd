package org.cronpulse.config;

import org.cronpulse.config.utils.XmlUtil;
import org.w3c.dom.Document;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Set;

public class ConfigLoader {

    public static final String STORAGE_POSTGRES = "postgres";
    public static final String STORAGE_MEMORY = "memory";
    private static final Set<String> STORAGE_MODES = Set.of(STORAGE_POSTGRES, STORAGE_MEMORY);

    private ConfigLoader() {}

    /**
     * Loads the XML configuration file and returns a fully-typed XmlConfiguration object.
     * Sections that are absent from the file fall back to their defaults.
     */
    public static XmlConfiguration loadConfig(String xmlPath) {
        try (InputStream in = Files.newInputStream(Path.of(xmlPath))) {
            return load(in);
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config file! " + e.getMessage(), e);
        }
    }

    public static XmlConfiguration load(InputStream in) {
        XmlConfiguration cfg;
        try {
            Document doc = XmlUtil.parse(in);
            cfg = XmlUtil.unmarshal(doc, XmlConfiguration.class);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse configuration: " + e.getMessage(), e);
        }
        return withDefaults(cfg);
    }

    static XmlConfiguration withDefaults(XmlConfiguration cfg) {
        if (cfg.server == null) cfg.server = new XmlConfiguration.Server();
        if (cfg.connectionPool == null) cfg.connectionPool = new XmlConfiguration.ConnectionPool();
        if (cfg.storage == null) cfg.storage = new XmlConfiguration.Storage();
        if (cfg.scheduler == null) cfg.scheduler = new XmlConfiguration.Scheduler();
        if (cfg.rateLimits == null) cfg.rateLimits = new ArrayList<>();

        String mode = cfg.storage.mode == null ? STORAGE_POSTGRES : cfg.storage.mode.trim().toLowerCase(Locale.ROOT);
        if (!STORAGE_MODES.contains(mode)) {
            throw new IllegalStateException("Unknown storage mode '" + cfg.storage.mode + "', expected one of " + STORAGE_MODES);
        }
        cfg.storage.mode = mode;

        if (STORAGE_POSTGRES.equals(mode) && cfg.dataSource == null) {
            throw new IllegalStateException("storage mode 'postgres' requires a <dataSource> section");
        }
        if (cfg.scheduler.pollIntervalSeconds <= 0 || cfg.scheduler.batchLimit <= 0 || cfg.scheduler.workerThreads <= 0) {
            throw new IllegalStateException("scheduler pollIntervalSeconds, batchLimit and workerThreads must be positive");
        }
        return cfg;
    }
}
