package org.cronpulse.rest;

import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import org.cronpulse.AppContext;
import org.cronpulse.config.XmlConfiguration;
import org.cronpulse.rest.base.CORSHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

public class RestApiServer {
    private static final Logger logger = LoggerFactory.getLogger(RestApiServer.class);

    private RestApiServer() {}

    /**
     * Builds and starts the Undertow server. The caller owns the returned instance and must stop it.
     */
    public static Undertow start(XmlConfiguration cfg, AppContext ctx) {
        if (cfg == null || cfg.server == null) {
            logger.error("Invalid configuration: missing server configuration.");
            throw new IllegalArgumentException("Invalid configuration: missing server section.");
        }
        XmlConfiguration.Server sc = cfg.server;

        Undertow server = Undertow.builder()
                .setServerOption(UndertowOptions.DECODE_URL, true)
                .setServerOption(UndertowOptions.URL_CHARSET, StandardCharsets.UTF_8.name())
                .setIoThreads(sc.ioThreads)
                .setWorkerThreads(sc.workerThreads)
                .addHttpListener(sc.port, sc.host)
                .setHandler(new CORSHandler(Routes.api(sc.basePath, ctx), sc.allowedOrigins))
                .build();

        server.start();
        logger.info("""
                        
                        CRONPULSE SCHEDULER REST API
                        --------------------------------------
                        Undertow server started successfully!
                        Host   : http://{}:{}{}
                        Storage: {}
                        """,
                sc.host, sc.port, sc.basePath, cfg.storage.mode);
        return server;
    }
}
