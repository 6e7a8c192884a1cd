package org.cronpulse.services;

import org.cronpulse.services.handlers.HttpJobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup registration of job handlers. Must run before the dispatch loop starts.
 */
public class ApplicationHandlers {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationHandlers.class);

    private ApplicationHandlers() {}

    public static void registerApplicationHandlers(HandlerRegistry registry, HttpJobHandler httpHandler) {
        logger.info("[------------ Registering job handlers ------------]");
        registry.register(HttpJobHandler.TYPE, httpHandler);
        logger.info("[------------ {} job handler(s) registered ------------]", registry.registeredTypes().size());
    }
}
