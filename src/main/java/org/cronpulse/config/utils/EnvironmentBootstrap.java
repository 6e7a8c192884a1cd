package org.cronpulse.config.utils;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Process settings that live outside config.xml.
 * <p>
 * Values come from the process environment first, then an optional {@code .env} file.
 * {@code APP_ENV=DEVELOPMENT} switches logging to {@code logback-dev.xml}.
 */
public final class EnvironmentBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(EnvironmentBootstrap.class);

    public static final String APP_ENV = "APP_ENV";
    private static final String DEVELOPMENT = "DEVELOPMENT";
    private static final String PRODUCTION = "PRODUCTION";

    private static volatile Dotenv dotenv;
    private static volatile String environment = PRODUCTION;

    private EnvironmentBootstrap() {}

    /**
     * Reads {@code .env} and selects the logback configuration. Safe to call more than once.
     */
    public static synchronized void init() {
        if (dotenv != null) return;
        dotenv = Dotenv.configure().ignoreIfMissing().load();

        environment = lookup(APP_ENV, PRODUCTION).toUpperCase(Locale.ROOT);
        String logbackFile = DEVELOPMENT.equals(environment) ? "logback-dev.xml" : "logback.xml";
        reconfigureLogging(logbackFile);
        logger.info("Environment {} (logging from {})", environment, logbackFile);
    }

    /** Process environment first, then {@code .env}, then {@code fallback}. */
    public static String get(String key, String fallback) {
        init();
        return lookup(key, fallback);
    }

    /** Active environment name. Does not trigger {@link #init()}. */
    public static String getEnvironment() {
        return environment;
    }

    private static String lookup(String key, String fallback) {
        String value = System.getenv(key);
        if ((value == null || value.isBlank()) && dotenv != null) {
            value = dotenv.get(key);
        }
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static void reconfigureLogging(String resource) {
        try (InputStream in = EnvironmentBootstrap.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("{} not found on classpath, keeping current logging setup", resource);
                return;
            }
            LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(in);
        } catch (IOException | JoranException e) {
            throw new IllegalStateException("Logging configuration " + resource + " could not be applied", e);
        }
    }
}
