package org.cronpulse.services;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * job_type → handler. Populated at startup and sealed when the dispatch loop starts;
 * registering afterwards is a configuration error.
 */
public class HandlerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();
    private final JobHandler defaultHandler;
    private volatile boolean sealed;

    public HandlerRegistry(JobHandler defaultHandler) {
        this.defaultHandler = Objects.requireNonNull(defaultHandler, "defaultHandler");
    }

    public void register(String jobType, JobHandler handler) {
        Objects.requireNonNull(handler, "handler");
        if (jobType == null || jobType.isBlank()) {
            throw new IllegalArgumentException("job type is required");
        }
        if (sealed) {
            throw new IllegalStateException("Cannot register handler '" + jobType + "': dispatch loop already started");
        }
        JobHandler previous = handlers.put(key(jobType), handler);
        if (previous != null) {
            logger.warn("Handler for job type '{}' replaced", jobType);
        }
        logger.info("Registered handler for job type '{}'", jobType);
    }

    /** Registered handler, or the default handler for unknown types. */
    public JobHandler resolve(String jobType) {
        if (jobType == null) return defaultHandler;
        JobHandler handler = handlers.get(key(jobType));
        if (handler == null) {
            logger.debug("No handler for job type '{}', using default", jobType);
            return defaultHandler;
        }
        return handler;
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public Set<String> registeredTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }

    private static String key(String jobType) {
        return jobType.trim().toLowerCase(Locale.ROOT);
    }
}
