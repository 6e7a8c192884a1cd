package org.cronpulse.services;

import java.util.Map;

/**
 * Work performed when a job of a given type fires.
 * <p>
 * Any exception thrown from {@link #handle} counts as a failed attempt and puts the job into backoff.
 * Handlers are expected to bound their own duration; the dispatch loop never interrupts a running call.
 */
@FunctionalInterface
public interface JobHandler {

    void handle(String ownerId, Map<String, Object> action) throws Exception;

    /**
     * Checks the action payload when a job is created, so bad payloads are rejected before persistence.
     *
     * @throws org.cronpulse.errors.ValidationException when the payload cannot be executed
     */
    default void validate(Map<String, Object> action) {
    }
}
