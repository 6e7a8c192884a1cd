package org.cronpulse.jobs;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable CRUD for job definitions and their runtime state. No scheduling logic lives here.
 * <p>
 * Implementations must be safe for concurrent use by the dispatch loop and the REST API.
 * Failures of the backing store surface as {@link org.cronpulse.errors.StoreException}.
 * Deleted jobs are invisible to every read, and outcome writes against them are no-ops
 * that return {@code false}.
 */
public interface JobStore {

    /** Persist an already validated job. */
    ScheduledJob insert(ScheduledJob job);

    /** Owner's jobs, newest first. */
    List<ScheduledJob> list(String ownerId);

    Optional<ScheduledJob> find(String ownerId, UUID id);

    /** Logical delete. {@code false} when no such job exists for the owner. */
    boolean delete(String ownerId, UUID id);

    boolean setEnabled(String ownerId, UUID id, boolean enabled);

    /**
     * Jobs that are enabled, have {@code next_run <= now} and no pending backoff,
     * ordered by {@code next_run} ascending and capped at {@code limit}.
     */
    List<ScheduledJob> fetchDue(Instant now, int limit);

    /** Sets last/next run and clears {@code error_count} and {@code backoff_until} in one write. */
    boolean recordSuccess(UUID id, Instant lastRun, Instant nextRun);

    /** Sets the failure streak, its backoff and {@code last_run = attemptedAt} in one write. */
    boolean recordFailure(UUID id, int errorCount, Instant backoffUntil, Instant attemptedAt);
}
