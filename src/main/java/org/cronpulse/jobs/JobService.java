package org.cronpulse.jobs;

import org.cronpulse.cron.CronEvaluator;
import org.cronpulse.errors.ValidationException;
import org.cronpulse.ratelimit.RateLimitDefaults;
import org.cronpulse.services.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owner-facing job operations. All validation happens here, before the store is touched,
 * so a job that reaches persistence always has a parseable schedule and an executable action.
 */
public class JobService {

    private static final Logger logger = LoggerFactory.getLogger(JobService.class);

    static final int MAX_NAME_LENGTH = 200;
    static final int MAX_ID_LENGTH = 128;

    private final JobStore store;
    private final CronEvaluator cron;
    private final HandlerRegistry handlers;
    private final Clock clock;

    public JobService(JobStore store, CronEvaluator cron, HandlerRegistry handlers, Clock clock) {
        this.store = store;
        this.cron = cron;
        this.handlers = handlers;
        this.clock = clock;
    }

    /**
     * Validates, computes the first {@code next_run} and persists.
     *
     * @throws ValidationException on any invalid field; nothing is persisted in that case
     */
    public ScheduledJob create(JobCreateRequest request) {
        if (request == null) {
            throw new ValidationException("body", "job definition is required");
        }
        String ownerId = requireOwner(request.ownerId());
        String name = require(request.name(), "name");
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("name", "name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        String jobType = require(request.jobType(), "job_type");
        if (request.action() == null) {
            throw new ValidationException("action", "action is required and must be an object");
        }
        String expression = require(request.cronExpression(), "cron_expression");
        String timezone = cron.zone(request.timezone()).getId();
        cron.validate(expression, timezone);
        handlers.resolve(jobType).validate(request.action());

        Instant createdAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant nextRun = cron.nextTrigger(expression, timezone, createdAt);

        ScheduledJob job = new ScheduledJob(
                UUID.randomUUID(),
                ownerId,
                name,
                expression,
                timezone,
                jobType,
                RateLimitDefaults.normalize(request.integration()),
                request.action(),
                request.enabled() == null || request.enabled(),
                null,
                nextRun,
                0,
                null,
                createdAt);

        ScheduledJob saved = store.insert(job);
        logger.info("Created job {} '{}' for owner {} ({} in {}), next run {}",
                saved.id(), name, ownerId, expression, timezone, nextRun);
        return saved;
    }

    public List<ScheduledJob> list(String ownerId) {
        return store.list(requireOwner(ownerId));
    }

    public Optional<ScheduledJob> get(String ownerId, UUID id) {
        return store.find(requireOwner(ownerId), id);
    }

    public boolean delete(String ownerId, UUID id) {
        boolean deleted = store.delete(requireOwner(ownerId), id);
        if (deleted) {
            logger.info("Deleted job {} for owner {}", id, ownerId);
        }
        return deleted;
    }

    /**
     * Re-enabling does not recompute {@code next_run}; a job whose next run already passed fires on the next cycle.
     */
    public Optional<ScheduledJob> setEnabled(String ownerId, UUID id, boolean enabled) {
        String owner = requireOwner(ownerId);
        if (!store.setEnabled(owner, id, enabled)) {
            return Optional.empty();
        }
        logger.info("Job {} for owner {} {}", id, owner, enabled ? "enabled" : "disabled");
        return store.find(owner, id);
    }

    private static String requireOwner(String ownerId) {
        String owner = require(ownerId, "owner_id");
        if (owner.length() > MAX_ID_LENGTH) {
            throw new ValidationException("owner_id", "owner_id must be at most " + MAX_ID_LENGTH + " characters");
        }
        return owner;
    }

    private static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " is required");
        }
        return value.trim();
    }
}
