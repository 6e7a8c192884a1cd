package org.cronpulse.jobs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A persisted job definition together with its runtime state.
 * {@code backoffUntil} is only ever non-null while {@code errorCount > 0}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduledJob(
        UUID id,
        String ownerId,
        String name,
        String cronExpression,
        String timezone,
        String jobType,
        String integration,
        Map<String, Object> action,
        boolean enabled,
        Instant lastRun,
        Instant nextRun,
        int errorCount,
        Instant backoffUntil,
        Instant createdAt
) {

    public ScheduledJob {
        action = action == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(action));
    }

    /**
     * enabled, next_run reached and no backoff pending.
     */
    @JsonIgnore
    public boolean isDue(Instant now) {
        return enabled
                && nextRun != null && !nextRun.isAfter(now)
                && (backoffUntil == null || !backoffUntil.isAfter(now));
    }

    public ScheduledJob withEnabled(boolean value) {
        return new ScheduledJob(id, ownerId, name, cronExpression, timezone, jobType, integration, action,
                value, lastRun, nextRun, errorCount, backoffUntil, createdAt);
    }

    public ScheduledJob withSuccess(Instant ranAt, Instant next) {
        return new ScheduledJob(id, ownerId, name, cronExpression, timezone, jobType, integration, action,
                enabled, ranAt, next, 0, null, createdAt);
    }

    public ScheduledJob withFailure(int errors, Instant until, Instant attemptedAt) {
        return new ScheduledJob(id, ownerId, name, cronExpression, timezone, jobType, integration, action,
                enabled, attemptedAt, nextRun, errors, until, createdAt);
    }
}
