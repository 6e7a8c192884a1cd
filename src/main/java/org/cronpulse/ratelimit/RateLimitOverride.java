package org.cronpulse.ratelimit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Per-owner override row. Takes precedence over the integration default.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RateLimitOverride(String ownerId, String integration, int maxCallsPerHour, int maxCallsPerDay) {
}
