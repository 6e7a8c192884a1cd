package org.cronpulse.ratelimit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Caps for one (owner, integration) pair. {@code failClosed} decides what happens
 * when usage cannot be read.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RateLimitPolicy(int maxCallsPerHour, int maxCallsPerDay, boolean failClosed) {

    public RateLimitPolicy {
        if (maxCallsPerHour < 0 || maxCallsPerDay < 0) {
            throw new IllegalArgumentException("rate limit caps must be >= 0");
        }
    }

    public int cap(PeriodType period) {
        return period == PeriodType.HOURLY ? maxCallsPerHour : maxCallsPerDay;
    }
}
