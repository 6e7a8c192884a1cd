package org.cronpulse.services;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Outcome counts of one poll cycle. {@code aborted} means the job store could not be read.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CycleSummary(
        Instant startedAt,
        long durationMillis,
        int due,
        int succeeded,
        int failed,
        int deferred,
        int vanished,
        int errors,
        boolean aborted
) {

    public static CycleSummary aborted(Instant startedAt, long durationMillis) {
        return new CycleSummary(startedAt, durationMillis, 0, 0, 0, 0, 0, 0, true);
    }
}
