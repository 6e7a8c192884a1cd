package org.cronpulse.ratelimit;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Usage windows. Window starts are UTC-aligned.
 */
public enum PeriodType {
    HOURLY("hourly", ChronoUnit.HOURS),
    DAILY("daily", ChronoUnit.DAYS);

    private final String dbValue;
    private final ChronoUnit unit;

    PeriodType(String dbValue, ChronoUnit unit) {
        this.dbValue = dbValue;
        this.unit = unit;
    }

    public String dbValue() {
        return dbValue;
    }

    public Instant windowStart(Instant now) {
        return now.truncatedTo(unit);
    }
}
