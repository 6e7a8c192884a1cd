package org.cronpulse.ratelimit;

import java.time.Instant;

/**
 * Call counters per (owner, integration, period type, period start).
 * <p>
 * {@link #recordUsage} must increment atomically at the storage layer: N concurrent calls
 * for the same key always add exactly N.
 */
public interface UsageLedger {

    long count(String ownerId, String integration, PeriodType period, Instant periodStart);

    /** Increments the hourly and daily window that contain {@code now}, creating rows as needed. */
    void recordUsage(String ownerId, String integration, Instant now);
}
