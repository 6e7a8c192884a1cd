package org.cronpulse.ratelimit;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Non-durable ledger for {@code storage.mode=memory}. {@link ConcurrentMap#merge} gives the
 * same atomic upsert-increment as the SQL implementation.
 */
public class InMemoryUsageLedger implements UsageLedger {

    private record Key(String ownerId, String integration, PeriodType period, Instant periodStart) {}

    private final ConcurrentMap<Key, Long> counters = new ConcurrentHashMap<>();

    @Override
    public long count(String ownerId, String integration, PeriodType period, Instant periodStart) {
        return counters.getOrDefault(new Key(ownerId, integration, period, periodStart), 0L);
    }

    @Override
    public void recordUsage(String ownerId, String integration, Instant now) {
        for (PeriodType period : PeriodType.values()) {
            counters.merge(new Key(ownerId, integration, period, period.windowStart(now)), 1L, Long::sum);
        }
    }
}
