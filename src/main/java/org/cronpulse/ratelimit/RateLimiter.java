package org.cronpulse.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.cronpulse.errors.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only quota gate. Checking never consumes quota; only
 * {@link UsageLedger#recordUsage} after a handler actually ran does.
 */
public class RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private record PolicyKey(String ownerId, String integration) {}

    private final RateLimitDefaults defaults;
    private final PolicyStore policies;
    private final UsageLedger ledger;
    private final Cache<PolicyKey, RateLimitPolicy> policyCache;

    public RateLimiter(RateLimitDefaults defaults, PolicyStore policies, UsageLedger ledger, Duration policyCacheTtl) {
        this.defaults = defaults;
        this.policies = policies;
        this.ledger = ledger;
        this.policyCache = Caffeine.newBuilder()
                .expireAfterWrite(policyCacheTtl)
                .maximumSize(10_000)
                .build();
    }

    /**
     * {@code false} once either the hourly or the daily window has reached its cap.
     */
    public boolean allow(String ownerId, String integration, Instant now) {
        String canonical = RateLimitDefaults.normalize(integration);
        RateLimitPolicy policy = effectivePolicy(ownerId, canonical);
        try {
            for (PeriodType period : PeriodType.values()) {
                long used = ledger.count(ownerId, canonical, period, period.windowStart(now));
                if (used >= policy.cap(period)) {
                    logger.debug("Quota reached for {}/{}: {} {} of {}", ownerId, canonical, used, period.dbValue(), policy.cap(period));
                    return false;
                }
            }
            return true;
        } catch (StoreException e) {
            // ledger outage: open unless the integration is configured failClosed
            if (policy.failClosed()) {
                logger.warn("Usage ledger unavailable, failing CLOSED for {}/{}: {}", ownerId, canonical, e.getMessage());
                return false;
            }
            logger.warn("Usage ledger unavailable, failing OPEN for {}/{}: {}", ownerId, canonical, e.getMessage());
            return true;
        }
    }

    /**
     * Owner override if one exists, else the integration default. Cached briefly.
     * A policy store outage falls back to the default without caching it.
     */
    public RateLimitPolicy effectivePolicy(String ownerId, String integration) {
        String canonical = RateLimitDefaults.normalize(integration);
        PolicyKey key = new PolicyKey(ownerId, canonical);
        RateLimitPolicy cached = policyCache.getIfPresent(key);
        if (cached != null) return cached;

        RateLimitPolicy fallback = defaults.forIntegration(canonical);
        try {
            Optional<RateLimitOverride> override = policies.find(ownerId, canonical);
            RateLimitPolicy resolved = override
                    .map(o -> new RateLimitPolicy(o.maxCallsPerHour(), o.maxCallsPerDay(), fallback.failClosed()))
                    .orElse(fallback);
            policyCache.put(key, resolved);
            return resolved;
        } catch (StoreException e) {
            logger.warn("Policy store unavailable for {}/{}, using integration default: {}", ownerId, canonical, e.getMessage());
            return fallback;
        }
    }

    public Map<PeriodType, Long> currentUsage(String ownerId, String integration, Instant now) {
        String canonical = RateLimitDefaults.normalize(integration);
        Map<PeriodType, Long> usage = new EnumMap<>(PeriodType.class);
        for (PeriodType period : PeriodType.values()) {
            usage.put(period, ledger.count(ownerId, canonical, period, period.windowStart(now)));
        }
        return usage;
    }

    public void invalidate(String ownerId, String integration) {
        policyCache.invalidate(new PolicyKey(ownerId, RateLimitDefaults.normalize(integration)));
    }

    public RateLimitDefaults defaults() {
        return defaults;
    }
}
