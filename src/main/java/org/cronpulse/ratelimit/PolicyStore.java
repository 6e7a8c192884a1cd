package org.cronpulse.ratelimit;

import java.util.Optional;

/**
 * Durable per-owner rate limit overrides.
 */
public interface PolicyStore {

    Optional<RateLimitOverride> find(String ownerId, String integration);

    void upsert(RateLimitOverride override);

    boolean delete(String ownerId, String integration);
}
