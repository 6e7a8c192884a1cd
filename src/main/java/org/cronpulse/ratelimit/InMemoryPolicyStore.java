package org.cronpulse.ratelimit;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryPolicyStore implements PolicyStore {

    private record Key(String ownerId, String integration) {}

    private final ConcurrentMap<Key, RateLimitOverride> overrides = new ConcurrentHashMap<>();

    @Override
    public Optional<RateLimitOverride> find(String ownerId, String integration) {
        return Optional.ofNullable(overrides.get(new Key(ownerId, integration)));
    }

    @Override
    public void upsert(RateLimitOverride override) {
        overrides.put(new Key(override.ownerId(), override.integration()), override);
    }

    @Override
    public boolean delete(String ownerId, String integration) {
        return overrides.remove(new Key(ownerId, integration)) != null;
    }
}
