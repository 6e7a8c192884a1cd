package org.cronpulse.jobs;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Non-durable {@link JobStore} for {@code storage.mode=memory}. Deleted jobs are dropped from the map,
 * so outcome writes for a job deleted mid-cycle find nothing and return {@code false}.
 * Per-job updates go through {@link ConcurrentMap#computeIfPresent} so each is atomic.
 */
public class InMemoryJobStore implements JobStore {

    private final ConcurrentMap<UUID, ScheduledJob> jobs = new ConcurrentHashMap<>();

    @Override
    public ScheduledJob insert(ScheduledJob job) {
        Objects.requireNonNull(job.id(), "job id");
        if (jobs.putIfAbsent(job.id(), job) != null) {
            throw new IllegalStateException("Duplicate job id " + job.id());
        }
        return job;
    }

    @Override
    public List<ScheduledJob> list(String ownerId) {
        return jobs.values().stream()
                .filter(j -> j.ownerId().equals(ownerId))
                .sorted(Comparator.comparing(ScheduledJob::createdAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public Optional<ScheduledJob> find(String ownerId, UUID id) {
        ScheduledJob job = jobs.get(id);
        return (job != null && job.ownerId().equals(ownerId)) ? Optional.of(job) : Optional.empty();
    }

    @Override
    public boolean delete(String ownerId, UUID id) {
        AtomicBoolean removed = new AtomicBoolean(false);
        jobs.computeIfPresent(id, (key, job) -> {
            if (!job.ownerId().equals(ownerId)) return job;
            removed.set(true);
            return null;
        });
        return removed.get();
    }

    @Override
    public boolean setEnabled(String ownerId, UUID id, boolean enabled) {
        AtomicBoolean updated = new AtomicBoolean(false);
        jobs.computeIfPresent(id, (key, job) -> {
            if (!job.ownerId().equals(ownerId)) return job;
            updated.set(true);
            return job.withEnabled(enabled);
        });
        return updated.get();
    }

    @Override
    public List<ScheduledJob> fetchDue(Instant now, int limit) {
        return jobs.values().stream()
                .filter(j -> j.isDue(now))
                .sorted(Comparator.comparing(ScheduledJob::nextRun))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public boolean recordSuccess(UUID id, Instant lastRun, Instant nextRun) {
        return jobs.computeIfPresent(id, (key, job) -> job.withSuccess(lastRun, nextRun)) != null;
    }

    @Override
    public boolean recordFailure(UUID id, int errorCount, Instant backoffUntil, Instant attemptedAt) {
        return jobs.computeIfPresent(id, (key, job) -> job.withFailure(errorCount, backoffUntil, attemptedAt)) != null;
    }
}
