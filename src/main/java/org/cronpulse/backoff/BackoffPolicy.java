package org.cronpulse.backoff;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed ascending deferral schedule applied after consecutive handler failures.
 * Once the schedule is exhausted the delay stays at its last entry.
 */
public final class BackoffPolicy {

    public static final String DEFAULT_SCHEDULE = "30,60,300,900,3600";

    private final List<Duration> schedule;

    public BackoffPolicy(List<Duration> schedule) {
        if (schedule == null || schedule.isEmpty()) {
            throw new IllegalArgumentException("backoff schedule must not be empty");
        }
        for (int i = 0; i < schedule.size(); i++) {
            Duration step = schedule.get(i);
            if (step == null || step.isNegative()) {
                throw new IllegalArgumentException("backoff step " + i + " must be non-negative");
            }
            if (i > 0 && step.compareTo(schedule.get(i - 1)) < 0) {
                throw new IllegalArgumentException("backoff schedule must be ascending: " + schedule);
            }
        }
        this.schedule = List.copyOf(schedule);
    }

    public static BackoffPolicy defaults() {
        return parse(DEFAULT_SCHEDULE);
    }

    /** Comma separated seconds, e.g. {@code 30,60,300}. */
    public static BackoffPolicy parse(String secondsCsv) {
        String csv = (secondsCsv == null || secondsCsv.isBlank()) ? DEFAULT_SCHEDULE : secondsCsv;
        List<Duration> steps = new ArrayList<>();
        for (String part : csv.split(",")) {
            String s = part.trim();
            if (s.isEmpty()) continue;
            try {
                steps.add(Duration.ofSeconds(Long.parseLong(s)));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid backoff step '" + s + "' in '" + csv + "'", e);
            }
        }
        return new BackoffPolicy(steps);
    }

    /**
     * Delay for the given number of consecutive failures (1 = first failure).
     */
    public Duration deferral(int errorCount) {
        if (errorCount < 1) {
            throw new IllegalArgumentException("errorCount must be >= 1, got " + errorCount);
        }
        return schedule.get(Math.min(errorCount - 1, schedule.size() - 1));
    }

    public Instant backoffUntil(Instant now, int errorCount) {
        return now.plus(deferral(errorCount));
    }

    public Duration maximum() {
        return schedule.get(schedule.size() - 1);
    }

    public List<Duration> schedule() {
        return schedule;
    }
}
