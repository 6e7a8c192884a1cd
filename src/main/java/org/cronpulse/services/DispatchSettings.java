package org.cronpulse.services;

import org.cronpulse.config.XmlConfiguration;

import java.time.Duration;

public record DispatchSettings(Duration pollInterval, int batchLimit, int workerThreads, Duration shutdownGrace) {

    public DispatchSettings {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (batchLimit < 1) throw new IllegalArgumentException("batchLimit must be >= 1");
        if (workerThreads < 1) throw new IllegalArgumentException("workerThreads must be >= 1");
        if (shutdownGrace == null || shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("shutdownGrace must not be negative");
        }
    }

    public static DispatchSettings from(XmlConfiguration.Scheduler cfg) {
        return new DispatchSettings(
                Duration.ofSeconds(cfg.pollIntervalSeconds),
                cfg.batchLimit,
                cfg.workerThreads,
                Duration.ofSeconds(cfg.shutdownGraceSeconds));
    }
}
