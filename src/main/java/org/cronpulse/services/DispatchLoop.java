package org.cronpulse.services;

import org.cronpulse.backoff.BackoffPolicy;
import org.cronpulse.config.utils.LogContext;
import org.cronpulse.cron.CronEvaluator;
import org.cronpulse.errors.StoreException;
import org.cronpulse.jobs.JobStore;
import org.cronpulse.jobs.ScheduledJob;
import org.cronpulse.ratelimit.RateLimitDefaults;
import org.cronpulse.ratelimit.RateLimiter;
import org.cronpulse.ratelimit.UsageLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The coordinating scheduler process.
 * <p>
 * One loop thread polls the job store, then hands due jobs to a bounded worker pool. Jobs that share
 * an (owner, integration) pair form a lane and run one after another in {@code next_run} order, so a
 * quota slot consumed by one job is visible to the next rate limit check. Separate lanes run in parallel.
 * <p>
 * Lifecycle: {@link #start()} once, {@link #stop()} once. A stopped loop cannot be restarted.
 */
public class DispatchLoop {

    private static final Logger logger = LoggerFactory.getLogger(DispatchLoop.class);

    enum Outcome { SUCCEEDED, FAILED, DEFERRED, VANISHED, ERROR }

    private record Lane(String ownerId, String integration) {}

    private final JobStore jobs;
    private final RateLimiter rateLimiter;
    private final UsageLedger usage;
    private final HandlerRegistry handlers;
    private final CronEvaluator cron;
    private final BackoffPolicy backoff;
    private final DispatchSettings settings;
    private final Clock clock;

    private final ExecutorService workers;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final Object lifecycle = new Object();

    private Thread loopThread;
    private boolean started;
    private boolean stopped;
    private volatile boolean running;
    private volatile CycleSummary lastCycle;

    public DispatchLoop(JobStore jobs, RateLimiter rateLimiter, UsageLedger usage, HandlerRegistry handlers,
                        CronEvaluator cron, BackoffPolicy backoff, DispatchSettings settings, Clock clock) {
        this.jobs = jobs;
        this.rateLimiter = rateLimiter;
        this.usage = usage;
        this.handlers = handlers;
        this.cron = cron;
        this.backoff = backoff;
        this.settings = settings;
        this.clock = clock;

        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(settings.workerThreads(),
                r -> new Thread(r, "cronpulse-worker-" + seq.incrementAndGet()));
    }

    /**
     * Seals the handler registry and starts the loop thread. The first cycle runs immediately.
     *
     * @throws IllegalStateException if already started or stopped
     */
    public void start() {
        synchronized (lifecycle) {
            if (started) {
                throw new IllegalStateException("Dispatch loop can only be started once");
            }
            started = true;
            handlers.seal();
            running = true;
            loopThread = new Thread(this::runLoop, "cronpulse-dispatch");
            loopThread.start();
        }
        logger.info("Dispatch loop started: poll every {}s, batch {}, {} workers, handlers {}",
                settings.pollInterval().toSeconds(), settings.batchLimit(), settings.workerThreads(),
                handlers.registeredTypes());
    }

    /**
     * Stops starting new cycles and waits for the current cycle's handlers to finish.
     * Workers still busy after the shutdown grace period are interrupted.
     */
    public void stop() {
        Thread thread;
        synchronized (lifecycle) {
            if (stopped) return;
            stopped = true;
            started = true;
            running = false;
            thread = loopThread;
        }
        if (thread == null) {
            workers.shutdownNow();
            return;
        }
        logger.info("Stopping dispatch loop...");
        stopSignal.countDown();

        long graceMillis = settings.shutdownGrace().toMillis();
        try {
            thread.join(graceMillis);
            workers.shutdown();
            if (!workers.awaitTermination(Math.max(1, graceMillis), TimeUnit.MILLISECONDS)) {
                logger.warn("In-flight handlers did not finish within {}s, interrupting", settings.shutdownGrace().toSeconds());
                workers.shutdownNow();
            }
            thread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
            logger.warn("Dispatch loop shutdown interrupted.");
        }
        logger.info("Dispatch loop stopped.");
    }

    public boolean isRunning() {
        return running;
    }

    /** Summary of the most recent cycle, or {@code null} before the first one completes. */
    public CycleSummary lastCycle() {
        return lastCycle;
    }

    private void runLoop() {
        try {
            do {
                LogContext.start("DispatchLoop");
                try {
                    runCycle();
                } catch (RuntimeException e) {
                    logger.error("Unexpected error in dispatch cycle: {}", e.getMessage(), e);
                } finally {
                    LogContext.clear();
                }
            } while (!stopSignal.await(settings.pollInterval().toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Dispatch loop interrupted");
        }
    }

    /**
     * Runs one poll cycle synchronously: fetch due jobs, dispatch them and wait for every lane to finish.
     */
    public CycleSummary runCycle() {
        Instant startedAt = clock.instant();
        long t0 = System.nanoTime();

        List<ScheduledJob> due;
        try {
            due = jobs.fetchDue(startedAt, settings.batchLimit());
        } catch (StoreException e) {
            logger.error("Job store unavailable, cycle aborted: {}", e.getMessage(), e);
            CycleSummary summary = CycleSummary.aborted(startedAt, elapsedMillis(t0));
            lastCycle = summary;
            return summary;
        }

        Map<Lane, List<ScheduledJob>> lanes = new LinkedHashMap<>();
        for (ScheduledJob job : due) {
            Lane lane = new Lane(job.ownerId(), RateLimitDefaults.normalize(job.integration()));
            lanes.computeIfAbsent(lane, k -> new ArrayList<>()).add(job);
        }

        String traceId = LogContext.getTraceId();
        List<Future<List<Outcome>>> pending = new ArrayList<>();
        for (List<ScheduledJob> lane : lanes.values()) {
            pending.add(workers.submit(() -> runLane(lane, traceId)));
        }

        int[] counts = new int[Outcome.values().length];
        for (Future<List<Outcome>> f : pending) {
            try {
                for (Outcome o : f.get()) counts[o.ordinal()]++;
            } catch (ExecutionException e) {
                counts[Outcome.ERROR.ordinal()]++;
                logger.error("Dispatch lane failed: {}", e.getCause().getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for dispatch lanes");
                break;
            }
        }

        CycleSummary summary = new CycleSummary(startedAt, elapsedMillis(t0), due.size(),
                counts[Outcome.SUCCEEDED.ordinal()], counts[Outcome.FAILED.ordinal()],
                counts[Outcome.DEFERRED.ordinal()], counts[Outcome.VANISHED.ordinal()],
                counts[Outcome.ERROR.ordinal()], false);
        lastCycle = summary;
        if (summary.due() > 0) {
            logger.info("Cycle complete: due={} succeeded={} failed={} deferred={} vanished={} errors={} in {}ms",
                    summary.due(), summary.succeeded(), summary.failed(), summary.deferred(),
                    summary.vanished(), summary.errors(), summary.durationMillis());
        } else {
            logger.debug("Cycle complete: nothing due");
        }
        return summary;
    }

    private List<Outcome> runLane(List<ScheduledJob> lane, String traceId) {
        List<Outcome> outcomes = new ArrayList<>(lane.size());
        for (ScheduledJob job : lane) {
            LogContext.start("DispatchWorker", traceId);
            LogContext.job(job.id(), job.ownerId());
            try {
                outcomes.add(dispatch(job));
            } catch (RuntimeException e) {
                logger.error("Dispatch of job {} aborted: {}", job.id(), e.getMessage(), e);
                outcomes.add(Outcome.ERROR);
            } finally {
                LogContext.clear();
            }
        }
        return outcomes;
    }

    Outcome dispatch(ScheduledJob job) {
        Instant now = clock.instant();
        String integration = RateLimitDefaults.normalize(job.integration());

        if (!rateLimiter.allow(job.ownerId(), integration, now)) {
            logger.info("DEFERRED job {} '{}': {} quota reached for owner {}",
                    job.id(), job.name(), integration, job.ownerId());
            return Outcome.DEFERRED;
        }

        JobHandler handler = handlers.resolve(job.jobType());
        try {
            handler.handle(job.ownerId(), job.action());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return recordFailure(job, now, e);
        }

        Instant nextRun = cron.nextTrigger(job.cronExpression(), job.timezone(), now);
        boolean found = jobs.recordSuccess(job.id(), now, nextRun);
        recordUsage(job, integration, now);
        if (!found) {
            logger.debug("Job {} was deleted while running; success not recorded", job.id());
            return Outcome.VANISHED;
        }
        logger.info("Job {} '{}' succeeded, next run {}", job.id(), job.name(), nextRun);
        return Outcome.SUCCEEDED;
    }

    private Outcome recordFailure(ScheduledJob job, Instant now, Exception cause) {
        int errorCount = job.errorCount() + 1;
        Instant backoffUntil = backoff.backoffUntil(now, errorCount);
        logger.warn("FAILED job {} '{}' (attempt {} in a row): {}. Backing off until {}",
                job.id(), job.name(), errorCount, cause.getMessage(), backoffUntil);
        if (!jobs.recordFailure(job.id(), errorCount, backoffUntil, now)) {
            logger.debug("Job {} was deleted while running; failure not recorded", job.id());
            return Outcome.VANISHED;
        }
        return Outcome.FAILED;
    }

    private void recordUsage(ScheduledJob job, String integration, Instant now) {
        try {
            usage.recordUsage(job.ownerId(), integration, now);
        } catch (StoreException e) {
            logger.warn("Usage for job {} not recorded ({}/{}): {}", job.id(), job.ownerId(), integration, e.getMessage());
        }
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
