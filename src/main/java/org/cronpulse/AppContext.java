package org.cronpulse;

import org.cronpulse.backoff.BackoffPolicy;
import org.cronpulse.config.ConfigLoader;
import org.cronpulse.config.XmlConfiguration;
import org.cronpulse.cron.CronEvaluator;
import org.cronpulse.jobs.InMemoryJobStore;
import org.cronpulse.jobs.JdbcJobStore;
import org.cronpulse.jobs.JobService;
import org.cronpulse.jobs.JobStore;
import org.cronpulse.ratelimit.InMemoryPolicyStore;
import org.cronpulse.ratelimit.InMemoryUsageLedger;
import org.cronpulse.ratelimit.JdbcPolicyStore;
import org.cronpulse.ratelimit.JdbcUsageLedger;
import org.cronpulse.ratelimit.PolicyStore;
import org.cronpulse.ratelimit.RateLimitDefaults;
import org.cronpulse.ratelimit.RateLimiter;
import org.cronpulse.ratelimit.UsageLedger;
import org.cronpulse.services.DispatchLoop;
import org.cronpulse.services.DispatchSettings;
import org.cronpulse.services.HandlerRegistry;
import org.cronpulse.services.handlers.HttpJobHandler;
import org.cronpulse.utils.ConnectionSource;
import org.cronpulse.utils.JdbcUtils;

import java.time.Clock;
import java.time.Duration;

import static org.cronpulse.services.ApplicationHandlers.registerApplicationHandlers;

/**
 * Object graph of one engine instance. Nothing here is global, so several instances can coexist.
 */
public final class AppContext {

    private final XmlConfiguration config;
    private final Clock clock;
    private final JobService jobService;
    private final RateLimiter rateLimiter;
    private final PolicyStore policyStore;
    private final HandlerRegistry handlers;
    private final DispatchLoop dispatchLoop;

    private AppContext(XmlConfiguration config, Clock clock, JobService jobService, RateLimiter rateLimiter,
                       PolicyStore policyStore, HandlerRegistry handlers, DispatchLoop dispatchLoop) {
        this.config = config;
        this.clock = clock;
        this.jobService = jobService;
        this.rateLimiter = rateLimiter;
        this.policyStore = policyStore;
        this.handlers = handlers;
        this.dispatchLoop = dispatchLoop;
    }

    /**
     * Wires stores for the configured storage mode and registers the built-in handlers.
     * Further handlers may be registered on {@link #handlers()} until the dispatch loop starts.
     */
    public static AppContext create(XmlConfiguration cfg, Clock clock) {
        JobStore jobStore;
        UsageLedger ledger;
        PolicyStore policies;
        if (ConfigLoader.STORAGE_MEMORY.equals(cfg.storage.mode)) {
            jobStore = new InMemoryJobStore();
            ledger = new InMemoryUsageLedger();
            policies = new InMemoryPolicyStore();
        } else {
            ConnectionSource connections = JdbcUtils::getConnection;
            jobStore = new JdbcJobStore(connections);
            ledger = new JdbcUsageLedger(connections);
            policies = new JdbcPolicyStore(connections);
        }

        XmlConfiguration.Scheduler sc = cfg.scheduler;
        HttpJobHandler httpHandler = new HttpJobHandler(Duration.ofSeconds(sc.handlerTimeoutSeconds));
        HandlerRegistry handlers = new HandlerRegistry(httpHandler);
        registerApplicationHandlers(handlers, httpHandler);

        CronEvaluator cron = new CronEvaluator();
        RateLimiter rateLimiter = new RateLimiter(
                RateLimitDefaults.builtIn().withOverrides(cfg.rateLimits),
                policies,
                ledger,
                Duration.ofSeconds(Math.max(0, sc.policyCacheSeconds)));

        DispatchLoop loop = new DispatchLoop(jobStore, rateLimiter, ledger, handlers, cron,
                BackoffPolicy.parse(sc.backoffScheduleSeconds), DispatchSettings.from(sc), clock);

        return new AppContext(cfg, clock, new JobService(jobStore, cron, handlers, clock),
                rateLimiter, policies, handlers, loop);
    }

    public XmlConfiguration config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public JobService jobService() {
        return jobService;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public PolicyStore policyStore() {
        return policyStore;
    }

    public HandlerRegistry handlers() {
        return handlers;
    }

    public DispatchLoop dispatchLoop() {
        return dispatchLoop;
    }

    public boolean isPersistent() {
        return ConfigLoader.STORAGE_POSTGRES.equals(config.storage.mode);
    }
}
