package org.cronpulse.rest;

import io.undertow.Handlers;
import io.undertow.server.RoutingHandler;
import org.cronpulse.AppContext;
import org.cronpulse.handlers.HealthCheckHandler;
import org.cronpulse.handlers.jobs.CreateJobHandler;
import org.cronpulse.handlers.jobs.DeleteJobHandler;
import org.cronpulse.handlers.jobs.GetJobHandler;
import org.cronpulse.handlers.jobs.ListJobsHandler;
import org.cronpulse.handlers.jobs.ToggleJobHandler;
import org.cronpulse.handlers.limits.DeleteLimitsHandler;
import org.cronpulse.handlers.limits.GetLimitsHandler;
import org.cronpulse.handlers.limits.PutLimitsHandler;
import org.cronpulse.jobs.JobService;
import static org.cronpulse.rest.base.RouteUtils.methodNotAllowed;
import static org.cronpulse.rest.base.RouteUtils.notFound;
import static org.cronpulse.rest.base.RouteUtils.publicRoute;

public class Routes {

    private Routes() {}

    /**
     * Every API route under {@code basePath}. Path templates are absolute so a single
     * routing handler resolves them; path parameters land in the query parameter map.
     */
    public static RoutingHandler api(String basePath, AppContext ctx) {
        String base = basePath == null ? "" : basePath.replaceAll("/+$", "");
        JobService jobs = ctx.jobService();

        return Handlers.routing()
                .post(base + "/jobs", publicRoute(new CreateJobHandler(jobs)))
                .get(base + "/jobs", publicRoute(new ListJobsHandler(jobs)))
                .get(base + "/jobs/{id}", publicRoute(new GetJobHandler(jobs)))
                .delete(base + "/jobs/{id}", publicRoute(new DeleteJobHandler(jobs)))
                .post(base + "/jobs/{id}/enable", publicRoute(new ToggleJobHandler(jobs, true)))
                .post(base + "/jobs/{id}/disable", publicRoute(new ToggleJobHandler(jobs, false)))

                .get(base + "/limits", publicRoute(new GetLimitsHandler(ctx.rateLimiter(), ctx.policyStore(), ctx.clock())))
                .put(base + "/limits", publicRoute(new PutLimitsHandler(ctx.rateLimiter(), ctx.policyStore())))
                .delete(base + "/limits", publicRoute(new DeleteLimitsHandler(ctx.rateLimiter(), ctx.policyStore())))

                .get(base + "/system/health", publicRoute(new HealthCheckHandler(ctx)))

                .setInvalidMethodHandler(methodNotAllowed())
                .setFallbackHandler(notFound());
    }
}
