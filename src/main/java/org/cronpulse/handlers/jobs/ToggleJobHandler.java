package org.cronpulse.handlers.jobs;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.cronpulse.jobs.JobService;
import org.cronpulse.jobs.ScheduledJob;
import org.cronpulse.utils.HttpRequestUtil;
import org.cronpulse.utils.ResponseUtil;

import java.util.Optional;
import java.util.UUID;

/**
 * POST /jobs/{id}/enable and /jobs/{id}/disable
 */
public class ToggleJobHandler implements HttpHandler {

    private final JobService jobs;
    private final boolean enable;

    public ToggleJobHandler(JobService jobs, boolean enable) {
        this.jobs = jobs;
        this.enable = enable;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String ownerId = HttpRequestUtil.requireParam(exchange, "owner_id");
        UUID id = HttpRequestUtil.pathId(exchange);

        Optional<ScheduledJob> job = jobs.setEnabled(ownerId, id, enable);
        if (job.isEmpty()) {
            ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND, "Job " + id + " not found");
            return;
        }
        ResponseUtil.sendSuccess(exchange, enable ? "Job enabled" : "Job disabled", job.get());
    }
}
