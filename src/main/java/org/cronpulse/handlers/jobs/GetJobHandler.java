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
 * GET /jobs/{id}?owner_id=
 */
public class GetJobHandler implements HttpHandler {

    private final JobService jobs;

    public GetJobHandler(JobService jobs) {
        this.jobs = jobs;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String ownerId = HttpRequestUtil.requireParam(exchange, "owner_id");
        UUID id = HttpRequestUtil.pathId(exchange);

        Optional<ScheduledJob> job = jobs.get(ownerId, id);
        if (job.isEmpty()) {
            ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND, "Job " + id + " not found");
            return;
        }
        ResponseUtil.sendSuccess(exchange, "Job retrieved", job.get());
    }
}
