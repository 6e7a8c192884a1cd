package org.cronpulse.handlers.jobs;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.cronpulse.jobs.JobService;
import org.cronpulse.jobs.ScheduledJob;
import org.cronpulse.utils.HttpRequestUtil;
import org.cronpulse.utils.ResponseUtil;

import java.util.List;

/**
 * GET /jobs?owner_id= (newest first)
 */
public class ListJobsHandler implements HttpHandler {

    private final JobService jobs;

    public ListJobsHandler(JobService jobs) {
        this.jobs = jobs;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String ownerId = HttpRequestUtil.requireParam(exchange, "owner_id");

        List<ScheduledJob> result = jobs.list(ownerId);
        ResponseUtil.sendSuccess(exchange, result.size() + " job(s) found", result);
    }
}
