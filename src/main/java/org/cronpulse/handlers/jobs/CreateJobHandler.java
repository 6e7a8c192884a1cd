package org.cronpulse.handlers.jobs;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.cronpulse.jobs.JobCreateRequest;
import org.cronpulse.jobs.JobService;
import org.cronpulse.jobs.ScheduledJob;
import org.cronpulse.utils.HttpRequestUtil;
import org.cronpulse.utils.ResponseUtil;

import java.util.Map;

/**
 * POST /jobs
 */
public class CreateJobHandler implements HttpHandler {

    private final JobService jobs;

    public CreateJobHandler(JobService jobs) {
        this.jobs = jobs;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Map<String, Object> body = HttpRequestUtil.parseJson(exchange);

        if (body.containsKey("id")) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "id is assigned by the server and must not be provided");
            return;
        }
        Object action = body.get("action");
        if (action != null && !(action instanceof Map)) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "action must be an object");
            return;
        }

        ScheduledJob job = jobs.create(JobCreateRequest.fromBody(body));
        ResponseUtil.sendCreated(exchange, "Job created", job);
    }
}
