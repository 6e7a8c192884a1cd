package org.cronpulse.handlers.jobs;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.cronpulse.jobs.JobService;
import org.cronpulse.utils.HttpRequestUtil;
import org.cronpulse.utils.ResponseUtil;

import java.util.Map;
import java.util.UUID;

/**
 * DELETE /jobs/{id}?owner_id=
 */
public class DeleteJobHandler implements HttpHandler {

    private final JobService jobs;

    public DeleteJobHandler(JobService jobs) {
        this.jobs = jobs;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String ownerId = HttpRequestUtil.requireParam(exchange, "owner_id");
        UUID id = HttpRequestUtil.pathId(exchange);

        if (!jobs.delete(ownerId, id)) {
            ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND, "Job " + id + " not found");
            return;
        }
        ResponseUtil.sendSuccess(exchange, "Job deleted", Map.of("id", id));
    }
}
