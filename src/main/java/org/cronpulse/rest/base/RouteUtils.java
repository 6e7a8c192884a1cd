package org.cronpulse.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.StatusCodes;
import org.cronpulse.utils.ResponseUtil;

public final class RouteUtils {

    private RouteUtils() {}

    /**
     * API route: runs on a worker thread in blocking mode, exceptions mapped to the error envelope.
     * {@link BlockingHandler} dispatches off the IO thread itself.
     */
    public static HttpHandler publicRoute(HttpHandler handler) {
        return new BlockingHandler(new ErrorMapper(handler));
    }

    /** Unknown path. */
    public static HttpHandler notFound() {
        return exchange -> ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND,
                "No route for " + exchange.getRequestMethod() + " " + exchange.getRequestPath());
    }

    /** Known path, unsupported verb. */
    public static HttpHandler methodNotAllowed() {
        return exchange -> ResponseUtil.sendError(exchange, StatusCodes.METHOD_NOT_ALLOWED,
                "Method " + exchange.getRequestMethod() + " is not supported on " + exchange.getRequestPath());
    }
}
