package org.eventstatus.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.eventstatus.utils.ResponseUtil;

import java.util.Map;

/**
 * Liveness check. Answers as long as the process serves HTTP.
 */
public class HealthCheckHandler implements HttpHandler {

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ResponseUtil.sendJson(exchange, StatusCodes.OK, Map.of("status", "ok"));
    }
}
