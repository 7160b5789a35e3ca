package org.eventstatus.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.eventstatus.utils.ResponseUtil;

/**
 * Known path, wrong method. All status routes are read-only.
 * */
public class InvalidMethod implements HttpHandler {

    private final String allowed;

    public InvalidMethod(String allowed) {
        this.allowed = allowed;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.ALLOW, allowed);
        ResponseUtil.sendError(exchange, StatusCodes.METHOD_NOT_ALLOWED,
                exchange.getRequestMethod() + " not allowed on " + exchange.getRequestPath() + ", use " + allowed);
    }
}
