package org.eventstatus.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;

/**
 * Moves request handling off the IO thread onto a worker thread.
 */
public class Dispatcher implements HttpHandler {
    private final HttpHandler handler;

    public Dispatcher(HttpHandler handler) {
        this.handler = handler;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        exchange.dispatch(this.handler);
    }
}
