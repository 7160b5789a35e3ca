package org.eventstatus.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.eventstatus.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/***
 * Unknown routes. The status surface is tiny, so the answer lists what does exist.
 * */
public class FallBack implements HttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(FallBack.class);

    private final List<String> knownPaths;

    public FallBack(List<String> knownPaths) {
        this.knownPaths = List.copyOf(knownPaths);
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String path = exchange.getRequestPath();
        logger.debug("No route for {} {}", exchange.getRequestMethod(), path);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("message", "Path " + path + " not found");
        body.put("available", knownPaths);
        ResponseUtil.sendJson(exchange, StatusCodes.NOT_FOUND, body);
    }
}
