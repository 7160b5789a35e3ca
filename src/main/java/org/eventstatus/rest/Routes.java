package org.eventstatus.rest;

import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import org.eventstatus.config.XmlConfiguration;
import org.eventstatus.handlers.HealthCheckHandler;
import org.eventstatus.handlers.ServiceStatusHandler;
import org.eventstatus.rest.base.Dispatcher;
import org.eventstatus.rest.base.FallBack;
import org.eventstatus.rest.base.InvalidMethod;
import org.eventstatus.services.TaskScheduler;

import java.time.Instant;
import java.util.List;

public class Routes {

    static final String ROOT = "/";
    static final String HEALTH = "/health";

    private Routes() {}

    public static RoutingHandler system(XmlConfiguration cfg, TaskScheduler scheduler, Instant startedAt) {
        return Handlers.routing()
                .get(ROOT, publicRoute(new ServiceStatusHandler(cfg, scheduler, startedAt)))
                .get(HEALTH, publicRoute(new HealthCheckHandler()))
                .setInvalidMethodHandler(new Dispatcher(new InvalidMethod("GET")))
                .setFallbackHandler(new Dispatcher(new FallBack(List.of(ROOT, HEALTH))));
    }

    /**
     * Route that does not require authentication.
     */
    private static HttpHandler publicRoute(HttpHandler handler) {
        return new Dispatcher(handler);
    }
}
