package org.eventstatus.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.eventstatus.config.XmlConfiguration;
import org.eventstatus.services.TaskScheduler;
import org.eventstatus.services.TaskStatus;
import org.eventstatus.utils.ResponseUtil;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root endpoint.
 * Returns  -  basic service info,
 *          -  configured intervals,
 *          -  last-run snapshot of each scheduled task.
 */
public class ServiceStatusHandler implements HttpHandler {

    public static final String SERVICE_NAME = "Event Status Service";
    public static final String VERSION = "1.0.0";

    private final XmlConfiguration cfg;
    private final TaskScheduler scheduler;
    private final Instant startedAt;

    /**
     * @param startedAt when the service process began booting; uptime is measured from here
     */
    public ServiceStatusHandler(XmlConfiguration cfg, TaskScheduler scheduler, Instant startedAt) {
        this.cfg = cfg;
        this.scheduler = scheduler;
        this.startedAt = startedAt;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", SERVICE_NAME);
        response.put("version", VERSION);
        response.put("status", scheduler.isStopping() ? "stopping" : "running");
        response.put("scheduler_interval_seconds", cfg.scheduler.intervalSeconds);
        response.put("cleanup_interval_seconds", cfg.scheduler.cleanupEnabled ? cfg.scheduler.cleanupIntervalSeconds : null);
        response.put("uptime_seconds", Duration.between(startedAt, Instant.now()).toSeconds());
        response.put("timestamp", Instant.now().toString());

        List<Map<String, Object>> jobs = new ArrayList<>();
        for (TaskStatus status : scheduler.statuses()) {
            jobs.add(status.toMap());
        }
        response.put("jobs", jobs);

        ResponseUtil.sendJson(exchange, StatusCodes.OK, response);
    }
}
