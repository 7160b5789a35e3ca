package org.eventstatus.services.tasks;

import org.eventstatus.client.EventBackendClient;
import org.eventstatus.client.dto.Event;
import org.eventstatus.config.utils.LogContext;
import org.eventstatus.services.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Deletes scheduled events whose start date is past the backend's expiration threshold.
 * Deletion is privileged, so every run re-establishes the superadmin token first and
 * does nothing at all when that fails.
 */
public class ExpiredEventsCleanupTask implements ScheduledTask {
    private static final Logger logger = LoggerFactory.getLogger(ExpiredEventsCleanupTask.class);

    public static final String NAME = "cleanup_expired_events";

    private final EventBackendClient client;
    private final long intervalSeconds;

    public ExpiredEventsCleanupTask(EventBackendClient client, long intervalSeconds) {
        this.client = client;
        this.intervalSeconds = intervalSeconds;
    }

    @Override public String name() { return NAME; }
    @Override public long intervalSeconds() { return intervalSeconds; }

    @Override
    public void execute() {
        logger.info("Running task {}", NAME);
        try {
            if (!client.ensureToken()) {
                logger.warn("Could not obtain a superadmin token, skipping cleanup");
                return;
            }

            List<Event> expired = client.fetchExpired();
            if (expired.isEmpty()) {
                logger.info("No expired events");
                return;
            }

            logger.info("Found {} expired event(s)", expired.size());
            int deleted = 0;
            for (Event event : expired) {
                if (event.id() == null) {
                    logger.warn("Skipping expired event without id: {}", event.fields());
                    continue;
                }
                LogContext.forEvent(event.id());
                try {
                    logger.info("Deleting event {} (start date: {})", event.id(), event.startDate());
                    if (client.delete(event.id())) {
                        deleted++;
                        logger.info("Event {} deleted", event.id());
                    } else {
                        logger.warn("Could not delete event {}", event.id());
                    }
                } finally {
                    LogContext.endEvent();
                }
            }
            logger.info("Cleanup complete: {}/{} event(s) deleted", deleted, expired.size());
        } catch (Exception e) {
            logger.error("Error in task {}: {}", NAME, e.getMessage(), e);
        }
    }
}
