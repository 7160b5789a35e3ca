package org.eventstatus.services.tasks;

import org.eventstatus.client.EventBackendClient;
import org.eventstatus.client.dto.Event;
import org.eventstatus.config.utils.LogContext;
import org.eventstatus.services.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * EventLifecycleTask: one pass of the two-phase sweep.
 * Step 1 starts scheduled events that are due, step 2 finishes in-progress events that
 * are due and kicks off completion processing for each one that finished.
 * The steps are isolated: a failure in step 1 never prevents step 2.
 */
public class EventLifecycleTask implements ScheduledTask {
    private static final Logger logger = LoggerFactory.getLogger(EventLifecycleTask.class);

    public static final String NAME = "process_events";

    private final EventBackendClient client;
    private final long intervalSeconds;

    public EventLifecycleTask(EventBackendClient client, long intervalSeconds) {
        this.client = client;
        this.intervalSeconds = intervalSeconds;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public long intervalSeconds() {
        return intervalSeconds;
    }

    @Override
    public void execute() {
        logger.info("[------------ Processing events ------------]");

        try {
            startPendingEvents();
        } catch (Exception e) {
            logger.error("Step 1/2 (start events) failed: {}", e.getMessage(), e);
        }

        try {
            finishPendingEvents();
        } catch (Exception e) {
            logger.error("Step 2/2 (finish events) failed: {}", e.getMessage(), e);
        }

        logger.info("[------------ Event processing complete ------------]");
    }

    private void startPendingEvents() {
        logger.info("Step 1/2: checking events pending start");
        List<Event> pending = client.fetchDueToStart();
        if (pending.isEmpty()) {
            logger.info("No events pending start");
            logger.info("Step 1/2 complete");
            return;
        }

        logger.info("Found {} event(s) to start", pending.size());
        int index = 0;
        for (Event event : pending) {
            index++;
            if (event.id() == null) {
                logger.warn("[{}/{}] Skipping event without id: {}", index, pending.size(), event.fields());
                continue;
            }
            LogContext.forEvent(event.id());
            try {
                logger.info("[{}/{}] Starting event id={} (scheduled start: {})",
                        index, pending.size(), event.id(), event.startDate());

                if (client.start(event.id())) {
                    logger.info("Event {} started", event.id());
                } else {
                    logger.warn("Could not start event {}", event.id());
                }
            } finally {
                LogContext.endEvent();
            }
        }
        logger.info("Step 1/2 complete");
    }

    private void finishPendingEvents() {
        logger.info("Step 2/2: checking events pending finish");
        List<Event> pending = client.fetchDueToFinish();
        if (pending.isEmpty()) {
            logger.info("No events pending finish");
            logger.info("Step 2/2 complete");
            return;
        }

        logger.info("Found {} event(s) to finish", pending.size());
        int index = 0;
        for (Event event : pending) {
            index++;
            if (event.id() == null) {
                logger.warn("[{}/{}] Skipping event without id: {}", index, pending.size(), event.fields());
                continue;
            }
            LogContext.forEvent(event.id());
            try {
                finishEvent(event, index, pending.size());
            } finally {
                LogContext.endEvent();
            }
        }
        logger.info("Step 2/2 complete");
    }

    private void finishEvent(Event event, int index, int total) {
        logger.info("[{}/{}] Finishing event id={} (scheduled end: {})",
                index, total, event.id(), event.endDate());

        if (!client.finish(event.id())) {
            logger.warn("Could not finish event {}, completion processing skipped", event.id());
            return;
        }
        logger.info("Event {} finished, starting completion processing", event.id());

        // Only ever reached after a successful finish.
        if (client.triggerCompletionProcessing(event.id())) {
            logger.info("Completion processing started for event {}", event.id());
        } else {
            logger.warn("Could not start completion processing for event {}", event.id());
        }
    }
}
