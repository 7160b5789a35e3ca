package org.eventstatus.services;

import org.eventstatus.client.EventBackendClient;
import org.eventstatus.config.XmlConfiguration;
import org.eventstatus.services.tasks.EventLifecycleTask;
import org.eventstatus.services.tasks.ExpiredEventsCleanupTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ApplicationTasks {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationTasks.class);

    private ApplicationTasks() {}

    public static void registerApplicationTasks(TaskScheduler scheduler, XmlConfiguration cfg, EventBackendClient client) {
        logger.info("[------------ Registering Tasks ------------]");

        // 1. Event lifecycle: start due events, then finish due events
        scheduler.register(new EventLifecycleTask(client, cfg.scheduler.intervalSeconds));
        logger.info("[***** Task '{}' every {}s *****]", EventLifecycleTask.NAME, cfg.scheduler.intervalSeconds);

        // 2. Expired event cleanup (privileged)
        if (cfg.scheduler.cleanupEnabled) {
            scheduler.register(new ExpiredEventsCleanupTask(client, cfg.scheduler.cleanupIntervalSeconds));
            logger.info("[***** Task '{}' every {}s *****]", ExpiredEventsCleanupTask.NAME, cfg.scheduler.cleanupIntervalSeconds);
        } else {
            logger.info("Expired event cleanup disabled by configuration");
        }

        logger.info("[------------ Application tasks registered ------------]");
    }
}
