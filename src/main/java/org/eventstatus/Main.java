package org.eventstatus;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import io.undertow.Undertow;
import org.eventstatus.client.EventBackendClient;
import org.eventstatus.client.HttpEventBackendClient;
import org.eventstatus.client.SuperadminCredentials;
import org.eventstatus.config.ConfigLoader;
import org.eventstatus.config.XmlConfiguration;
import org.eventstatus.config.utils.KeyProvider;
import org.eventstatus.config.utils.LogContext;
import org.eventstatus.rest.RestApiServer;
import org.eventstatus.services.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

import static org.eventstatus.services.ApplicationTasks.registerApplicationTasks;

/**
 * Entry point
 * Load Configuration from Xml
 * Start status endpoints
 * Register and start the event tasks
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        Instant startedAt = Instant.now();
        LogContext.start("Main");

        try {
            logger.info("[------------ Starting Event Status Service ({}) ------------]", KeyProvider.getEnvironment());

            String configPath = (args.length > 0) ? args[0] : "config.xml";
            XmlConfiguration cfg = ConfigLoader.loadConfig(configPath);
            applyLogLevel(cfg.logging.level);
            logger.debug("Configuration loaded from {}", configPath);
            logger.info("Backend URL: {}", cfg.backend.baseUrl);
            logger.info("Scheduler interval: {}s, misfire grace: {}s, coalesce: {}",
                    cfg.scheduler.intervalSeconds, cfg.scheduler.misfireGraceSeconds, cfg.scheduler.coalesce);

            SuperadminCredentials credentials = SuperadminCredentials.fromEnvironment();
            if (!credentials.canLogin()) {
                logger.warn("Superadmin credentials are missing, expired event cleanup will be skipped");
            }
            EventBackendClient client = new HttpEventBackendClient(cfg.backend, credentials);

            TaskScheduler scheduler = new TaskScheduler(
                    cfg.scheduler.poolSize,
                    Duration.ofSeconds(cfg.scheduler.misfireGraceSeconds),
                    cfg.scheduler.coalesce
            );

            logger.info("[------------ Starting Undertow server ------------]");
            Undertow server = RestApiServer.startUndertow(cfg, scheduler, startedAt);

            registerApplicationTasks(scheduler, cfg, client);
            scheduler.start();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LogContext.start("Shutdown");
                logger.info("[------------ Shutdown initiated ------------]");
                scheduler.shutdown();
                server.stop();
                logger.info("[------------ Event Status Service shutdown complete ------------]");
                LogContext.clear();
            }, "shutdown-hook"));

            logger.info("[------------ Service started ------------]");

        } catch (Exception e) {
            logger.error("[------------ System startup failed: {} ------------]", e.getMessage(), e);
            System.exit(1);
        } finally {
            LogContext.clear();
        }
    }

    private static void applyLogLevel(String level) {
        if (level == null || level.isBlank()) return;
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(level, Level.INFO));
    }
}
