package org.eventstatus.rest;

import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import org.eventstatus.config.XmlConfiguration;
import org.eventstatus.services.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

public class RestApiServer {
    private static final Logger logger = LoggerFactory.getLogger(RestApiServer.class);

    private RestApiServer() {}

    public static Undertow startUndertow(XmlConfiguration cfg, TaskScheduler scheduler, Instant startedAt) {
        if (cfg == null || cfg.server == null) {
            logger.error("Invalid configuration: missing server configuration.");
            throw new IllegalArgumentException("Invalid configuration: missing server section.");
        }
        try {
            Undertow server = Undertow.builder()
                    .setServerOption(UndertowOptions.DECODE_URL, true)
                    .setServerOption(UndertowOptions.URL_CHARSET, StandardCharsets.UTF_8.name())
                    .setIoThreads(cfg.server.ioThreads)
                    .setWorkerThreads(cfg.server.workerThreads)
                    .addHttpListener(cfg.server.port, cfg.server.host)
                    .setHandler(Routes.system(cfg, scheduler, startedAt))
                    .build();

            server.start();
            logger.info("""
                                        EVENT STATUS SERVICE
                                        --------------------------------------
                                        Undertow server started successfully!
                                        Host   : http://{}:{}
                   \s""",
                    cfg.server.host, boundPort(server));
            return server;

        } catch (RuntimeException e) {
            logger.error("Error starting server: {}", e.getMessage());
            throw new IllegalStateException("Failed to start HTTP server on "
                    + cfg.server.host + ":" + cfg.server.port, e);
        }
    }

    /**
     * Actual listening port; differs from the configured one when port 0 was requested.
     */
    public static int boundPort(Undertow server) {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }
}
