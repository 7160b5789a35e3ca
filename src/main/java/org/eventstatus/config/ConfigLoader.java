package org.eventstatus.config;

import org.eventstatus.config.utils.KeyProvider;
import org.eventstatus.config.utils.XmlUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    /**
     * Loads the XML file, applies environment overrides from KeyProvider,
     * and returns a fully-typed XmlConfiguration object.
     */
    public static XmlConfiguration loadConfig(String xmlPath) {
        return loadConfig(Path.of(xmlPath), KeyProvider::getOptional);
    }

    public static XmlConfiguration loadConfig(Path xmlPath, Function<String, String> env) {
        if (!Files.isRegularFile(xmlPath)) {
            throw new IllegalStateException("Config file not found: " + xmlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(xmlPath)) {
            Document doc = XmlUtil.parse(in);
            XmlConfiguration cfg = XmlUtil.unmarshal(doc, XmlConfiguration.class);
            applyOverrides(cfg, env);
            validate(cfg);
            return cfg;
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config file! " + e.getMessage(), e);
        }
    }

    /**
     * Environment values win over the XML file. Names match the ones the
     * service has always been deployed with.
     */
    static void applyOverrides(XmlConfiguration cfg, Function<String, String> env) {
        String baseUrl = env.apply("BACKEND_URL");
        if (baseUrl != null) cfg.backend.baseUrl = baseUrl;

        cfg.backend.httpTimeoutSeconds = intValue(env, "HTTP_TIMEOUT", cfg.backend.httpTimeoutSeconds);
        cfg.scheduler.intervalSeconds = longValue(env, "SCHEDULER_INTERVAL_SECONDS", cfg.scheduler.intervalSeconds);
        cfg.scheduler.cleanupIntervalSeconds = longValue(env, "CLEANUP_INTERVAL_SECONDS", cfg.scheduler.cleanupIntervalSeconds);
        cfg.scheduler.misfireGraceSeconds = longValue(env, "SCHEDULER_MISFIRE_GRACE_SECONDS", cfg.scheduler.misfireGraceSeconds);

        String coalesce = env.apply("SCHEDULER_COALESCE");
        if (coalesce != null) cfg.scheduler.coalesce = Boolean.parseBoolean(coalesce.trim());

        String host = env.apply("HOST");
        if (host != null) cfg.server.host = host;
        cfg.server.port = intValue(env, "PORT", cfg.server.port);

        String level = env.apply("LOG_LEVEL");
        if (level != null) cfg.logging.level = level;
    }

    private static void validate(XmlConfiguration cfg) {
        if (cfg.backend.baseUrl == null || cfg.backend.baseUrl.isBlank()) {
            throw new IllegalStateException("backend.baseUrl must be set");
        }
        if (cfg.backend.httpTimeoutSeconds <= 0 || cfg.backend.completionTimeoutSeconds <= 0) {
            throw new IllegalStateException("backend timeouts must be positive");
        }
        if (cfg.scheduler.intervalSeconds <= 0 || cfg.scheduler.cleanupIntervalSeconds <= 0) {
            throw new IllegalStateException("scheduler intervals must be positive");
        }
        if (cfg.scheduler.misfireGraceSeconds < 0) {
            throw new IllegalStateException("scheduler.misfireGraceSeconds must not be negative");
        }
        if (cfg.scheduler.poolSize < 2) {
            logger.warn("scheduler.poolSize={} is too small for timers plus jobs, using 2", cfg.scheduler.poolSize);
            cfg.scheduler.poolSize = 2;
        }
    }

    private static int intValue(Function<String, String> env, String name, int fallback) {
        long value = longValue(env, name, fallback);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new IllegalStateException("Value out of range for " + name + ": " + value, e);
        }
    }

    private static long longValue(Function<String, String> env, String name, long fallback) {
        String raw = env.apply(name);
        if (raw == null) return fallback;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid numeric value for " + name + ": " + raw, e);
        }
    }
}
