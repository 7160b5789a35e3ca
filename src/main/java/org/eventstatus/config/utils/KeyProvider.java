package org.eventstatus.config.utils;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.util.StatusPrinter;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.concurrent.ConcurrentHashMap;

/**
 * KeyProvider = central source of environment values and secrets.
 * Responsibilities:
 *   1. Load environment (.env + system ENV)
 *   2. Initialize correct Logback (dev/prod)
 *   3. Provide superadmin credentials and setting overrides
 * Priority for resolution:
 *     1. System environment variable
 *     2. .env file
 */
public class KeyProvider {

    private static final Logger logger = LoggerFactory.getLogger(KeyProvider.class);

    private static final String ENV_ENVIRONMENT = "APP_ENV";

    private static volatile boolean initialized = false;
    private static String activeEnv = "PRODUCTION";
    private static Dotenv dotenv;
    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private KeyProvider() {}

    private static synchronized void init() {
        if (initialized) return;

        try {
            dotenv = Dotenv.configure()
                    .ignoreIfMalformed()
                    .ignoreIfMissing()
                    .load();

            String env = System.getenv(ENV_ENVIRONMENT);
            if (env == null || env.isBlank()) {
                env = dotenv.get(ENV_ENVIRONMENT, "PRODUCTION");
            }
            activeEnv = env.toUpperCase();
            System.setProperty(ENV_ENVIRONMENT, activeEnv);

            if ("DEVELOPMENT".equals(activeEnv)) {
                loadLogback("logback-dev.xml");
            } else {
                loadLogback("logback.xml");
            }

            initialized = true;
            logger.info("KeyProvider initialized, environment: {}", activeEnv);

        } catch (Exception e) {
            System.err.println("KeyProvider initialization failed: " + e.getMessage());
            throw new IllegalStateException("Failed initializing environment", e);
        }
    }

    /** Required value; fails loudly when neither ENV nor .env provides it. */
    public static String get(String keyName) {
        String value = getOptional(keyName);
        if (value == null) {
            logger.error("Missing required secret '{}'", keyName);
            throw new IllegalStateException(
                    "\nMissing secret: " + keyName +
                            "\nProvide it via:\n" +
                            "  • System ENV: " + keyName + "\n" +
                            "  • OR .env file: " + keyName + "=value\n"
            );
        }
        return value;
    }

    /** Optional value, or {@code null} when unset or blank. */
    public static String getOptional(String keyName) {
        if (!initialized) init();

        String cached = CACHE.get(keyName);
        if (cached != null) return cached;

        String value = System.getenv(keyName);
        if ((value == null || value.isBlank()) && dotenv != null) {
            value = dotenv.get(keyName);
        }
        if (value == null || value.isBlank()) return null;

        CACHE.put(keyName, value.trim());
        logger.debug("Value '{}' loaded ({} chars)", keyName, value.length());
        return value.trim();
    }

    public static boolean isDev() { return "DEVELOPMENT".equalsIgnoreCase(getEnvironment()); }
    public static String getEnvironment() { if (!initialized) init(); return activeEnv; }

    /** Load logback safely */
    private static void loadLogback(String fileName) {
        try (InputStream config = KeyProvider.class.getClassLoader().getResourceAsStream(fileName)) {
            if (config == null) {
                System.err.println("Logback configuration not found on classpath: " + fileName);
                return;
            }
            LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
            ctx.reset();

            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(ctx);
            configurator.doConfigure(config);

            StatusPrinter.printInCaseOfErrorsOrWarnings(ctx);
        } catch (Exception e) {
            System.err.println("ERROR loading logback: " + fileName + " -> " + e.getMessage());
        }
    }
}
