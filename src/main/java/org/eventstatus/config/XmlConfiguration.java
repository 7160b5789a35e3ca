package org.eventstatus.config;

import jakarta.xml.bind.annotation.XmlRootElement;

/**
 * Typed view of config.xml. Every section is pre-populated with defaults so
 * a partial file (or a missing element) still yields a usable configuration.
 */
@XmlRootElement(name = "configuration")
public class XmlConfiguration {

    public Server server = new Server();
    public Backend backend = new Backend();
    public Scheduler scheduler = new Scheduler();
    public Logging logging = new Logging();

    // --- Undertow Server ---
    @XmlRootElement(name = "server")
    public static class Server {
        public String host = "0.0.0.0";
        public int port = 8001;
        public int ioThreads = 2;
        public int workerThreads = 8;
    }

    // --- Remote events backend ---
    @XmlRootElement(name = "backend")
    public static class Backend {
        public String baseUrl = "http://localhost:8000";
        public int httpTimeoutSeconds = 30;
        public int completionTimeoutSeconds = 60;
    }

    // --- Job scheduler ---
    @XmlRootElement(name = "scheduler")
    public static class Scheduler {
        public long intervalSeconds = 60;
        public long cleanupIntervalSeconds = 300;
        public boolean cleanupEnabled = true;
        public long misfireGraceSeconds = 5;
        public boolean coalesce = true;
        public int poolSize = 4;
    }

    // --- Logging ---
    @XmlRootElement(name = "logging")
    public static class Logging {
        public String level = "INFO";
    }
}
