package org.eventstatus.services;

public interface ScheduledTask {
    /**
     * A short, unique name used for logging and registry.
     */
    String name();

    /**
     * Interval in seconds between executions.
     */
    long intervalSeconds();

    /**
     * The work to do. Implementations should catch exceptions and log them;
     * the scheduler still guards against anything that escapes.
     */
    void execute();
}
