package org.eventstatus.config.utils;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys shared by every log line.
 * "component" names the task or phase, "trace.id" ties together the lines of one run,
 * "event.id" is present while a single backend event is being handled.
 */
public class LogContext {
    public static final String COMPONENT = "component";
    public static final String TRACE_ID = "trace.id";
    public static final String EVENT_ID = "event.id";

    private LogContext() {}

    /**
     * Opens a new context for one run of {@code component}. Returns the generated trace id.
     */
    public static String start(String component) {
        String traceId = UUID.randomUUID().toString();
        MDC.put(COMPONENT, component);
        MDC.put(TRACE_ID, traceId);
        return traceId;
    }

    public static void forEvent(long eventId) {
        MDC.put(EVENT_ID, Long.toString(eventId));
    }

    public static void endEvent() {
        MDC.remove(EVENT_ID);
    }

    public static void clear() {
        MDC.clear();
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }
}



/**
 *| Action                              | Rule                                         |
 * | ----------------------------------- | -------------------------------------------- |
 * | At start of any operation           | `LogContext.start("ComponentName")`          |
 * | At end (in finally block)           | `LogContext.clear()`                         |
 * | Scheduled runs                      | TaskScheduler opens one context per run      |
 * | Per-event work inside a run         | `forEvent(id)` ... `endEvent()` in finally   |
 * */
