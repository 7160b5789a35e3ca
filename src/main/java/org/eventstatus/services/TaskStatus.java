package org.eventstatus.services;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time view of one registered task. Only the latest run is kept.
 */
public record TaskStatus(
        String name,
        long intervalSeconds,
        boolean running,
        Instant lastStartedAt,
        long lastDurationMillis,
        String lastError,
        long runs,
        long failures,
        long misfires,
        long dropped
) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("interval_seconds", intervalSeconds);
        map.put("running", running);
        map.put("last_started_at", lastStartedAt == null ? null : lastStartedAt.toString());
        map.put("last_duration_ms", lastDurationMillis);
        map.put("last_error", lastError);
        map.put("runs", runs);
        map.put("failures", failures);
        map.put("misfires", misfires);
        map.put("dropped", dropped);
        return map;
    }
}
