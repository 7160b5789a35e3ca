package org.eventstatus.client.dto;

import java.util.Locale;

/**
 * Lifecycle state reported by the backend. Transitions only ever go
 * SCHEDULED -> IN_PROGRESS -> COMPLETED and are enforced server-side.
 */
public enum EventStatus {
    SCHEDULED("scheduled", "programado"),
    IN_PROGRESS("in_progress", "en_progreso"),
    COMPLETED("completed", "completado"),
    UNKNOWN;

    private final String[] wireValues;

    EventStatus(String... wireValues) {
        this.wireValues = wireValues;
    }

    public static EventStatus fromWire(String value) {
        if (value == null) return UNKNOWN;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EventStatus status : values()) {
            for (String wire : status.wireValues) {
                if (wire.equals(normalized)) return status;
            }
        }
        return UNKNOWN;
    }
}
