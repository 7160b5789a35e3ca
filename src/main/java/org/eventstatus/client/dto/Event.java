package org.eventstatus.client.dto;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import org.eventstatus.utils.JsonUtil;

import java.util.Collections;
import java.util.Map;

/**
 * Transient copy of a backend event, valid for a single poll cycle.
 *
 * @param id        backend identifier, {@code null} when the payload carries none
 * @param status    reported lifecycle state
 * @param startDate raw {@code start_date} as sent by the backend
 * @param endDate   raw {@code end_date} as sent by the backend
 * @param fields    every field of the payload, untouched
 */
public record Event(Long id, EventStatus status, String startDate, String endDate, Map<String, Object> fields) {

    public static Event fromJson(JsonNode node) {
        Map<String, Object> fields = node.isObject()
                ? JsonUtil.mapper().convertValue(node, new TypeReference<Map<String, Object>>() {})
                : Collections.emptyMap();
        return new Event(
                idOf(node.path("id")),
                EventStatus.fromWire(textOrNull(node.path("status"))),
                textOrNull(node.path("start_date")),
                textOrNull(node.path("end_date")),
                Collections.unmodifiableMap(fields)
        );
    }

    private static Long idOf(JsonNode id) {
        if (id.isIntegralNumber()) return id.longValue();
        if (id.isTextual()) {
            try {
                return Long.parseLong(id.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
