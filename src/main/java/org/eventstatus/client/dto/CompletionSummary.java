package org.eventstatus.client.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Acknowledgment returned when completion processing (video merge + analysis)
 * is kicked off. Participant failures are informational only.
 */
public record CompletionSummary(String message, int totalParticipants, int successful, int failed,
                                List<ParticipantResult> results) {

    public record ParticipantResult(String participantName, boolean success, String error) {}

    public static CompletionSummary fromJson(JsonNode body) {
        List<ParticipantResult> results = new ArrayList<>();
        for (JsonNode result : body.path("results")) {
            results.add(new ParticipantResult(
                    result.path("participant_name").asText("unknown"),
                    result.path("success").asBoolean(false),
                    result.path("error").asText("no details")
            ));
        }
        return new CompletionSummary(
                body.path("message").asText(),
                body.path("total_participants").asInt(0),
                body.path("successful").asInt(0),
                body.path("failed").asInt(0),
                List.copyOf(results)
        );
    }

    public List<ParticipantResult> failures() {
        return results.stream().filter(r -> !r.success()).toList();
    }
}
