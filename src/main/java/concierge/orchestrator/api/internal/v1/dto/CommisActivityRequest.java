package concierge.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import concierge.orchestrator.model.EventType;

import java.util.Map;

/**
 * Request DTO for commis tool activity.
 * POST /internal/v1/commis/{commisId}/activity
 *
 * {@code phase} is {@code started} or {@code completed}.
 */
public record CommisActivityRequest(
        @JsonProperty("phase") String phase,
        @JsonProperty("toolName") String toolName,
        @JsonProperty("details") Map<String, Object> details) {

    public void validate() {
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("toolName is required");
        }
        eventType();
    }

    public EventType eventType() {
        if ("started".equals(phase)) {
            return EventType.COMMIS_TOOL_STARTED;
        }
        if ("completed".equals(phase)) {
            return EventType.COMMIS_TOOL_COMPLETED;
        }
        throw new IllegalArgumentException("phase must be 'started' or 'completed'");
    }
}
