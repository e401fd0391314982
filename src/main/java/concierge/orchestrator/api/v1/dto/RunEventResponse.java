package concierge.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import concierge.orchestrator.model.RunEvent;

import java.time.Instant;
import java.util.Map;

/**
 * One logged event as returned by the poll endpoint.
 * GET /api/v1/runs/{runId}/events
 */
public record RunEventResponse(
        @JsonProperty("runId") String runId,
        @JsonProperty("seq") long seq,
        @JsonProperty("type") String type,
        @JsonProperty("correlationId") String correlationId,
        @JsonProperty("ts") Instant ts,
        @JsonProperty("payload") Map<String, Object> payload) {

    public static RunEventResponse from(RunEvent event) {
        return new RunEventResponse(
                event.runId(),
                event.sequence(),
                event.type().wireName(),
                event.correlationId(),
                event.timestamp(),
                event.payload());
    }
}
