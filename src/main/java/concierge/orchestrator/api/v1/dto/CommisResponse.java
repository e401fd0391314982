package concierge.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import concierge.orchestrator.model.Commis;

/**
 * Response DTO for a commis.
 * GET /api/v1/runs/{runId}/commis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommisResponse(
        @JsonProperty("commisId") String commisId,
        @JsonProperty("runId") String runId,
        @JsonProperty("spawnIndex") int spawnIndex,
        @JsonProperty("task") String task,
        @JsonProperty("toolCallId") String toolCallId,
        @JsonProperty("status") String status,
        @JsonProperty("result") String result,
        @JsonProperty("error") String error) {

    public static CommisResponse from(Commis commis) {
        return new CommisResponse(
                commis.id(),
                commis.runId(),
                commis.spawnIndex(),
                commis.task(),
                commis.toolCallId(),
                commis.status().wireName(),
                commis.result(),
                commis.error());
    }
}
