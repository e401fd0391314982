package concierge.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import concierge.orchestrator.model.Run;

import java.time.Instant;

/**
 * Response DTO for run details.
 * GET /api/v1/runs/{runId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        @JsonProperty("runId") String runId,
        @JsonProperty("correlationId") String correlationId,
        @JsonProperty("status") String status,
        @JsonProperty("task") String task,
        @JsonProperty("threadId") String threadId,
        @JsonProperty("tenantId") String tenantId,
        @JsonProperty("result") String result,
        @JsonProperty("error") String error,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("waitingSince") Instant waitingSince) {

    /** Create response from domain model */
    public static RunResponse from(Run run) {
        return new RunResponse(
                run.id(),
                run.correlationId(),
                run.status().wireName(),
                run.task(),
                run.threadId(),
                run.tenantId(),
                run.result(),
                run.error(),
                run.createdAt(),
                run.updatedAt(),
                run.waitingSince());
    }
}
