package concierge.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import concierge.orchestrator.model.WorkSpec;

import java.util.List;

/**
 * Request DTO for an explicit fan-out.
 * POST /api/v1/runs/{runId}/fan-out
 */
public record FanOutRequest(
        @JsonProperty("commis") List<Item> commis) {

    public record Item(
            @JsonProperty("task") String task,
            @JsonProperty("toolCallId") String toolCallId) {
    }

    /** Validate the request */
    public void validate() {
        if (commis == null || commis.isEmpty()) {
            throw new IllegalArgumentException("commis must not be empty");
        }
        for (int i = 0; i < commis.size(); i++) {
            Item item = commis.get(i);
            if (item == null || item.task() == null || item.task().isBlank()) {
                throw new IllegalArgumentException("commis[" + i + "].task is required");
            }
        }
    }

    public List<WorkSpec> toSpecs() {
        return commis.stream()
                .map(item -> new WorkSpec(item.task(), item.toolCallId()))
                .toList();
    }
}
