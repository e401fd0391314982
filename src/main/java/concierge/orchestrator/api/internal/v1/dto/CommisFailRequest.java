package concierge.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for reporting commis failure.
 * POST /internal/v1/commis/{commisId}/fail
 */
public record CommisFailRequest(
        @JsonProperty("error") String error) {

    public void validate() {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error is required");
        }
    }
}
