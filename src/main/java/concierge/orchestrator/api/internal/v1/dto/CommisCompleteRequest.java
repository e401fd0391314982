package concierge.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for reporting commis success.
 * POST /internal/v1/commis/{commisId}/complete
 */
public record CommisCompleteRequest(
        @JsonProperty("result") String result) {

    public void validate() {
        if (result == null) {
            throw new IllegalArgumentException("result is required");
        }
    }
}
