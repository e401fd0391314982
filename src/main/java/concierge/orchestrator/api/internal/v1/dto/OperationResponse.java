package concierge.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import concierge.orchestrator.service.CommisReport;

import java.util.Locale;

/**
 * Generic response for internal API operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("outcome") String outcome,
        @JsonProperty("runStatus") String runStatus,
        @JsonProperty("error") String error) {

    /** Success response */
    public static OperationResponse success() {
        return new OperationResponse(true, null, null, null);
    }

    /** Response describing a commis report */
    public static OperationResponse from(CommisReport report) {
        return new OperationResponse(
                true,
                report.outcome().name().toLowerCase(Locale.ROOT),
                report.run() != null ? report.run().status().wireName() : null,
                null);
    }

    /** Error response */
    public static OperationResponse error(String error) {
        return new OperationResponse(false, null, null, error);
    }

    public static OperationResponse commisNotFound() {
        return error("commis_not_found");
    }
}
