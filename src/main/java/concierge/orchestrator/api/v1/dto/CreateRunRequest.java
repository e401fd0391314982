package concierge.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import concierge.orchestrator.service.RunRequest;
import concierge.orchestrator.service.RunStateMachine;

/**
 * Request DTO for starting a run.
 * POST /api/v1/runs
 *
 * The idempotency key, correlation id and tenant may also arrive as headers;
 * headers win over body fields. The task and correlation id are validated only
 * when the key does not resolve to an existing run.
 */
public record CreateRunRequest(
        @JsonProperty("task") String task,
        @JsonProperty("correlationId") String correlationId,
        @JsonProperty("idempotencyKey") String idempotencyKey,
        @JsonProperty("tenantId") String tenantId,
        @JsonProperty("threadId") String threadId) {

    /**
     * Merge header values over body fields.
     *
     * @throws IllegalArgumentException if the resulting idempotency key is too long
     */
    public RunRequest toRunRequest(String headerKey, String headerCorrelationId, String headerTenant) {
        String key = firstPresent(headerKey, idempotencyKey);
        if (key != null && key.length() > RunStateMachine.MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw new IllegalArgumentException("idempotencyKey must be at most "
                    + RunStateMachine.MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
        return new RunRequest(
                task,
                firstPresent(headerCorrelationId, correlationId),
                key,
                firstPresent(headerTenant, tenantId),
                threadId);
    }

    private static String firstPresent(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
