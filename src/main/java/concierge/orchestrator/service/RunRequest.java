package concierge.orchestrator.service;

/**
 * Input for starting a run.
 *
 * @param task           what the concierge should do
 * @param correlationId  optional caller-supplied correlation id (UUID)
 * @param idempotencyKey optional dedupe key
 * @param tenantId       optional tenant scope for push delivery
 * @param threadId       optional conversation thread
 */
public record RunRequest(
        String task,
        String correlationId,
        String idempotencyKey,
        String tenantId,
        String threadId) {

    public static RunRequest of(String task) {
        return new RunRequest(task, null, null, null, null);
    }
}
