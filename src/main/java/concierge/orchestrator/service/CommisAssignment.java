package concierge.orchestrator.service;

/**
 * Unit of work handed to a {@link CommisWorker}.
 */
public record CommisAssignment(
        String commisId,
        String runId,
        String correlationId,
        int spawnIndex,
        String task,
        String toolCallId) {
}
