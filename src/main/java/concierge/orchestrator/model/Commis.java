package concierge.orchestrator.model;

import java.util.Objects;

/**
 * One fanned-out unit of work belonging to a run.
 *
 * @param id         globally unique commis id
 * @param runId      owning run
 * @param spawnIndex 0-based spawn order within the run
 * @param task       work description handed to the worker
 * @param toolCallId optional caller tag, echoed back in results
 * @param status     current status
 * @param result     worker output when COMPLETE
 * @param error      worker error when FAILED
 */
public record Commis(
        String id,
        String runId,
        int spawnIndex,
        String task,
        String toolCallId,
        CommisStatus status,
        String result,
        String error) {

    public Commis {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(status, "status is required");
    }

    public static Commis spawned(String id, String runId, int spawnIndex, String task, String toolCallId) {
        return new Commis(id, runId, spawnIndex, task, toolCallId, CommisStatus.SPAWNED, null, null);
    }

    public Commis completed(String result) {
        return new Commis(id, runId, spawnIndex, task, toolCallId, CommisStatus.COMPLETE, result, null);
    }

    public Commis failed(String error) {
        return new Commis(id, runId, spawnIndex, task, toolCallId, CommisStatus.FAILED, null, error);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
