package concierge.orchestrator.model;

/**
 * Description of one commis to spawn during a fan-out.
 *
 * @param task       work description for the worker
 * @param toolCallId optional caller tag (e.g. the concierge's tool call id)
 */
public record WorkSpec(String task, String toolCallId) {

    public WorkSpec {
        if (task == null || task.isBlank()) {
            throw new IllegalArgumentException("task is required");
        }
    }

    public static WorkSpec of(String task) {
        return new WorkSpec(task, null);
    }
}
