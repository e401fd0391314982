package concierge.orchestrator.client;

import java.util.List;

/**
 * Consumer-side view of a commis.
 *
 * @param commisId       commis id
 * @param runId          owning run, null while unknown
 * @param spawnIndex     spawn order, -1 while unknown
 * @param task           task text, null while unknown
 * @param status         {@code spawned}, {@code success} or {@code failed}
 * @param pendingDetails true while only activity has been seen for the commis
 * @param activity       tool activity in arrival order
 */
public record CommisView(
        String commisId,
        String runId,
        int spawnIndex,
        String task,
        String status,
        boolean pendingDetails,
        List<String> activity) {

    public CommisView {
        activity = List.copyOf(activity);
    }

    static CommisView placeholder(String commisId, String runId) {
        return new CommisView(commisId, runId, -1, null, "spawned", true, List.of());
    }
}
