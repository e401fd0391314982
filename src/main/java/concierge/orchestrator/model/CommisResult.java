package concierge.orchestrator.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal outcome of one commis as handed to a run's continuation.
 */
public record CommisResult(
        String commisId,
        String toolCallId,
        int spawnIndex,
        CommisStatus status,
        String result,
        String error) {

    public static CommisResult from(Commis commis) {
        return new CommisResult(commis.id(), commis.toolCallId(), commis.spawnIndex(),
                commis.status(), commis.result(), commis.error());
    }

    public boolean succeeded() {
        return status == CommisStatus.COMPLETE;
    }

    /** Payload form used inside {@code run_resumed} events */
    public Map<String, Object> toPayload() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(PayloadKeys.COMMIS_ID, commisId);
        map.put(PayloadKeys.TOOL_CALL_ID, toolCallId);
        map.put(PayloadKeys.SPAWN_INDEX, spawnIndex);
        map.put(PayloadKeys.STATUS, status == CommisStatus.COMPLETE ? "success" : "failed");
        map.put(PayloadKeys.RESULT, result);
        map.put(PayloadKeys.ERROR, error);
        return map;
    }
}
