package concierge.orchestrator.service;

import java.util.Map;

/**
 * Callback a worker uses to report on its commis. Exactly one of
 * {@link #complete} or {@link #fail} must be called per commis; further calls
 * are no-ops.
 */
public interface CommisReporter {

    CommisReport complete(String commisId, String result);

    CommisReport fail(String commisId, String error);

    void toolStarted(String commisId, String toolName, Map<String, Object> details);

    void toolCompleted(String commisId, String toolName, Map<String, Object> details);
}
