package concierge.orchestrator.service;

import concierge.orchestrator.model.CommisResult;
import concierge.orchestrator.model.Run;

import java.util.List;

/**
 * Continuation invoked once per released barrier.
 */
@FunctionalInterface
public interface ResumeHandler {

    /**
     * @param run     the run, now RESUMED
     * @param results outcomes of the wave in spawn order
     */
    void onResumed(Run run, List<CommisResult> results);
}
