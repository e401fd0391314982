package concierge.orchestrator.service;

import concierge.orchestrator.model.CommisResult;

import java.util.List;

/**
 * The concierge's decision logic. Both calls run on the orchestrator executor
 * and may stream tokens through {@link RunContext}.
 */
public interface ConciergeStep {

    /** First step of a freshly started run */
    StepOutcome start(RunContext context) throws Exception;

    /**
     * Continuation after a barrier released.
     *
     * @param results the wave's outcomes in spawn order, failures included
     */
    StepOutcome resume(RunContext context, List<CommisResult> results) throws Exception;
}
