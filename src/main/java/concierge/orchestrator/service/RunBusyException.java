package concierge.orchestrator.service;

import concierge.orchestrator.model.RunStatus;

/**
 * A run-level operation arrived while the run cannot accept it: the run is
 * parked on a barrier or already terminal. Not retried automatically.
 */
public class RunBusyException extends RuntimeException {

    private final String runId;
    private final RunStatus status;

    public RunBusyException(String runId, RunStatus status, String operation) {
        super("run " + runId + " is " + status.wireName() + ", cannot " + operation);
        this.runId = runId;
        this.status = status;
    }

    public String runId() {
        return runId;
    }

    public RunStatus status() {
        return status;
    }
}
