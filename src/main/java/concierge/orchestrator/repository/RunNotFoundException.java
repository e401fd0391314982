package concierge.orchestrator.repository;

/**
 * No run with the requested id.
 */
public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String runId) {
        super("run not found: " + runId);
    }
}
