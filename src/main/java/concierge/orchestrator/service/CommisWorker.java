package concierge.orchestrator.service;

/**
 * Executes commis work. Called on the dispatcher pool, one call per commis.
 */
@FunctionalInterface
public interface CommisWorker {

    /**
     * Do the work and report through the reporter. Implementations may also
     * return without reporting and let an external party report later.
     *
     * @throws Exception a thrown exception is reported as a commis failure
     */
    void execute(CommisAssignment assignment, CommisReporter reporter) throws Exception;
}
