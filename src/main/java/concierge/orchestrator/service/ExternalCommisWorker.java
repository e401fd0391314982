package concierge.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker for commis executed outside this process. It only logs the
 * assignment; the remote worker reports over the internal HTTP API.
 */
public class ExternalCommisWorker implements CommisWorker {

    private static final Logger log = LoggerFactory.getLogger(ExternalCommisWorker.class);

    @Override
    public void execute(CommisAssignment assignment, CommisReporter reporter) {
        log.info("Commis {} of run {} awaiting external report", assignment.commisId(), assignment.runId());
    }
}
