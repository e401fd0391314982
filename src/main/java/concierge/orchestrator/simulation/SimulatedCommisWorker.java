package concierge.orchestrator.simulation;

import concierge.orchestrator.service.CommisAssignment;
import concierge.orchestrator.service.CommisReporter;
import concierge.orchestrator.service.CommisWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * In-process commis worker: sleeps for a random delay, records one tool call,
 * then reports. Tasks mentioning "fail" report a failure.
 */
public final class SimulatedCommisWorker implements CommisWorker {

    private static final Logger log = LoggerFactory.getLogger(SimulatedCommisWorker.class);

    private static final String TOOL_NAME = "simulate";

    private final int delayMinMs;
    private final int delayMaxMs;

    public SimulatedCommisWorker(int delayMinMs, int delayMaxMs) {
        if (delayMinMs < 0 || delayMaxMs < delayMinMs) {
            throw new IllegalArgumentException("invalid delay range " + delayMinMs + ".." + delayMaxMs);
        }
        this.delayMinMs = delayMinMs;
        this.delayMaxMs = delayMaxMs;
    }

    @Override
    public void execute(CommisAssignment assignment, CommisReporter reporter) throws InterruptedException {
        String commisId = assignment.commisId();
        reporter.toolStarted(commisId, TOOL_NAME, Map.of("task", assignment.task()));

        long delay = delayMaxMs > delayMinMs
                ? ThreadLocalRandom.current().nextLong(delayMinMs, delayMaxMs + 1L)
                : delayMinMs;
        Thread.sleep(delay);

        if (assignment.task().toLowerCase(Locale.ROOT).contains("fail")) {
            log.info("Commis {} simulating failure after {}ms", commisId, delay);
            reporter.fail(commisId, "Simulated failure: " + assignment.task());
            return;
        }

        reporter.toolCompleted(commisId, TOOL_NAME, Map.of("elapsed_ms", delay));
        reporter.complete(commisId, "Result of " + assignment.task());
        log.info("Commis {} done in {}ms", commisId, delay);
    }
}
