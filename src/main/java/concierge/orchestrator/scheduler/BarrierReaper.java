package concierge.orchestrator.scheduler;

import concierge.orchestrator.config.OrchestratorConfig;
import concierge.orchestrator.model.Commis;
import concierge.orchestrator.model.Run;
import concierge.orchestrator.repository.RunStore;
import concierge.orchestrator.service.CommisDispatcher;
import concierge.orchestrator.service.CommisReport;
import concierge.orchestrator.util.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Background task that releases barriers whose commis never reported.
 *
 * Commis can go silent if:
 * - The worker process dies mid-task
 * - An external worker never calls back
 *
 * The reaper finds runs WAITING longer than the barrier timeout and reports
 * every unreported commis of the wave as failed through the normal report path,
 * so the barrier releases once and the continuation sees the timeouts.
 */
public class BarrierReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BarrierReaper.class);

    public static final String TIMEOUT_ERROR = "Commis timed out (deadline exceeded)";

    private final RunStore runStore;
    private final CommisDispatcher dispatcher;
    private final OrchestratorConfig config;

    public BarrierReaper(RunStore runStore, CommisDispatcher dispatcher, OrchestratorConfig config) {
        this.runStore = runStore;
        this.dispatcher = dispatcher;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reapExpiredBarriers();
        } catch (Exception e) {
            log.error("Barrier reaper error", e);
        }
    }

    /**
     * Fail the outstanding commis of every expired barrier.
     *
     * @return number of runs released
     */
    public int reapExpiredBarriers() {
        Instant cutoff = Instant.now().minus(config.barrierTimeout());

        List<Run> expired = runStore.findWaitingSince(cutoff);

        if (expired.isEmpty()) {
            log.debug("No expired barriers found");
            return 0;
        }

        int released = 0;
        for (Run run : expired) {
            try (LogContext ignored = LogContext.of(run.id(), run.correlationId())) {
                int timedOut = 0;
                for (Commis commis : runStore.findCommisByRun(run.id())) {
                    if (commis.isTerminal()) {
                        continue;
                    }
                    CommisReport report = dispatcher.fail(commis.id(), TIMEOUT_ERROR);
                    timedOut++;
                    if (report.released()) {
                        released++;
                    }
                }
                log.warn("Run {} barrier expired (waiting since {}), timed out {} commis",
                        run.id(), run.waitingSince(), timedOut);
            } catch (Exception e) {
                log.error("Failed to reap barrier of run {}", run.id(), e);
            }
        }

        log.info("Barrier reaper: {} released, {} expired", released, expired.size());

        return released;
    }
}
