package concierge.orchestrator.service;

import concierge.orchestrator.model.Commis;
import concierge.orchestrator.model.EventType;
import concierge.orchestrator.model.PayloadKeys;
import concierge.orchestrator.model.WorkSpec;
import concierge.orchestrator.repository.RunStore;
import concierge.orchestrator.util.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Spawns commis for a run and routes their reports to the barrier.
 */
public class CommisDispatcher implements CommisReporter {

    private static final Logger log = LoggerFactory.getLogger(CommisDispatcher.class);

    private final RunStore store;
    private final RunStateMachine stateMachine;
    private final BarrierController barrier;
    private final CommisWorker worker;
    private final ExecutorService pool;
    private volatile ResumeHandler resumeHandler;

    public CommisDispatcher(RunStore store, RunStateMachine stateMachine, BarrierController barrier,
            CommisWorker worker, ExecutorService pool) {
        this.store = store;
        this.stateMachine = stateMachine;
        this.barrier = barrier;
        this.worker = worker;
        this.pool = pool;
    }

    public void setResumeHandler(ResumeHandler resumeHandler) {
        this.resumeHandler = resumeHandler;
    }

    /**
     * Spawn one commis per spec, park the run, then start the workers.
     * Returns without waiting for any commis.
     *
     * @throws IllegalArgumentException if specs is empty
     * @throws RunBusyException         if the run is waiting or terminal
     */
    public List<Commis> fanOut(String runId, List<WorkSpec> specs) {
        List<Commis> spawned = stateMachine.recordFanOut(runId, specs);
        String correlationId = store.findById(runId).map(r -> r.correlationId()).orElse(null);

        for (Commis commis : spawned) {
            CommisAssignment assignment = new CommisAssignment(commis.id(), runId, correlationId,
                    commis.spawnIndex(), commis.task(), commis.toolCallId());
            try {
                pool.execute(() -> run(assignment));
            } catch (RejectedExecutionException e) {
                log.error("Dispatcher pool rejected commis {}", commis.id(), e);
                failQuietly(commis.id(), "Commis could not be scheduled: " + e.getMessage());
            }
        }
        return spawned;
    }

    private void run(CommisAssignment assignment) {
        try (LogContext ignored = LogContext.of(assignment.runId(), assignment.correlationId())) {
            try {
                worker.execute(assignment, this);
            } catch (Exception e) {
                log.error("Commis {} worker crashed", assignment.commisId(), e);
                failQuietly(assignment.commisId(), "Commis worker crashed: " + e.getMessage());
            }
        }
    }

    /**
     * Report a failure on behalf of a worker that cannot report it itself.
     * Errors are logged; the barrier watchdog eventually fails the commis.
     */
    private void failQuietly(String commisId, String error) {
        try {
            fail(commisId, error);
        } catch (RuntimeException e) {
            log.error("Failed to record failure of commis {} ({})", commisId, error, e);
        }
    }

    @Override
    public CommisReport complete(String commisId, String result) {
        return reportCommisResult(commisId, result, null);
    }

    @Override
    public CommisReport fail(String commisId, String error) {
        return reportCommisResult(commisId, null, error != null ? error : "Commis failed");
    }

    /**
     * Record an outcome and, when it releases the barrier, hand the results to
     * the continuation.
     */
    public CommisReport reportCommisResult(String commisId, String result, String error) {
        CommisReport report = barrier.reportCommisResult(commisId, result, error);
        if (report.released()) {
            ResumeHandler handler = resumeHandler;
            if (handler != null) {
                handler.onResumed(report.run(), report.results());
            } else {
                log.warn("Run {} resumed with no continuation registered", report.run().id());
            }
        }
        return report;
    }

    @Override
    public void toolStarted(String commisId, String toolName, Map<String, Object> details) {
        recordCommisActivity(commisId, EventType.COMMIS_TOOL_STARTED, toolName, details);
    }

    @Override
    public void toolCompleted(String commisId, String toolName, Map<String, Object> details) {
        recordCommisActivity(commisId, EventType.COMMIS_TOOL_COMPLETED, toolName, details);
    }

    /**
     * Append a tool activity event for the commis.
     *
     * @return false if the commis is unknown or already reported
     */
    public boolean recordCommisActivity(String commisId, EventType type, String toolName,
            Map<String, Object> details) {
        Commis commis = store.findCommis(commisId).orElse(null);
        if (commis == null) {
            log.warn("Activity for unknown commis {}", commisId);
            return false;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        if (details != null) {
            payload.putAll(details);
        }
        payload.put(PayloadKeys.TOOL_NAME, toolName);
        return stateMachine.recordCommisActivity(commis.runId(), commisId, type, payload);
    }
}
