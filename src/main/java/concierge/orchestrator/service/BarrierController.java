package concierge.orchestrator.service;

import concierge.orchestrator.model.Commis;
import concierge.orchestrator.model.CommisReportResult;
import concierge.orchestrator.model.CommisResult;
import concierge.orchestrator.model.EventType;
import concierge.orchestrator.model.PayloadKeys;
import concierge.orchestrator.model.RunState;
import concierge.orchestrator.model.RunStatus;
import concierge.orchestrator.repository.RunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records commis outcomes and releases a waiting run exactly once, when the
 * last commis of its wave reports.
 *
 * The final {@code commis_complete} and {@code run_resumed} are appended in the
 * same transaction, so concurrent last reports cannot both release.
 */
public class BarrierController {

    private static final Logger log = LoggerFactory.getLogger(BarrierController.class);

    private final RunStore store;
    private final RunStateMachine stateMachine;

    public BarrierController(RunStore store, RunStateMachine stateMachine) {
        this.store = store;
        this.stateMachine = stateMachine;
    }

    /**
     * Record a commis outcome. A non-null error marks the commis failed.
     */
    public CommisReport reportCommisResult(String commisId, String result, String error) {
        if (commisId == null || commisId.isBlank()) {
            throw new IllegalArgumentException("commisId is required");
        }

        Optional<Commis> indexed = store.findCommis(commisId);
        if (indexed.isEmpty()) {
            log.warn("Report for unknown commis {}", commisId);
            return CommisReport.notFound();
        }
        String runId = indexed.get().runId();

        CommisReport report = stateMachine.transition(runId, tx -> {
            Optional<Commis> current = tx.state().commis(commisId);
            if (current.isEmpty()) {
                return new CommisReport(CommisReportResult.NOT_FOUND, RunStateMachine.snapshot(tx), List.of());
            }
            Commis commis = current.get();
            if (commis.isTerminal()) {
                return new CommisReport(CommisReportResult.ALREADY_TERMINAL, RunStateMachine.snapshot(tx), List.of());
            }

            boolean failed = error != null;
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(PayloadKeys.COMMIS_ID, commisId);
            payload.put(PayloadKeys.TOOL_CALL_ID, commis.toolCallId());
            payload.put(PayloadKeys.SPAWN_INDEX, commis.spawnIndex());
            payload.put(PayloadKeys.STATUS, failed ? "failed" : "success");
            payload.put(PayloadKeys.RESULT, failed ? null : result);
            payload.put(PayloadKeys.ERROR, error);
            tx.append(EventType.COMMIS_COMPLETE, payload);

            RunState state = tx.state();
            if (state.status() != RunStatus.WAITING || !state.isBarrierSatisfied()) {
                log.debug("Commis {} recorded, barrier {}/{}", commisId,
                        state.waveTerminalCount(), state.waveSize());
                return new CommisReport(CommisReportResult.RECORDED, RunStateMachine.snapshot(tx), List.of());
            }

            List<CommisResult> results = state.waveResults();
            List<Map<String, Object>> resultPayloads = new ArrayList<>(results.size());
            for (CommisResult r : results) {
                resultPayloads.add(r.toPayload());
            }
            Map<String, Object> resumed = new LinkedHashMap<>();
            resumed.put(PayloadKeys.EXPECTED, results.size());
            resumed.put(PayloadKeys.RESULTS, resultPayloads);
            tx.append(EventType.RUN_RESUMED, resumed);

            return new CommisReport(CommisReportResult.RELEASED, RunStateMachine.snapshot(tx), results);
        });

        switch (report.outcome()) {
            case RELEASED -> log.info("Run {} barrier released by commis {} ({} results)",
                    runId, commisId, report.results().size());
            case RECORDED -> log.info("Commis {} of run {} reported {}", commisId, runId,
                    error != null ? "failure" : "success");
            case ALREADY_TERMINAL -> log.debug("Commis {} already terminal (idempotent)", commisId);
            default -> log.warn("Commis {} not found in run {}", commisId, runId);
        }
        return report;
    }
}
