package concierge.orchestrator.service;

import concierge.orchestrator.model.Commis;
import concierge.orchestrator.model.EventType;
import concierge.orchestrator.model.Run;
import concierge.orchestrator.model.RunEvent;
import concierge.orchestrator.model.RunStatus;
import concierge.orchestrator.model.WorkSpec;
import concierge.orchestrator.repository.EventLog;
import concierge.orchestrator.repository.RunNotFoundException;
import concierge.orchestrator.repository.RunStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Service layer behind the HTTP controllers and push sessions.
 */
public class RunService {

    public static final int DEFAULT_LIST_LIMIT = 50;
    public static final int MAX_LIST_LIMIT = 500;

    private final RunStore runStore;
    private final EventLog eventLog;
    private final RunOrchestrator orchestrator;
    private final CommisDispatcher dispatcher;

    public RunService(RunStore runStore, EventLog eventLog, RunOrchestrator orchestrator,
            CommisDispatcher dispatcher) {
        this.runStore = runStore;
        this.eventLog = eventLog;
        this.orchestrator = orchestrator;
        this.dispatcher = dispatcher;
    }

    public RunCreation createRun(RunRequest request) {
        return orchestrator.submit(request);
    }

    /**
     * @throws RunNotFoundException if no such run
     */
    public Run getRun(String runId) {
        return runStore.findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    public List<Run> listRuns(Instant createdAfter, Integer limit) {
        int effective = limit == null ? DEFAULT_LIST_LIMIT : limit;
        if (effective <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return runStore.findRecent(createdAfter, Math.min(effective, MAX_LIST_LIMIT));
    }

    /**
     * Events after the watermark, in sequence order. With {@code includeTokens}
     * false, {@code stream_chunk} events are left out.
     *
     * @throws RunNotFoundException if no such run
     */
    public List<RunEvent> events(String runId, long after, boolean includeTokens) {
        if (after < 0) {
            throw new IllegalArgumentException("after must be >= 0");
        }
        getRun(runId);
        List<RunEvent> events = eventLog.readFrom(runId, after);
        if (includeTokens) {
            return events;
        }
        List<RunEvent> filtered = new ArrayList<>(events.size());
        for (RunEvent event : events) {
            if (event.type() != EventType.STREAM_CHUNK) {
                filtered.add(event);
            }
        }
        return filtered;
    }

    public List<Commis> commis(String runId) {
        getRun(runId);
        return runStore.findCommisByRun(runId);
    }

    public List<Commis> fanOut(String runId, List<WorkSpec> specs) {
        getRun(runId);
        return dispatcher.fanOut(runId, specs);
    }

    public CommisReport completeCommis(String commisId, String result) {
        return dispatcher.complete(commisId, result);
    }

    public CommisReport failCommis(String commisId, String error) {
        return dispatcher.fail(commisId, error);
    }

    public boolean recordCommisActivity(String commisId, EventType type, String toolName,
            Map<String, Object> details) {
        return dispatcher.recordCommisActivity(commisId, type, toolName, details);
    }

    public Map<RunStatus, Integer> countsByStatus() {
        Map<RunStatus, Integer> counts = new EnumMap<>(RunStatus.class);
        for (RunStatus status : RunStatus.values()) {
            counts.put(status, runStore.countByStatus(status));
        }
        return counts;
    }
}
