package concierge.orchestrator.client;

import concierge.orchestrator.model.EventEnvelope;
import concierge.orchestrator.model.EventType;
import concierge.orchestrator.model.PayloadKeys;
import concierge.orchestrator.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Consumer-side projection of pushed or polled events.
 *
 * Events are de-duplicated by (run, sequence) and applied as they arrive, even
 * out of order. Tool activity for a commis whose spawn event has not arrived
 * yet creates a placeholder marked {@code pendingDetails}; the spawn event fills
 * it in. Unknown event types and newer protocol versions are ignored.
 */
public final class RunStateTracker {

    private static final Logger log = LoggerFactory.getLogger(RunStateTracker.class);

    /** What {@link #apply} did with an envelope */
    public enum Outcome {
        APPLIED, DUPLICATE, IGNORED
    }

    private final Map<String, RunTrack> runs = new LinkedHashMap<>();
    private final Map<String, CommisView> commis = new LinkedHashMap<>();

    private static final class RunTrack {
        final String runId;
        final Set<Long> seen = new TreeSet<>();
        String correlationId;
        RunStatus status = RunStatus.PENDING;
        long statusSeq;
        long contiguousSeq;
        long highestSeq;
        String result;
        String error;

        RunTrack(String runId) {
            this.runId = runId;
        }

        boolean markSeen(long seq) {
            if (seq <= contiguousSeq || !seen.add(seq)) {
                return false;
            }
            highestSeq = Math.max(highestSeq, seq);
            while (seen.remove(contiguousSeq + 1)) {
                contiguousSeq++;
            }
            return true;
        }

        RunView view() {
            return new RunView(runId, correlationId, status, statusSeq, contiguousSeq, highestSeq, result, error);
        }
    }

    public synchronized Outcome apply(EventEnvelope envelope) {
        if (envelope == null || envelope.v() > EventEnvelope.VERSION) {
            return Outcome.IGNORED;
        }
        Optional<EventType> resolved = EventType.fromWire(envelope.type());
        if (resolved.isEmpty()) {
            log.debug("Ignoring frame of unknown type {}", envelope.type());
            return Outcome.IGNORED;
        }
        EventType type = resolved.get();
        Map<String, Object> data = envelope.data();
        String runId = string(data, PayloadKeys.RUN_ID);
        long seq = longValue(data.get(PayloadKeys.SEQ));

        RunTrack run = null;
        if (runId != null) {
            run = runs.computeIfAbsent(runId, RunTrack::new);
            if (seq > 0 && !run.markSeen(seq)) {
                return Outcome.DUPLICATE;
            }
            String correlationId = string(data, PayloadKeys.CORRELATION_ID);
            if (correlationId != null) {
                run.correlationId = correlationId;
            }
        }

        switch (type) {
            case COMMIS_SPAWNED -> onSpawned(runId, data);
            case COMMIS_TOOL_STARTED, COMMIS_TOOL_COMPLETED -> onActivity(runId, type, data);
            case COMMIS_COMPLETE -> onComplete(runId, data);
            default -> {
                // stream events carry no projected state
            }
        }
        if (run != null && type.isLifecycle()) {
            onLifecycle(run, type, seq, data);
        }
        return Outcome.APPLIED;
    }

    private void onLifecycle(RunTrack run, EventType type, long seq, Map<String, Object> data) {
        if (seq > 0 && seq <= run.statusSeq) {
            return;
        }
        RunStatus status = switch (type) {
            case RUN_STARTED -> RunStatus.RUNNING;
            case RUN_WAITING -> RunStatus.WAITING;
            case RUN_RESUMED -> RunStatus.RESUMED;
            case RUN_SUCCESS -> RunStatus.SUCCESS;
            case RUN_FAILED -> RunStatus.FAILED;
            default -> null;
        };
        if (status == null) {
            return;
        }
        run.status = status;
        run.statusSeq = Math.max(run.statusSeq, seq);
        if (type == EventType.RUN_SUCCESS) {
            run.result = string(data, PayloadKeys.RESULT);
        } else if (type == EventType.RUN_FAILED) {
            run.error = string(data, PayloadKeys.ERROR);
        }
    }

    private void onSpawned(String runId, Map<String, Object> data) {
        String commisId = string(data, PayloadKeys.COMMIS_ID);
        if (commisId == null) {
            return;
        }
        CommisView existing = commis.get(commisId);
        if (existing != null && !existing.pendingDetails()) {
            return;
        }
        int spawnIndex = (int) longValue(data.get(PayloadKeys.SPAWN_INDEX));
        String task = string(data, PayloadKeys.TASK);
        if (existing == null) {
            commis.put(commisId, new CommisView(commisId, runId, spawnIndex, task, "spawned", false, List.of()));
        } else {
            commis.put(commisId, new CommisView(commisId, runId, spawnIndex, task, existing.status(), false,
                    existing.activity()));
            log.debug("Commis {} details resolved for run {}", commisId, runId);
        }
    }

    private void onActivity(String runId, EventType type, Map<String, Object> data) {
        String commisId = string(data, PayloadKeys.COMMIS_ID);
        if (commisId == null) {
            return;
        }
        CommisView view = commis.get(commisId);
        if (view == null) {
            view = CommisView.placeholder(commisId, runId);
            log.debug("Activity for unseen commis {}, holding placeholder", commisId);
        }
        List<String> activity = new ArrayList<>(view.activity());
        String phase = type == EventType.COMMIS_TOOL_STARTED ? "started" : "completed";
        activity.add(string(data, PayloadKeys.TOOL_NAME) + ":" + phase);
        commis.put(commisId, new CommisView(commisId, view.runId() != null ? view.runId() : runId,
                view.spawnIndex(), view.task(), view.status(), view.pendingDetails(), activity));
    }

    private void onComplete(String runId, Map<String, Object> data) {
        String commisId = string(data, PayloadKeys.COMMIS_ID);
        if (commisId == null) {
            return;
        }
        CommisView view = commis.get(commisId);
        if (view == null) {
            view = CommisView.placeholder(commisId, runId);
        }
        String status = "failed".equals(string(data, PayloadKeys.STATUS)) ? "failed" : "success";
        commis.put(commisId, new CommisView(commisId, view.runId() != null ? view.runId() : runId,
                view.spawnIndex(), view.task(), status, view.pendingDetails(), view.activity()));
    }

    public synchronized Optional<RunView> run(String runId) {
        RunTrack run = runs.get(runId);
        return run != null ? Optional.of(run.view()) : Optional.empty();
    }

    public synchronized Optional<CommisView> commis(String commisId) {
        return Optional.ofNullable(commis.get(commisId));
    }

    /** Commis of the run in spawn order; placeholders last */
    public synchronized List<CommisView> commisOf(String runId) {
        List<CommisView> result = new ArrayList<>();
        for (CommisView view : commis.values()) {
            if (runId.equals(view.runId())) {
                result.add(view);
            }
        }
        result.sort((a, b) -> Integer.compare(
                a.spawnIndex() < 0 ? Integer.MAX_VALUE : a.spawnIndex(),
                b.spawnIndex() < 0 ? Integer.MAX_VALUE : b.spawnIndex()));
        return result;
    }

    /** Commis seen only through activity so far */
    public synchronized List<CommisView> pendingDetails() {
        List<CommisView> result = new ArrayList<>();
        for (CommisView view : commis.values()) {
            if (view.pendingDetails()) {
                result.add(view);
            }
        }
        return result;
    }

    /** Highest sequence delivered without gaps; resubscribe from here */
    public synchronized long watermark(String runId) {
        RunTrack run = runs.get(runId);
        return run != null ? run.contiguousSeq : 0;
    }

    public synchronized boolean hasGap(String runId) {
        RunTrack run = runs.get(runId);
        return run != null && run.highestSeq > run.contiguousSeq;
    }

    private static String string(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    private static long longValue(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}
