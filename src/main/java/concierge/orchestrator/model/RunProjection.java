package concierge.orchestrator.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure projection of a run's event log into {@link RunState}.
 *
 * The projection does not validate business rules (that is the state machine's
 * job before it appends); it only requires events to arrive in sequence.
 */
public final class RunProjection {

    private RunProjection() {
    }

    /**
     * Left-fold the given events, starting from the empty state.
     *
     * @throws IllegalArgumentException if events are not contiguous from 1 or
     *                                  belong to another run
     */
    public static RunState fold(String runId, List<RunEvent> events) {
        RunState state = RunState.initial(runId);
        for (RunEvent event : events) {
            state = apply(state, event);
        }
        return state;
    }

    /**
     * Apply one event. The event must be the next in sequence.
     */
    public static RunState apply(RunState state, RunEvent event) {
        if (!state.runId().equals(event.runId())) {
            throw new IllegalArgumentException(
                    "event " + event + " does not belong to run " + state.runId());
        }
        if (event.sequence() != state.lastSequence() + 1) {
            throw new IllegalArgumentException("expected sequence " + (state.lastSequence() + 1)
                    + " for run " + state.runId() + ", got " + event.sequence());
        }

        RunStatus status = state.status();
        String result = state.result();
        String error = state.error();
        Map<String, Commis> commis = state.commisMap();
        List<String> wave = state.wave();
        List<String> pending = state.pendingSpawns();

        switch (event.type()) {
            case RUN_STARTED -> status = RunStatus.RUNNING;
            case COMMIS_SPAWNED -> {
                String commisId = event.string(PayloadKeys.COMMIS_ID);
                if (commisId != null && !commis.containsKey(commisId)) {
                    commis = new LinkedHashMap<>(commis);
                    commis.put(commisId, Commis.spawned(
                            commisId,
                            state.runId(),
                            event.intValue(PayloadKeys.SPAWN_INDEX, commis.size()),
                            event.string(PayloadKeys.TASK),
                            event.string(PayloadKeys.TOOL_CALL_ID)));
                    pending = new ArrayList<>(pending);
                    pending.add(commisId);
                }
            }
            case RUN_WAITING -> {
                status = RunStatus.WAITING;
                wave = waveFrom(event, pending);
                pending = List.of();
            }
            case COMMIS_COMPLETE -> {
                String commisId = event.string(PayloadKeys.COMMIS_ID);
                Commis existing = commisId != null ? commis.get(commisId) : null;
                if (existing != null && !existing.isTerminal()) {
                    commis = new LinkedHashMap<>(commis);
                    boolean failed = "failed".equals(event.string(PayloadKeys.STATUS));
                    commis.put(commisId, failed
                            ? existing.failed(event.string(PayloadKeys.ERROR))
                            : existing.completed(event.string(PayloadKeys.RESULT)));
                }
            }
            case RUN_RESUMED -> status = RunStatus.RESUMED;
            case RUN_SUCCESS -> {
                status = RunStatus.SUCCESS;
                result = event.string(PayloadKeys.RESULT);
            }
            case RUN_FAILED -> {
                status = RunStatus.FAILED;
                error = event.string(PayloadKeys.ERROR);
            }
            default -> {
                // informational: stream tokens, tool activity
            }
        }

        return state.with(status, result, error, commis, wave, pending, event.sequence());
    }

    private static List<String> waveFrom(RunEvent event, List<String> pending) {
        Object ids = event.payload().get(PayloadKeys.COMMIS_IDS);
        if (ids instanceof List<?> list && !list.isEmpty()) {
            List<String> wave = new ArrayList<>(list.size());
            for (Object id : list) {
                wave.add(String.valueOf(id));
            }
            return wave;
        }
        return pending;
    }
}
