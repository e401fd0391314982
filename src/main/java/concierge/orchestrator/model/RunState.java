package concierge.orchestrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derived state of a run and its commis, produced by {@link RunProjection#fold}.
 * Immutable; every applied event yields a new instance.
 */
public final class RunState {

    private final String runId;
    private final RunStatus status;
    private final String result;
    private final String error;
    private final Map<String, Commis> commis; // spawn order
    private final List<String> wave;
    private final List<String> pendingSpawns;
    private final long lastSequence;

    RunState(String runId, RunStatus status, String result, String error,
            Map<String, Commis> commis, List<String> wave, List<String> pendingSpawns, long lastSequence) {
        this.runId = runId;
        this.status = status;
        this.result = result;
        this.error = error;
        this.commis = Collections.unmodifiableMap(new LinkedHashMap<>(commis));
        this.wave = List.copyOf(wave);
        this.pendingSpawns = List.copyOf(pendingSpawns);
        this.lastSequence = lastSequence;
    }

    public static RunState initial(String runId) {
        return new RunState(runId, RunStatus.PENDING, null, null, Map.of(), List.of(), List.of(), 0);
    }

    public String runId() {
        return runId;
    }

    public RunStatus status() {
        return status;
    }

    public String result() {
        return result;
    }

    public String error() {
        return error;
    }

    public long lastSequence() {
        return lastSequence;
    }

    /** All commis of the run in spawn order */
    public List<Commis> commis() {
        return new ArrayList<>(commis.values());
    }

    public Optional<Commis> commis(String commisId) {
        return Optional.ofNullable(commis.get(commisId));
    }

    /** Commis ids the current (or last) barrier waits on, in spawn order */
    public List<String> wave() {
        return wave;
    }

    /** Commis spawned since the last barrier was armed */
    List<String> pendingSpawns() {
        return pendingSpawns;
    }

    Map<String, Commis> commisMap() {
        return commis;
    }

    public int waveSize() {
        return wave.size();
    }

    public int waveTerminalCount() {
        int count = 0;
        for (String id : wave) {
            Commis c = commis.get(id);
            if (c != null && c.isTerminal()) {
                count++;
            }
        }
        return count;
    }

    /** True when every commis of the current wave has reported */
    public boolean isBarrierSatisfied() {
        return !wave.isEmpty() && waveTerminalCount() == wave.size();
    }

    /** Results of the current wave ordered by spawn order */
    public List<CommisResult> waveResults() {
        List<CommisResult> results = new ArrayList<>(wave.size());
        for (String id : wave) {
            Commis c = commis.get(id);
            if (c != null) {
                results.add(CommisResult.from(c));
            }
        }
        results.sort((a, b) -> Integer.compare(a.spawnIndex(), b.spawnIndex()));
        return results;
    }

    RunState with(RunStatus status, String result, String error, Map<String, Commis> commis,
            List<String> wave, List<String> pendingSpawns, long lastSequence) {
        return new RunState(runId, status, result, error, commis, wave, pendingSpawns, lastSequence);
    }

    @Override
    public String toString() {
        return "RunState{" + runId + " " + status + " wave=" + waveTerminalCount() + "/" + waveSize()
                + " seq=" + lastSequence + "}";
    }
}
