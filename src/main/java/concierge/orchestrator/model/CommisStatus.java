package concierge.orchestrator.model;

import java.util.Locale;

/**
 * Commis execution status.
 */
public enum CommisStatus {
    /** Spawned, result not reported yet */
    SPAWNED,
    /** Reported a result */
    COMPLETE,
    /** Reported an error (still counts toward the barrier) */
    FAILED;

    public boolean isTerminal() {
        return this != SPAWNED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
