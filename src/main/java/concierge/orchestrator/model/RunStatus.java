package concierge.orchestrator.model;

import java.util.Locale;

/**
 * Lifecycle status of a run.
 */
public enum RunStatus {
    /** Created, no event recorded yet */
    PENDING,
    /** Concierge step is executing */
    RUNNING,
    /** Fanned out, blocked on the commis barrier */
    WAITING,
    /** Barrier released, continuation executing */
    RESUMED,
    /** Finished successfully */
    SUCCESS,
    /** Finished with an error */
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    /** A run in this state may fan out, stream, or finish */
    public boolean isActive() {
        return this == RUNNING || this == RESUMED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RunStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
