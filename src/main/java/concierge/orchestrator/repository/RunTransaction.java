package concierge.orchestrator.repository;

import concierge.orchestrator.model.Commis;
import concierge.orchestrator.model.EventType;
import concierge.orchestrator.model.Run;
import concierge.orchestrator.model.RunEvent;
import concierge.orchestrator.model.RunState;

import java.util.Map;

/**
 * A unit of work holding the exclusive lock on one run.
 *
 * Appends made through the transaction and the cached projection they imply
 * commit together or not at all.
 */
public interface RunTransaction {

    /** The locked run row as it was when the lock was taken */
    Run run();

    /** Folded state including events appended so far in this transaction */
    RunState state();

    /**
     * Append an event at the next sequence number.
     *
     * @throws ConflictException if the sequence was claimed outside the lock
     */
    RunEvent append(EventType type, Map<String, Object> payload);

    /** Index a new commis so it can later be found by id alone */
    void registerCommis(Commis commis);
}
