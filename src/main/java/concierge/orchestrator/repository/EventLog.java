package concierge.orchestrator.repository;

import concierge.orchestrator.model.EventType;
import concierge.orchestrator.model.RunEvent;

import java.util.List;
import java.util.Map;

/**
 * Append-only, per-run ordered event log.
 */
public interface EventLog {

    /**
     * Append an event at the next sequence number of the run.
     *
     * @param runId         the run
     * @param type          event type
     * @param payload       event data
     * @param correlationId the run's correlation id
     * @return the stored event with its sequence number
     * @throws ConflictException if a concurrent appender claimed the same
     *                           sequence; nothing was written
     */
    RunEvent append(String runId, EventType type, Map<String, Object> payload, String correlationId);

    /**
     * Read events with sequence greater than {@code afterSequence}, ordered.
     * Idempotent and safe for any number of concurrent readers.
     *
     * @param runId         the run
     * @param afterSequence watermark (0 reads from the start)
     * @return ordered events
     */
    List<RunEvent> readFrom(String runId, long afterSequence);

    /**
     * Last sequence number of the run, 0 if the log is empty.
     */
    long tail(String runId);
}
