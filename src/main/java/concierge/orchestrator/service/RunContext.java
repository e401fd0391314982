package concierge.orchestrator.service;

import concierge.orchestrator.model.EventType;
import concierge.orchestrator.model.PayloadKeys;
import concierge.orchestrator.model.Run;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * View of a run handed to a concierge step.
 */
public final class RunContext {

    private final Run run;
    private final RunStateMachine stateMachine;

    RunContext(Run run, RunStateMachine stateMachine) {
        this.run = run;
        this.stateMachine = stateMachine;
    }

    public String runId() {
        return run.id();
    }

    public String correlationId() {
        return run.correlationId();
    }

    public String threadId() {
        return run.threadId();
    }

    public String tenantId() {
        return run.tenantId();
    }

    public String task() {
        return run.task();
    }

    /** Append an informational event to the run's log */
    public void emit(EventType type, Map<String, Object> payload) {
        stateMachine.emit(run.id(), type, payload);
    }

    public void streamStart(String messageId) {
        emit(EventType.STREAM_START, message(messageId));
    }

    public void streamChunk(String messageId, String token) {
        Map<String, Object> payload = message(messageId);
        payload.put(PayloadKeys.TOKEN, token);
        emit(EventType.STREAM_CHUNK, payload);
    }

    public void streamEnd(String messageId) {
        emit(EventType.STREAM_END, message(messageId));
    }

    private static Map<String, Object> message(String messageId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.MESSAGE_ID, messageId);
        return payload;
    }
}
