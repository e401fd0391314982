package concierge.orchestrator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable fact appended to a run's event log.
 *
 * @param runId         owning run
 * @param sequence      1-based, gap-free per run
 * @param type          event type
 * @param payload       event data (JSON object)
 * @param timestamp     append time
 * @param correlationId the run's correlation id
 */
public record RunEvent(
        String runId,
        long sequence,
        EventType type,
        Map<String, Object> payload,
        Instant timestamp,
        String correlationId) {

    public RunEvent {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(type, "type is required");
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1, got " + sequence);
        }
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public String string(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }

    public int intValue(String key, int fallback) {
        Object value = payload.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            return Integer.parseInt(s.trim());
        }
        return fallback;
    }

    @Override
    public String toString() {
        return "RunEvent{" + runId + "#" + sequence + " " + type.wireName() + "}";
    }
}
