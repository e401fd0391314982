package concierge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Versioned push frame: {@code {v, type, topic, ts, data}}.
 *
 * Event frames carry an {@link EventType} wire name in {@code type}; control
 * frames (connected, subscribed, pong, error) use their own names. Consumers
 * skip types they do not know and frames with a newer {@code v}.
 */
public record EventEnvelope(
        @JsonProperty("v") int v,
        @JsonProperty("type") String type,
        @JsonProperty("topic") String topic,
        @JsonProperty("ts") long ts,
        @JsonProperty("data") Map<String, Object> data) {

    public static final int VERSION = 1;

    public static final String TYPE_CONNECTED = "connected";
    public static final String TYPE_SUBSCRIBED = "subscribed";
    public static final String TYPE_UNSUBSCRIBED = "unsubscribed";
    public static final String TYPE_PONG = "pong";
    public static final String TYPE_ERROR = "error";

    public EventEnvelope {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(topic, "topic is required");
        data = data == null ? Map.of() : data;
    }

    public static String runTopic(String runId) {
        return "run:" + runId;
    }

    public static String tenantTopic(String tenantId) {
        return "tenant:" + tenantId;
    }

    /**
     * Wrap a logged event. {@code data} is the payload plus the routing context a
     * consumer needs without a follow-up fetch.
     */
    public static EventEnvelope of(RunEvent event, String threadId) {
        Map<String, Object> data = new LinkedHashMap<>(event.payload());
        data.put(PayloadKeys.RUN_ID, event.runId());
        data.put(PayloadKeys.SEQ, event.sequence());
        data.put(PayloadKeys.CORRELATION_ID, event.correlationId());
        if (threadId != null) {
            data.put(PayloadKeys.THREAD_ID, threadId);
        }
        long ts = event.timestamp() != null ? event.timestamp().toEpochMilli() : System.currentTimeMillis();
        return new EventEnvelope(VERSION, event.type().wireName(), runTopic(event.runId()), ts, data);
    }

    public static EventEnvelope control(String type, String topic, Map<String, Object> data) {
        return new EventEnvelope(VERSION, type, topic, System.currentTimeMillis(), data);
    }
}
