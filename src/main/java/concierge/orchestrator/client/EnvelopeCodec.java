package concierge.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import concierge.orchestrator.model.EventEnvelope;
import concierge.orchestrator.model.EventType;
import concierge.orchestrator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes push frames.
 *
 * Decoding never throws: malformed frames and frames from a newer protocol
 * version decode to empty.
 */
public final class EnvelopeCodec {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeCodec.class);

    private EnvelopeCodec() {
    }

    public static String encode(EventEnvelope envelope) {
        return Json.write(envelope);
    }

    public static Optional<EventEnvelope> decode(String frame) {
        if (frame == null || frame.isBlank()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = Json.mapper().readTree(frame);
        } catch (JsonProcessingException e) {
            log.debug("Dropping malformed frame: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }

        int version = node.path("v").asInt(0);
        if (version < 1 || version > EventEnvelope.VERSION) {
            log.debug("Ignoring frame with unsupported version {}", version);
            return Optional.empty();
        }
        String type = node.path("type").asText(null);
        if (type == null || type.isBlank()) {
            return Optional.empty();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        JsonNode dataNode = node.get("data");
        if (dataNode != null && dataNode.isObject()) {
            data = Json.mapper().convertValue(dataNode, Json.mapper().getTypeFactory()
                    .constructMapType(LinkedHashMap.class, String.class, Object.class));
        }
        String topic = node.path("topic").asText("");
        long ts = node.path("ts").asLong(0);
        return Optional.of(new EventEnvelope(version, type, topic, ts, data));
    }

    /**
     * Event type of the frame, resolving legacy names. Empty for control
     * frames and unknown types.
     */
    public static Optional<EventType> eventType(EventEnvelope envelope) {
        return EventType.fromWire(envelope.type());
    }
}
