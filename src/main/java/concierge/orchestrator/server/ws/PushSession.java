package concierge.orchestrator.server.ws;

import concierge.orchestrator.model.EventEnvelope;
import concierge.orchestrator.model.EventType;
import concierge.orchestrator.model.Run;
import concierge.orchestrator.model.RunEvent;
import concierge.orchestrator.repository.RunNotFoundException;
import concierge.orchestrator.service.EventBroker;
import concierge.orchestrator.service.EventBroker.Published;
import concierge.orchestrator.service.RunService;
import concierge.orchestrator.util.Json;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One WebSocket connection's subscriptions.
 *
 * All state is confined to the channel's event loop: broker callbacks hop onto
 * it before touching anything. Each run keeps a delivered-sequence watermark;
 * live events at or below it are dropped and a live event beyond the next
 * sequence triggers a read from the log so frames go out in order.
 */
public class PushSession {

    private static final Logger log = LoggerFactory.getLogger(PushSession.class);

    private final Channel channel;
    private final String tenantId;
    private final RunService runService;
    private final EventBroker broker;

    private final Map<String, AutoCloseable> subscriptions = new HashMap<>();
    private final Map<String, RunCursor> cursors = new HashMap<>();
    private boolean closed;

    private static final class RunCursor {
        long lastSeq;
        String threadId;
        boolean includeTokens = true;

        RunCursor(long lastSeq, String threadId) {
            this.lastSeq = lastSeq;
            this.threadId = threadId;
        }
    }

    public PushSession(Channel channel, String tenantId, RunService runService, EventBroker broker) {
        this.channel = channel;
        this.tenantId = tenantId;
        this.runService = runService;
        this.broker = broker;
    }

    public String tenantId() {
        return tenantId;
    }

    /** Greet the client once the handshake completed */
    public void onConnected() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tenant_id", tenantId);
        send(EventEnvelope.control(EventEnvelope.TYPE_CONNECTED, "session", data));
    }

    /**
     * Handle a client text frame.
     * Supported: subscribe, unsubscribe, ping. Anything else yields an error frame.
     */
    public void onMessage(String text) {
        Map<String, Object> message;
        try {
            message = Json.readMap(text);
        } catch (IllegalArgumentException e) {
            sendError(null, "malformed message");
            return;
        }

        Object type = message.get("type");
        Object topicValue = message.get("topic");
        String topic = topicValue != null ? topicValue.toString() : null;

        if ("ping".equals(type)) {
            send(EventEnvelope.control(EventEnvelope.TYPE_PONG, "session", Map.of()));
        } else if ("subscribe".equals(type)) {
            subscribe(topic, longValue(message.get("after")), !Boolean.FALSE.equals(message.get("includeTokens")));
        } else if ("unsubscribe".equals(type)) {
            unsubscribe(topic);
        } else {
            sendError(topic, "unsupported message type: " + type);
        }
    }

    private void subscribe(String topic, long after, boolean includeTokens) {
        if (topic == null || topic.isBlank()) {
            sendError(null, "topic is required");
            return;
        }
        if (after < 0) {
            sendError(topic, "after must be >= 0");
            return;
        }
        if (subscriptions.containsKey(topic)) {
            sendError(topic, "already subscribed");
            return;
        }

        if (topic.startsWith("run:")) {
            subscribeRun(topic, topic.substring("run:".length()), after, includeTokens);
        } else if (topic.startsWith("tenant:")) {
            subscribeTenant(topic, topic.substring("tenant:".length()));
        } else {
            sendError(topic, "unknown topic");
        }
    }

    private void subscribeRun(String topic, String runId, long after, boolean includeTokens) {
        Run run = findRun(runId);
        if (run == null) {
            sendError(topic, "run not found");
            return;
        }
        if (!visible(run)) {
            sendError(topic, "forbidden");
            return;
        }

        RunCursor cursor = cursors.computeIfAbsent(runId, id -> new RunCursor(after, run.threadId()));
        cursor.lastSeq = Math.max(cursor.lastSeq, after);
        cursor.includeTokens = includeTokens;

        // Listen before replaying so nothing committed in between is lost
        subscriptions.put(topic, broker.subscribe(topic, this::onPublished));
        send(EventEnvelope.control(EventEnvelope.TYPE_SUBSCRIBED, topic, Map.of("after", after)));
        catchUp(runId, cursor);
        log.debug("Session subscribed to {} after {}", topic, after);
    }

    private void subscribeTenant(String topic, String requestedTenant) {
        if (tenantId == null || !tenantId.equals(requestedTenant)) {
            sendError(topic, "forbidden");
            return;
        }
        subscriptions.put(topic, broker.subscribe(topic, this::onPublished));
        send(EventEnvelope.control(EventEnvelope.TYPE_SUBSCRIBED, topic, Map.of()));
    }

    private void unsubscribe(String topic) {
        AutoCloseable subscription = topic != null ? subscriptions.remove(topic) : null;
        if (subscription == null) {
            sendError(topic, "not subscribed");
            return;
        }
        closeQuietly(topic, subscription);
        if (topic.startsWith("run:")) {
            cursors.remove(topic.substring("run:".length()));
        }
        send(EventEnvelope.control(EventEnvelope.TYPE_UNSUBSCRIBED, topic, Map.of()));
    }

    private void onPublished(Published published) {
        channel.eventLoop().execute(() -> deliver(published));
    }

    private void deliver(Published published) {
        if (closed) {
            return;
        }
        RunEvent event = published.event();
        RunCursor cursor = cursors.get(event.runId());
        if (cursor == null) {
            // First sight through a tenant topic: start from this event
            cursor = new RunCursor(event.sequence() - 1, published.threadId());
            cursors.put(event.runId(), cursor);
        }
        if (event.sequence() <= cursor.lastSeq) {
            return;
        }
        if (event.sequence() == cursor.lastSeq + 1) {
            emit(cursor, event);
            return;
        }
        catchUp(event.runId(), cursor);
    }

    private void catchUp(String runId, RunCursor cursor) {
        List<RunEvent> missed = runService.events(runId, cursor.lastSeq, true);
        for (RunEvent event : missed) {
            emit(cursor, event);
        }
    }

    private void emit(RunCursor cursor, RunEvent event) {
        cursor.lastSeq = event.sequence();
        if (!cursor.includeTokens && event.type() == EventType.STREAM_CHUNK) {
            return;
        }
        send(EventEnvelope.of(event, cursor.threadId));
    }

    private Run findRun(String runId) {
        try {
            return runService.getRun(runId);
        } catch (RunNotFoundException e) {
            return null;
        }
    }

    private boolean visible(Run run) {
        return run.tenantId() == null || run.tenantId().equals(tenantId);
    }

    private void sendError(String topic, String message) {
        send(EventEnvelope.control(EventEnvelope.TYPE_ERROR, topic != null ? topic : "session",
                Map.of("message", message)));
    }

    private void send(EventEnvelope envelope) {
        if (channel.isActive()) {
            channel.writeAndFlush(new TextWebSocketFrame(Json.write(envelope)));
        }
    }

    /** Drop every subscription; called when the channel closes */
    public void close() {
        closed = true;
        for (Map.Entry<String, AutoCloseable> entry : subscriptions.entrySet()) {
            closeQuietly(entry.getKey(), entry.getValue());
        }
        subscriptions.clear();
        cursors.clear();
    }

    private static void closeQuietly(String topic, AutoCloseable subscription) {
        try {
            subscription.close();
        } catch (Exception e) {
            log.warn("Failed to close subscription to {}: {}", topic, e.getMessage());
        }
    }

    private static long longValue(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        return 0;
    }
}
