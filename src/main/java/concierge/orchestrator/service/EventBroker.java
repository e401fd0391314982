package concierge.orchestrator.service;

import concierge.orchestrator.model.EventEnvelope;
import concierge.orchestrator.model.Run;
import concierge.orchestrator.model.RunEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of committed events to live subscribers.
 *
 * Topics are {@code run:{id}} and {@code tenant:{id}}. Publishing happens after
 * commit, so a subscriber may see events out of order or miss some; the log
 * stays authoritative and subscribers de-duplicate by sequence.
 */
public final class EventBroker {

    private static final Logger log = LoggerFactory.getLogger(EventBroker.class);

    private final Map<String, CopyOnWriteArrayList<Consumer<Published>>> topics = new ConcurrentHashMap<>();

    /**
     * A committed event with the run context needed to build a push frame.
     */
    public record Published(RunEvent event, String threadId, String tenantId) {

        public EventEnvelope envelope() {
            return EventEnvelope.of(event, threadId);
        }
    }

    /**
     * Register a listener. Close the returned handle to unsubscribe.
     */
    public AutoCloseable subscribe(String topic, Consumer<Published> listener) {
        topics.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(listener);
        log.debug("Subscribed to {}", topic);
        return () -> unsubscribe(topic, listener);
    }

    public void publish(Run run, List<RunEvent> events) {
        for (RunEvent event : events) {
            Published published = new Published(event, run.threadId(), run.tenantId());
            deliver(EventEnvelope.runTopic(run.id()), published);
            if (run.tenantId() != null) {
                deliver(EventEnvelope.tenantTopic(run.tenantId()), published);
            }
        }
    }

    public int subscriberCount(String topic) {
        List<Consumer<Published>> listeners = topics.get(topic);
        return listeners != null ? listeners.size() : 0;
    }

    private void unsubscribe(String topic, Consumer<Published> listener) {
        topics.computeIfPresent(topic, (t, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    private void deliver(String topic, Published published) {
        List<Consumer<Published>> listeners = topics.get(topic);
        if (listeners == null) {
            return;
        }
        for (Consumer<Published> listener : listeners) {
            try {
                listener.accept(published);
            } catch (RuntimeException e) {
                log.warn("Listener on {} failed for {}: {}", topic, published.event(), e.getMessage());
            }
        }
    }
}
