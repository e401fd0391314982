package concierge.orchestrator.model;

import java.util.Map;
import java.util.Optional;

/**
 * Closed set of event types recorded in a run's event log.
 *
 * <p>
 * The wire name is what consumers see as {@code event_type} in polled events and
 * as {@code type} in push envelopes. Older producers used {@code oikos_*} and
 * {@code concierge_*} names for the same lifecycle facts; {@link #fromWire}
 * normalizes those so a consumer can read either vocabulary.
 */
public enum EventType {
    RUN_STARTED("run_started", true),
    STREAM_START("stream_start", false),
    STREAM_CHUNK("stream_chunk", false),
    STREAM_END("stream_end", false),
    COMMIS_SPAWNED("commis_spawned", true),
    COMMIS_TOOL_STARTED("commis_tool_started", false),
    COMMIS_TOOL_COMPLETED("commis_tool_completed", false),
    COMMIS_COMPLETE("commis_complete", true),
    RUN_WAITING("run_waiting", true),
    RUN_RESUMED("run_resumed", true),
    RUN_SUCCESS("run_success", true),
    RUN_FAILED("run_failed", true);

    private static final Map<String, EventType> LEGACY_ALIASES = Map.of(
            "oikos_started", RUN_STARTED,
            "oikos_waiting", RUN_WAITING,
            "oikos_resumed", RUN_RESUMED,
            "oikos_complete", RUN_SUCCESS,
            "concierge_started", RUN_STARTED,
            "concierge_waiting", RUN_WAITING,
            "concierge_resumed", RUN_RESUMED,
            "concierge_complete", RUN_SUCCESS);

    private final String wireName;
    private final boolean lifecycle;

    EventType(String wireName, boolean lifecycle) {
        this.wireName = wireName;
        this.lifecycle = lifecycle;
    }

    public String wireName() {
        return wireName;
    }

    /** Lifecycle events change run or commis state; the rest are informational */
    public boolean isLifecycle() {
        return lifecycle;
    }

    public boolean isTerminal() {
        return this == RUN_SUCCESS || this == RUN_FAILED;
    }

    /**
     * Resolve a wire name, accepting legacy aliases.
     * Unknown names yield empty so consumers can skip events from newer producers.
     */
    public static Optional<EventType> fromWire(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (EventType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.ofNullable(LEGACY_ALIASES.get(name));
    }
}
