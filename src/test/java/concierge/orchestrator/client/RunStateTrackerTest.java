package concierge.orchestrator.client;

import concierge.orchestrator.client.RunStateTracker.Outcome;
import concierge.orchestrator.model.EventEnvelope;
import concierge.orchestrator.model.PayloadKeys;
import concierge.orchestrator.model.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunStateTrackerTest {

    private static final String RUN = "run-1";

    private RunStateTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new RunStateTracker();
    }

    private static EventEnvelope frame(String type, long seq, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>(extra);
        data.put(PayloadKeys.RUN_ID, RUN);
        data.put(PayloadKeys.SEQ, seq);
        data.put(PayloadKeys.CORRELATION_ID, "corr-1");
        return new EventEnvelope(1, type, "run:" + RUN, 0, data);
    }

    @Test
    @DisplayName("Replayed frames are detected as duplicates")
    void deduplicatesBySequence() {
        assertEquals(Outcome.APPLIED, tracker.apply(frame("run_started", 1, Map.of())));
        assertEquals(Outcome.DUPLICATE, tracker.apply(frame("run_started", 1, Map.of())));

        RunView view = tracker.run(RUN).orElseThrow();
        assertEquals(RunStatus.RUNNING, view.status());
        assertEquals("corr-1", view.correlationId());
        assertEquals(1, tracker.watermark(RUN));
    }

    @Test
    @DisplayName("Out-of-order frames leave a gap until the missing one arrives")
    void tracksGaps() {
        tracker.apply(frame("run_started", 1, Map.of()));
        tracker.apply(frame("run_waiting", 3, Map.of()));

        assertTrue(tracker.hasGap(RUN));
        assertEquals(1, tracker.watermark(RUN));
        assertEquals(RunStatus.WAITING, tracker.run(RUN).orElseThrow().status());

        tracker.apply(frame("commis_spawned", 2, Map.of(PayloadKeys.COMMIS_ID, "c-1", PayloadKeys.SPAWN_INDEX, 0)));
        assertFalse(tracker.hasGap(RUN));
        assertEquals(3, tracker.watermark(RUN));
        assertEquals(Outcome.DUPLICATE, tracker.apply(frame("run_waiting", 3, Map.of())));
    }

    @Test
    @DisplayName("A late lifecycle frame does not roll the status back")
    void statusFollowsHighestLifecycleSequence() {
        tracker.apply(frame("run_started", 1, Map.of()));
        tracker.apply(frame("run_success", 3, Map.of(PayloadKeys.RESULT, "answer")));
        tracker.apply(frame("run_waiting", 2, Map.of()));

        RunView view = tracker.run(RUN).orElseThrow();
        assertEquals(RunStatus.SUCCESS, view.status());
        assertEquals(3, view.statusSeq());
        assertEquals("answer", view.result());
    }

    @Test
    @DisplayName("Activity for an unseen commis creates a placeholder that spawn later resolves")
    void orphanActivity() {
        tracker.apply(frame("commis_tool_started", 3,
                Map.of(PayloadKeys.COMMIS_ID, "c-9", PayloadKeys.TOOL_NAME, "search")));

        CommisView placeholder = tracker.commis("c-9").orElseThrow();
        assertTrue(placeholder.pendingDetails());
        assertEquals(-1, placeholder.spawnIndex());
        assertEquals(List.of("search:started"), placeholder.activity());
        assertEquals(1, tracker.pendingDetails().size());

        tracker.apply(frame("commis_spawned", 2,
                Map.of(PayloadKeys.COMMIS_ID, "c-9", PayloadKeys.SPAWN_INDEX, 1, PayloadKeys.TASK, "look up")));

        CommisView resolved = tracker.commis("c-9").orElseThrow();
        assertFalse(resolved.pendingDetails());
        assertEquals(1, resolved.spawnIndex());
        assertEquals("look up", resolved.task());
        assertEquals(List.of("search:started"), resolved.activity());
        assertTrue(tracker.pendingDetails().isEmpty());
    }

    @Test
    void commisOrderingAndCompletion() {
        tracker.apply(frame("commis_spawned", 2, Map.of(PayloadKeys.COMMIS_ID, "c-b", PayloadKeys.SPAWN_INDEX, 1)));
        tracker.apply(frame("commis_spawned", 1, Map.of(PayloadKeys.COMMIS_ID, "c-a", PayloadKeys.SPAWN_INDEX, 0)));
        tracker.apply(frame("commis_complete", 4, Map.of(PayloadKeys.COMMIS_ID, "c-x", PayloadKeys.STATUS, "failed")));
        tracker.apply(frame("commis_complete", 3, Map.of(PayloadKeys.COMMIS_ID, "c-b", PayloadKeys.STATUS, "success")));

        List<CommisView> views = tracker.commisOf(RUN);
        assertEquals(List.of("c-a", "c-b", "c-x"), views.stream().map(CommisView::commisId).toList());
        assertEquals("spawned", views.get(0).status());
        assertEquals("success", views.get(1).status());
        assertEquals("failed", views.get(2).status());
        assertTrue(views.get(2).pendingDetails());
    }

    @Test
    @DisplayName("Unknown types, control frames and newer versions are ignored")
    void ignoresUnknown() {
        assertEquals(Outcome.IGNORED, tracker.apply(frame("something_new", 1, Map.of())));
        assertEquals(Outcome.IGNORED, tracker.apply(
                EventEnvelope.control(EventEnvelope.TYPE_CONNECTED, "system", Map.of())));
        assertEquals(Outcome.IGNORED, tracker.apply(
                new EventEnvelope(2, "run_started", "run:" + RUN, 0, Map.of(PayloadKeys.RUN_ID, RUN))));
        assertEquals(Outcome.IGNORED, tracker.apply(null));
        assertTrue(tracker.run(RUN).isEmpty());
    }

    @Test
    void legacyNamesAreUnderstood() {
        tracker.apply(frame("oikos_started", 1, Map.of()));
        tracker.apply(frame("concierge_complete", 2, Map.of(PayloadKeys.RESULT, "ok")));
        assertEquals(RunStatus.SUCCESS, tracker.run(RUN).orElseThrow().status());
    }
}
