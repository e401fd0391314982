package concierge.orchestrator.api.v1.dto;

import concierge.orchestrator.model.Commis;
import concierge.orchestrator.model.Run;
import concierge.orchestrator.model.RunStatus;
import concierge.orchestrator.util.Json;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RunResponseTest {

    @Test
    void fromRunUsesWireStatus() {
        Run run = Run.builder()
                .id("run-1")
                .correlationId("corr-1")
                .task("t")
                .status(RunStatus.WAITING)
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();

        RunResponse response = RunResponse.from(run);
        assertEquals("waiting", response.status());

        String json = Json.write(response);
        assertTrue(json.contains("\"runId\":\"run-1\""));
        assertTrue(json.contains("\"createdAt\":\"2024-05-01T10:00:00Z\""));
        assertFalse(json.contains("result")); // null fields excluded
    }

    @Test
    void commisResponse() {
        Commis commis = Commis.spawned("c-1", "run-1", 2, "task", "call-2").failed("boom");
        CommisResponse response = CommisResponse.from(commis);
        assertEquals("failed", response.status());
        assertEquals(2, response.spawnIndex());
        assertEquals("boom", response.error());
        assertNull(response.result());
    }
}
