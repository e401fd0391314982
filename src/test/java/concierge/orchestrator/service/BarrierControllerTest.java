package concierge.orchestrator.service;

import concierge.orchestrator.model.Commis;
import concierge.orchestrator.model.CommisReportResult;
import concierge.orchestrator.model.CommisResult;
import concierge.orchestrator.model.CommisStatus;
import concierge.orchestrator.model.EventType;
import concierge.orchestrator.model.PayloadKeys;
import concierge.orchestrator.model.Run;
import concierge.orchestrator.model.RunEvent;
import concierge.orchestrator.model.RunStatus;
import concierge.orchestrator.model.WorkSpec;
import concierge.orchestrator.store.Database;
import concierge.orchestrator.store.JdbcEventLog;
import concierge.orchestrator.store.JdbcRunStore;
import concierge.orchestrator.util.RetryPolicy;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BarrierControllerTest {

    private Database db;
    private JdbcRunStore store;
    private JdbcEventLog eventLog;
    private RunStateMachine sm;
    private BarrierController barrier;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-barrier-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 10);
        store = new JdbcRunStore(db);
        eventLog = new JdbcEventLog(db);
        sm = new RunStateMachine(store, new EventBroker(),
                new RetryPolicy(50, Duration.ofMillis(2), Duration.ofMillis(50)));
        barrier = new BarrierController(store, sm);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private List<Commis> fanOut(String runId, int count) {
        List<WorkSpec> specs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            specs.add(new WorkSpec("task " + i, "call-" + i));
        }
        return sm.recordFanOut(runId, specs);
    }

    private long count(String runId, EventType type) {
        return eventLog.readFrom(runId, 0).stream().filter(e -> e.type() == type).count();
    }

    @Test
    @DisplayName("Only the last report releases; results come back in spawn order")
    void releasesOnLastReport() {
        Run run = sm.createRun(RunRequest.of("t")).run();
        List<Commis> commis = fanOut(run.id(), 3);

        CommisReport r2 = barrier.reportCommisResult(commis.get(2).id(), "third", null);
        CommisReport r0 = barrier.reportCommisResult(commis.get(0).id(), null, "timeout");
        assertEquals(CommisReportResult.RECORDED, r2.outcome());
        assertEquals(CommisReportResult.RECORDED, r0.outcome());
        assertEquals(RunStatus.WAITING, r0.run().status());

        CommisReport r1 = barrier.reportCommisResult(commis.get(1).id(), "second", null);
        assertTrue(r1.released());
        assertEquals(RunStatus.RESUMED, r1.run().status());

        List<CommisResult> results = r1.results();
        assertEquals(List.of(0, 1, 2), results.stream().map(CommisResult::spawnIndex).toList());
        assertEquals(CommisStatus.FAILED, results.get(0).status());
        assertEquals("timeout", results.get(0).error());
        assertEquals("second", results.get(1).result());
        assertEquals("call-2", results.get(2).toolCallId());

        RunEvent resumed = eventLog.readFrom(run.id(), 0).stream()
                .filter(e -> e.type() == EventType.RUN_RESUMED).findFirst().orElseThrow();
        assertEquals(3, resumed.intValue(PayloadKeys.EXPECTED, -1));
        assertEquals(RunStatus.RESUMED, store.findById(run.id()).orElseThrow().status());
    }

    @Test
    @DisplayName("Duplicate reports are idempotent and record nothing")
    void duplicateReport() {
        Run run = sm.createRun(RunRequest.of("t")).run();
        List<Commis> commis = fanOut(run.id(), 2);

        assertEquals(CommisReportResult.RECORDED,
                barrier.reportCommisResult(commis.get(0).id(), "a", null).outcome());
        long tail = eventLog.tail(run.id());

        CommisReport again = barrier.reportCommisResult(commis.get(0).id(), null, "late failure");
        assertEquals(CommisReportResult.ALREADY_TERMINAL, again.outcome());
        assertEquals(tail, eventLog.tail(run.id()));
        assertEquals(CommisStatus.COMPLETE, store.findCommis(commis.get(0).id()).orElseThrow().status());
    }

    @Test
    void unknownCommis() {
        assertEquals(CommisReportResult.NOT_FOUND,
                barrier.reportCommisResult("commis-nope", "x", null).outcome());
        assertThrows(IllegalArgumentException.class, () -> barrier.reportCommisResult(" ", "x", null));
    }

    @Test
    @DisplayName("A failure with a very long error is recorded and releases the barrier")
    void longErrorIsRecorded() {
        Run run = sm.createRun(RunRequest.of("t")).run();
        List<Commis> commis = fanOut(run.id(), 1);
        String error = "stack frame\n".repeat(1000);

        CommisReport report = barrier.reportCommisResult(commis.get(0).id(), null, error);

        assertTrue(report.released());
        assertEquals(RunStatus.RESUMED, store.findById(run.id()).orElseThrow().status());
        Commis stored = store.findCommis(commis.get(0).id()).orElseThrow();
        assertEquals(CommisStatus.FAILED, stored.status());
        assertEquals(error, stored.error());

        Run other = sm.createRun(RunRequest.of("other")).run();
        Run failed = sm.fail(other.id(), error);
        assertEquals(RunStatus.FAILED, failed.status());
        assertEquals(error, store.findById(other.id()).orElseThrow().error());
    }

    @Test
    @DisplayName("All commis failing still releases the barrier")
    void allFailedStillReleases() {
        Run run = sm.createRun(RunRequest.of("t")).run();
        List<Commis> commis = fanOut(run.id(), 2);

        barrier.reportCommisResult(commis.get(0).id(), null, "e0");
        CommisReport last = barrier.reportCommisResult(commis.get(1).id(), null, "e1");

        assertTrue(last.released());
        assertTrue(last.results().stream().noneMatch(CommisResult::succeeded));
    }

    @Test
    @DisplayName("Concurrent shuffled and duplicated reports release exactly once")
    void concurrentReportsReleaseOnce() throws Exception {
        Run run = sm.createRun(RunRequest.of("t")).run();
        List<Commis> commis = fanOut(run.id(), 5);

        List<String> reports = new ArrayList<>();
        for (Commis c : commis) {
            reports.add(c.id());
            reports.add(c.id());
        }
        Collections.shuffle(reports, new Random(42));

        ExecutorService pool = Executors.newFixedThreadPool(reports.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CommisReport>> futures = new ArrayList<>();
        try {
            for (String id : reports) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return barrier.reportCommisResult(id, "result of " + id, null);
                }));
            }
            start.countDown();

            int released = 0;
            int recorded = 0;
            int duplicates = 0;
            for (Future<CommisReport> f : futures) {
                switch (f.get(30, TimeUnit.SECONDS).outcome()) {
                    case RELEASED -> released++;
                    case RECORDED -> recorded++;
                    case ALREADY_TERMINAL -> duplicates++;
                    default -> fail("unexpected outcome");
                }
            }
            assertEquals(1, released);
            assertEquals(4, recorded);
            assertEquals(5, duplicates);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(5, count(run.id(), EventType.COMMIS_SPAWNED));
        assertEquals(5, count(run.id(), EventType.COMMIS_COMPLETE));
        assertEquals(1, count(run.id(), EventType.RUN_RESUMED));

        List<RunEvent> events = eventLog.readFrom(run.id(), 0);
        for (int i = 0; i < events.size(); i++) {
            assertEquals(i + 1, events.get(i).sequence());
        }
        assertEquals(EventType.RUN_RESUMED, events.get(events.size() - 1).type());
    }

    @Test
    @DisplayName("A resumed run can fan out a second wave with continuing spawn indexes")
    void secondWave() {
        Run run = sm.createRun(RunRequest.of("t")).run();
        Commis first = fanOut(run.id(), 1).get(0);
        assertTrue(barrier.reportCommisResult(first.id(), "ok", null).released());

        List<Commis> second = fanOut(run.id(), 2);
        assertEquals(List.of(1, 2), second.stream().map(Commis::spawnIndex).toList());

        assertEquals(CommisReportResult.RECORDED,
                barrier.reportCommisResult(second.get(0).id(), "x", null).outcome());
        CommisReport release = barrier.reportCommisResult(second.get(1).id(), "y", null);
        assertTrue(release.released());
        assertEquals(2, release.results().size());
        assertEquals(3, store.findCommisByRun(run.id()).size());
    }
}
