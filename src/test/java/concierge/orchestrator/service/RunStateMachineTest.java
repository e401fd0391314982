package concierge.orchestrator.service;

import concierge.orchestrator.model.Commis;
import concierge.orchestrator.model.EventType;
import concierge.orchestrator.model.PayloadKeys;
import concierge.orchestrator.model.Run;
import concierge.orchestrator.model.RunEvent;
import concierge.orchestrator.model.RunStatus;
import concierge.orchestrator.model.WorkSpec;
import concierge.orchestrator.repository.RunNotFoundException;
import concierge.orchestrator.store.Database;
import concierge.orchestrator.store.JdbcEventLog;
import concierge.orchestrator.store.JdbcRunStore;
import concierge.orchestrator.util.CorrelationIds;
import concierge.orchestrator.util.RetryPolicy;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RunStateMachineTest {

    private Database db;
    private JdbcRunStore store;
    private JdbcEventLog eventLog;
    private EventBroker broker;
    private RunStateMachine sm;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-sm-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 10);
        store = new JdbcRunStore(db);
        eventLog = new JdbcEventLog(db);
        broker = new EventBroker();
        sm = new RunStateMachine(store, broker, new RetryPolicy(50, Duration.ofMillis(2), Duration.ofMillis(50)));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private List<EventType> types(String runId) {
        return eventLog.readFrom(runId, 0).stream().map(RunEvent::type).toList();
    }

    @Test
    @DisplayName("createRun starts the run with a run_started event and a correlation id")
    void createRunStarts() {
        RunCreation creation = sm.createRun(new RunRequest("plan a trip", null, null, "tenant-a", "thread-1"));

        assertTrue(creation.created());
        Run run = creation.run();
        assertEquals(RunStatus.RUNNING, run.status());
        assertTrue(CorrelationIds.isValid(run.correlationId()));
        assertEquals("tenant-a", run.tenantId());
        assertEquals("thread-1", run.threadId());

        List<RunEvent> events = eventLog.readFrom(run.id(), 0);
        assertEquals(1, events.size());
        assertEquals(EventType.RUN_STARTED, events.get(0).type());
        assertEquals("plan a trip", events.get(0).string(PayloadKeys.TASK));
        assertEquals(run.correlationId(), events.get(0).correlationId());
    }

    @Test
    void createRunKeepsSuppliedCorrelationId() {
        String correlationId = CorrelationIds.newId();
        Run run = sm.createRun(new RunRequest("t", correlationId, null, null, null)).run();
        assertEquals(correlationId, run.correlationId());
    }

    @Test
    void createRunValidatesInput() {
        assertThrows(IllegalArgumentException.class, () -> sm.createRun(RunRequest.of(" ")));
        assertThrows(IllegalArgumentException.class,
                () -> sm.createRun(new RunRequest("t", "bad-id", null, null, null)));
        assertThrows(IllegalArgumentException.class,
                () -> sm.createRun(new RunRequest("t", null, "k".repeat(256), null, null)));
        assertTrue(sm.createRun(new RunRequest("t", null, "k".repeat(255), null, null)).created());
    }

    @Test
    @DisplayName("A retry with a known key resolves to the original run even with an invalid payload")
    void retryWithInvalidPayloadReturnsOriginal() {
        Run original = sm.createRun(new RunRequest("task one", null, "key-retry", null, null)).run();

        RunCreation blankTask = sm.createRun(new RunRequest(" ", null, "key-retry", null, null));
        RunCreation badCorrelation = sm.createRun(new RunRequest("task one", "bad-id", "key-retry", null, null));

        assertFalse(blankTask.created());
        assertEquals(original.id(), blankTask.run().id());
        assertFalse(badCorrelation.created());
        assertEquals(original.id(), badCorrelation.run().id());
        assertEquals(original.correlationId(), badCorrelation.run().correlationId());
        assertEquals(1, eventLog.tail(original.id()));
    }

    @Test
    @DisplayName("Same idempotency key returns the existing run and appends nothing")
    void idempotentCreate() {
        RunCreation first = sm.createRun(new RunRequest("task one", null, "key-1", null, null));
        RunCreation second = sm.createRun(new RunRequest("different payload", null, "key-1", null, null));

        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals(first.run().id(), second.run().id());
        assertEquals("task one", second.run().task());
        assertEquals(1, eventLog.tail(first.run().id()));
    }

    @Test
    @DisplayName("Concurrent creates with one key collapse onto a single run")
    void concurrentIdempotentCreate() throws Exception {
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RunCreation>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                int n = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return sm.createRun(new RunRequest("task " + n, null, "shared-key", null, null));
                }));
            }
            start.countDown();

            List<RunCreation> creations = new ArrayList<>();
            for (Future<RunCreation> f : futures) {
                creations.add(f.get(30, TimeUnit.SECONDS));
            }

            Set<String> ids = creations.stream().map(c -> c.run().id()).collect(Collectors.toSet());
            assertEquals(1, ids.size());
            assertEquals(1, creations.stream().filter(RunCreation::created).count());
            assertEquals(1, store.findRecent(null, 10).size());
            assertEquals(1, eventLog.tail(ids.iterator().next()));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Fan-out spawns commis in order and parks the run")
    void fanOut() {
        Run run = sm.createRun(RunRequest.of("t")).run();

        List<Commis> spawned = sm.recordFanOut(run.id(),
                List.of(new WorkSpec("a", "call-a"), WorkSpec.of("b"), WorkSpec.of("c")));

        assertEquals(3, spawned.size());
        assertEquals(List.of(0, 1, 2), spawned.stream().map(Commis::spawnIndex).toList());
        assertEquals(List.of(EventType.RUN_STARTED, EventType.COMMIS_SPAWNED, EventType.COMMIS_SPAWNED,
                EventType.COMMIS_SPAWNED, EventType.RUN_WAITING), types(run.id()));

        RunEvent waiting = eventLog.readFrom(run.id(), 4).get(0);
        assertEquals(3, waiting.intValue(PayloadKeys.EXPECTED, -1));
        assertEquals(RunStatus.WAITING, store.findById(run.id()).orElseThrow().status());
        assertEquals("call-a", store.findCommis(spawned.get(0).id()).orElseThrow().toolCallId());
    }

    @Test
    @DisplayName("A waiting run rejects fan-out, completion and token emission")
    void waitingRunIsBusy() {
        Run run = sm.createRun(RunRequest.of("t")).run();
        sm.recordFanOut(run.id(), List.of(WorkSpec.of("a")));
        long tail = eventLog.tail(run.id());

        RunBusyException e = assertThrows(RunBusyException.class,
                () -> sm.recordFanOut(run.id(), List.of(WorkSpec.of("b"))));
        assertEquals(RunStatus.WAITING, e.status());
        assertThrows(RunBusyException.class, () -> sm.complete(run.id(), "done"));
        assertThrows(RunBusyException.class,
                () -> sm.emit(run.id(), EventType.STREAM_CHUNK, Map.of(PayloadKeys.TOKEN, "x")));

        assertEquals(tail, eventLog.tail(run.id()));
    }

    @Test
    void terminalRunIsBusy() {
        Run run = sm.createRun(RunRequest.of("t")).run();
        Run done = sm.complete(run.id(), "answer");

        assertEquals(RunStatus.SUCCESS, done.status());
        assertEquals("answer", done.result());
        assertThrows(RunBusyException.class, () -> sm.fail(run.id(), "late"));
        assertThrows(RunBusyException.class, () -> sm.recordFanOut(run.id(), List.of(WorkSpec.of("a"))));
        assertEquals(RunStatus.SUCCESS, store.findById(run.id()).orElseThrow().status());
    }

    @Test
    void failRecordsError() {
        Run run = sm.createRun(RunRequest.of("t")).run();
        Run failed = sm.fail(run.id(), "model unavailable");
        assertEquals(RunStatus.FAILED, failed.status());
        assertEquals("model unavailable", store.findById(run.id()).orElseThrow().error());
    }

    @Test
    void emitRejectsLifecycleTypes() {
        Run run = sm.createRun(RunRequest.of("t")).run();
        assertThrows(IllegalArgumentException.class,
                () -> sm.emit(run.id(), EventType.RUN_SUCCESS, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> sm.recordFanOut(run.id(), List.of()));
    }

    @Test
    void unknownRun() {
        assertThrows(RunNotFoundException.class, () -> sm.complete("run-missing", "x"));
    }

    @Test
    @DisplayName("Commis activity is accepted only while the commis is pending")
    void commisActivity() {
        Run run = sm.createRun(RunRequest.of("t")).run();
        Commis commis = sm.recordFanOut(run.id(), List.of(WorkSpec.of("a"))).get(0);

        assertTrue(sm.recordCommisActivity(run.id(), commis.id(), EventType.COMMIS_TOOL_STARTED,
                Map.of(PayloadKeys.TOOL_NAME, "search")));
        assertFalse(sm.recordCommisActivity(run.id(), "commis-unknown", EventType.COMMIS_TOOL_STARTED, Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> sm.recordCommisActivity(run.id(), commis.id(), EventType.STREAM_CHUNK, Map.of()));

        RunEvent activity = eventLog.readFrom(run.id(), 3).get(0);
        assertEquals(EventType.COMMIS_TOOL_STARTED, activity.type());
        assertEquals(commis.id(), activity.string(PayloadKeys.COMMIS_ID));
    }

    @Test
    @DisplayName("Committed events are published to run and tenant topics")
    void publishesCommittedEvents() throws Exception {
        List<Long> runTopic = new CopyOnWriteArrayList<>();
        List<Long> tenantTopic = new CopyOnWriteArrayList<>();
        try (AutoCloseable sub = broker.subscribe("tenant:acme", p -> tenantTopic.add(p.event().sequence()))) {
            Run run = sm.createRun(new RunRequest("t", null, null, "acme", null)).run();
            try (AutoCloseable runSub = broker.subscribe("run:" + run.id(), p -> runTopic.add(p.event().sequence()))) {
                sm.emit(run.id(), EventType.STREAM_START, Map.of(PayloadKeys.MESSAGE_ID, "m1"));
                sm.complete(run.id(), "ok");
            }
        }

        assertEquals(List.of(2L, 3L), runTopic);
        assertEquals(List.of(1L, 2L, 3L), tenantTopic);
        assertEquals(0, broker.subscriberCount("tenant:acme"));
    }
}
