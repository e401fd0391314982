package concierge.orchestrator.service;

import concierge.orchestrator.model.Commis;
import concierge.orchestrator.model.EventType;
import concierge.orchestrator.model.PayloadKeys;
import concierge.orchestrator.model.Run;
import concierge.orchestrator.model.RunState;
import concierge.orchestrator.model.RunStatus;
import concierge.orchestrator.model.WorkSpec;
import concierge.orchestrator.repository.ConflictException;
import concierge.orchestrator.repository.RunStore;
import concierge.orchestrator.repository.RunStore.Committed;
import concierge.orchestrator.repository.RunStore.RunWork;
import concierge.orchestrator.repository.RunTransaction;
import concierge.orchestrator.util.CorrelationIds;
import concierge.orchestrator.util.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns run lifecycle transitions.
 *
 * Every transition locks the run, validates against the folded log, appends its
 * events and refreshes the cached projection in one transaction, then publishes
 * the committed events.
 */
public class RunStateMachine {

    /** Width of the runs.idempotency_key column */
    public static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;

    private static final Logger log = LoggerFactory.getLogger(RunStateMachine.class);

    private final RunStore store;
    private final EventBroker broker;
    private final RetryPolicy retryPolicy;

    public RunStateMachine(RunStore store, EventBroker broker, RetryPolicy retryPolicy) {
        this.store = store;
        this.broker = broker;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Create and start a run. A known idempotency key returns the existing run
     * unchanged and appends nothing.
     *
     * The key is looked up before the rest of the request is validated: a
     * retry resolves to the original run whatever payload it carries.
     *
     * @throws IllegalArgumentException if the key is too long, or for a new
     *                                  run if the task is missing or the
     *                                  correlation id is malformed
     */
    public RunCreation createRun(RunRequest request) {
        String key = blankToNull(request.idempotencyKey());
        if (key != null && key.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw new IllegalArgumentException(
                    "idempotency key must be at most " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }

        if (key != null) {
            Optional<Run> existing = store.findByIdempotencyKey(key);
            if (existing.isPresent()) {
                log.debug("Idempotency key {} maps to existing run {}", key, existing.get().id());
                return new RunCreation(existing.get(), false);
            }
        }

        if (request.task() == null || request.task().isBlank()) {
            throw new IllegalArgumentException("task is required");
        }
        String correlationId = CorrelationIds.orNew(request.correlationId());

        Run run = Run.builder()
                .id(store.generateRunId())
                .correlationId(correlationId)
                .idempotencyKey(key)
                .tenantId(blankToNull(request.tenantId()))
                .threadId(blankToNull(request.threadId()))
                .task(request.task())
                .status(RunStatus.PENDING)
                .createdAt(Instant.now())
                .build();

        return retryPolicy.execute(() -> {
            Optional<Committed<Run>> inserted = store.insert(run, tx -> {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put(PayloadKeys.TASK, run.task());
                payload.put(PayloadKeys.TENANT_ID, run.tenantId());
                tx.append(EventType.RUN_STARTED, payload);
                return snapshot(tx);
            });

            if (inserted.isPresent()) {
                Run started = inserted.get().value();
                broker.publish(started, inserted.get().events());
                log.info("Run {} started (correlation {})", started.id(), started.correlationId());
                return new RunCreation(started, true);
            }

            // Lost the race on the idempotency key: the winner may not be visible yet
            Run winner = store.findByIdempotencyKey(key)
                    .orElseThrow(() -> new ConflictException(run.id(), 0, null));
            log.debug("Concurrent create with key {} collapsed onto run {}", key, winner.id());
            return new RunCreation(winner, false);
        });
    }

    /**
     * Spawn one commis per spec and park the run on a barrier.
     *
     * @return the spawned commis in spawn order
     * @throws RunBusyException if the run is waiting or terminal
     */
    public List<Commis> recordFanOut(String runId, List<WorkSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new IllegalArgumentException("fan-out requires at least one commis");
        }

        return transition(runId, tx -> {
            requireActive(tx, "fan out");

            RunState state = tx.state();
            int baseIndex = state.commis().size();
            List<Commis> spawned = new ArrayList<>(specs.size());
            List<String> ids = new ArrayList<>(specs.size());

            for (int i = 0; i < specs.size(); i++) {
                WorkSpec spec = specs.get(i);
                Commis commis = Commis.spawned(store.generateCommisId(), runId, baseIndex + i,
                        spec.task(), spec.toolCallId());
                tx.registerCommis(commis);

                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put(PayloadKeys.COMMIS_ID, commis.id());
                payload.put(PayloadKeys.SPAWN_INDEX, commis.spawnIndex());
                payload.put(PayloadKeys.TASK, commis.task());
                payload.put(PayloadKeys.TOOL_CALL_ID, commis.toolCallId());
                tx.append(EventType.COMMIS_SPAWNED, payload);

                spawned.add(commis);
                ids.add(commis.id());
            }

            Map<String, Object> waiting = new LinkedHashMap<>();
            waiting.put(PayloadKeys.COMMIS_IDS, ids);
            waiting.put(PayloadKeys.EXPECTED, ids.size());
            waiting.put(PayloadKeys.MESSAGE, "Waiting for " + ids.size() + " commis");
            tx.append(EventType.RUN_WAITING, waiting);

            log.info("Run {} fanned out {} commis, waiting", runId, spawned.size());
            return spawned;
        });
    }

    /**
     * Finish the run successfully.
     *
     * @throws RunBusyException if the run is waiting or terminal
     */
    public Run complete(String runId, String result) {
        return transition(runId, tx -> {
            requireActive(tx, "complete");
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(PayloadKeys.RESULT, result);
            tx.append(EventType.RUN_SUCCESS, payload);
            log.info("Run {} succeeded", runId);
            return snapshot(tx);
        });
    }

    /**
     * Finish the run with an error.
     *
     * @throws RunBusyException if the run is waiting or terminal
     */
    public Run fail(String runId, String error) {
        return transition(runId, tx -> {
            requireActive(tx, "fail");
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(PayloadKeys.ERROR, error);
            tx.append(EventType.RUN_FAILED, payload);
            log.info("Run {} failed: {}", runId, error);
            return snapshot(tx);
        });
    }

    /**
     * Append an informational event (stream tokens) on behalf of the concierge.
     *
     * @throws IllegalArgumentException for lifecycle event types
     * @throws RunBusyException         if the run is waiting or terminal
     */
    public void emit(String runId, EventType type, Map<String, Object> payload) {
        if (type.isLifecycle()) {
            throw new IllegalArgumentException(type.wireName() + " is a lifecycle event and cannot be emitted");
        }
        transition(runId, tx -> {
            requireActive(tx, "emit " + type.wireName());
            tx.append(type, payload);
            return null;
        });
    }

    /**
     * Record commis tool activity. Accepted while the commis has not reported.
     *
     * @return false if the commis is unknown or already terminal
     */
    public boolean recordCommisActivity(String runId, String commisId, EventType type, Map<String, Object> payload) {
        if (type != EventType.COMMIS_TOOL_STARTED && type != EventType.COMMIS_TOOL_COMPLETED) {
            throw new IllegalArgumentException(type.wireName() + " is not a commis activity event");
        }
        return transition(runId, tx -> {
            Optional<Commis> commis = tx.state().commis(commisId);
            if (commis.isEmpty() || commis.get().isTerminal()) {
                log.debug("Ignoring {} for commis {}: unknown or terminal", type.wireName(), commisId);
                return false;
            }
            Map<String, Object> data = new LinkedHashMap<>(payload);
            data.put(PayloadKeys.COMMIS_ID, commisId);
            tx.append(type, data);
            return true;
        });
    }

    /**
     * Run work under the run lock, retrying lost sequence races, and publish
     * what it committed.
     */
    <T> T transition(String runId, RunWork<T> work) {
        Committed<Transition<T>> committed = retryPolicy.execute(() -> store.withRunLock(runId,
                tx -> {
                    T value = work.execute(tx);
                    return new Transition<>(snapshot(tx), value);
                }));
        if (!committed.events().isEmpty()) {
            broker.publish(committed.value().run(), committed.events());
        }
        return committed.value().value();
    }

    static Run snapshot(RunTransaction tx) {
        RunState state = tx.state();
        return tx.run().toBuilder()
                .status(state.status())
                .result(state.result())
                .error(state.error())
                .build();
    }

    private static void requireActive(RunTransaction tx, String operation) {
        RunStatus status = tx.state().status();
        if (!status.isActive()) {
            log.warn("Rejected {} on run {}: status {}", operation, tx.run().id(), status);
            throw new RunBusyException(tx.run().id(), status, operation);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private record Transition<T>(Run run, T value) {
    }
}
