package concierge.orchestrator.repository;

import concierge.orchestrator.model.Commis;
import concierge.orchestrator.model.Run;
import concierge.orchestrator.model.RunEvent;
import concierge.orchestrator.model.RunStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for runs, their commis index and the transactional append path.
 */
public interface RunStore {

    /**
     * Insert a new run and record its first events in one transaction.
     *
     * @param run   the run (status PENDING)
     * @param first work run against the freshly inserted, locked run
     * @return the run and the events appended, or empty if another run already
     *         holds the same idempotency key
     */
    Optional<Committed<Run>> insert(Run run, RunWork<Run> first);

    /**
     * Lock the run, execute the work, refresh the cached projection and commit.
     *
     * @throws RunNotFoundException if no such run
     * @throws ConflictException    if an append lost a sequence race
     */
    <T> Committed<T> withRunLock(String runId, RunWork<T> work);

    Optional<Run> findById(String runId);

    Optional<Run> findByIdempotencyKey(String idempotencyKey);

    /**
     * Most recent runs first.
     *
     * @param createdAfter optional lower bound (exclusive), null for none
     * @param limit        maximum results
     */
    List<Run> findRecent(Instant createdAfter, int limit);

    /**
     * Runs in WAITING whose barrier was armed before the cutoff.
     */
    List<Run> findWaitingSince(Instant cutoff);

    Optional<Commis> findCommis(String commisId);

    List<Commis> findCommisByRun(String runId);

    int countByStatus(RunStatus status);

    String generateRunId();

    String generateCommisId();

    /**
     * Work executed under a run lock.
     */
    @FunctionalInterface
    interface RunWork<T> {
        T execute(RunTransaction tx);
    }

    /**
     * Value produced under the lock plus the events that were committed with it.
     */
    record Committed<T>(T value, List<RunEvent> events) {
    }
}
