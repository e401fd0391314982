package concierge.orchestrator.store;

import concierge.orchestrator.model.Commis;
import concierge.orchestrator.model.CommisStatus;
import concierge.orchestrator.model.EventType;
import concierge.orchestrator.model.PayloadKeys;
import concierge.orchestrator.model.Run;
import concierge.orchestrator.model.RunEvent;
import concierge.orchestrator.model.RunProjection;
import concierge.orchestrator.model.RunState;
import concierge.orchestrator.model.RunStatus;
import concierge.orchestrator.repository.ConflictException;
import concierge.orchestrator.repository.RunNotFoundException;
import concierge.orchestrator.repository.RunStore;
import concierge.orchestrator.repository.RunTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * JDBC implementation of RunStore.
 * Uses a pessimistic row lock on the run to serialize its appenders; the
 * runs and commis rows are a cache of the folded event log, refreshed in the
 * same transaction as the appends.
 */
public class JdbcRunStore implements RunStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunStore.class);

    private final Database db;

    public JdbcRunStore(Database db) {
        this.db = db;
    }

    @Override
    public Optional<Committed<Run>> insert(Run run, RunWork<Run> first) {
        String sql = """
                    INSERT INTO runs (id, correlation_id, idempotency_key, tenant_id, thread_id, task,
                                      status, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                Instant createdAt = run.createdAt() != null ? run.createdAt() : Instant.now();
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, run.id());
                    ps.setString(2, run.correlationId());
                    ps.setString(3, run.idempotencyKey());
                    ps.setString(4, run.tenantId());
                    ps.setString(5, run.threadId());
                    ps.setString(6, run.task());
                    ps.setString(7, run.status().name());
                    ps.setTimestamp(8, Timestamp.from(createdAt));
                    ps.setTimestamp(9, Timestamp.from(createdAt));
                    ps.executeUpdate();
                }
            } catch (SQLException e) {
                conn.rollback();
                if (run.idempotencyKey() != null && JdbcEventLog.isConflict(e)) {
                    log.debug("Idempotency key {} already claimed", run.idempotencyKey());
                    return Optional.empty();
                }
                throw e;
            }

            return Optional.of(runLocked(conn, run.id(), first));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert run: " + run.id(), e);
        }
    }

    @Override
    public <T> Committed<T> withRunLock(String runId, RunWork<T> work) {
        try (Connection conn = db.getConnection()) {
            return runLocked(conn, runId, work);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update run: " + runId, e);
        }
    }

    private <T> Committed<T> runLocked(Connection conn, String runId, RunWork<T> work) throws SQLException {
        try {
            Run run = lockRun(conn, runId).orElseThrow(() -> new RunNotFoundException(runId));
            RunState state = RunProjection.fold(runId, JdbcEventLog.read(conn, runId, 0));

            LockedRun tx = new LockedRun(conn, run, state);
            T value = work.execute(tx);
            tx.flush();

            conn.commit();
            return new Committed<>(value, List.copyOf(tx.appended));
        } catch (SQLException e) {
            conn.rollback();
            if (JdbcEventLog.isConflict(e)) {
                throw new ConflictException(runId, 0, e);
            }
            throw e;
        } catch (RuntimeException e) {
            conn.rollback();
            throw e;
        }
    }

    private Optional<Run> lockRun(Connection conn, String runId) throws SQLException {
        String sql = "SELECT * FROM runs WHERE id = ? FOR UPDATE";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRun(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<Run> findById(String runId) {
        String sql = "SELECT * FROM runs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRun(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find run: " + runId, e);
        }
    }

    @Override
    public Optional<Run> findByIdempotencyKey(String idempotencyKey) {
        String sql = "SELECT * FROM runs WHERE idempotency_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, idempotencyKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRun(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find run by idempotency key", e);
        }
    }

    @Override
    public List<Run> findRecent(Instant createdAfter, int limit) {
        String sql = createdAfter != null
                ? "SELECT * FROM runs WHERE created_at > ? ORDER BY created_at DESC LIMIT ?"
                : "SELECT * FROM runs ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            if (createdAfter != null) {
                ps.setTimestamp(i++, Timestamp.from(createdAfter));
            }
            ps.setInt(i, limit);
            return queryRuns(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent runs", e);
        }
    }

    @Override
    public List<Run> findWaitingSince(Instant cutoff) {
        String sql = """
                    SELECT * FROM runs
                    WHERE status = 'WAITING' AND waiting_since < ?
                    ORDER BY waiting_since
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            return queryRuns(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find waiting runs", e);
        }
    }

    @Override
    public Optional<Commis> findCommis(String commisId) {
        String sql = "SELECT * FROM commis WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, commisId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapCommis(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find commis: " + commisId, e);
        }
    }

    @Override
    public List<Commis> findCommisByRun(String runId) {
        String sql = "SELECT * FROM commis WHERE run_id = ? ORDER BY spawn_index";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            List<Commis> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapCommis(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find commis of run: " + runId, e);
        }
    }

    @Override
    public int countByStatus(RunStatus status) {
        String sql = "SELECT COUNT(*) FROM runs WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count runs", e);
        }
    }

    @Override
    public String generateRunId() {
        return "run-" + UUID.randomUUID();
    }

    @Override
    public String generateCommisId() {
        return "commis-" + UUID.randomUUID();
    }

    /**
     * Transaction bound to one locked run row.
     */
    private static final class LockedRun implements RunTransaction {

        private final Connection conn;
        private final Run run;
        private final List<Commis> registered = new ArrayList<>();
        private final List<RunEvent> appended = new ArrayList<>();
        private RunState state;

        LockedRun(Connection conn, Run run, RunState state) {
            this.conn = conn;
            this.run = run;
            this.state = state;
        }

        @Override
        public Run run() {
            return run;
        }

        @Override
        public RunState state() {
            return state;
        }

        @Override
        public RunEvent append(EventType type, Map<String, Object> payload) {
            long sequence = state.lastSequence() + 1;
            try {
                RunEvent event = JdbcEventLog.insert(conn, run.id(), sequence, type, payload, run.correlationId());
                state = RunProjection.apply(state, event);
                appended.add(event);
                return event;
            } catch (SQLException e) {
                if (JdbcEventLog.isConflict(e)) {
                    throw new ConflictException(run.id(), sequence, e);
                }
                throw new RuntimeException("Failed to append event to run: " + run.id(), e);
            }
        }

        @Override
        public void registerCommis(Commis commis) {
            registered.add(commis);
        }

        /**
         * Write registered commis and refresh the cached projection from the folded state.
         */
        void flush() throws SQLException {
            if (!registered.isEmpty()) {
                insertCommis();
            }
            if (appended.isEmpty()) {
                return;
            }

            Set<String> touched = new LinkedHashSet<>();
            for (RunEvent event : appended) {
                if (event.type() == EventType.COMMIS_COMPLETE) {
                    touched.add(event.string(PayloadKeys.COMMIS_ID));
                }
            }
            if (!touched.isEmpty()) {
                updateCommis(touched);
            }
            updateRun();
        }

        private void insertCommis() throws SQLException {
            String sql = """
                        INSERT INTO commis (id, run_id, spawn_index, task, tool_call_id, status)
                        VALUES (?, ?, ?, ?, ?, ?)
                    """;
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (Commis c : registered) {
                    ps.setString(1, c.id());
                    ps.setString(2, c.runId());
                    ps.setInt(3, c.spawnIndex());
                    ps.setString(4, c.task());
                    ps.setString(5, c.toolCallId());
                    ps.setString(6, c.status().name());
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        }

        private void updateCommis(Set<String> commisIds) throws SQLException {
            String sql = "UPDATE commis SET status = ?, result = ?, error = ? WHERE id = ?";
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (String id : commisIds) {
                    Optional<Commis> commis = state.commis(id);
                    if (commis.isEmpty()) {
                        continue;
                    }
                    Commis c = commis.get();
                    ps.setString(1, c.status().name());
                    ps.setString(2, c.result());
                    ps.setString(3, c.error());
                    ps.setString(4, c.id());
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        }

        private void updateRun() throws SQLException {
            String sql = """
                        UPDATE runs
                        SET status = ?, result = ?, error = ?, updated_at = ?, waiting_since = ?
                        WHERE id = ?
                    """;

            Instant now = Instant.now();
            Instant waitingSince = null;
            if (state.status() == RunStatus.WAITING) {
                waitingSince = run.status() == RunStatus.WAITING && run.waitingSince() != null
                        ? run.waitingSince()
                        : now;
            }

            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, state.status().name());
                ps.setString(2, state.result());
                ps.setString(3, state.error());
                ps.setTimestamp(4, Timestamp.from(now));
                setTimestamp(ps, 5, waitingSince);
                ps.setString(6, run.id());

                int updated = ps.executeUpdate();
                if (updated != 1) {
                    throw new SQLException("Run update failed: run " + run.id() + " updated " + updated + " rows");
                }
            }
        }
    }

    // Helper methods

    private List<Run> queryRuns(PreparedStatement ps) throws SQLException {
        List<Run> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRun(rs));
            }
        }
        return results;
    }

    private static Run mapRun(ResultSet rs) throws SQLException {
        return Run.builder()
                .id(rs.getString("id"))
                .correlationId(rs.getString("correlation_id"))
                .idempotencyKey(rs.getString("idempotency_key"))
                .tenantId(rs.getString("tenant_id"))
                .threadId(rs.getString("thread_id"))
                .task(rs.getString("task"))
                .status(RunStatus.valueOf(rs.getString("status")))
                .result(rs.getString("result"))
                .error(rs.getString("error"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .waitingSince(toInstant(rs.getTimestamp("waiting_since")))
                .build();
    }

    private static Commis mapCommis(ResultSet rs) throws SQLException {
        return new Commis(
                rs.getString("id"),
                rs.getString("run_id"),
                rs.getInt("spawn_index"),
                rs.getString("task"),
                rs.getString("tool_call_id"),
                CommisStatus.valueOf(rs.getString("status")),
                rs.getString("result"),
                rs.getString("error"));
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, java.sql.Types.TIMESTAMP);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
