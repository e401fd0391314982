package concierge.orchestrator.store;

import concierge.orchestrator.model.EventType;
import concierge.orchestrator.model.RunEvent;
import concierge.orchestrator.repository.ConflictException;
import concierge.orchestrator.repository.EventLog;
import concierge.orchestrator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JDBC implementation of EventLog.
 * The (run_id, sequence) primary key rejects a second writer for the same
 * sequence; that rejection surfaces as {@link ConflictException}.
 */
public class JdbcEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventLog.class);

    private static final String SQLSTATE_UNIQUE_VIOLATION = "23505";
    private static final String SQLSTATE_LOCK_TIMEOUT = "HYT00";
    private static final String SQLSTATE_DEADLOCK = "40001";
    private static final String SQLSTATE_H2_CONCURRENT_UPDATE = "90131";

    private final Database db;

    public JdbcEventLog(Database db) {
        this.db = db;
    }

    @Override
    public RunEvent append(String runId, EventType type, Map<String, Object> payload, String correlationId) {
        try (Connection conn = db.getConnection()) {
            long sequence = 0;
            try {
                sequence = tail(conn, runId) + 1;
                RunEvent event = insert(conn, runId, sequence, type, payload, correlationId);
                conn.commit();
                return event;
            } catch (SQLException e) {
                conn.rollback();
                if (isConflict(e)) {
                    throw new ConflictException(runId, sequence, e);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append event to run: " + runId, e);
        }
    }

    @Override
    public List<RunEvent> readFrom(String runId, long afterSequence) {
        try (Connection conn = db.getConnection()) {
            List<RunEvent> events = read(conn, runId, afterSequence);
            conn.commit();
            return events;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read events of run: " + runId, e);
        }
    }

    @Override
    public long tail(String runId) {
        try (Connection conn = db.getConnection()) {
            long tail = tail(conn, runId);
            conn.commit();
            return tail;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read log tail of run: " + runId, e);
        }
    }

    // Connection-scoped operations, shared with JdbcRunStore transactions

    static long tail(Connection conn, String runId) throws SQLException {
        String sql = "SELECT COALESCE(MAX(sequence), 0) FROM run_events WHERE run_id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        }
    }

    static RunEvent insert(Connection conn, String runId, long sequence, EventType type,
            Map<String, Object> payload, String correlationId) throws SQLException {
        String sql = """
                    INSERT INTO run_events (run_id, sequence, event_type, payload, correlation_id, created_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        Instant now = Instant.now();
        RunEvent event = new RunEvent(runId, sequence, type, payload, now, correlationId);

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setLong(2, sequence);
            ps.setString(3, type.wireName());
            ps.setString(4, Json.write(event.payload()));
            ps.setString(5, correlationId);
            ps.setTimestamp(6, Timestamp.from(now));
            ps.executeUpdate();
        }

        log.debug("Appended {}", event);
        return event;
    }

    static List<RunEvent> read(Connection conn, String runId, long afterSequence) throws SQLException {
        String sql = """
                    SELECT run_id, sequence, event_type, payload, correlation_id, created_at
                    FROM run_events
                    WHERE run_id = ? AND sequence > ?
                    ORDER BY sequence
                """;

        List<RunEvent> events = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setLong(2, afterSequence);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    events.add(mapRow(rs));
                }
            }
        }
        return events;
    }

    static boolean isConflict(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql) {
                String state = sql.getSQLState();
                if (SQLSTATE_UNIQUE_VIOLATION.equals(state)
                        || SQLSTATE_LOCK_TIMEOUT.equals(state)
                        || SQLSTATE_DEADLOCK.equals(state)
                        || SQLSTATE_H2_CONCURRENT_UPDATE.equals(state)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static RunEvent mapRow(ResultSet rs) throws SQLException {
        String wire = rs.getString("event_type");
        EventType type = EventType.fromWire(wire)
                .orElseThrow(() -> new SQLException("Unknown event type in log: " + wire));
        Timestamp ts = rs.getTimestamp("created_at");
        return new RunEvent(
                rs.getString("run_id"),
                rs.getLong("sequence"),
                type,
                Json.readMap(rs.getString("payload")),
                ts != null ? ts.toInstant() : null,
                rs.getString("correlation_id"));
    }
}
