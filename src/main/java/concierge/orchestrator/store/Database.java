package concierge.orchestrator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import concierge.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are not auto-commit.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(OrchestratorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("concierge-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- RUNS (identity + cached projection) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS runs (
                            id              VARCHAR(64) PRIMARY KEY,
                            correlation_id  VARCHAR(64) NOT NULL,
                            idempotency_key VARCHAR(255),
                            tenant_id       VARCHAR(128),
                            thread_id       VARCHAR(128),
                            task            CLOB,
                            status          VARCHAR(20) DEFAULT 'PENDING',
                            result          CLOB,
                            error           CLOB,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP,
                            waiting_since   TIMESTAMP
                        );
                    """);

            // ---------- RUN EVENTS (source of truth) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS run_events (
                            run_id          VARCHAR(64) NOT NULL,
                            sequence        BIGINT NOT NULL,
                            event_type      VARCHAR(64) NOT NULL,
                            payload         CLOB NOT NULL,
                            correlation_id  VARCHAR(64),
                            created_at      TIMESTAMP NOT NULL,
                            PRIMARY KEY (run_id, sequence)
                        );
                    """);

            // ---------- COMMIS (id index + cached projection) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS commis (
                            id              VARCHAR(64) PRIMARY KEY,
                            run_id          VARCHAR(64) NOT NULL,
                            spawn_index     INT NOT NULL,
                            task            CLOB,
                            tool_call_id    VARCHAR(255),
                            status          VARCHAR(20) DEFAULT 'SPAWNED',
                            result          CLOB,
                            error           CLOB
                        );
                    """);

            st.addBatch("CREATE UNIQUE INDEX IF NOT EXISTS uq_runs_idempotency ON runs(idempotency_key);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_created ON runs(created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_status_waiting ON runs(status, waiting_since);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_commis_run ON commis(run_id, spawn_index);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
