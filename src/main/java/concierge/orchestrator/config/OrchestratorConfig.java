package concierge.orchestrator.config;

import java.time.Duration;

/**
 * Configuration holder for orchestrator settings.
 * All settings have sensible defaults.
 */
public final class OrchestratorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/concierge;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Barrier settings
    private Duration barrierTimeout = Duration.ofMinutes(10);
    private Duration barrierReaperInterval = Duration.ofSeconds(30);

    // Commis settings
    private int commisThreads = 8;

    // Append retry settings
    private int appendMaxAttempts = 8;
    private Duration appendBaseDelay = Duration.ofMillis(10);
    private Duration appendMaxDelay = Duration.ofMillis(500);

    // Auth settings (optional)
    private String agentKey = null; // If set, workers must provide X-Concierge-Key header

    private OrchestratorConfig() {
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig();
    }

    public static OrchestratorConfig fromEnv() {
        OrchestratorConfig config = new OrchestratorConfig();

        // Override from environment variables
        String dbUrl = System.getenv("CONCIERGE_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("CONCIERGE_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String agentKey = System.getenv("CONCIERGE_AGENT_KEY");
        if (agentKey != null && !agentKey.isBlank()) {
            config.agentKey = agentKey;
        }

        String barrierTimeout = System.getenv("CONCIERGE_BARRIER_TIMEOUT_SECONDS");
        if (barrierTimeout != null && !barrierTimeout.isBlank()) {
            config.barrierTimeout = Duration.ofSeconds(Long.parseLong(barrierTimeout));
        }

        String commisThreads = System.getenv("CONCIERGE_COMMIS_THREADS");
        if (commisThreads != null && !commisThreads.isBlank()) {
            config.commisThreads = Integer.parseInt(commisThreads);
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration barrierTimeout() {
        return barrierTimeout;
    }

    public Duration barrierReaperInterval() {
        return barrierReaperInterval;
    }

    public int commisThreads() {
        return commisThreads;
    }

    public int appendMaxAttempts() {
        return appendMaxAttempts;
    }

    public Duration appendBaseDelay() {
        return appendBaseDelay;
    }

    public Duration appendMaxDelay() {
        return appendMaxDelay;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    // Fluent setters for testing/customization
    public OrchestratorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public OrchestratorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public OrchestratorConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public OrchestratorConfig withBarrierTimeout(Duration timeout) {
        this.barrierTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withBarrierReaperInterval(Duration interval) {
        this.barrierReaperInterval = interval;
        return this;
    }

    public OrchestratorConfig withCommisThreads(int threads) {
        this.commisThreads = threads;
        return this;
    }

    public OrchestratorConfig withAppendRetry(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        this.appendMaxAttempts = maxAttempts;
        this.appendBaseDelay = baseDelay;
        this.appendMaxDelay = maxDelay;
        return this;
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", barrierTimeout=" + barrierTimeout +
                ", commisThreads=" + commisThreads +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
