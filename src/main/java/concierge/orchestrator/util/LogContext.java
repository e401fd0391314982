package concierge.orchestrator.util;

import org.slf4j.MDC;

/**
 * Puts run and correlation ids into the SLF4J MDC for the current thread.
 * Use with try-with-resources; previous values are restored on close.
 */
public final class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String CORRELATION_ID = "correlationId";

    private final String previousRunId;
    private final String previousCorrelationId;

    private LogContext(String runId, String correlationId) {
        this.previousRunId = MDC.get(RUN_ID);
        this.previousCorrelationId = MDC.get(CORRELATION_ID);
        put(RUN_ID, runId);
        put(CORRELATION_ID, correlationId);
    }

    public static LogContext of(String runId, String correlationId) {
        return new LogContext(runId, correlationId);
    }

    @Override
    public void close() {
        put(RUN_ID, previousRunId);
        put(CORRELATION_ID, previousCorrelationId);
    }

    private static void put(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
