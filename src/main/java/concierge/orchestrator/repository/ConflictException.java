package concierge.orchestrator.repository;

/**
 * Thrown when a concurrent append already claimed the target sequence number.
 * The event was not written; the caller must re-read the log tail and retry.
 */
public class ConflictException extends RuntimeException {

    private final String runId;
    private final long sequence;

    public ConflictException(String runId, long sequence, Throwable cause) {
        super("sequence " + sequence + " of run " + runId + " already claimed", cause);
        this.runId = runId;
        this.sequence = sequence;
    }

    public String runId() {
        return runId;
    }

    public long sequence() {
        return sequence;
    }
}
