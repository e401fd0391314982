package concierge.orchestrator.util;

import concierge.orchestrator.repository.ConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff and jitter for appends that lose a
 * sequence race. Only {@link ConflictException} is retried.
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseBackoffMs = Math.max(0, baseDelay.toMillis());
        this.maxBackoffMs = Math.max(baseBackoffMs, maxDelay.toMillis());
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(8, Duration.ofMillis(10), Duration.ofMillis(500));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Run the action, retrying on conflict.
     *
     * @throws ConflictException the last conflict once attempts are exhausted
     */
    public <T> T execute(Supplier<T> action) {
        ConflictException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (ConflictException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long delay = backoffMs(attempt);
                log.debug("Append conflict on run {} (attempt {}/{}), retrying in {} ms",
                        e.runId(), attempt, maxAttempts, delay);
                sleep(delay);
            }
        }
        log.warn("Giving up on run {} after {} conflicting attempts", last.runId(), maxAttempts);
        throw last;
    }

    long backoffMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitter = baseBackoffMs > 0 ? ThreadLocalRandom.current().nextLong(0L, baseBackoffMs + 1) : 0L;
        return Math.min(maxBackoffMs, backoff + jitter);
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while backing off", e);
        }
    }
}
