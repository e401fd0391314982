package concierge.orchestrator.util;

import concierge.orchestrator.repository.ConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    @DisplayName("Conflicts are retried until the action succeeds")
    void retriesConflicts() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(1), Duration.ofMillis(5));
        AtomicInteger calls = new AtomicInteger();

        String value = policy.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new ConflictException("run-1", calls.get(), null);
            }
            return "ok";
        });

        assertEquals("ok", value);
        assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("Last conflict is rethrown once attempts are exhausted")
    void givesUpAfterMaxAttempts() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        ConflictException e = assertThrows(ConflictException.class, () -> policy.execute(() -> {
            throw new ConflictException("run-1", calls.incrementAndGet(), null);
        }));

        assertEquals(3, calls.get());
        assertEquals(3, e.sequence());
        assertEquals("run-1", e.runId());
    }

    @Test
    @DisplayName("Other exceptions propagate without retry")
    void doesNotRetryOtherExceptions() {
        RetryPolicy policy = RetryPolicy.defaults();
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> policy.execute(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Backoff grows and stays within the cap")
    void backoffIsBounded() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofMillis(10), Duration.ofMillis(100));

        long first = policy.backoffMs(1);
        assertTrue(first >= 10 && first <= 20, "first backoff " + first);

        long third = policy.backoffMs(3);
        assertTrue(third >= 40 && third <= 50, "third backoff " + third);

        for (int attempt = 1; attempt <= 10; attempt++) {
            assertTrue(policy.backoffMs(attempt) <= 100);
        }
    }

    @Test
    void rejectsNonPositiveAttempts() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, Duration.ofMillis(1), Duration.ofMillis(1)));
    }
}
