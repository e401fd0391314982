package concierge.orchestrator.util;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation ids are lowercase UUID v4 strings, minted once per run.
 */
public final class CorrelationIds {

    public static final String HEADER = "X-Correlation-Id";

    private static final Pattern FORMAT =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

    private CorrelationIds() {
    }

    public static String newId() {
        return UUID.randomUUID().toString().toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String value) {
        return value != null && FORMAT.matcher(value).matches();
    }

    /**
     * Return the supplied id if present, otherwise mint one.
     *
     * @throws IllegalArgumentException if a supplied id is malformed
     */
    public static String orNew(String supplied) {
        if (supplied == null || supplied.isBlank()) {
            return newId();
        }
        String normalized = supplied.trim().toLowerCase(Locale.ROOT);
        if (!isValid(normalized)) {
            throw new IllegalArgumentException("correlation id must be a UUID, got: " + supplied);
        }
        return normalized;
    }
}
