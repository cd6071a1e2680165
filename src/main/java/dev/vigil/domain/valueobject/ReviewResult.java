package dev.vigil.domain.valueobject;

import dev.vigil.domain.enums.Severity;

import java.time.Instant;
import java.util.Locale;

/**
 * Classified answer of one shadow review.
 */
public record ReviewResult(Severity severity, String message, Instant reviewedAt) {

    static final String ERROR_PREFIX = "Error:";

    /**
     * Severity from the model's tag. An {@code Error:} answer is a gateway failure, not a
     * finding; CRITICAL outranks WARNING when both tags appear.
     */
    public static ReviewResult classify(String message, Instant reviewedAt) {
        String text = message == null ? "" : message;
        return new ReviewResult(severityOf(text), text, reviewedAt);
    }

    static Severity severityOf(String message) {
        if (message.startsWith(ERROR_PREFIX)) return Severity.ERROR;
        String upper = message.toUpperCase(Locale.ROOT);
        if (upper.contains("[CRITICAL]")) return Severity.CRITICAL;
        if (upper.contains("[WARNING]")) return Severity.WARNING;
        return Severity.SAFE;
    }

    public static ReviewResult error(String message, Instant reviewedAt) {
        return new ReviewResult(Severity.ERROR, message, reviewedAt);
    }
}
