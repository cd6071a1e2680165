package dev.vigil.domain.enums;

/**
 * Outcome class of a shadow review.
 *
 * SAFE = nothing worth flagging | WARNING / CRITICAL = tagged by the model | ERROR = review could not run
 */
public enum Severity {
    SAFE(false), WARNING(true), CRITICAL(true), ERROR(true);

    private final boolean surfaced;
    Severity(boolean surfaced) { this.surfaced = surfaced; }

    /** Whether results of this severity belong in the activity log rather than only the indicator. */
    public boolean isSurfaced() {
        return surfaced;
    }
}
