package com.example.docimp.workflow;

/**
 * Outcome of a prerequisite check. {@code staleness} is informational and never makes
 * the result invalid.
 */
public record PrerequisiteResult(boolean valid, String error, String suggestion, StalenessReport staleness) {
    public static PrerequisiteResult ok(StalenessReport staleness) {
        return new PrerequisiteResult(true, null, null, staleness);
    }

    public static PrerequisiteResult failed(String error, String suggestion, StalenessReport staleness) {
        return new PrerequisiteResult(false, error, suggestion, staleness);
    }

    public boolean hasStalenessWarning() {
        return staleness != null && staleness.stale();
    }
}
