package com.example.docimp.interactive;

/**
 * Counts for one invocation of a runner, plus where it stopped.
 *
 * @param stoppedAt the session's {@code current_index} when the run returned
 * @param completed whether the session was finalized by this run
 */
public record RunSummary(int accepted, int skipped, int errors, boolean quit, int stoppedAt, boolean completed) {
    public int processed() {
        return accepted + skipped + errors;
    }
}
