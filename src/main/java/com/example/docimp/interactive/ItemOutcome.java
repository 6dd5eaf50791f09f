package com.example.docimp.interactive;

/**
 * How the processing of one item ended.
 */
public enum ItemOutcome {
    ACCEPTED,
    SKIPPED,
    ERROR,
    /** Stops the whole run at the current item. */
    QUIT
}
