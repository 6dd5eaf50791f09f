package com.example.docimp.interactive;

/**
 * Running tally of item outcomes within one run.
 */
public final class ProgressTracker {
    private final int totalItems;
    private int accepted;
    private int skipped;
    private int errors;
    private boolean quit;

    public ProgressTracker(int totalItems) {
        this.totalItems = totalItems;
    }

    public void record(ItemOutcome outcome) {
        switch (outcome) {
            case ACCEPTED:
                accepted++;
                break;
            case SKIPPED:
                skipped++;
                break;
            case ERROR:
                errors++;
                break;
            case QUIT:
                quit = true;
                break;
            default:
                throw new IllegalArgumentException("Unknown outcome " + outcome);
        }
    }

    public String progressString() {
        return String.format("%d accepted, %d skipped, %d errors of %d", accepted, skipped, errors, totalItems);
    }

    public RunSummary summary(int stoppedAt, boolean completed) {
        return new RunSummary(accepted, skipped, errors, quit, stoppedAt, completed);
    }
}
