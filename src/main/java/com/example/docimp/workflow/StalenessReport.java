package com.example.docimp.workflow;

import java.util.Set;

/**
 * Whether tracked files changed since the stages feeding {@code stage} last ran.
 * {@code changedCount} is for display only.
 */
public record StalenessReport(WorkflowStage stage, boolean stale, int changedCount, Set<String> changedFiles) {
    public StalenessReport {
        changedFiles = changedFiles == null ? Set.of() : Set.copyOf(changedFiles);
    }

    public static StalenessReport fresh(WorkflowStage stage) {
        return new StalenessReport(stage, false, 0, Set.of());
    }

    public static StalenessReport of(WorkflowStage stage, Set<String> changedFiles) {
        return new StalenessReport(stage, !changedFiles.isEmpty(), changedFiles.size(), changedFiles);
    }

    /**
     * Command that refreshes the stale inputs, or {@code null} when fresh.
     */
    public String suggestedCommand() {
        if (!stale) {
            return null;
        }
        return stage == WorkflowStage.IMPROVE ? WorkflowStage.PLAN.command() : WorkflowStage.ANALYZE.command();
    }
}
