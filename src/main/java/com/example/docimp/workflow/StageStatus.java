package com.example.docimp.workflow;

import java.time.Instant;

/**
 * Status line for one stage: {@code changedFiles} counts tracked files modified since
 * the stage's own run.
 */
public record StageStatus(WorkflowStage stage, boolean ran, Instant timestamp, int itemCount, int changedFiles) {
    public static StageStatus notRun(WorkflowStage stage) {
        return new StageStatus(stage, false, null, 0, 0);
    }
}
