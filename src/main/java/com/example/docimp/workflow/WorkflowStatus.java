package com.example.docimp.workflow;

import java.util.List;

public record WorkflowStatus(List<StageStatus> stages, List<String> suggestions) {
    public WorkflowStatus {
        stages = List.copyOf(stages);
        suggestions = List.copyOf(suggestions);
    }

    public StageStatus stage(WorkflowStage stage) {
        return stages.get(stage.ordinal());
    }
}
