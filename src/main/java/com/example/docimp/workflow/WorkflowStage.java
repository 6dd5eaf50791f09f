package com.example.docimp.workflow;

import java.util.List;
import java.util.Locale;

/**
 * Pipeline stages in execution order.
 */
public enum WorkflowStage {
    ANALYZE("analyze"),
    AUDIT("audit"),
    PLAN("plan"),
    IMPROVE("improve");

    private final String value;

    WorkflowStage(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Stages whose recorded file checksums this stage's inputs derive from.
     */
    public List<WorkflowStage> upstream() {
        switch (this) {
            case AUDIT:
                return List.of(ANALYZE);
            case PLAN:
                return List.of(ANALYZE, AUDIT);
            case IMPROVE:
                return List.of(PLAN);
            default:
                return List.of();
        }
    }

    /**
     * The stage that must have run before this one, or {@code null} for analyze.
     */
    public WorkflowStage prerequisite() {
        switch (this) {
            case AUDIT:
            case PLAN:
                return ANALYZE;
            case IMPROVE:
                return PLAN;
            default:
                return null;
        }
    }

    public String command() {
        return "docimp " + value;
    }

    public static WorkflowStage fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (WorkflowStage stage : values()) {
                if (stage.value.equals(normalized)) {
                    return stage;
                }
            }
        }
        throw new IllegalArgumentException("Unknown workflow stage '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
