package com.example.docimp;

import com.example.docimp.workflow.WorkflowStage;

import java.nio.file.Path;

/**
 * Layout of the project-local state directory:
 *
 * <pre>
 * .docimp/
 *   workflow-state.json
 *   history/workflow-state-&lt;capture-time&gt;.json
 *   session-reports/{audit,improve}-session-&lt;id&gt;.json
 *   session-reports/analyze-latest.json, audit.json, plan.json
 * </pre>
 */
public final class StateDirectory {
    public static final String DEFAULT_NAME = ".docimp";

    private final Path root;

    public StateDirectory(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public static StateDirectory forProject(Path projectRoot) {
        return new StateDirectory(projectRoot.resolve(DEFAULT_NAME));
    }

    public Path root() {
        return root;
    }

    public Path workflowStateFile() {
        return root.resolve("workflow-state.json");
    }

    public Path historyDirectory() {
        return root.resolve("history");
    }

    public Path sessionReportsDirectory() {
        return root.resolve("session-reports");
    }

    public Path analyzeFile() {
        return sessionReportsDirectory().resolve("analyze-latest.json");
    }

    public Path auditFile() {
        return sessionReportsDirectory().resolve("audit.json");
    }

    public Path planFile() {
        return sessionReportsDirectory().resolve("plan.json");
    }

    /**
     * Output file a stage leaves behind, or {@code null} for stages without one.
     */
    public Path artifactFor(WorkflowStage stage) {
        switch (stage) {
            case ANALYZE:
                return analyzeFile();
            case AUDIT:
                return auditFile();
            case PLAN:
                return planFile();
            default:
                return null;
        }
    }
}
