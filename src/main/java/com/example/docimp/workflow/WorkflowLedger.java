package com.example.docimp.workflow;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Latest known-good run of each pipeline stage. A {@code null} entry means the stage has
 * never completed.
 */
public class WorkflowLedger {
    @JsonProperty("schema_version")
    private String schemaVersion = WorkflowLedgerMigrations.CURRENT_VERSION;
    @JsonProperty("last_analyze")
    private StageRun lastAnalyze;
    @JsonProperty("last_audit")
    private StageRun lastAudit;
    @JsonProperty("last_plan")
    private StageRun lastPlan;
    @JsonProperty("last_improve")
    private StageRun lastImprove;
    @JsonProperty("migration_log")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<MigrationLogEntry> migrationLog = new ArrayList<>();

    private final Map<String, Object> extras = new LinkedHashMap<>();

    public WorkflowLedger() {
    }

    public static WorkflowLedger empty() {
        return new WorkflowLedger();
    }

    public StageRun get(WorkflowStage stage) {
        switch (stage) {
            case ANALYZE:
                return lastAnalyze;
            case AUDIT:
                return lastAudit;
            case PLAN:
                return lastPlan;
            case IMPROVE:
                return lastImprove;
            default:
                throw new IllegalArgumentException("Unknown stage " + stage);
        }
    }

    public void put(WorkflowStage stage, StageRun run) {
        switch (stage) {
            case ANALYZE:
                lastAnalyze = run;
                break;
            case AUDIT:
                lastAudit = run;
                break;
            case PLAN:
                lastPlan = run;
                break;
            case IMPROVE:
                lastImprove = run;
                break;
            default:
                throw new IllegalArgumentException("Unknown stage " + stage);
        }
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(String schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public StageRun getLastAnalyze() {
        return lastAnalyze;
    }

    public StageRun getLastAudit() {
        return lastAudit;
    }

    public StageRun getLastPlan() {
        return lastPlan;
    }

    public StageRun getLastImprove() {
        return lastImprove;
    }

    public List<MigrationLogEntry> getMigrationLog() {
        return migrationLog;
    }

    public void setMigrationLog(List<MigrationLogEntry> migrationLog) {
        this.migrationLog = migrationLog == null ? new ArrayList<>() : new ArrayList<>(migrationLog);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return extras;
    }

    @JsonAnySetter
    public void putExtra(String name, Object value) {
        extras.put(name, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorkflowLedger that)) {
            return false;
        }
        return Objects.equals(schemaVersion, that.schemaVersion)
                && Objects.equals(lastAnalyze, that.lastAnalyze)
                && Objects.equals(lastAudit, that.lastAudit)
                && Objects.equals(lastPlan, that.lastPlan)
                && Objects.equals(lastImprove, that.lastImprove)
                && Objects.equals(migrationLog, that.migrationLog)
                && Objects.equals(extras, that.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaVersion, lastAnalyze, lastAudit, lastPlan, lastImprove, migrationLog, extras);
    }
}
