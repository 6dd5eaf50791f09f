package com.example.docimp.workflow;

import com.example.docimp.StateDirectory;
import com.example.docimp.tracking.ChangeDetector;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Checks a stage's inputs against the ledger before the stage runs. Neither staleness nor
 * a missing upstream stage raises; only failures reading the ledger propagate.
 */
public class StalenessValidator {
    private final WorkflowLedgerStore ledgerStore;
    private final ChangeDetector changeDetector;
    private final StateDirectory stateDirectory;

    public StalenessValidator(WorkflowLedgerStore ledgerStore, ChangeDetector changeDetector, StateDirectory stateDirectory) {
        this.ledgerStore = ledgerStore;
        this.changeDetector = changeDetector;
        this.stateDirectory = stateDirectory;
    }

    /**
     * Reports whether any file recorded by {@code stage}'s upstream stages has changed.
     */
    public StalenessReport isStale(WorkflowStage stage) throws IOException, InterruptedException {
        return isStale(stage, ledgerStore.load());
    }

    StalenessReport isStale(WorkflowStage stage, WorkflowLedger ledger) throws InterruptedException {
        Map<String, String> baseline = new LinkedHashMap<>();
        Set<String> changed = new LinkedHashSet<>();
        for (WorkflowStage upstream : stage.upstream()) {
            StageRun run = ledger.get(upstream);
            if (run == null) {
                continue;
            }
            for (Map.Entry<String, String> entry : run.fileChecksums().entrySet()) {
                String previous = baseline.putIfAbsent(entry.getKey(), entry.getValue());
                // Two upstream stages saw different content, so one of them is out of date.
                if (previous != null && !previous.equals(entry.getValue())) {
                    changed.add(entry.getKey());
                }
            }
        }
        if (baseline.isEmpty()) {
            return StalenessReport.fresh(stage);
        }
        changed.addAll(changeDetector.detectChangedChecksums(baseline));
        return StalenessReport.of(stage, changed);
    }

    /**
     * Verifies that {@code stage}'s prerequisite stage has produced its output and that
     * nothing it depends on ran after it. With {@code skip} set only the staleness report
     * is computed and the result is always valid.
     */
    public PrerequisiteResult validatePrerequisites(WorkflowStage stage, boolean skip) throws IOException, InterruptedException {
        WorkflowLedger ledger = ledgerStore.load();
        StalenessReport staleness = isStale(stage, ledger);
        if (skip) {
            return PrerequisiteResult.ok(staleness);
        }
        WorkflowStage required = stage.prerequisite();
        if (required == null) {
            return PrerequisiteResult.ok(staleness);
        }

        Path artifact = stateDirectory.artifactFor(required);
        if (artifact != null && !Files.exists(artifact)) {
            return PrerequisiteResult.failed(
                    "Cannot run " + stage + ": " + required + " results not found at " + artifact,
                    "Run '" + required.command() + " <path>' first, then re-run '" + stage.command() + "'.",
                    staleness);
        }
        StageRun requiredRun = ledger.get(required);
        if (requiredRun == null) {
            return PrerequisiteResult.failed(
                    "Cannot run " + stage + ": " + required + " results exist but the workflow state has no record of them.",
                    "Re-run '" + required.command() + " <path>' to update the workflow state.",
                    staleness);
        }
        for (WorkflowStage upstream : required.upstream()) {
            StageRun upstreamRun = ledger.get(upstream);
            if (upstreamRun != null && upstreamRun.timestamp().isAfter(requiredRun.timestamp())) {
                return PrerequisiteResult.failed(
                        "Cannot run " + stage + ": " + required + " is outdated (" + upstream
                                + " was re-run after it).",
                        "Re-run '" + required.command() + " <path>' to refresh it with the latest " + upstream + " results.",
                        staleness);
            }
        }
        return PrerequisiteResult.ok(staleness);
    }
}
