package com.example.docimp.workflow;

import com.example.docimp.tracking.ChangeDetector;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Summarizes the ledger for display: what ran, when, over how many items, what changed
 * since, and which commands to run next.
 */
public class WorkflowStatusReporter {
    private final WorkflowLedgerStore ledgerStore;
    private final ChangeDetector changeDetector;

    public WorkflowStatusReporter(WorkflowLedgerStore ledgerStore, ChangeDetector changeDetector) {
        this.ledgerStore = ledgerStore;
        this.changeDetector = changeDetector;
    }

    public WorkflowStatus report() throws IOException, InterruptedException {
        WorkflowLedger ledger = ledgerStore.load();
        List<StageStatus> stages = new ArrayList<>();
        for (WorkflowStage stage : WorkflowStage.values()) {
            StageRun run = ledger.get(stage);
            if (run == null) {
                stages.add(StageStatus.notRun(stage));
            } else {
                int changed = changeDetector.detectChangedChecksums(run.fileChecksums()).size();
                stages.add(new StageStatus(stage, true, run.timestamp(), run.itemCount(), changed));
            }
        }
        return new WorkflowStatus(stages, suggestions(ledger, stages));
    }

    private static List<String> suggestions(WorkflowLedger ledger, List<StageStatus> stages) {
        List<String> suggestions = new ArrayList<>();
        StageStatus analyze = stages.get(WorkflowStage.ANALYZE.ordinal());
        if (!analyze.ran()) {
            suggestions.add(WorkflowStage.ANALYZE.command() + " <path>");
            return suggestions;
        }
        if (analyze.changedFiles() > 0) {
            suggestions.add(WorkflowStage.ANALYZE.command() + " <path>  (" + analyze.changedFiles() + " file(s) changed)");
        }
        if (ledger.get(WorkflowStage.AUDIT) == null) {
            suggestions.add(WorkflowStage.AUDIT.command() + " <path>  (optional)");
        }
        StageRun plan = ledger.get(WorkflowStage.PLAN);
        if (plan == null || isOutdated(ledger, WorkflowStage.PLAN)) {
            suggestions.add(WorkflowStage.PLAN.command() + " <path>");
        } else {
            suggestions.add(WorkflowStage.IMPROVE.command() + " <path>");
        }
        return suggestions;
    }

    private static boolean isOutdated(WorkflowLedger ledger, WorkflowStage stage) {
        StageRun run = ledger.get(stage);
        for (WorkflowStage upstream : stage.upstream()) {
            StageRun upstreamRun = ledger.get(upstream);
            if (upstreamRun != null && upstreamRun.timestamp().isAfter(run.timestamp())) {
                return true;
            }
        }
        return false;
    }
}
