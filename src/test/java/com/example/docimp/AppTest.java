package com.example.docimp;

import com.example.docimp.session.AuditSession;
import com.example.docimp.session.SessionItem;
import com.example.docimp.session.SessionStore;
import com.example.docimp.session.SessionType;
import com.example.docimp.workflow.WorkflowLedgerStore;
import com.example.docimp.workflow.WorkflowStage;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppTest {
    @Test
    void sessionCommandsListAndDelete() throws Exception {
        EngineConfig config = config(Files.createTempDirectory("app"));
        SessionStore store = new SessionStore(new StateDirectory(config.stateDirectory()).sessionReportsDirectory());
        store.save(AuditSession.createInitial("keep", List.of(new SessionItem("a.py", "f")), Map.of(), Map.of()),
                SessionType.AUDIT);

        assertTrue(App.run(config, "list-sessions", List.of("audit")));
        assertTrue(App.run(config, "delete-session", List.of("audit", "keep")));

        assertFalse(store.exists("keep", SessionType.AUDIT));
        assertThrows(IllegalArgumentException.class, () -> App.run(config, "list-sessions", List.of("plan")));
    }

    @Test
    void historyCommandsRestoreAndPrune() throws Exception {
        EngineConfig config = config(Files.createTempDirectory("app"));
        StateDirectory stateDirectory = new StateDirectory(config.stateDirectory());
        WorkflowLedgerStore ledger = new WorkflowLedgerStore(stateDirectory.workflowStateFile(),
                stateDirectory.historyDirectory());
        ledger.recordStage(WorkflowStage.ANALYZE, 1, Map.of());
        ledger.recordStage(WorkflowStage.ANALYZE, 2, Map.of());
        String snapshotName = ledger.listHistory().get(0).getFileName().toString();

        assertTrue(App.run(config, "status", List.of()));
        assertTrue(App.run(config, "history", List.of("5")));
        assertTrue(App.run(config, "restore-history", List.of(snapshotName)));
        assertEquals(1, ledger.load().getLastAnalyze().itemCount());

        assertTrue(App.run(config, "prune-history", List.of()));
        assertEquals(1, ledger.listHistory().size());
    }

    @Test
    void checkRunsPrerequisiteValidation() throws Exception {
        EngineConfig config = config(Files.createTempDirectory("app"));

        assertTrue(App.run(config, "check", List.of("plan")));
        assertTrue(App.run(config, "check", List.of("improve", "--skip")));
        assertFalse(App.run(config, "check", List.of("plan", "--force")));
        assertThrows(IllegalArgumentException.class, () -> App.run(config, "check", List.of("publish")));
    }

    @Test
    void unknownCommandsAndArityAreRejected() throws Exception {
        EngineConfig config = config(Files.createTempDirectory("app"));

        assertFalse(App.run(config, "analyze", List.of()));
        assertFalse(App.run(config, "delete-session", List.of("audit")));
        assertFalse(App.run(config, "history", List.of("1", "2")));
    }

    private static EngineConfig config(Path project) {
        return new EngineConfig(project, project.resolve(".docimp"), 2, true, 1, 30);
    }
}
