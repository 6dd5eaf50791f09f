package com.example.docimp.workflow;

import com.example.docimp.io.CorruptStateException;
import com.example.docimp.io.StateJson;
import com.example.docimp.io.StateValidationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowLedgerStoreTest {
    private static final Instant NOW = Instant.parse("2026-10-01T12:00:00.123456789Z");

    @Test
    void missingLedgerMeansNothingHasRun() throws Exception {
        Path dir = Files.createTempDirectory("ledger");
        WorkflowLedgerStore store = new WorkflowLedgerStore(dir.resolve("workflow-state.json"), dir.resolve("history"));

        WorkflowLedger ledger = store.load();

        for (WorkflowStage stage : WorkflowStage.values()) {
            assertNull(ledger.get(stage));
        }
        assertEquals("1.0", ledger.getSchemaVersion());
    }

    @Test
    void recordedStageSurvivesReload() throws Exception {
        Path dir = Files.createTempDirectory("ledger");
        WorkflowLedgerStore store = store(dir, Clock.fixed(NOW, ZoneOffset.UTC), true);

        WorkflowLedger saved = store.recordStage(WorkflowStage.ANALYZE, 12, Map.of("a.py", "x", "b.py", "y"));
        WorkflowLedger loaded = store.load();

        assertEquals(saved, loaded);
        assertEquals(NOW, loaded.getLastAnalyze().timestamp());
        assertEquals(12, loaded.getLastAnalyze().itemCount());
        assertEquals(Map.of("a.py", "x", "b.py", "y"), loaded.getLastAnalyze().fileChecksums());
        assertNull(loaded.getLastPlan());
    }

    @Test
    void saveArchivesTheLedgerItReplaces() throws Exception {
        Path dir = Files.createTempDirectory("ledger");
        WorkflowLedgerStore store = store(dir, Clock.systemUTC(), true);

        store.recordStage(WorkflowStage.ANALYZE, 1, Map.of("a.py", "x"));
        assertTrue(store.listHistory().isEmpty());
        byte[] firstLedger = Files.readAllBytes(store.ledgerFile());

        store.recordStage(WorkflowStage.PLAN, 1, Map.of("a.py", "x"));

        List<Path> history = store.listHistory();
        assertEquals(1, history.size());
        assertArrayEquals(firstLedger, Files.readAllBytes(history.get(0)));
        assertNull(store.loadSnapshot(history.get(0)).getLastPlan());
    }

    @Test
    void savesWithinTheSameInstantGetDistinctHistoryFiles() throws Exception {
        Path dir = Files.createTempDirectory("ledger");
        WorkflowLedgerStore store = store(dir, Clock.fixed(NOW, ZoneOffset.UTC), true);

        for (int i = 0; i < 5; i++) {
            store.recordStage(WorkflowStage.ANALYZE, i, Map.of());
        }

        List<Path> history = store.listHistory();
        assertEquals(4, history.size());
        assertEquals(4, new HashSet<>(history).size());
        // Newest first: the latest snapshot holds the ledger written by the fourth save.
        assertEquals(3, store.loadSnapshot(history.get(0)).getLastAnalyze().itemCount());
        assertEquals(0, store.loadSnapshot(history.get(3)).getLastAnalyze().itemCount());
    }

    @Test
    void historyLimitIsAppliedAfterOrdering() throws Exception {
        Path dir = Files.createTempDirectory("ledger");
        WorkflowLedgerStore store = store(dir, Clock.fixed(NOW, ZoneOffset.UTC), true);
        for (int i = 0; i < 4; i++) {
            store.recordStage(WorkflowStage.ANALYZE, i, Map.of());
        }
        List<Path> all = store.listHistory();

        assertTrue(store.listHistory(0).isEmpty());
        assertEquals(all.subList(0, 2), store.listHistory(2));
        assertEquals(all, store.listHistory(100));
        assertThrows(IllegalArgumentException.class, () -> store.listHistory(-1));
    }

    @Test
    void disabledHistoryWritesNoSnapshots() throws Exception {
        Path dir = Files.createTempDirectory("ledger");
        WorkflowLedgerStore store = store(dir, Clock.systemUTC(), false);

        store.recordStage(WorkflowStage.ANALYZE, 1, Map.of());
        store.recordStage(WorkflowStage.ANALYZE, 2, Map.of());

        assertTrue(store.listHistory().isEmpty());
        assertFalse(Files.exists(dir.resolve("history")));
    }

    @Test
    void legacyLedgerIsMigratedOnLoad() throws Exception {
        Path dir = Files.createTempDirectory("ledger");
        WorkflowLedgerStore store = store(dir, Clock.fixed(NOW, ZoneOffset.UTC), true);
        Files.writeString(store.ledgerFile(),
                "{\"last_analyze\":{\"timestamp\":\"2025-01-01T00:00:00Z\",\"item_count\":3,"
                        + "\"file_checksums\":{\"a.py\":\"x\"}},\"last_audit\":null,\"last_plan\":null,"
                        + "\"last_improve\":null}");

        WorkflowLedger ledger = store.load();

        assertEquals("1.0", ledger.getSchemaVersion());
        assertEquals(1, ledger.getMigrationLog().size());
        assertEquals("legacy", ledger.getMigrationLog().get(0).from());
        assertEquals("1.0", ledger.getMigrationLog().get(0).to());
        assertEquals(3, ledger.getLastAnalyze().itemCount());
    }

    @Test
    void legacyUpgradeAppendsToAnExistingLogAndCurrentLedgersAreLeftAlone() throws Exception {
        Path dir = Files.createTempDirectory("ledger");
        WorkflowLedgerStore store = store(dir, Clock.fixed(NOW, ZoneOffset.UTC), true);
        Files.writeString(store.ledgerFile(),
                "{\"migration_log\":[{\"from\":\"0.1\",\"to\":\"0.2\",\"timestamp\":\"2024-01-01T00:00:00Z\"}]}");

        List<MigrationLogEntry> log = store.load().getMigrationLog();

        assertEquals(2, log.size());
        assertEquals("0.1", log.get(0).from());
        assertEquals("legacy", log.get(1).from());
        assertEquals("1.0", log.get(1).to());

        Files.writeString(store.ledgerFile(), "{\"schema_version\":\"1.0\"}");
        WorkflowLedger current = store.load();
        assertEquals("1.0", current.getSchemaVersion());
        assertTrue(current.getMigrationLog().isEmpty());
    }

    @Test
    void unknownVersionAndBadEntriesFailValidation() throws Exception {
        Path dir = Files.createTempDirectory("ledger");
        WorkflowLedgerStore store = store(dir, Clock.systemUTC(), true);

        Files.writeString(store.ledgerFile(), "{\"schema_version\":\"9.0\"}");
        assertThrows(StateValidationException.class, store::load);

        Files.writeString(store.ledgerFile(),
                "{\"schema_version\":\"1.0\",\"last_plan\":{\"timestamp\":\"yesterday\",\"item_count\":-1}}");
        StateValidationException error = assertThrows(StateValidationException.class, store::load);
        assertEquals(3, error.getViolations().size());
    }

    @Test
    void corruptLedgerIsReportedAndKept() throws Exception {
        Path dir = Files.createTempDirectory("ledger");
        WorkflowLedgerStore store = store(dir, Clock.systemUTC(), true);
        Files.writeString(store.ledgerFile(), "{\"last_analyze\":");

        assertThrows(CorruptStateException.class, store::load);
        assertTrue(Files.exists(store.ledgerFile()));
    }

    @Test
    void unknownTopLevelFieldsArePreserved() throws Exception {
        Path dir = Files.createTempDirectory("ledger");
        WorkflowLedgerStore store = store(dir, Clock.systemUTC(), true);
        Files.writeString(store.ledgerFile(), "{\"schema_version\":\"1.0\",\"last_analyze\":null,\"owner\":\"ci\"}");

        store.recordStage(WorkflowStage.ANALYZE, 1, Map.of());

        assertEquals("ci", StateJson.newMapper().readTree(store.ledgerFile().toFile()).path("owner").asText());
    }

    @Test
    void restoreReplacesLedgerAndArchivesTheCurrentOne() throws Exception {
        Path dir = Files.createTempDirectory("ledger");
        WorkflowLedgerStore store = store(dir, Clock.systemUTC(), true);
        WorkflowLedger first = store.recordStage(WorkflowStage.ANALYZE, 1, Map.of("a.py", "x"));
        store.recordStage(WorkflowStage.ANALYZE, 2, Map.of("a.py", "y"));
        Path snapshotOfFirst = store.listHistory().get(0);

        WorkflowLedger restored = store.restore(snapshotOfFirst);

        assertEquals(first, restored);
        assertEquals(first, store.load());
        assertEquals(2, store.listHistory().size());
        assertEquals(2, store.loadSnapshot(store.listHistory().get(0)).getLastAnalyze().itemCount());
    }

    @Test
    void pruneDeletesByCountAndByAge() throws Exception {
        Path dir = Files.createTempDirectory("ledger");
        Instant now = Instant.now();
        WorkflowLedgerStore store = store(dir, Clock.fixed(now, ZoneOffset.UTC), true);
        for (int i = 0; i < 6; i++) {
            store.recordStage(WorkflowStage.ANALYZE, i, Map.of());
        }
        List<Path> history = store.listHistory();
        assertEquals(5, history.size());
        Files.setLastModifiedTime(history.get(1), FileTime.from(now.minus(Duration.ofDays(40))));

        List<Path> deleted = store.pruneHistory(3, 30);

        assertEquals(List.of(history.get(1), history.get(3), history.get(4)), deleted);
        assertEquals(List.of(history.get(0), history.get(2)), store.listHistory());
    }

    private static WorkflowLedgerStore store(Path dir, Clock clock, boolean historyEnabled) {
        return new WorkflowLedgerStore(dir.resolve("workflow-state.json"), dir.resolve("history"),
                StateJson.newMapper(), null, clock, historyEnabled);
    }
}
