package com.example.docimp.interactive;

import com.example.docimp.session.AuditSession;
import com.example.docimp.session.SessionItem;
import com.example.docimp.session.SessionStore;
import com.example.docimp.session.SessionType;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuditRunnerTest {
    private static final SessionItem FIRST = new SessionItem("calc.py", "add");
    private static final SessionItem SECOND = new SessionItem("calc.py", "subtract");
    private static final List<SessionItem> ITEMS = List.of(FIRST, SECOND);

    @Test
    void ratingsAreCheckpointedAndSessionResumesWhereItStopped() throws Exception {
        SessionStore store = new SessionStore(Files.createTempDirectory("audit-runner"));
        AuditSession session = AuditSession.createInitial("audit-1", ITEMS, Map.of(), Map.of());
        store.save(session, SessionType.AUDIT);

        RunSummary firstRun = new AuditRunner(store, scripted(AuditDecision.rate(3), AuditDecision.quit()))
                .run(session, ITEMS);

        assertTrue(firstRun.quit());
        assertFalse(firstRun.completed());
        assertEquals(1, firstRun.stoppedAt());
        AuditSession reloaded = store.loadAudit("audit-1");
        assertEquals(1, reloaded.getCurrentIndex());
        assertEquals(3, reloaded.ratingFor("calc.py", "add"));
        assertNull(reloaded.getCompletedAt());

        RunSummary secondRun = new AuditRunner(store, scripted(AuditDecision.rate(2))).run(reloaded, ITEMS);

        assertTrue(secondRun.completed());
        assertEquals(1, secondRun.accepted());
        AuditSession finished = store.loadAudit("audit-1");
        assertNotNull(finished.getCompletedAt());
        assertEquals(2, finished.getCurrentIndex());
        assertEquals(3, finished.ratingFor("calc.py", "add"));
        assertEquals(2, finished.ratingFor("calc.py", "subtract"));
    }

    @Test
    void skipStoresNullRatingAndAdvances() throws Exception {
        SessionStore store = new SessionStore(Files.createTempDirectory("audit-runner"));
        AuditSession session = AuditSession.createInitial("audit-2", ITEMS, Map.of(), Map.of());

        RunSummary summary = new AuditRunner(store, scripted(AuditDecision.skip(), AuditDecision.rate(4)))
                .run(session, ITEMS);

        assertEquals(1, summary.skipped());
        assertEquals(1, summary.accepted());
        assertEquals(2, summary.processed());
        AuditSession reloaded = store.loadAudit("audit-2");
        assertNull(reloaded.ratingFor("calc.py", "add"));
        assertEquals(1, reloaded.getRatedCount());
    }

    @Test
    void quitOnFirstItemSavesWithoutAdvancing() throws Exception {
        SessionStore store = new SessionStore(Files.createTempDirectory("audit-runner"));
        AuditSession session = AuditSession.createInitial("audit-3", ITEMS, Map.of(), Map.of());

        new AuditRunner(store, scripted(AuditDecision.quit())).run(session, ITEMS);

        AuditSession reloaded = store.loadAudit("audit-3");
        assertEquals(0, reloaded.getCurrentIndex());
        assertFalse(reloaded.isCompleted());
    }

    @Test
    void rerunningFinishedSessionKeepsOriginalCompletionTime() throws Exception {
        SessionStore store = new SessionStore(Files.createTempDirectory("audit-runner"));
        List<SessionItem> oneItem = List.of(FIRST);
        Clock firstClock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        Clock laterClock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        AuditSession session = AuditSession.createInitial("audit-5", oneItem, Map.of(), Map.of(), firstClock);
        new AuditRunner(store, scripted(AuditDecision.rate(4)), firstClock).run(session, oneItem);

        AuditSession reloaded = store.loadAudit("audit-5");
        RunSummary rerun = new AuditRunner(store, scripted(), laterClock).run(reloaded, oneItem);

        assertTrue(rerun.completed());
        assertEquals(0, rerun.processed());
        assertEquals("2025-01-01T00:00:00.000000Z", reloaded.getCompletedAt());
        assertEquals("2025-01-01T00:00:00.000000Z", store.loadAudit("audit-5").getCompletedAt());
    }

    @Test
    void itemListMustMatchSession() throws Exception {
        SessionStore store = new SessionStore(Files.createTempDirectory("audit-runner"));
        AuditSession session = AuditSession.createInitial("audit-4", ITEMS, Map.of(), Map.of());
        AuditRunner runner = new AuditRunner(store, scripted());

        assertThrows(IllegalArgumentException.class, () -> runner.run(session, List.of(FIRST)));
    }

    private static RatingPrompt scripted(AuditDecision... decisions) {
        Deque<AuditDecision> queue = new ArrayDeque<>(List.of(decisions));
        return (item, index, total) -> queue.removeFirst();
    }
}
