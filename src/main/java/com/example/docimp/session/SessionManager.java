package com.example.docimp.session;

import com.example.docimp.tracking.ChangeDetector;
import com.example.docimp.tracking.ChecksumSnapshotter;
import com.example.docimp.tracking.FileSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Opens sessions for a run: resumes the latest unfinished session of the type when one
 * exists and covers the same number of items, otherwise snapshots the items' files and
 * creates a new session.
 */
public class SessionManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

    private final SessionStore store;
    private final ChecksumSnapshotter snapshotter;
    private final ChangeDetector changeDetector;
    private final Clock clock;

    public SessionManager(SessionStore store, ChecksumSnapshotter snapshotter, ChangeDetector changeDetector) {
        this(store, snapshotter, changeDetector, Clock.systemUTC());
    }

    public SessionManager(SessionStore store, ChecksumSnapshotter snapshotter, ChangeDetector changeDetector, Clock clock) {
        this.store = store;
        this.snapshotter = snapshotter;
        this.changeDetector = changeDetector;
        this.clock = clock;
    }

    /**
     * The most recently started session of {@code type} that has not completed.
     */
    public Optional<SessionRecord> latestInProgress(SessionType type) throws IOException {
        for (SessionRecord session : store.list(type)) {
            if (!session.isCompleted()) {
                return Optional.of(session);
            }
        }
        return Optional.empty();
    }

    /**
     * Files in the session's snapshot whose content changed or that disappeared.
     */
    public Set<String> changedFiles(SessionRecord session) throws InterruptedException {
        return changeDetector.detectChanges(session.getFileSnapshot());
    }

    public AuditSession openAudit(List<SessionItem> items, Map<String, Object> config, boolean forceNew)
            throws IOException, InterruptedException {
        Optional<SessionRecord> resumable = forceNew ? Optional.empty() : resumable(SessionType.AUDIT, items);
        if (resumable.isPresent()) {
            return (AuditSession) resumable.get();
        }
        AuditSession session = AuditSession.createInitial(SessionIds.newId(), items, snapshot(items), config, clock);
        store.save(session, SessionType.AUDIT);
        LOGGER.info("Started audit session {} with {} items", session.getSessionId(), items.size());
        return session;
    }

    public ImproveSession openImprove(List<SessionItem> items, Map<String, Object> config, boolean forceNew)
            throws IOException, InterruptedException {
        Optional<SessionRecord> resumable = forceNew ? Optional.empty() : resumable(SessionType.IMPROVE, items);
        if (resumable.isPresent()) {
            return (ImproveSession) resumable.get();
        }
        String sessionId = SessionIds.newId();
        ImproveSession session = ImproveSession.createInitial(sessionId, sessionId, items, snapshot(items), config, clock);
        store.save(session, SessionType.IMPROVE);
        LOGGER.info("Started improve session {} with {} items", sessionId, items.size());
        return session;
    }

    private Optional<SessionRecord> resumable(SessionType type, List<SessionItem> items) throws IOException, InterruptedException {
        Optional<SessionRecord> latest = latestInProgress(type);
        if (latest.isEmpty()) {
            return latest;
        }
        SessionRecord session = latest.get();
        if (session.getTotalItems() != items.size()) {
            LOGGER.info("Not resuming {} session {}: it covers {} items, the current run has {}", type,
                    session.getSessionId(), session.getTotalItems(), items.size());
            return Optional.empty();
        }
        Set<String> changed = changedFiles(session);
        if (!changed.isEmpty()) {
            LOGGER.warn("{} file(s) changed since {} session {} started: {}", changed.size(), type,
                    session.getSessionId(), changed);
        }
        LOGGER.info("Resuming {} session {} at item {} of {}", type, session.getSessionId(),
                session.getCurrentIndex() + 1, session.getTotalItems());
        return latest;
    }

    private Map<String, FileSnapshot> snapshot(List<SessionItem> items) throws InterruptedException {
        Set<String> files = new LinkedHashSet<>();
        for (SessionItem item : items) {
            files.add(item.filepath());
        }
        return snapshotter.snapshot(files);
    }
}
