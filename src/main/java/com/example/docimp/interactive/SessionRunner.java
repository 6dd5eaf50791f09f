package com.example.docimp.interactive;

import com.example.docimp.io.Timestamps;
import com.example.docimp.session.SessionItem;
import com.example.docimp.session.SessionRecord;
import com.example.docimp.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;

/**
 * Drives a session item by item from its {@code current_index}. After every accepted,
 * skipped or failed item the session is checkpointed with the index advanced past that
 * item; quitting checkpoints without advancing; exhausting the items stamps
 * {@code completed_at} and saves once more, unless the session was already completed.
 *
 * @param <R> the session record type this runner updates
 */
public abstract class SessionRunner<R extends SessionRecord> {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionRunner.class);

    protected final SessionStore store;
    protected final Clock clock;

    protected SessionRunner(SessionStore store, Clock clock) {
        this.store = store;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Runs the remaining items of {@code session}. {@code items} must be the full, ordered
     * item list the session was created for.
     */
    public RunSummary run(R session, List<SessionItem> items) throws IOException {
        if (items.size() != session.getTotalItems()) {
            throw new IllegalArgumentException("Session " + session.getSessionId() + " expects "
                    + session.getTotalItems() + " items but " + items.size() + " were supplied");
        }
        ProgressTracker tracker = new ProgressTracker(items.size());
        int start = session.getCurrentIndex();
        if (start > 0) {
            LOGGER.info("Resuming {} session {} from item {} of {}", session.getSessionType(),
                    session.getSessionId(), start + 1, items.size());
        }
        for (int index = start; index < items.size(); index++) {
            SessionItem item = items.get(index);
            ItemOutcome outcome = processItem(session, item, index);
            tracker.record(outcome);
            if (outcome == ItemOutcome.QUIT) {
                session.setCurrentIndex(index);
                store.save(session, session.getSessionType());
                LOGGER.info("Session {} paused at item {} of {} ({})", session.getSessionId(), index + 1,
                        items.size(), tracker.progressString());
                return tracker.summary(index, false);
            }
            session.setCurrentIndex(index + 1);
            store.save(session, session.getSessionType());
        }
        // completed_at is stamped once; re-running a finished session keeps the original time.
        if (!session.isCompleted()) {
            session.setCompletedAt(Timestamps.now(clock));
            store.save(session, session.getSessionType());
        }
        LOGGER.info("Session {} complete: {}", session.getSessionId(), tracker.progressString());
        return tracker.summary(session.getCurrentIndex(), true);
    }

    /**
     * Presents one item until it reaches a terminal outcome, recording that outcome on
     * {@code session}. Must not save; the caller checkpoints.
     */
    protected abstract ItemOutcome processItem(R session, SessionItem item, int index) throws IOException;

    protected String now() {
        return Timestamps.now(clock);
    }
}
