package com.example.docimp.interactive;

import com.example.docimp.session.AuditSession;
import com.example.docimp.session.SessionItem;
import com.example.docimp.session.SessionStore;

import java.time.Clock;

/**
 * Rates items of an audit session. A rating counts as accepted; a skip is stored as a
 * {@code null} rating.
 */
public class AuditRunner extends SessionRunner<AuditSession> {
    private final RatingPrompt prompt;

    public AuditRunner(SessionStore store, RatingPrompt prompt) {
        this(store, prompt, Clock.systemUTC());
    }

    public AuditRunner(SessionStore store, RatingPrompt prompt, Clock clock) {
        super(store, clock);
        this.prompt = prompt;
    }

    @Override
    protected ItemOutcome processItem(AuditSession session, SessionItem item, int index) {
        AuditDecision decision = prompt.ask(item, index, session.getTotalItems());
        switch (decision.kind()) {
            case RATE:
                session.recordRating(item, decision.rating());
                return ItemOutcome.ACCEPTED;
            case SKIP:
                session.recordRating(item, null);
                return ItemOutcome.SKIPPED;
            case QUIT:
                return ItemOutcome.QUIT;
            default:
                throw new IllegalStateException("Unhandled audit decision " + decision.kind());
        }
    }
}
