package com.example.docimp.interactive;

import com.example.docimp.session.ImproveSession;
import com.example.docimp.session.ImprovementOutcome;
import com.example.docimp.session.SessionItem;
import com.example.docimp.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;

/**
 * Improves items of an improve session. Edits and regenerations re-present the item
 * without checkpointing; only accept, skip and error are recorded.
 */
public class ImproveRunner extends SessionRunner<ImproveSession> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImproveRunner.class);

    private final SuggestionSource suggestions;
    private final ImprovePrompt prompt;
    private final DocumentationWriter writer;

    public ImproveRunner(SessionStore store, SuggestionSource suggestions, ImprovePrompt prompt, DocumentationWriter writer) {
        this(store, suggestions, prompt, writer, Clock.systemUTC());
    }

    public ImproveRunner(SessionStore store,
                         SuggestionSource suggestions,
                         ImprovePrompt prompt,
                         DocumentationWriter writer,
                         Clock clock) {
        super(store, clock);
        this.suggestions = suggestions;
        this.prompt = prompt;
        this.writer = writer;
    }

    @Override
    protected ItemOutcome processItem(ImproveSession session, SessionItem item, int index) {
        String current = requestSuggestion(item, null);
        if (current == null) {
            session.recordOutcome(item, ImprovementOutcome.ERROR, now(), null);
            return ItemOutcome.ERROR;
        }
        while (true) {
            ImproveDecision decision = prompt.decide(item, current);
            switch (decision.kind()) {
                case ACCEPT:
                    try {
                        writer.write(item, current);
                    } catch (IOException ex) {
                        LOGGER.warn("Failed to write documentation for {} in {}", item.name(), item.filepath(), ex);
                        session.recordOutcome(item, ImprovementOutcome.ERROR, now(), null);
                        return ItemOutcome.ERROR;
                    }
                    session.recordOutcome(item, ImprovementOutcome.ACCEPTED, now(), current);
                    return ItemOutcome.ACCEPTED;
                case EDIT:
                    if (decision.text() != null && !decision.text().isBlank()) {
                        current = decision.text();
                    }
                    break;
                case REGENERATE:
                    String regenerated = requestSuggestion(item, decision.text());
                    if (regenerated != null) {
                        current = regenerated;
                    }
                    break;
                case SKIP:
                    session.recordOutcome(item, ImprovementOutcome.SKIPPED, now(), null);
                    return ItemOutcome.SKIPPED;
                case QUIT:
                    return ItemOutcome.QUIT;
                default:
                    throw new IllegalStateException("Unhandled improve decision " + decision.kind());
            }
        }
    }

    private String requestSuggestion(SessionItem item, String feedback) {
        try {
            String suggestion = suggestions.suggest(item, feedback);
            return suggestion == null || suggestion.isBlank() ? null : suggestion.trim();
        } catch (IOException ex) {
            LOGGER.warn("Suggestion request failed for {} in {}: {}", item.name(), item.filepath(), ex.getMessage());
            return null;
        }
    }
}
