package com.example.docimp.interactive;

import com.example.docimp.session.SessionItem;

/**
 * Asks the user to rate the documentation of one item.
 */
@FunctionalInterface
public interface RatingPrompt {
    AuditDecision ask(SessionItem item, int index, int total);
}
