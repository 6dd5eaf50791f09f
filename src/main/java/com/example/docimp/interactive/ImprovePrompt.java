package com.example.docimp.interactive;

import com.example.docimp.session.SessionItem;

/**
 * Shows a documentation suggestion and returns what the user wants to do with it.
 */
@FunctionalInterface
public interface ImprovePrompt {
    ImproveDecision decide(SessionItem item, String suggestion);
}
