package com.example.docimp.interactive;

import com.example.docimp.session.SessionItem;

import java.io.IOException;

/**
 * Produces documentation for an item, optionally steered by user feedback.
 */
@FunctionalInterface
public interface SuggestionSource {
    String suggest(SessionItem item, String feedback) throws IOException;
}
