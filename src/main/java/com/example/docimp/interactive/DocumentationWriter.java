package com.example.docimp.interactive;

import com.example.docimp.session.SessionItem;

import java.io.IOException;

/**
 * Applies accepted documentation to the item's source file.
 */
@FunctionalInterface
public interface DocumentationWriter {
    void write(SessionItem item, String documentation) throws IOException;
}
