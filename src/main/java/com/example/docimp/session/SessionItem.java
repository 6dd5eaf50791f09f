package com.example.docimp.session;

/**
 * A code item addressed by a session: the file it lives in and its name in that file.
 */
public record SessionItem(String filepath, String name) {
}
