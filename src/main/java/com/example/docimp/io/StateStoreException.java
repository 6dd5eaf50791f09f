package com.example.docimp.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Base type for state file failures that callers can recover from by starting fresh.
 */
public class StateStoreException extends IOException {
    private final Path path;

    public StateStoreException(String message, Path path) {
        super(message);
        this.path = path;
    }

    public StateStoreException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
