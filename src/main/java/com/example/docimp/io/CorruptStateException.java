package com.example.docimp.io;

import java.nio.file.Path;

/**
 * Raised when a state file cannot be parsed as JSON. The file is left in place.
 */
public class CorruptStateException extends StateStoreException {
    public CorruptStateException(String message, Path path, Throwable cause) {
        super(message, path, cause);
    }
}
