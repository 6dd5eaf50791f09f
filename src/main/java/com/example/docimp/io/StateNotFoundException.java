package com.example.docimp.io;

import java.nio.file.Path;

/**
 * Raised when a requested state file does not exist.
 */
public class StateNotFoundException extends StateStoreException {
    public StateNotFoundException(String message, Path path) {
        super(message, path);
    }
}
