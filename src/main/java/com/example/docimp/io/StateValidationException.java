package com.example.docimp.io;

import java.nio.file.Path;
import java.util.List;

/**
 * Raised when a state file parses but does not satisfy the expected schema.
 */
public class StateValidationException extends StateStoreException {
    private final List<String> violations;

    public StateValidationException(Path path, List<String> violations) {
        super("Invalid state file " + path + ": " + String.join("; ", violations), path);
        this.violations = List.copyOf(violations);
    }

    public StateValidationException(Path path, String violation, Throwable cause) {
        super("Invalid state file " + path + ": " + violation, path, cause);
        this.violations = List.of(violation);
    }

    public List<String> getViolations() {
        return violations;
    }
}
