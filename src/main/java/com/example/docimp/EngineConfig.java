package com.example.docimp;

import java.nio.file.Path;

/**
 * Immutable runtime settings for the state engine.
 */
public record EngineConfig(
        Path projectRoot,
        Path stateDirectory,
        int checksumThreads,
        boolean historyEnabled,
        int historyMaxSnapshots,
        int historyMaxAgeDays
) {
}
