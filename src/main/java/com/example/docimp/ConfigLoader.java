package com.example.docimp;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigLoader {
    private static final int DEFAULT_HISTORY_MAX_SNAPSHOTS = 50;
    private static final int DEFAULT_HISTORY_MAX_AGE_DAYS = 30;

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Reads a JSON config file. A missing file yields the defaults.
     */
    public EngineConfig load(Path path) throws IOException {
        RawConfig raw = Files.exists(path) ? mapper.readValue(path.toFile(), RawConfig.class) : new RawConfig();

        Path projectRoot = Path.of(optionalString(raw.projectRoot, ".")).toAbsolutePath().normalize();
        Path stateDirectory = raw.stateDirectory == null || raw.stateDirectory.isBlank()
                ? projectRoot.resolve(StateDirectory.DEFAULT_NAME)
                : projectRoot.resolve(raw.stateDirectory).normalize();
        int checksumThreads = raw.checksumThreads != null && raw.checksumThreads > 0
                ? raw.checksumThreads
                : Math.max(1, Runtime.getRuntime().availableProcessors());

        RawHistory history = raw.workflowHistory == null ? new RawHistory() : raw.workflowHistory;
        boolean historyEnabled = history.enabled == null || history.enabled;
        int maxSnapshots = history.maxSnapshots != null && history.maxSnapshots >= 0
                ? history.maxSnapshots
                : DEFAULT_HISTORY_MAX_SNAPSHOTS;
        int maxAgeDays = history.maxAgeDays != null && history.maxAgeDays >= 0
                ? history.maxAgeDays
                : DEFAULT_HISTORY_MAX_AGE_DAYS;

        return new EngineConfig(
                projectRoot,
                stateDirectory,
                checksumThreads,
                historyEnabled,
                maxSnapshots,
                maxAgeDays
        );
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String projectRoot;
        public String stateDirectory;
        public Integer checksumThreads;
        public RawHistory workflowHistory;
    }

    private static class RawHistory {
        public Boolean enabled;
        public Integer maxSnapshots;
        public Integer maxAgeDays;
    }
}
