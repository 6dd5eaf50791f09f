package com.example.docimp.workflow;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Last successful run of one pipeline stage.
 *
 * @param timestamp     completion time
 * @param itemCount     number of code items the stage processed
 * @param fileChecksums checksum of every file the stage read, keyed by path
 */
public record StageRun(
        Instant timestamp,
        @JsonProperty("item_count") int itemCount,
        @JsonProperty("file_checksums") Map<String, String> fileChecksums
) {
    public StageRun {
        fileChecksums = fileChecksums == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fileChecksums));
    }
}
