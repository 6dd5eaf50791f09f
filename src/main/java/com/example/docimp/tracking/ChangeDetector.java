package com.example.docimp.tracking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Reports which tracked files no longer match a baseline. Only paths present in the
 * baseline are examined; new files are not reported.
 */
public class ChangeDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeDetector.class);

    private final ChecksumSnapshotter snapshotter;

    public ChangeDetector(ChecksumSnapshotter snapshotter) {
        this.snapshotter = snapshotter;
    }

    /**
     * Returns the baseline paths whose content checksum differs or that are missing.
     */
    public Set<String> detectChanges(Map<String, FileSnapshot> baseline) throws InterruptedException {
        Map<String, String> checksums = new LinkedHashMap<>();
        baseline.forEach((filepath, snapshot) -> checksums.put(filepath, snapshot.checksum()));
        return detectChangedChecksums(checksums);
    }

    /**
     * Same as {@link #detectChanges(Map)} for a bare {@code filepath -> checksum} map.
     */
    public Set<String> detectChangedChecksums(Map<String, String> baseline) throws InterruptedException {
        Set<String> changed = new LinkedHashSet<>();
        if (baseline.isEmpty()) {
            return changed;
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(snapshotter.threadCount(), baseline.size()));
        try {
            List<String> paths = new ArrayList<>(baseline.size());
            List<Future<Boolean>> futures = new ArrayList<>(baseline.size());
            for (Map.Entry<String, String> entry : baseline.entrySet()) {
                paths.add(entry.getKey());
                futures.add(executor.submit(() -> hasChanged(entry.getKey(), entry.getValue())));
            }
            for (int i = 0; i < futures.size(); i++) {
                if (ChecksumSnapshotter.await(futures.get(i))) {
                    changed.add(paths.get(i));
                }
            }
        } finally {
            executor.shutdownNow();
        }
        LOGGER.debug("{} of {} tracked files changed", changed.size(), baseline.size());
        return changed;
    }

    private boolean hasChanged(String filepath, String expectedChecksum) {
        Path path = snapshotter.resolve(filepath);
        if (!Files.isRegularFile(path)) {
            return true;
        }
        try {
            return !snapshotter.checksum(path).equals(expectedChecksum);
        } catch (IOException ex) {
            // Unreadable counts as changed.
            LOGGER.warn("Cannot read tracked file {}: {}", path, ex.getMessage());
            return true;
        }
    }
}
