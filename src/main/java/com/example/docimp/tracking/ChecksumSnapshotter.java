package com.example.docimp.tracking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Computes content-addressed snapshots of tracked files. Checksums are SHA-256 over the
 * file bytes, so touching a file without changing it yields the same snapshot checksum.
 */
public class ChecksumSnapshotter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChecksumSnapshotter.class);

    private final Path baseDirectory;
    private final int threadCount;

    public ChecksumSnapshotter(Path baseDirectory, int threadCount) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
        this.threadCount = Math.max(1, threadCount);
    }

    /**
     * Snapshots every readable regular file in {@code filepaths}. Missing or unreadable
     * files are left out of the result; callers treat an absent entry as unknown.
     */
    public Map<String, FileSnapshot> snapshot(Collection<String> filepaths) throws InterruptedException {
        Map<String, FileSnapshot> snapshots = new LinkedHashMap<>();
        if (filepaths.isEmpty()) {
            return snapshots;
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threadCount, filepaths.size()));
        try {
            List<Future<Optional<FileSnapshot>>> futures = new ArrayList<>(filepaths.size());
            for (String filepath : filepaths) {
                futures.add(executor.submit(() -> snapshotFile(filepath)));
            }
            for (Future<Optional<FileSnapshot>> future : futures) {
                await(future).ifPresent(snapshot -> snapshots.put(snapshot.filepath(), snapshot));
            }
            return snapshots;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Snapshots a single file, or returns empty if it does not exist or cannot be read.
     */
    public Optional<FileSnapshot> snapshotFile(String filepath) {
        Path path = resolve(filepath);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            String checksum = checksum(path);
            return Optional.of(new FileSnapshot(
                    filepath,
                    attributes.lastModifiedTime().toInstant(),
                    checksum,
                    attributes.size()
            ));
        } catch (AccessDeniedException ex) {
            LOGGER.warn("Permission denied when reading {}", path);
            return Optional.empty();
        } catch (IOException ex) {
            LOGGER.debug("Skipping unreadable file {}", path, ex);
            return Optional.empty();
        }
    }

    /**
     * Returns the SHA-256 hex digest of a file's contents.
     */
    public String checksum(Path path) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream inputStream = Files.newInputStream(path)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        byte[] hash = digest.digest();
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            builder.append(String.format("%02x", b));
        }
        return builder.toString();
    }

    /**
     * Extracts the checksum column of a snapshot map, as stored in the workflow ledger.
     */
    public static Map<String, String> checksumsOf(Map<String, FileSnapshot> snapshots) {
        Map<String, String> checksums = new LinkedHashMap<>();
        snapshots.forEach((filepath, snapshot) -> checksums.put(filepath, snapshot.checksum()));
        return checksums;
    }

    Path resolve(String filepath) {
        return baseDirectory.resolve(filepath).normalize();
    }

    int threadCount() {
        return threadCount;
    }

    static <T> T await(Future<T> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Checksum task failed", cause);
        }
    }
}
