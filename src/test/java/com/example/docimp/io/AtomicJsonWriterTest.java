package com.example.docimp.io;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class AtomicJsonWriterTest {
    @Test
    void writesAndReplacesTargetFile() throws Exception {
        Path dir = Files.createTempDirectory("atomic-writer");
        Path target = dir.resolve("state.json");
        AtomicJsonWriter writer = new AtomicJsonWriter(StateJson.newMapper());

        writer.write(target, Map.of("value", 1));
        writer.write(target, Map.of("value", 2));

        assertEquals(2, StateJson.newMapper().readTree(target.toFile()).get("value").asInt());
        assertEquals(List.of("state.json"), fileNames(dir));
    }

    @Test
    void failedRenameLeavesPreviousFileUntouched() throws Exception {
        Path dir = Files.createTempDirectory("atomic-writer");
        Path target = dir.resolve("state.json");
        Files.writeString(target, "{\"value\":1}");
        AtomicJsonWriter writer = new AtomicJsonWriter(StateJson.newMapper(), (source, destination) -> {
            throw new IOException("simulated crash before rename");
        });

        IOException error = assertThrows(IOException.class, () -> writer.write(target, Map.of("value", 2)));

        assertEquals("simulated crash before rename", error.getMessage());
        assertEquals("{\"value\":1}", Files.readString(target, StandardCharsets.UTF_8));
        assertEquals(List.of("state.json"), fileNames(dir));
    }

    @Test
    void failedRenameWithoutPreviousFileLeavesNothingBehind() throws Exception {
        Path dir = Files.createTempDirectory("atomic-writer");
        Path target = dir.resolve("state.json");
        AtomicJsonWriter writer = new AtomicJsonWriter(StateJson.newMapper(), (source, destination) -> {
            throw new IOException("disk full");
        });

        assertThrows(IOException.class, () -> writer.writeBytes(target, "{}".getBytes(StandardCharsets.UTF_8)));

        assertFalse(Files.exists(target));
        assertTrue(fileNames(dir).isEmpty());
    }

    @Test
    void createsMissingParentDirectories() throws Exception {
        Path dir = Files.createTempDirectory("atomic-writer");
        Path target = dir.resolve("nested").resolve("deeper").resolve("state.json");

        new AtomicJsonWriter(null).write(target, Map.of("ok", true));

        assertTrue(StateJson.newMapper().readTree(target.toFile()).get("ok").asBoolean());
    }

    @Test
    void publishedFileGetsTheSamePermissionsAsAPlainWrite() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path dir = Files.createTempDirectory("atomic-writer");
        Path plain = Files.writeString(dir.resolve("plain.json"), "{}");
        Path target = dir.resolve("state.json");

        new AtomicJsonWriter(StateJson.newMapper()).write(target, Map.of("value", 1));

        assertEquals(Files.getPosixFilePermissions(plain), Files.getPosixFilePermissions(target));
    }

    private static List<String> fileNames(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(path -> path.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }
}
