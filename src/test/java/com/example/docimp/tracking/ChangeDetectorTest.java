package com.example.docimp.tracking;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeDetectorTest {
    @Test
    void reportsExactlyTheModifiedFiles() throws Exception {
        Path dir = Files.createTempDirectory("change-detector");
        List<String> paths = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            String name = "src/file_" + i + ".py";
            Files.createDirectories(dir.resolve("src"));
            Files.writeString(dir.resolve(name), "value = " + i + "\n");
            paths.add(name);
        }
        ChecksumSnapshotter snapshotter = new ChecksumSnapshotter(dir, 8);
        Map<String, FileSnapshot> baseline = snapshotter.snapshot(paths);

        Set<String> expected = new HashSet<>();
        for (int i = 0; i < 1000; i += 10) {
            String name = paths.get(i);
            Files.writeString(dir.resolve(name), "value = " + (i + 1) + "  # changed\n");
            expected.add(name);
        }

        Set<String> changed = new ChangeDetector(snapshotter).detectChanges(baseline);

        assertEquals(100, changed.size());
        assertEquals(expected, changed);
    }

    @Test
    void rewritingIdenticalBytesIsNotAChange() throws Exception {
        Path dir = Files.createTempDirectory("change-detector");
        Files.writeString(dir.resolve("a.py"), "a = 1\n");
        Files.writeString(dir.resolve("b.py"), "b = 2\n");
        ChecksumSnapshotter snapshotter = new ChecksumSnapshotter(dir, 2);
        Map<String, FileSnapshot> baseline = snapshotter.snapshot(List.of("a.py", "b.py"));

        Files.writeString(dir.resolve("a.py"), "a = 1\n");
        Files.writeString(dir.resolve("b.py"), "b = 2\n");

        assertTrue(new ChangeDetector(snapshotter).detectChanges(baseline).isEmpty());
    }

    @Test
    void reportsDeletedFilesAndIgnoresNewOnes() throws Exception {
        Path dir = Files.createTempDirectory("change-detector");
        Files.writeString(dir.resolve("a.py"), "a = 1\n");
        Files.writeString(dir.resolve("b.py"), "b = 2\n");
        ChecksumSnapshotter snapshotter = new ChecksumSnapshotter(dir, 2);
        Map<String, String> baseline = ChecksumSnapshotter.checksumsOf(snapshotter.snapshot(List.of("a.py", "b.py")));

        Files.delete(dir.resolve("b.py"));
        Files.writeString(dir.resolve("c.py"), "c = 3\n");

        assertEquals(Set.of("b.py"), new ChangeDetector(snapshotter).detectChangedChecksums(baseline));
    }

    @Test
    void emptyBaselineHasNoChanges() throws Exception {
        ChangeDetector detector = new ChangeDetector(new ChecksumSnapshotter(Files.createTempDirectory("change-detector"), 2));

        assertTrue(detector.detectChanges(Map.of()).isEmpty());
    }
}
