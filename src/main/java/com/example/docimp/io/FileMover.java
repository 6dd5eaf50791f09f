package com.example.docimp.io;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Final step of an atomic write: publishes a fully written temporary file under its
 * canonical name.
 */
@FunctionalInterface
public interface FileMover {
    void move(Path source, Path target) throws IOException;

    /**
     * Rename within the same directory. Falls back to a replacing move only on file
     * systems without atomic rename support.
     */
    static FileMover atomicRename() {
        return (source, target) -> {
            try {
                Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
        };
    }
}
