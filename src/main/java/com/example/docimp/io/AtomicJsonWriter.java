package com.example.docimp.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Writes JSON documents with the write-then-rename discipline: content goes to a
 * temporary file in the target directory, is flushed to disk, and is then renamed onto
 * the canonical path. Readers see either the previous file or the new one, never a
 * partial write.
 */
public final class AtomicJsonWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(AtomicJsonWriter.class);

    private final ObjectMapper mapper;
    private final FileMover mover;

    public AtomicJsonWriter(ObjectMapper mapper) {
        this(mapper, FileMover.atomicRename());
    }

    public AtomicJsonWriter(ObjectMapper mapper, FileMover mover) {
        this.mapper = mapper == null ? StateJson.newMapper() : mapper;
        this.mover = mover == null ? FileMover.atomicRename() : mover;
    }

    /**
     * Serializes {@code value} and atomically publishes it at {@code target}.
     */
    public void write(Path target, Object value) throws IOException {
        byte[] content = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        writeBytes(target, content);
    }

    /**
     * Atomically publishes raw bytes at {@code target}.
     */
    public void writeBytes(Path target, byte[] content) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        // Created like any new file, so it gets the process umask rather than owner-only access.
        Path temporary = directory.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temporary, StandardOpenOption.WRITE, StandardOpenOption.CREATE_NEW)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            mover.move(temporary, target);
            LOGGER.debug("Wrote {} ({} bytes)", target, content.length);
        } catch (IOException | RuntimeException ex) {
            try {
                Files.deleteIfExists(temporary);
            } catch (IOException cleanup) {
                ex.addSuppressed(cleanup);
            }
            throw ex;
        }
    }
}
