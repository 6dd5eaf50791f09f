package com.example.docimp.session;

import com.example.docimp.io.AtomicJsonWriter;
import com.example.docimp.io.CorruptStateException;
import com.example.docimp.io.StateJson;
import com.example.docimp.io.StateNotFoundException;
import com.example.docimp.io.StateStoreException;
import com.example.docimp.io.StateValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Persists one JSON file per session under the session-reports directory, named
 * {@code <type>-session-<id>.json}. Writes are atomic; loads are schema-checked.
 */
public class SessionStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionStore.class);
    private static final Comparator<SessionRecord> NEWEST_FIRST =
            Comparator.<SessionRecord, String>comparing(SessionRecord::getStartedAt, Comparator.nullsFirst(Comparator.naturalOrder())).reversed();

    private final Path sessionReportsDirectory;
    private final ObjectMapper mapper;
    private final AtomicJsonWriter writer;

    public SessionStore(Path sessionReportsDirectory) {
        this(sessionReportsDirectory, StateJson.newMapper(), null);
    }

    public SessionStore(Path sessionReportsDirectory, ObjectMapper mapper, AtomicJsonWriter writer) {
        this.sessionReportsDirectory = sessionReportsDirectory;
        this.mapper = mapper == null ? StateJson.newMapper() : mapper;
        this.writer = writer == null ? new AtomicJsonWriter(this.mapper) : writer;
    }

    /**
     * Atomically writes {@code record} as the current state of its session. A record that
     * {@link #load} would reject is refused and nothing is written.
     *
     * @return the session id the record was stored under
     */
    public String save(SessionRecord record, SessionType type) throws IOException {
        if (type == null) {
            throw new IllegalArgumentException("Session type is required");
        }
        if (record == null) {
            throw new IllegalArgumentException("Session record is required");
        }
        if (!type.recordClass().isInstance(record)) {
            throw new IllegalArgumentException("A " + record.getClass().getSimpleName()
                    + " cannot be stored as a " + type + " session");
        }
        String sessionId = record.getSessionId();
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session record must include 'session_id'");
        }
        Path target = pathFor(sessionId, type);
        List<String> violations = SessionSchema.validate(mapper.valueToTree(record), type);
        if (!violations.isEmpty()) {
            throw new IllegalArgumentException("Session " + sessionId + " is not a valid " + type + " session: "
                    + String.join("; ", violations));
        }
        writer.write(target, record);
        LOGGER.debug("Checkpointed {} session {} at index {}/{}", type, sessionId,
                record.getCurrentIndex(), record.getTotalItems());
        return sessionId;
    }

    /**
     * Reads and validates one session.
     *
     * @throws StateNotFoundException    if no file exists for the id
     * @throws CorruptStateException     if the file is not valid JSON
     * @throws StateValidationException  if required fields are missing or malformed
     */
    public SessionRecord load(String sessionId, SessionType type) throws IOException {
        Path path = pathFor(sessionId, type);
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (NoSuchFileException ex) {
            throw new StateNotFoundException("Session file not found: " + path.getFileName()
                    + ". Use 'docimp list-sessions " + type + "' to see available sessions or start a new session.", path);
        }
        return parse(path, content, type);
    }

    public AuditSession loadAudit(String sessionId) throws IOException {
        return (AuditSession) load(sessionId, SessionType.AUDIT);
    }

    public ImproveSession loadImprove(String sessionId) throws IOException {
        return (ImproveSession) load(sessionId, SessionType.IMPROVE);
    }

    /**
     * Returns every readable session of {@code type}, newest {@code started_at} first.
     * Files that are corrupt or fail validation are logged and skipped.
     */
    public List<SessionRecord> list(SessionType type) throws IOException {
        List<SessionRecord> sessions = new ArrayList<>();
        if (!Files.isDirectory(sessionReportsDirectory)) {
            return sessions;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(sessionReportsDirectory, type.filePrefix() + "*.json")) {
            for (Path path : stream) {
                try {
                    sessions.add(parse(path, Files.readAllBytes(path), type));
                } catch (StateStoreException ex) {
                    LOGGER.warn("Skipping unreadable session file {}: {}", path.getFileName(), ex.getMessage());
                } catch (NoSuchFileException ex) {
                    LOGGER.debug("Session file {} disappeared while listing", path.getFileName());
                }
            }
        }
        sessions.sort(NEWEST_FIRST);
        return sessions;
    }

    /**
     * Most recently started session of {@code type}, if any.
     */
    public Optional<SessionRecord> getLatest(SessionType type) throws IOException {
        List<SessionRecord> sessions = list(type);
        return sessions.isEmpty() ? Optional.empty() : Optional.of(sessions.get(0));
    }

    /**
     * Removes a session file. Deleting a session that does not exist is not an error.
     */
    public void delete(String sessionId, SessionType type) throws IOException {
        Path path = pathFor(sessionId, type);
        if (Files.deleteIfExists(path)) {
            LOGGER.debug("Deleted {} session {}", type, sessionId);
        }
    }

    public boolean exists(String sessionId, SessionType type) {
        return Files.exists(pathFor(sessionId, type));
    }

    public Path pathFor(String sessionId, SessionType type) {
        if (type == null) {
            throw new IllegalArgumentException("Session type is required");
        }
        if (sessionId == null || sessionId.isBlank()
                || sessionId.contains("/") || sessionId.contains("\\") || sessionId.contains("..")) {
            throw new IllegalArgumentException("Invalid session id '" + sessionId + "'");
        }
        return sessionReportsDirectory.resolve(type.fileName(sessionId));
    }

    public Path directory() {
        return sessionReportsDirectory;
    }

    private SessionRecord parse(Path path, byte[] content, SessionType type) throws StateStoreException {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (IOException ex) {
            throw new CorruptStateException("Session file is not valid JSON: " + path.getFileName(), path, ex);
        }
        List<String> violations = SessionSchema.validate(root, type);
        if (!violations.isEmpty()) {
            throw new StateValidationException(path, violations);
        }
        try {
            return mapper.treeToValue(root, type.recordClass());
        } catch (JsonProcessingException ex) {
            throw new StateValidationException(path, ex.getOriginalMessage(), ex);
        }
    }
}
