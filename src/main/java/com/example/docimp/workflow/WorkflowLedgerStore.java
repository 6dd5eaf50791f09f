package com.example.docimp.workflow;

import com.example.docimp.io.AtomicJsonWriter;
import com.example.docimp.io.CorruptStateException;
import com.example.docimp.io.StateJson;
import com.example.docimp.io.StateNotFoundException;
import com.example.docimp.io.StateValidationException;
import com.example.docimp.io.Timestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the workflow ledger ({@code workflow-state.json}). Every save first
 * archives the ledger being replaced into the history directory, then publishes the new
 * ledger with an atomic rename.
 *
 * <p>There is no cross-process locking: two processes saving concurrently each write a
 * consistent file, and the last rename wins.
 */
public class WorkflowLedgerStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkflowLedgerStore.class);
    static final String HISTORY_PREFIX = "workflow-state-";
    static final String HISTORY_SUFFIX = ".json";

    private final Path ledgerFile;
    private final Path historyDirectory;
    private final ObjectMapper mapper;
    private final AtomicJsonWriter writer;
    private final Clock clock;
    private final boolean historyEnabled;
    private Instant lastCapture = Instant.MIN;

    public WorkflowLedgerStore(Path ledgerFile, Path historyDirectory) {
        this(ledgerFile, historyDirectory, StateJson.newMapper(), null, Clock.systemUTC(), true);
    }

    public WorkflowLedgerStore(Path ledgerFile,
                               Path historyDirectory,
                               ObjectMapper mapper,
                               AtomicJsonWriter writer,
                               Clock clock,
                               boolean historyEnabled) {
        this.ledgerFile = ledgerFile;
        this.historyDirectory = historyDirectory;
        this.mapper = mapper == null ? StateJson.newMapper() : mapper;
        this.writer = writer == null ? new AtomicJsonWriter(this.mapper) : writer;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.historyEnabled = historyEnabled;
    }

    /**
     * Returns the current ledger, or an all-empty ledger if none has been written yet.
     */
    public WorkflowLedger load() throws IOException {
        byte[] content;
        try {
            content = Files.readAllBytes(ledgerFile);
        } catch (NoSuchFileException ex) {
            return WorkflowLedger.empty();
        }
        return parse(ledgerFile, content);
    }

    /**
     * Archives the current ledger (if any) into history, then atomically replaces it.
     */
    public void save(WorkflowLedger ledger) throws IOException {
        if (historyEnabled) {
            archiveCurrent();
        }
        writer.write(ledgerFile, ledger);
    }

    /**
     * Replaces one stage's entry with a run completed now.
     */
    public WorkflowLedger recordStage(WorkflowStage stage, int itemCount, Map<String, String> fileChecksums) throws IOException {
        WorkflowLedger ledger = load();
        ledger.put(stage, new StageRun(clock.instant(), itemCount, fileChecksums));
        save(ledger);
        LOGGER.debug("Recorded {} run with {} items over {} files", stage, itemCount, fileChecksums.size());
        return ledger;
    }

    /**
     * History snapshots, newest first.
     */
    public List<Path> listHistory() throws IOException {
        List<Path> snapshots = new ArrayList<>();
        if (!Files.isDirectory(historyDirectory)) {
            return snapshots;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(historyDirectory, HISTORY_PREFIX + "*" + HISTORY_SUFFIX)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    snapshots.add(path);
                }
            }
        }
        // File names embed a fixed-width capture time, so name order is time order.
        snapshots.sort(Comparator.comparing((Path path) -> path.getFileName().toString()).reversed());
        return snapshots;
    }

    /**
     * At most {@code limit} history snapshots, newest first.
     */
    public List<Path> listHistory(int limit) throws IOException {
        if (limit < 0) {
            throw new IllegalArgumentException("History limit must be >= 0, got " + limit);
        }
        List<Path> snapshots = listHistory();
        return snapshots.size() <= limit ? snapshots : new ArrayList<>(snapshots.subList(0, limit));
    }

    /**
     * Reads one history snapshot with the same validation as {@link #load()}.
     */
    public WorkflowLedger loadSnapshot(Path snapshot) throws IOException {
        try {
            return parse(snapshot, Files.readAllBytes(snapshot));
        } catch (NoSuchFileException ex) {
            throw new StateNotFoundException("History snapshot not found: " + snapshot, snapshot);
        }
    }

    /**
     * Makes a history snapshot the current ledger. The ledger it replaces is archived.
     */
    public WorkflowLedger restore(Path snapshot) throws IOException {
        WorkflowLedger restored = loadSnapshot(snapshot);
        save(restored);
        LOGGER.info("Restored workflow state from {}", snapshot.getFileName());
        return restored;
    }

    /**
     * Deletes snapshots beyond the newest {@code maxSnapshots}, and snapshots last
     * modified more than {@code maxAgeDays} ago.
     *
     * @return the deleted snapshot paths
     */
    public List<Path> pruneHistory(int maxSnapshots, int maxAgeDays) throws IOException {
        if (maxSnapshots < 0 || maxAgeDays < 0) {
            throw new IllegalArgumentException("History retention limits must be >= 0");
        }
        Instant threshold = clock.instant().minus(Duration.ofDays(maxAgeDays));
        List<Path> deleted = new ArrayList<>();
        List<Path> snapshots = listHistory();
        for (int i = 0; i < snapshots.size(); i++) {
            Path snapshot = snapshots.get(i);
            boolean overCount = i >= maxSnapshots;
            boolean overAge = Files.getLastModifiedTime(snapshot).toInstant().isBefore(threshold);
            if ((overCount || overAge) && Files.deleteIfExists(snapshot)) {
                deleted.add(snapshot);
            }
        }
        if (!deleted.isEmpty()) {
            LOGGER.info("Pruned {} workflow history snapshot(s)", deleted.size());
        }
        return deleted;
    }

    public Path ledgerFile() {
        return ledgerFile;
    }

    public Path historyDirectory() {
        return historyDirectory;
    }

    private void archiveCurrent() throws IOException {
        byte[] current;
        try {
            current = Files.readAllBytes(ledgerFile);
        } catch (NoSuchFileException ex) {
            return;
        }
        Path snapshot = nextHistoryPath();
        writer.writeBytes(snapshot, current);
        LOGGER.debug("Archived workflow state to {}", snapshot.getFileName());
    }

    private synchronized Path nextHistoryPath() {
        Instant capture = clock.instant();
        if (!capture.isAfter(lastCapture)) {
            capture = lastCapture.plusNanos(1);
        }
        Path path = historyPath(capture);
        while (Files.exists(path)) {
            capture = capture.plusNanos(1);
            path = historyPath(capture);
        }
        lastCapture = capture;
        return path;
    }

    private Path historyPath(Instant capture) {
        return historyDirectory.resolve(HISTORY_PREFIX + Timestamps.forFileName(capture) + HISTORY_SUFFIX);
    }

    private WorkflowLedger parse(Path path, byte[] content) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (IOException ex) {
            throw new CorruptStateException("Workflow state is not valid JSON: " + path.getFileName(), path, ex);
        }
        if (root == null || !root.isObject()) {
            throw new StateValidationException(path, List.of("workflow state must contain a JSON object"));
        }
        ObjectNode migrated;
        try {
            migrated = WorkflowLedgerMigrations.apply((ObjectNode) root, clock);
        } catch (IllegalArgumentException ex) {
            throw new StateValidationException(path, ex.getMessage(), ex);
        }
        List<String> violations = validate(migrated);
        if (!violations.isEmpty()) {
            throw new StateValidationException(path, violations);
        }
        try {
            return mapper.treeToValue(migrated, WorkflowLedger.class);
        } catch (JsonProcessingException ex) {
            throw new StateValidationException(path, ex.getOriginalMessage(), ex);
        }
    }

    private static List<String> validate(ObjectNode root) {
        List<String> violations = new ArrayList<>();
        for (WorkflowStage stage : WorkflowStage.values()) {
            String field = "last_" + stage.value();
            JsonNode run = root.get(field);
            if (run == null || run.isNull()) {
                continue;
            }
            if (!run.isObject()) {
                violations.add(field + ": must be an object or null");
                continue;
            }
            JsonNode timestamp = run.get("timestamp");
            if (timestamp == null || !timestamp.isTextual()) {
                violations.add(field + ".timestamp: required string");
            } else {
                try {
                    Instant.parse(timestamp.asText());
                } catch (DateTimeParseException ex) {
                    violations.add(field + ".timestamp: not an ISO-8601 instant");
                }
            }
            JsonNode itemCount = run.get("item_count");
            if (itemCount == null || !itemCount.isIntegralNumber() || itemCount.intValue() < 0) {
                violations.add(field + ".item_count: required non-negative integer");
            }
            JsonNode checksums = run.get("file_checksums");
            if (checksums == null || !checksums.isObject()) {
                violations.add(field + ".file_checksums: required object");
            } else {
                for (Iterator<Map.Entry<String, JsonNode>> it = checksums.fields(); it.hasNext(); ) {
                    Map.Entry<String, JsonNode> entry = it.next();
                    if (!entry.getValue().isTextual()) {
                        violations.add(field + ".file_checksums[" + entry.getKey() + "]: must be a string");
                    }
                }
            }
        }
        return violations;
    }
}
