package com.example.docimp.workflow;

import com.example.docimp.io.Timestamps;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.util.List;

/**
 * Brings parsed ledger documents to the current schema version. Each applied upgrade is
 * appended to {@code migration_log}.
 */
final class WorkflowLedgerMigrations {
    static final String CURRENT_VERSION = "1.0";
    static final String LEGACY_VERSION = "legacy";
    static final List<String> KNOWN_VERSIONS = List.of(CURRENT_VERSION);

    private WorkflowLedgerMigrations() {
    }

    /**
     * Upgrades a ledger written before versioning to {@link #CURRENT_VERSION} in place.
     *
     * @throws IllegalArgumentException if the document declares a version this build does not know
     */
    static ObjectNode apply(ObjectNode root, Clock clock) {
        if (!root.hasNonNull("schema_version")) {
            root.put("schema_version", CURRENT_VERSION);
            appendLog(root, LEGACY_VERSION, CURRENT_VERSION, clock);
            return root;
        }
        String version = root.get("schema_version").asText();
        if (!KNOWN_VERSIONS.contains(version)) {
            throw new IllegalArgumentException("Unknown workflow state version " + version
                    + ". Known versions: " + String.join(", ", KNOWN_VERSIONS));
        }
        return root;
    }

    private static void appendLog(ObjectNode root, String from, String to, Clock clock) {
        ArrayNode log = root.has("migration_log") && root.get("migration_log").isArray()
                ? (ArrayNode) root.get("migration_log")
                : root.putArray("migration_log");
        log.addObject()
                .put("from", from)
                .put("to", to)
                .put("timestamp", Timestamps.now(clock));
    }
}
