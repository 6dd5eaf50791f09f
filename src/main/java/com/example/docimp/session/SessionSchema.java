package com.example.docimp.session;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks applied to a parsed session file before it is bound to a record
 * class. Required fields must be present with the right shape; fields the schema does not
 * mention are allowed and preserved.
 */
final class SessionSchema {
    private static final Set<String> IMPROVE_STATUSES = Set.of("accepted", "skipped", "error");

    private SessionSchema() {
    }

    /**
     * Returns the list of violations, empty when the document is valid.
     */
    static List<String> validate(JsonNode root, SessionType type) {
        List<String> violations = new ArrayList<>();
        if (root == null || !root.isObject()) {
            violations.add("session file must contain a JSON object");
            return violations;
        }
        requireText(root, "session_id", violations);
        requireText(root, "started_at", violations);
        optionalText(root, "schema_version", violations);
        optionalText(root, "completed_at", violations);
        requireObject(root, "config", violations);

        JsonNode currentIndex = root.get("current_index");
        JsonNode totalItems = root.get("total_items");
        if (currentIndex == null || !currentIndex.canConvertToInt() || !currentIndex.isIntegralNumber()) {
            violations.add("current_index: required integer");
        } else if (currentIndex.intValue() < 0) {
            violations.add("current_index: must be >= 0");
        }
        if (totalItems == null || !totalItems.canConvertToInt() || !totalItems.isIntegralNumber()) {
            violations.add("total_items: required integer");
        } else if (totalItems.intValue() < 1) {
            violations.add("total_items: must be >= 1");
        }
        if (violations.isEmpty() && currentIndex.intValue() > totalItems.intValue()) {
            violations.add("current_index: must not exceed total_items");
        }

        JsonNode fileSnapshot = root.get("file_snapshot");
        if (fileSnapshot != null && !fileSnapshot.isNull()) {
            validateFileSnapshot(fileSnapshot, violations);
        }

        if (type == SessionType.AUDIT) {
            validateRatings(root.get("partial_ratings"), violations);
        } else {
            requireText(root, "transaction_id", violations);
            optionalText(root, "previous_session_id", violations);
            validateImprovements(root.get("partial_improvements"), violations);
        }
        return violations;
    }

    private static void validateFileSnapshot(JsonNode node, List<String> violations) {
        if (!node.isObject()) {
            violations.add("file_snapshot: must be an object");
            return;
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            String prefix = "file_snapshot[" + entry.getKey() + "]";
            JsonNode snapshot = entry.getValue();
            if (!snapshot.isObject()) {
                violations.add(prefix + ": must be an object");
                continue;
            }
            if (!snapshot.path("filepath").isTextual()) {
                violations.add(prefix + ".filepath: required string");
            }
            if (!snapshot.path("timestamp").isNumber()) {
                violations.add(prefix + ".timestamp: required number");
            }
            if (!snapshot.path("checksum").isTextual()) {
                violations.add(prefix + ".checksum: required string");
            }
            JsonNode size = snapshot.path("size");
            if (!size.isIntegralNumber() || size.longValue() < 0) {
                violations.add(prefix + ".size: required non-negative integer");
            }
        }
    }

    private static void validateRatings(JsonNode node, List<String> violations) {
        if (node == null || !node.isObject()) {
            violations.add("partial_ratings: required object");
            return;
        }
        for (Iterator<Map.Entry<String, JsonNode>> files = node.fields(); files.hasNext(); ) {
            Map.Entry<String, JsonNode> file = files.next();
            if (!file.getValue().isObject()) {
                violations.add("partial_ratings[" + file.getKey() + "]: must be an object");
                continue;
            }
            for (Iterator<Map.Entry<String, JsonNode>> items = file.getValue().fields(); items.hasNext(); ) {
                Map.Entry<String, JsonNode> item = items.next();
                JsonNode rating = item.getValue();
                if (rating.isNull()) {
                    continue;
                }
                if (!rating.isIntegralNumber()
                        || rating.intValue() < AuditSession.MIN_RATING
                        || rating.intValue() > AuditSession.MAX_RATING) {
                    violations.add("partial_ratings[" + file.getKey() + "][" + item.getKey()
                            + "]: rating must be null or an integer from 1 to 4");
                }
            }
        }
    }

    private static void validateImprovements(JsonNode node, List<String> violations) {
        if (node == null || !node.isObject()) {
            violations.add("partial_improvements: required object");
            return;
        }
        for (Iterator<Map.Entry<String, JsonNode>> files = node.fields(); files.hasNext(); ) {
            Map.Entry<String, JsonNode> file = files.next();
            if (!file.getValue().isObject()) {
                violations.add("partial_improvements[" + file.getKey() + "]: must be an object");
                continue;
            }
            for (Iterator<Map.Entry<String, JsonNode>> items = file.getValue().fields(); items.hasNext(); ) {
                Map.Entry<String, JsonNode> item = items.next();
                String prefix = "partial_improvements[" + file.getKey() + "][" + item.getKey() + "]";
                JsonNode record = item.getValue();
                if (!record.isObject()) {
                    violations.add(prefix + ": must be an object");
                    continue;
                }
                if (record.isEmpty()) {
                    continue;
                }
                JsonNode status = record.get("status");
                if (status == null || !status.isTextual() || !IMPROVE_STATUSES.contains(status.asText())) {
                    violations.add(prefix + ".status: must be one of accepted, skipped, error");
                }
                if (!record.path("timestamp").isTextual()) {
                    violations.add(prefix + ".timestamp: required string");
                }
                JsonNode suggestion = record.get("suggestion");
                if (suggestion != null && !suggestion.isTextual()) {
                    violations.add(prefix + ".suggestion: must be a string");
                }
            }
        }
    }

    private static void requireText(JsonNode root, String field, List<String> violations) {
        JsonNode value = root.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            violations.add(field + ": required string");
        }
    }

    private static void optionalText(JsonNode root, String field, List<String> violations) {
        JsonNode value = root.get(field);
        if (value != null && !value.isNull() && !value.isTextual()) {
            violations.add(field + ": must be a string or null");
        }
    }

    private static void requireObject(JsonNode root, String field, List<String> violations) {
        JsonNode value = root.get(field);
        if (value == null || !value.isObject()) {
            violations.add(field + ": required object");
        }
    }
}
