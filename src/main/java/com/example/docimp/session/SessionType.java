package com.example.docimp.session;

import java.util.Locale;

/**
 * The two kinds of interruptible session. Each type owns a file name prefix in the
 * session-reports directory.
 */
public enum SessionType {
    AUDIT("audit", AuditSession.class),
    IMPROVE("improve", ImproveSession.class);

    private final String value;
    private final Class<? extends SessionRecord> recordClass;

    SessionType(String value, Class<? extends SessionRecord> recordClass) {
        this.value = value;
        this.recordClass = recordClass;
    }

    public String value() {
        return value;
    }

    public Class<? extends SessionRecord> recordClass() {
        return recordClass;
    }

    public String filePrefix() {
        return value + "-session-";
    }

    public String fileName(String sessionId) {
        return filePrefix() + sessionId + ".json";
    }

    /**
     * Parses {@code audit} or {@code improve}; anything else is a caller bug.
     */
    public static SessionType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (SessionType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Invalid session type '" + value + "'. Must be 'audit' or 'improve'");
    }

    @Override
    public String toString() {
        return value;
    }
}
