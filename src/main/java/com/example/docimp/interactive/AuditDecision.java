package com.example.docimp.interactive;

/**
 * A user's answer to an audit prompt.
 */
public record AuditDecision(Kind kind, Integer rating) {
    public enum Kind {
        RATE,
        SKIP,
        QUIT
    }

    public static AuditDecision rate(int rating) {
        return new AuditDecision(Kind.RATE, rating);
    }

    public static AuditDecision skip() {
        return new AuditDecision(Kind.SKIP, null);
    }

    public static AuditDecision quit() {
        return new AuditDecision(Kind.QUIT, null);
    }
}
