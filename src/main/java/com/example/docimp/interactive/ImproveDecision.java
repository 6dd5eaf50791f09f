package com.example.docimp.interactive;

/**
 * A user's answer to an improve prompt. {@code text} carries the edited documentation
 * for {@link Kind#EDIT} and the feedback for {@link Kind#REGENERATE}.
 */
public record ImproveDecision(Kind kind, String text) {
    public enum Kind {
        ACCEPT,
        EDIT,
        REGENERATE,
        SKIP,
        QUIT
    }

    public static ImproveDecision accept() {
        return new ImproveDecision(Kind.ACCEPT, null);
    }

    public static ImproveDecision edit(String editedText) {
        return new ImproveDecision(Kind.EDIT, editedText);
    }

    public static ImproveDecision regenerate(String feedback) {
        return new ImproveDecision(Kind.REGENERATE, feedback);
    }

    public static ImproveDecision skip() {
        return new ImproveDecision(Kind.SKIP, null);
    }

    public static ImproveDecision quit() {
        return new ImproveDecision(Kind.QUIT, null);
    }
}
