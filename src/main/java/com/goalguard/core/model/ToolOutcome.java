package com.goalguard.core.model;

/**
 * Captured result of a tool call whose failure is carried forward into a gate
 * rather than failing the transition that issued it.
 */
public record ToolOutcome<T>(
    ToolKind kind,
    T value,
    String error,
    boolean timedOut
) {
    public static <T> ToolOutcome<T> success(ToolKind kind, T value) {
        return new ToolOutcome<>(kind, value, null, false);
    }

    public static <T> ToolOutcome<T> failure(ToolKind kind, String error, boolean timedOut) {
        return new ToolOutcome<>(kind, null, error, timedOut);
    }

    public boolean succeeded() {
        return error == null;
    }
}
