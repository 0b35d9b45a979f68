package com.goalguard.core.tools;

import com.goalguard.core.model.ToolKind;

/**
 * Failure of an external tool call, including timeouts. Always caught inside the core and
 * converted into a failed gate check or a tool-failure transition.
 */
public class ToolInvocationException extends Exception {

    private final ToolKind kind;
    private final boolean timedOut;

    public ToolInvocationException(ToolKind kind, String message) {
        this(kind, message, null, false);
    }

    public ToolInvocationException(ToolKind kind, String message, Throwable cause) {
        this(kind, message, cause, false);
    }

    public ToolInvocationException(ToolKind kind, String message, Throwable cause, boolean timedOut) {
        super(kind.key() + ": " + message, cause);
        this.kind = kind;
        this.timedOut = timedOut;
    }

    public static ToolInvocationException timeout(ToolKind kind, long timeoutMs) {
        return new ToolInvocationException(kind, "timed out after " + timeoutMs + " ms", null, true);
    }

    public ToolKind getKind() {
        return kind;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
