package com.goalguard.core.gate;

/**
 * Failure of a single gate check. Never escapes a gate; it is folded into the
 * {@link GateResult} as a failed check.
 */
public class GateCheckException extends Exception {

    private final transient Object detail;

    public GateCheckException(String message) {
        this(message, null);
    }

    public GateCheckException(String message, Object detail) {
        super(message);
        this.detail = detail;
    }

    public Object getDetail() {
        return detail;
    }
}
