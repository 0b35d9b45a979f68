package com.goalguard.core.gate;

/**
 * Result of one passing or disabled check. Failures are signalled by throwing
 * {@link GateCheckException} instead.
 */
public record CheckOutcome(Object detail) {

    public static final String DISABLED = "disabled";

    public static CheckOutcome pass(Object detail) {
        return new CheckOutcome(detail);
    }

    public static CheckOutcome disabled() {
        return new CheckOutcome(DISABLED);
    }
}
