package com.goalguard.core.walkforward;

/**
 * Thrown when a dataset cannot support the requested number of non-degenerate windows.
 */
public class InsufficientDataException extends RuntimeException {

    private final int requiredRows;
    private final int availableRows;

    public InsufficientDataException(int requiredRows, int availableRows, String detail) {
        super("Insufficient data for walk-forward windows: required %d rows, available %d (%s)"
                .formatted(requiredRows, availableRows, detail));
        this.requiredRows = requiredRows;
        this.availableRows = availableRows;
    }

    public int getRequiredRows() {
        return requiredRows;
    }

    public int getAvailableRows() {
        return availableRows;
    }
}
