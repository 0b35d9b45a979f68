package com.goalguard.core.walkforward;

/**
 * How training ranges are laid out across successive walk-forward windows.
 */
public enum WindowMode {
    /** Fixed-size training range that slides forward with each window. */
    ROLLING,
    /** Training always starts at row 0 and expands; test ranges are unchanged. */
    ANCHORED
}
