package com.goalguard.core.walkforward;

import java.io.Serializable;

/**
 * One walk-forward window over a time-ordered dataset.
 * <pre>
 * ┌──────────────┬─────┬──────────┬───────┐
 * │   Training   │ gap │   Test   │ slack │
 * └──────────────┴─────┴──────────┴───────┘
 * </pre>
 * All ranges are half-open row ordinals {@code [start, end)}.
 *
 * @param windowId   zero-based index of this window in the sequence
 * @param trainStart first training row
 * @param trainEnd   first row after the training range
 * @param testStart  first test row
 * @param testEnd    first row after the test range
 */
public record WalkForwardWindow(
    int windowId,
    int trainStart,
    int trainEnd,
    int testStart,
    int testEnd
) implements Serializable {

    public WalkForwardWindow {
        if (windowId < 0) {
            throw new IllegalArgumentException("windowId must be non-negative, got: %d".formatted(windowId));
        }
        if (trainStart < 0 || trainStart >= trainEnd) {
            throw new IllegalArgumentException("trainStart (%d) must be non-negative and before trainEnd (%d)"
                    .formatted(trainStart, trainEnd));
        }
        if (testStart < trainEnd) {
            throw new IllegalArgumentException("testStart (%d) must not precede trainEnd (%d)"
                    .formatted(testStart, trainEnd));
        }
        if (testStart >= testEnd) {
            throw new IllegalArgumentException("testStart (%d) must be before testEnd (%d)"
                    .formatted(testStart, testEnd));
        }
    }

    public int trainRows() {
        return trainEnd - trainStart;
    }

    public int testRows() {
        return testEnd - testStart;
    }

    public int gapRows() {
        return testStart - trainEnd;
    }

    public String describe() {
        return "Window %d: Train [%d, %d) (%d rows) | Test [%d, %d) (%d rows)"
                .formatted(windowId, trainStart, trainEnd, trainRows(), testStart, testEnd, testRows());
    }
}
