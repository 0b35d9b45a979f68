package com.goalguard.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Time-ordered dataset view used for walk-forward windowing. Only the monotonic
 * timestamp column is needed; row {@code i} is the observation at {@code timestamps.get(i)}.
 */
public record TimeSeriesDataset(
    DataRef ref,
    List<Instant> timestamps
) {

    public TimeSeriesDataset {
        if (ref == null) {
            throw new IllegalArgumentException("ref must not be null");
        }
        timestamps = timestamps == null ? List.of() : List.copyOf(timestamps);
        for (int i = 1; i < timestamps.size(); i++) {
            if (!timestamps.get(i).isAfter(timestamps.get(i - 1))) {
                throw new IllegalArgumentException("timestamps must be strictly increasing; row %d (%s) is not after row %d (%s)"
                        .formatted(i, timestamps.get(i), i - 1, timestamps.get(i - 1)));
            }
        }
    }

    public int rowCount() {
        return timestamps.size();
    }

    public Instant timestampAt(int row) {
        return timestamps.get(row);
    }
}
