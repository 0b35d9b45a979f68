package com.goalguard.core.model;

import java.io.Serializable;

/**
 * Reference to a time-ordered dataset, optionally restricted to a half-open row range.
 *
 * @param uri     location of the dataset
 * @param fromRow first row included, or null for the start of the dataset
 * @param toRow   first row excluded, or null for the end of the dataset
 */
public record DataRef(
    String uri,
    Integer fromRow,
    Integer toRow
) implements Serializable {

    public DataRef {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("uri must not be blank");
        }
        if (fromRow != null && toRow != null && fromRow > toRow) {
            throw new IllegalArgumentException("fromRow (%d) must not exceed toRow (%d)".formatted(fromRow, toRow));
        }
    }

    public static DataRef of(String uri) {
        return new DataRef(uri, null, null);
    }

    /** Returns a reference to rows {@code [fromRow, toRow)} of the same dataset. */
    public DataRef slice(int fromRow, int toRow) {
        return new DataRef(uri, fromRow, toRow);
    }

    public boolean isSliced() {
        return fromRow != null || toRow != null;
    }
}
