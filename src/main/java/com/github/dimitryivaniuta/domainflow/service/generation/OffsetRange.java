package com.github.dimitryivaniuta.domainflow.service.generation;

/**
 * Half-open offset range {@code [start, endExclusive)} reserved from a generation cursor.
 *
 * @param start        first offset
 * @param endExclusive one past the last offset
 */
public record OffsetRange(long start, long endExclusive) {

    public OffsetRange {
        if (start < 0 || endExclusive < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + endExclusive + ")");
        }
    }

    public long size() {
        return endExclusive - start;
    }

    public boolean isEmpty() {
        return endExclusive == start;
    }
}
