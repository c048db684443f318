package com.github.dimitryivaniuta.domainflow.service.error;

/**
 * The enumerator has no domain at the requested offset. Ends generation with partial results; it is
 * not a failure.
 */
public class ExhaustionException extends RuntimeException {

    private final long offset;
    private final long capacity;

    public ExhaustionException(long offset, long capacity) {
        super("Offset " + offset + " is beyond capacity " + capacity);
        this.offset = offset;
        this.capacity = capacity;
    }

    public long getOffset() {
        return offset;
    }

    public long getCapacity() {
        return capacity;
    }
}
