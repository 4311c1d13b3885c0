package com.puzzle.solver.ids;

import lombok.Value;

/**
 * Inclusive range of product ids, {@code start <= end}.
 */
@Value
public class IdRange {

    long start;
    long end;

    public IdRange(long start, long end) {
        if (start < 0) {
            throw new IllegalArgumentException("Range start must be >= 0. Got: " + start);
        }
        if (start > end) {
            throw new IllegalArgumentException("Range start " + start + " is greater than end " + end);
        }
        this.start = start;
        this.end = end;
    }

    public static IdRange of(long start, long end) {
        return new IdRange(start, end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
