package com.puzzle.solver.ids;

import java.util.Collection;

import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sums the invalid product ids found in inclusive id ranges.
 */
@Getter
public class InvalidIdSummer {
    private static final Logger log = LoggerFactory.getLogger(InvalidIdSummer.class);

    private final RepetitionRule rule;

    public InvalidIdSummer() {
        this(RepetitionRule.AT_LEAST_TWICE);
    }

    public InvalidIdSummer(@NonNull RepetitionRule rule) {
        this.rule = rule;
    }

    /**
     * Sum of every invalid id in {@code [start, end]}, both ends included.
     *
     * @throws ArithmeticException if the sum does not fit in a {@code long}
     */
    public long sumInvalid(long start, long end) {
        return sumInvalid(IdRange.of(start, end));
    }

    public long sumInvalid(@NonNull IdRange range) {
        long sum = 0;
        int matches = 0;
        // stop on equality so that end == Long.MAX_VALUE terminates
        for (long value = range.getStart(); ; value++) {
            if (rule.matches(value)) {
                sum = Math.addExact(sum, value);
                matches++;
            }
            if (value == range.getEnd()) {
                break;
            }
        }
        log.debug("Range {}: {} invalid ids, sum {}", range, matches, sum);
        return sum;
    }

    /**
     * Grand total of {@link #sumInvalid(IdRange)} over all ranges. Ranges are summed as given;
     * overlapping ranges count shared ids more than once.
     */
    public long sumInvalidIds(@NonNull Collection<IdRange> ranges) {
        long total = 0;
        for (IdRange range : ranges) {
            total = Math.addExact(total, sumInvalid(range));
        }
        return total;
    }
}
