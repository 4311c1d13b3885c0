package com.puzzle.solver.dial;

import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks a circular dial numbered 0..99 as it receives rotations and counts how often it
 * reaches 0.
 *
 * <p>The dial keeps an unbounded raw position. The displayed reading is derived from it
 * with {@link Math#floorMod(long, long)}; the raw value is never wrapped back into
 * {@code [0, MODULUS)} because the crossing count of later rotations is computed from it.
 *
 * <p>Two counts are kept:
 * <ul>
 *   <li>landings: rotations that end with the reading at 0</li>
 *   <li>crossings: every click that brings the dial onto 0, including several per rotation</li>
 * </ul>
 *
 * Not thread-safe; one counter is owned by one caller.
 */
@Getter
public class DialCounter {
    private static final Logger log = LoggerFactory.getLogger(DialCounter.class);

    public static final int MODULUS = 100;
    public static final int INITIAL_POSITION = 50;

    private long position;
    private long landingCount;
    private long crossingCount;
    private int rotationsApplied;

    public DialCounter() {
        this(INITIAL_POSITION);
    }

    public DialCounter(long initialPosition) {
        this.position = initialPosition;
    }

    /**
     * Run every rotation through a fresh dial starting at {@link #INITIAL_POSITION}.
     */
    public static DialResult process(@NonNull Iterable<Rotation> rotations) {
        DialCounter counter = new DialCounter();
        for (Rotation rotation : rotations) {
            counter.apply(rotation);
        }
        return counter.toResult();
    }

    /**
     * Apply one rotation.
     *
     * @return the number of times 0 was reached during this rotation
     */
    public long apply(@NonNull Rotation rotation) {
        long pre = position;
        long post = Math.addExact(pre, rotation.displacement());

        long crossings = countCrossings(pre, post);
        crossingCount += crossings;

        position = post;
        rotationsApplied++;

        if (getReading() == 0) {
            landingCount++;
        }

        log.trace("Rotation {}: {} -> {} (reading {}, crossings {})",
                rotation, pre, post, getReading(), crossings);
        return crossings;
    }

    /**
     * Current dial reading in {@code [0, MODULUS)}.
     */
    public int getReading() {
        return (int) Math.floorMod(position, (long) MODULUS);
    }

    public DialResult toResult() {
        return DialResult.builder()
                .landingCount(landingCount)
                .crossingCount(crossingCount)
                .rotationsApplied(rotationsApplied)
                .finalPosition(position)
                .finalReading(getReading())
                .build();
    }

    /**
     * Count the multiples of {@link #MODULUS} the dial reaches when moving from {@code pre}
     * to {@code post} one click at a time. The starting position is never counted; the
     * final position is counted when it is itself a multiple.
     *
     * <p>Uses floor division throughout. Truncating division rounds negative positions
     * toward zero and loses a crossing every time the raw position is below 0.
     */
    static long countCrossings(long pre, long post) {
        if (post >= pre) {
            // multiples m with pre < m <= post
            return Math.floorDiv(post, MODULUS) - Math.floorDiv(pre, MODULUS);
        }
        // multiples m with post <= m < pre
        return Math.floorDiv(Math.subtractExact(pre, 1), MODULUS)
                - Math.floorDiv(Math.subtractExact(post, 1), MODULUS);
    }
}
