package com.puzzle.solver.dial;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of running a sequence of rotations through a {@link DialCounter}.
 */
@Value
@Builder(toBuilder = true)
public class DialResult {

    /**
     * Rotations that ended with the dial pointing at 0.
     */
    long landingCount;

    /**
     * Times 0 was passed or landed on during all motion.
     */
    long crossingCount;

    int rotationsApplied;

    long finalPosition;
    int finalReading;
}
