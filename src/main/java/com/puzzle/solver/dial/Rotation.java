package com.puzzle.solver.dial;

import lombok.NonNull;
import lombok.Value;

/**
 * A single dial command: a direction plus a non-negative number of clicks.
 */
@Value
public class Rotation {

    @NonNull
    RotationDirection direction;

    long magnitude;

    public Rotation(@NonNull RotationDirection direction, long magnitude) {
        if (magnitude < 0) {
            throw new IllegalArgumentException("Rotation magnitude must be >= 0. Got: " + magnitude);
        }
        this.direction = direction;
        this.magnitude = magnitude;
    }

    public static Rotation left(long magnitude) {
        return new Rotation(RotationDirection.LEFT, magnitude);
    }

    public static Rotation right(long magnitude) {
        return new Rotation(RotationDirection.RIGHT, magnitude);
    }

    /**
     * Signed displacement this rotation applies to the raw position.
     */
    public long displacement() {
        return direction.sign() * magnitude;
    }

    @Override
    public String toString() {
        return direction.getCode() + Long.toString(magnitude);
    }
}
