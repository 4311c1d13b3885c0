package com.puzzle.solver.dial;

import java.util.Optional;

/**
 * Direction a dial rotation moves the position in.
 */
public enum RotationDirection {
    /**
     * Toward lower values.
     */
    LEFT('L'),

    /**
     * Toward higher values.
     */
    RIGHT('R');

    private final char code;

    RotationDirection(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * Sign applied to a rotation's magnitude: -1 for LEFT, +1 for RIGHT.
     */
    public int sign() {
        return this == LEFT ? -1 : 1;
    }

    /**
     * Look up a direction by its one-character input code. Codes are case-sensitive.
     */
    public static Optional<RotationDirection> fromCode(char code) {
        for (RotationDirection direction : values()) {
            if (direction.code == code) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }
}
