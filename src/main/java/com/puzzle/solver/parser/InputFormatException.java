package com.puzzle.solver.parser;

/**
 * Puzzle input that cannot be parsed. Never recovered from: a skipped command or range would
 * silently corrupt the answer.
 */
public class InputFormatException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InputFormatException(String message) {
        super(message);
    }

    public InputFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
