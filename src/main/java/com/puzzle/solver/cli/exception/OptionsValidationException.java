package com.puzzle.solver.cli.exception;

import java.util.List;

/**
 * Every problem found in the command-line options, reported together rather than one per run.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super("Invalid options (" + errors.size() + "):" + System.lineSeparator()
                + String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public static OptionsValidationException of(String error) {
        return new OptionsValidationException(List.of(error));
    }

    public List<String> getErrors() {
        return errors;
    }
}
