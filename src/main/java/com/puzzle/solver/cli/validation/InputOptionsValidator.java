package com.puzzle.solver.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.puzzle.solver.cli.exception.OptionsValidationException;
import com.puzzle.solver.cli.model.InputOptions;
import com.puzzle.solver.cli.model.ValidatedInputOptions;

public class InputOptionsValidator {

	public ValidatedInputOptions validate(InputOptions o) {
		if (o.getInput() == null || o.getInput().toString().isBlank()) {
			throw OptionsValidationException.of("Input file is required (--input / -i).");
		}

		List<String> errors = new ArrayList<>();
		Path inputFile = o.getInput().toAbsolutePath().normalize();

		if (!Files.exists(inputFile)) {
			errors.add("Input file does not exist: " + inputFile);
		} else if (Files.isDirectory(inputFile)) {
			errors.add("Input path is a directory, not a file: " + inputFile);
		} else {
			if (!Files.isReadable(inputFile)) {
				errors.add("Input file is not readable: " + inputFile);
			}
			if (isEmptyFile(inputFile)) {
				errors.add("Input file is empty: " + inputFile);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedInputOptions(inputFile, o.isVerbose());
	}

	private static boolean isEmptyFile(Path p) {
		try {
			return Files.size(p) == 0;
		} catch (IOException e) {
			// unreadable files are reported by the readability check
			return false;
		}
	}
}
