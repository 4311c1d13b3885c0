package com.puzzle.solver.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options shared by every puzzle command, mixed in with {@code @Mixin}. No validation, no
 * execution logic, no printing.
 */
@Getter
public class InputOptions {

	@Option(names = { "--input", "-i" }, defaultValue = "input.txt", description = "Puzzle input file (default: ${DEFAULT-VALUE})")
	private Path input;

	@Option(names = { "--verbose", "-v" }, description = "Log parsing and per-range details")
	private boolean verbose;

}
