package com.puzzle.solver.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the commands. Keeps the commands thin.
 */
@Data
@AllArgsConstructor
public class ValidatedInputOptions {
    Path inputFile;
    boolean verbose;
}
