package com.puzzle.solver;

import com.puzzle.solver.cli.SolverCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Puzzle Solver.
 * Reads a puzzle input file and prints the answers for the safe dial ({@code dial}) or the
 * invalid product id ({@code ids}) puzzle.
 */
public class PuzzleSolverApplication {

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine createCommandLine() {
        return new CommandLine(new SolverCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
