package com.puzzle.solver.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Top-level command. Does nothing by itself; one of the puzzle subcommands must be given.
 */
@Command(
        name = "puzzle-solver",
        mixinStandardHelpOptions = true,
        version = "puzzle-solver 1.0.0",
        description = "Solves the safe dial and invalid product id puzzles.",
        subcommands = {DialCommand.class, InvalidIdsCommand.class}
)
public class SolverCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand: dial or ids");
    }
}
