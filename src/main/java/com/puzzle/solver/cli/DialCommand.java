package com.puzzle.solver.cli;

import com.puzzle.solver.cli.exception.OptionsValidationException;
import com.puzzle.solver.cli.model.InputOptions;
import com.puzzle.solver.cli.model.ValidatedInputOptions;
import com.puzzle.solver.cli.output.SolveResultsPrinter;
import com.puzzle.solver.cli.validation.InputOptionsValidator;
import com.puzzle.solver.dial.DialCounter;
import com.puzzle.solver.dial.DialResult;
import com.puzzle.solver.dial.Rotation;
import com.puzzle.solver.parser.InputFormatException;
import com.puzzle.solver.parser.RotationParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command for the safe dial puzzle: counts how often the dial reaches 0.
 */
@Command(
        name = "dial",
        mixinStandardHelpOptions = true,
        description = "Applies L/R rotations to a 0-99 dial starting at 50 and counts how often it reaches 0."
)
public class DialCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DialCommand.class);

    private static final String PUZZLE = "Safe Dial";

    @Mixin
    private InputOptions options;

    private final InputOptionsValidator validator = new InputOptionsValidator();
    private final SolveResultsPrinter printer = new SolveResultsPrinter();
    private final RotationParser parser = new RotationParser();

    @Override
    public Integer call() {
        try {
            ValidatedInputOptions v = validator.validate(options);
            printer.configureVerbosity(v);
            printer.printBanner(PUZZLE, v);

            List<Rotation> rotations = parser.parse(v.getInputFile());
            DialResult result = DialCounter.process(rotations);

            printer.printDialResult(result);
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (InputFormatException e) {
            printer.printFailure(PUZZLE, "malformed input. " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to read input file {}", options.getInput(), e);
            return 1;
        } catch (Exception e) {
            log.error("{} failed with exception", PUZZLE, e);
            return 1;
        } finally {
            printer.restoreVerbosity();
        }
    }
}
