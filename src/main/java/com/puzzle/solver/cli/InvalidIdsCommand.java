package com.puzzle.solver.cli;

import com.puzzle.solver.cli.exception.OptionsValidationException;
import com.puzzle.solver.cli.model.InputOptions;
import com.puzzle.solver.cli.model.ValidatedInputOptions;
import com.puzzle.solver.cli.output.SolveResultsPrinter;
import com.puzzle.solver.cli.validation.InputOptionsValidator;
import com.puzzle.solver.ids.IdRange;
import com.puzzle.solver.ids.InvalidIdSummer;
import com.puzzle.solver.ids.RepetitionRule;
import com.puzzle.solver.parser.IdRangeParser;
import com.puzzle.solver.parser.InputFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command for the product id puzzle: sums ids made of a repeated digit sequence.
 */
@Command(
        name = "ids",
        mixinStandardHelpOptions = true,
        description = "Sums the product ids in comma-separated start-end ranges whose digits are a repeated sequence."
)
public class InvalidIdsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InvalidIdsCommand.class);

    private static final String PUZZLE = "Invalid Product IDs";

    @Mixin
    private InputOptions options;

    @Option(names = {"--rule", "-r"}, defaultValue = "AT_LEAST_TWICE",
            description = "Repetition rule: AT_LEAST_TWICE or EXACTLY_TWICE (default: ${DEFAULT-VALUE})")
    private RepetitionRule rule;

    private final InputOptionsValidator validator = new InputOptionsValidator();
    private final SolveResultsPrinter printer = new SolveResultsPrinter();
    private final IdRangeParser parser = new IdRangeParser();

    @Override
    public Integer call() {
        try {
            ValidatedInputOptions v = validator.validate(options);
            printer.configureVerbosity(v);
            printer.printBanner(PUZZLE, v);

            List<IdRange> ranges = parser.parse(v.getInputFile());
            long total = new InvalidIdSummer(rule).sumInvalidIds(ranges);

            printer.printInvalidIdResult(rule, ranges.size(), total);
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
