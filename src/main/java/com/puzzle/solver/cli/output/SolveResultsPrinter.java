package com.puzzle.solver.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.puzzle.solver.cli.model.ValidatedInputOptions;
import com.puzzle.solver.dial.DialCounter;
import com.puzzle.solver.dial.DialResult;
import com.puzzle.solver.ids.RepetitionRule;

import ch.qos.logback.classic.Level;

/**
 * Responsible only for printing CLI output for the puzzle commands.
 * No validation, no parsing, no solving.
 */
public class SolveResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(SolveResultsPrinter.class);

    private static final String BASE_LOGGER = "com.puzzle.solver";

    private ch.qos.logback.classic.Logger raisedLogger;
    private Level previousLevel;

    /**
     * Raise the project's loggers to DEBUG when --verbose is given. The change lasts until
     * {@link #restoreVerbosity()}.
     */
    public void configureVerbosity(ValidatedInputOptions v) {
        if (!v.isVerbose() || raisedLogger != null) {
            return;
        }
        Logger base = LoggerFactory.getLogger(BASE_LOGGER);
        if (base instanceof ch.qos.logback.classic.Logger) {
            raisedLogger = (ch.qos.logback.classic.Logger) base;
            previousLevel = raisedLogger.getLevel();
            raisedLogger.setLevel(Level.DEBUG);
        } else {
            log.warn("Verbose output requested but logging backend is not Logback; ignoring");
        }
    }

    /**
     * Put back the level that was configured before {@link #configureVerbosity}. No-op when
     * verbosity was never raised.
     */
    public void restoreVerbosity() {
        if (raisedLogger == null) {
            return;
        }
        // a null level means "inherit from parent" in Logback
        raisedLogger.setLevel(previousLevel);
        raisedLogger = null;
        previousLevel = null;
    }

    public void printBanner(String puzzle, ValidatedInputOptions v) {
        log.info("=================================================");
        log.info("Puzzle Solver: {}", puzzle);
        log.info("=================================================");
        log.info("Input File: {}", v.getInputFile());
    }

    public void printDialResult(DialResult result) {
        log.info("Rotations Applied: {}", result.getRotationsApplied());
        log.info("Final Reading: {} (raw position {})", result.getFinalReading(), result.getFinalPosition());
        log.info("-------------------------------------------------");
        log.info("Password (rotations ending on 0): {}", result.getLandingCount());
        log.info("Password (clicks landing on 0):   {}", result.getCrossingCount());
        log.info("=================================================");
        log.debug("Dial modulus {}, start {}", DialCounter.MODULUS, DialCounter.INITIAL_POSITION);
    }

    public void printInvalidIdResult(RepetitionRule rule, int rangeCount, long total) {
        log.info("Rule: {}", rule);
        log.info("Ranges Checked: {}", rangeCount);
        log.info("-------------------------------------------------");
        log.info("Sum of invalid IDs: {}", total);
        log.info("=================================================");
    }

    public void printFailure(String puzzle, String message) {
        log.error("{} failed: {}", puzzle, message);
    }
}
