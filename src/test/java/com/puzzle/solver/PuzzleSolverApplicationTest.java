package com.puzzle.solver;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.puzzle.solver.cli.output.SolveResultsPrinter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests running the command line against input files.
 */
class PuzzleSolverApplicationTest {

    @TempDir
    Path tempDir;

    private final Logger printerLogger = (Logger) LoggerFactory.getLogger(SolveResultsPrinter.class);
    private final ListAppender<ILoggingEvent> output = new ListAppender<>();

    @BeforeEach
    void captureOutput() {
        output.start();
        printerLogger.addAppender(output);
        printerLogger.setLevel(Level.INFO);
    }

    @AfterEach
    void releaseOutput() {
        printerLogger.detachAppender(output);
        printerLogger.setLevel(null);
        output.stop();
    }

    @Test
    void testDialCommand() throws IOException {
        Path input = tempDir.resolve("dial.txt");
        Files.writeString(input, "L68\nL30\nR48\nL5\nR60\nL55\nL1\nL99\nR14\nL82\n");

        assertThat(execute("dial", "--input", input.toString())).isZero();

        assertThat(printedLines())
                .contains("Password (rotations ending on 0): 3")
                .contains("Password (clicks landing on 0):   6")
                .contains("Final Reading: 32 (raw position -168)");
    }

    @Test
    void testVerboseLevelIsRestoredAfterCommand() throws IOException {
        Path input = tempDir.resolve("dial.txt");
        Files.writeString(input, "L68\n");
        Logger base = (Logger) LoggerFactory.getLogger("com.puzzle.solver");
        Level before = base.getLevel();

        assertThat(execute("dial", "-i", input.toString(), "--verbose")).isZero();

        assertThat(base.getLevel()).isEqualTo(before);
        assertThat(printedLines()).contains("Password (clicks landing on 0):   1");
    }

    @Test
    void testDialCommandWithMalformedInput() throws IOException {
        Path input = tempDir.resolve("dial.txt");
        Files.writeString(input, "L68\nQ30\n");

        assertThat(execute("dial", "-i", input.toString())).isEqualTo(1);
    }

    @Test
    void testIdsCommand() throws IOException {
        Path input = tempDir.resolve("ids.txt");
        Files.writeString(input, "11-22,95-115,998-1012\n");

        assertThat(execute("ids", "--input", input.toString())).isZero();
        assertThat(printedLines()).contains("Sum of invalid IDs: 2252", "Ranges Checked: 3");

        output.list.clear();
        assertThat(execute("ids", "--input", input.toString(), "--rule", "exactly_twice")).isZero();
        assertThat(printedLines()).contains("Rule: EXACTLY_TWICE", "Sum of invalid IDs: 1142");
    }

    @Test
    void testIdsCommandWithMalformedRange() throws IOException {
        Path input = tempDir.resolve("ids.txt");
        Files.writeString(input, "11-22,30-20\n");

        assertThat(execute("ids", "-i", input.toString())).isEqualTo(1);
    }

    @Test
    void testMissingInputFile() {
        assertThat(execute("ids", "-i", tempDir.resolve("missing.txt").toString())).isEqualTo(1);
    }

    @Test
    void testUsageErrors() {
        assertThat(execute()).isEqualTo(2);
        assertThat(execute("unknown")).isEqualTo(2);
        assertThat(execute("ids", "--rule", "SOMETIMES")).isEqualTo(2);
    }

    @Test
    void testVersion() {
        StringWriter out = new StringWriter();
        CommandLine cmd = PuzzleSolverApplication.createCommandLine();
        cmd.setOut(new PrintWriter(out));

        assertThat(cmd.execute("--version")).isZero();
        assertThat(out.toString()).contains("puzzle-solver 1.0.0");
    }

    private List<String> printedLines() {
        return output.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
    }

    private static int execute(String... args) {
        CommandLine cmd = PuzzleSolverApplication.createCommandLine();
        cmd.setErr(new PrintWriter(new StringWriter()));
        return cmd.execute(args);
    }
}
