package com.puzzle.solver.parser;

import com.puzzle.solver.dial.Rotation;
import com.puzzle.solver.dial.RotationDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parser for dial rotation files.
 *
 * Format, one rotation per line:
 * - Left by 68 clicks: L68
 * - Right by 1000 clicks: R1000
 * - Blank lines are skipped, surrounding whitespace is ignored
 */
public class RotationParser {
    private static final Logger log = LoggerFactory.getLogger(RotationParser.class);

    private static final Pattern MAGNITUDE_PATTERN = Pattern.compile("\\d+");

    public List<Rotation> parse(Path rotationFile) throws IOException {
        List<String> lines = Files.readAllLines(rotationFile);
        return parse(lines);
    }

    public List<Rotation> parse(List<String> lines) {
        List<Rotation> rotations = new ArrayList<>();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            rotations.add(parseLine(trimmed, lineNum));
        }

        log.debug("Parsed {} rotations from {} lines", rotations.size(), lineNum);
        return rotations;
    }

    Rotation parseLine(String line, int lineNum) {
        char code = line.charAt(0);
        RotationDirection direction = RotationDirection.fromCode(code)
                .orElseThrow(() -> new InputFormatException(
                        "Line " + lineNum + ": Unknown rotation direction '" + code + "' in '" + line + "'"));

        String magnitude = line.substring(1);
        if (magnitude.isEmpty()) {
            throw new InputFormatException("Line " + lineNum + ": Missing rotation magnitude in '" + line + "'");
        }
        if (!MAGNITUDE_PATTERN.matcher(magnitude).matches()) {
            throw new InputFormatException("Line " + lineNum + ": Invalid rotation magnitude '" + magnitude + "'");
        }

        try {
            return new Rotation(direction, Long.parseLong(magnitude));
        } catch (NumberFormatException e) {
            throw new InputFormatException("Line " + lineNum + ": Rotation magnitude out of range '" + magnitude + "'", e);
        }
    }
}
