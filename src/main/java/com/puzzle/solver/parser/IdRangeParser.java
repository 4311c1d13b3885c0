package com.puzzle.solver.parser;

import com.puzzle.solver.ids.IdRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for product id range files.
 *
 * Format: comma-separated inclusive ranges, e.g. {@code 11-22,95-115,998-1012}.
 * Whitespace and line breaks anywhere in the input are ignored, as are empty tokens
 * (a trailing comma).
 */
public class IdRangeParser {
    private static final Logger log = LoggerFactory.getLogger(IdRangeParser.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern RANGE_PATTERN = Pattern.compile("^(\\d+)-(\\d+)$");

    public List<IdRange> parse(Path rangeFile) throws IOException {
        return parse(Files.readString(rangeFile));
    }

    public List<IdRange> parse(String content) {
        String compact = WHITESPACE.matcher(content).replaceAll("");
        List<IdRange> ranges = new ArrayList<>();

        String[] tokens = compact.split(",");
        for (int i = 0; i < tokens.length; i++) {
            if (tokens[i].isEmpty()) {
                continue;
            }
            ranges.add(parseToken(tokens[i], i + 1));
        }

        log.debug("Parsed {} id ranges", ranges.size());
        return ranges;
    }

    IdRange parseToken(String token, int tokenNum) {
        if (token.indexOf('-') < 0) {
            throw new InputFormatException("Range " + tokenNum + ": Missing '-' delimiter in '" + token + "'");
        }

        Matcher matcher = RANGE_PATTERN.matcher(token);
        if (!matcher.matches()) {
            throw new InputFormatException("Range " + tokenNum + ": Invalid range format '" + token + "'");
        }

        long start;
        long end;
        try {
            start = Long.parseLong(matcher.group(1));
            end = Long.parseLong(matcher.group(2));
        } catch (NumberFormatException e) {
            throw new InputFormatException("Range " + tokenNum + ": Bound out of range in '" + token + "'", e);
        }

        if (start > end) {
            throw new InputFormatException(
                    "Range " + tokenNum + ": Start " + start + " is greater than end " + end);
        }
        return IdRange.of(start, end);
    }
}
