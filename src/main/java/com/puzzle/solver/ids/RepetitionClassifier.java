package com.puzzle.solver.ids;

import java.util.OptionalInt;

import lombok.NonNull;
import lombok.experimental.UtilityClass;

/**
 * Detects product ids whose decimal digits are a shorter digit sequence repeated with no
 * leftover digits.
 *
 * <p>Candidate period lengths {@code d} are the divisors of the digit count {@code L} with
 * {@code d <= L / 2}, tried in ascending order. Odd digit counts are not skipped: nine
 * digits still allow periods 1 and 3.
 */
@UtilityClass
public class RepetitionClassifier {

    /**
     * True if the digits of {@code value} are a sequence repeated at least twice.
     */
    public static boolean isRepeated(long value) {
        return minimalPeriod(digitsOf(value)).isPresent();
    }

    /**
     * True if the digits of {@code value} are a sequence repeated exactly twice, i.e. the
     * first half equals the second half.
     */
    public static boolean isRepeatedTwice(long value) {
        String digits = digitsOf(value);
        int length = digits.length();
        return length % 2 == 0 && hasPeriod(digits, length / 2);
    }

    public static boolean matches(long value, @NonNull RepetitionRule rule) {
        return switch (rule) {
            case AT_LEAST_TWICE -> isRepeated(value);
            case EXACTLY_TWICE -> isRepeatedTwice(value);
        };
    }

    /**
     * Shortest proper period of {@code digits}, or empty when the string is not a repetition
     * of any shorter block. Strings shorter than two characters never repeat.
     */
    public static OptionalInt minimalPeriod(@NonNull String digits) {
        int length = digits.length();
        for (int period = 1; period <= length / 2; period++) {
            if (length % period == 0 && hasPeriod(digits, period)) {
                return OptionalInt.of(period);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * True if every {@code period}-length block of {@code digits} equals the first one.
     * {@code period} must divide the length exactly.
     */
    static boolean hasPeriod(String digits, int period) {
        if (period <= 0 || digits.length() % period != 0) {
            throw new IllegalArgumentException(
                    "Period " + period + " does not divide length " + digits.length());
        }
        for (int offset = period; offset < digits.length(); offset += period) {
            if (!digits.regionMatches(offset, digits, 0, period)) {
                return false;
            }
        }
        return true;
    }

    private static String digitsOf(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Product id must be >= 0. Got: " + value);
        }
        return Long.toString(value);
    }
}
