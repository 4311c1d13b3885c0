package com.puzzle.solver.ids;

/**
 * Rule deciding which product ids count as invalid.
 */
public enum RepetitionRule {
    /**
     * The digits are some shorter sequence repeated two or more times, e.g. 111, 1212, 123123.
     */
    AT_LEAST_TWICE,

    /**
     * The digits are some sequence repeated exactly twice, e.g. 11, 1111, 123123 (but not 111).
     */
    EXACTLY_TWICE;

    public boolean matches(long value) {
        return RepetitionClassifier.matches(value, this);
    }
}
