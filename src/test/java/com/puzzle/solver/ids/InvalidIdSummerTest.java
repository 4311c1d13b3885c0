package com.puzzle.solver.ids;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for InvalidIdSummer range sums.
 */
class InvalidIdSummerTest {

    private static final List<IdRange> EXAMPLE_RANGES = List.of(
            IdRange.of(11, 22),
            IdRange.of(95, 115),
            IdRange.of(998, 1012),
            IdRange.of(1188511880L, 1188511890L),
            IdRange.of(222220, 222224),
            IdRange.of(1698522, 1698528),
            IdRange.of(446443, 446449),
            IdRange.of(38593856, 38593862),
            IdRange.of(565653, 565659),
            IdRange.of(824824821L, 824824827L),
            IdRange.of(2121212118L, 2121212124L));

    private final InvalidIdSummer summer = new InvalidIdSummer();

    @Test
    void testDefaultRuleIsAtLeastTwice() {
        assertThat(summer.getRule()).isEqualTo(RepetitionRule.AT_LEAST_TWICE);
    }

    @Test
    void testSmallRangeIncludesBothEnds() {
        assertThat(summer.sumInvalid(11, 22)).isEqualTo(33);
        assertThat(summer.sumInvalidIds(List.of(IdRange.of(11, 22)))).isEqualTo(33);
    }

    @Test
    void testSingleValueRange() {
        assertThat(summer.sumInvalid(22, 22)).isEqualTo(22);
        assertThat(summer.sumInvalid(23, 23)).isZero();
    }

    @Test
    void testRangeWithThreeDigitRepeat() {
        // 99 and 111
        assertThat(summer.sumInvalid(95, 115)).isEqualTo(210);
        assertThat(new InvalidIdSummer(RepetitionRule.EXACTLY_TWICE).sumInvalid(95, 115)).isEqualTo(99);
    }

    @Test
    void testExampleRangesAtLeastTwice() {
        assertThat(summer.sumInvalidIds(EXAMPLE_RANGES)).isEqualTo(4174379265L);
    }

    @Test
    void testExampleRangesExactlyTwice() {
        InvalidIdSummer exactlyTwice = new InvalidIdSummer(RepetitionRule.EXACTLY_TWICE);

        assertThat(exactlyTwice.sumInvalidIds(EXAMPLE_RANGES)).isEqualTo(1227775554L);
    }

    @Test
    void testTotalIndependentOfOrderAndSplitting() {
        List<IdRange> split = new ArrayList<>();
        split.add(IdRange.of(998, 1004));
        split.add(IdRange.of(1005, 1012));
        split.add(IdRange.of(11, 15));
        split.add(IdRange.of(16, 22));
        Collections.reverse(split);

        List<IdRange> whole = List.of(IdRange.of(11, 22), IdRange.of(998, 1012));

        assertThat(summer.sumInvalidIds(split)).isEqualTo(summer.sumInvalidIds(whole));
    }

    @Test
    void testAllInvalidIdsBelowOneThousand() {
        assertThat(summer.sumInvalid(1, 999)).isEqualTo(5490);
        assertThat(new InvalidIdSummer(RepetitionRule.EXACTLY_TWICE).sumInvalid(1, 999)).isEqualTo(495);
    }

    @Test
    void testEmptyRangeList() {
        assertThat(summer.sumInvalidIds(List.of())).isZero();
    }

    @Test
    void testRangeEndingAtLargestLongTerminates() {
        assertThat(summer.sumInvalid(Long.MAX_VALUE - 2, Long.MAX_VALUE)).isZero();
    }

    @Test
    void testReversedBoundsRejected() {
        assertThatThrownBy(() -> summer.sumInvalid(22, 11))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
