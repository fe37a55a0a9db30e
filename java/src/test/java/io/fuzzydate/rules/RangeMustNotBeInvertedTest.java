package io.fuzzydate.rules;

import static org.junit.jupiter.api.Assertions.*;

import io.fuzzydate.FuzzyDate;
import io.fuzzydate.FuzzyDateRange;
import io.fuzzydate.FuzzyDates;
import org.junit.jupiter.api.Test;

/** Tests for the range inversion rule. */
public class RangeMustNotBeInvertedTest {
  private final RangeMustNotBeInverted rule = new RangeMustNotBeInverted();
  private final FuzzyDates lax = FuzzyDates.using(RuleSet.empty());

  @Test
  void testInvertedFullRangeIsRejected() {
    FuzzyDateRange r = lax.range(lax.of(2020, 3, 2), lax.of(2020, 3, 1));
    assertEquals("Range end 2020/03/01 precedes start 2020/03/02", rule.check(r).orElseThrow());
  }

  @Test
  void testOrderedFullRangePasses() {
    assertTrue(rule.check(lax.range(lax.of(2020, 3, 1), lax.of(2020, 3, 2))).isEmpty());
    assertTrue(rule.check(lax.range(lax.of(2020, 3, 1), lax.of(2020, 3, 1))).isEmpty());
  }

  @Test
  void testPartialEndpointsAreNotChecked() {
    assertTrue(rule.check(lax.range(lax.of(2021), lax.of(2020, 3, 1))).isEmpty());
    assertTrue(rule.check(lax.range(lax.of(2021, 1, 1), lax.of(2020, 3))).isEmpty());
    assertTrue(rule.check(lax.range(null, null)).isEmpty());
  }

  @Test
  void testOnlyTargetsRanges() {
    assertEquals(FuzzyDateRange.class, rule.target());
    assertTrue(
        RuleSet.defaults().rulesFor(FuzzyDate.class).stream()
            .noneMatch(r -> r instanceof RangeMustNotBeInverted));
  }
}
