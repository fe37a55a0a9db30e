package io.fuzzydate;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.Random;
import java.util.stream.Stream;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

/** Ordering properties of fuzzy dates, checked over a sample of every specificity. */
public class OrderingTest {

  /** Samples in ascending order. */
  private static final List<FuzzyDate> ASCENDING =
      List.of(
          FuzzyDate.unknown(),
          date(null, null, 7),
          date(null, 5, null),
          date(null, 5, 2),
          FuzzyDate.of(1999),
          FuzzyDate.of(1999, 12, 31),
          FuzzyDate.of(2000),
          date(2000, null, 3),
          FuzzyDate.of(2000, 1),
          FuzzyDate.of(2000, 1, 1),
          FuzzyDate.of(2000, 1, 31),
          FuzzyDate.of(2000, 2),
          FuzzyDate.of(2000, 2, 1),
          FuzzyDate.of(2001, 1, 1));

  private static FuzzyDate date(Integer year, Integer month, Integer day) {
    return FuzzyDates.standard().of(opt(year), opt(month), opt(day));
  }

  private static OptionalInt opt(Integer value) {
    return value == null ? OptionalInt.empty() : OptionalInt.of(value);
  }

  @Test
  void testAbsenceBeforePresence() {
    assertTrue(FuzzyDate.unknown().compareTo(FuzzyDate.of(2000)) < 0);
    assertTrue(FuzzyDate.of(2000).compareTo(FuzzyDate.of(2000, 1)) < 0);
    assertTrue(FuzzyDate.of(2000, 1).compareTo(FuzzyDate.of(2000, 1, 1)) < 0);
  }

  @Test
  void testNumericWithinSpecificity() {
    assertTrue(FuzzyDate.of(1999).compareTo(FuzzyDate.of(2000)) < 0);
    assertTrue(FuzzyDate.of(2000, 1).compareTo(FuzzyDate.of(2000, 2)) < 0);
    assertTrue(FuzzyDate.of(2000, 1, 2).compareTo(FuzzyDate.of(2000, 1, 10)) < 0);
  }

  @Test
  void testYearOutranksSpecificity() {
    assertTrue(FuzzyDate.of(1999, 12, 31).compareTo(FuzzyDate.of(2000)) < 0);
  }

  @Test
  void testUnknownYearStillComparesMonthAndDay() {
    assertTrue(date(null, 5, null).compareTo(date(null, 6, null)) < 0);
    assertTrue(FuzzyDate.unknown().compareTo(date(null, null, 1)) < 0);
  }

  @Test
  void testShuffledSamplesSortBackIntoOrder() {
    List<FuzzyDate> shuffled = new ArrayList<>(ASCENDING);
    Collections.shuffle(shuffled, new Random(42));
    Collections.sort(shuffled);
    assertEquals(ASCENDING, shuffled);
  }

  @TestFactory
  Stream<DynamicTest> pairwiseTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (int i = 0; i < ASCENDING.size(); i++) {
      for (int j = 0; j < ASCENDING.size(); j++) {
        FuzzyDate a = ASCENDING.get(i);
        FuzzyDate b = ASCENDING.get(j);
        int expected = Integer.compare(i, j);
        tests.add(
            DynamicTest.dynamicTest(
                "[" + a.toCanonicalString() + "] vs [" + b.toCanonicalString() + "]",
                () -> {
                  assertEquals(expected, Integer.signum(a.compareTo(b)));
                  assertEquals(-Integer.signum(a.compareTo(b)), Integer.signum(b.compareTo(a)));
                  assertEquals(a.compareTo(b) == 0, a.equals(b));
                }));
      }
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> transitivityTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (FuzzyDate a : ASCENDING) {
      for (FuzzyDate b : ASCENDING) {
        for (FuzzyDate c : ASCENDING) {
          if (a.compareTo(b) <= 0 && b.compareTo(c) <= 0) {
            tests.add(
                DynamicTest.dynamicTest(
                    a.toCanonicalString() + " <= " + c.toCanonicalString(),
                    () -> assertTrue(a.compareTo(c) <= 0)));
          }
        }
      }
    }
    return tests.stream();
  }
}
