package io.fuzzydate;

import io.fuzzydate.display.Display;
import java.time.Duration;
import java.util.Objects;

/**
 * A pair of fuzzy dates marking the start and end of a period.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * FuzzyDateRange year = FuzzyDateRange.of(FuzzyDate.of(2020, 1, 1), FuzzyDate.of(2020, 12, 31));
 * Duration length = year.toDuration(); // 365 days
 * }</pre>
 *
 * <p>Ranges are immutable and are checked against the rules of the context that built them.
 * Ordering compares the start first, then the end.
 */
public final class FuzzyDateRange implements Comparable<FuzzyDateRange> {
  private final FuzzyDate from;
  private final FuzzyDate to;

  private FuzzyDateRange(FuzzyDate from, FuzzyDate to, FuzzyDates context) {
    this.from = from;
    this.to = to;

    context.rules().check(this);
  }

  static FuzzyDateRange create(FuzzyDate from, FuzzyDate to, FuzzyDates context) {
    return new FuzzyDateRange(from, to, context);
  }

  /**
   * Returns a range validated against {@link FuzzyDates#standard()}. A null endpoint stands for
   * the unknown date.
   *
   * @param from the start, or null
   * @param to the end, or null
   * @return the range
   * @throws FuzzyDateException with kind VALIDATION if a rule rejects the range
   */
  public static FuzzyDateRange of(FuzzyDate from, FuzzyDate to) {
    return FuzzyDates.standard().range(from, to);
  }

  /**
   * Returns the start of the range.
   *
   * @return the start, never null
   */
  public FuzzyDate from() {
    return from;
  }

  /**
   * Returns the end of the range.
   *
   * @return the end, never null
   */
  public FuzzyDate to() {
    return to;
  }

  /**
   * Returns the signed time between the materialized endpoints.
   *
   * <p>Both endpoints go through {@link FuzzyDate#toCalendarDate()}, so unknown components count
   * as 1 and the result is only exact for fully specified dates.
   *
   * @return {@code to - from}, negative if the end materializes before the start
   * @throws FuzzyDateException with kind RANGE if an endpoint has no calendar date
   */
  public Duration toDuration() {
    return Duration.between(
        from.toCalendarDate().atStartOfDay(), to.toCalendarDate().atStartOfDay());
  }

  /**
   * Checks whether a date lies between the endpoints, inclusive, under fuzzy date ordering.
   *
   * @param date the date to check
   * @return true if {@code from <= date <= to}
   */
  public boolean contains(FuzzyDate date) {
    Objects.requireNonNull(date, "date");
    return from.compareTo(date) <= 0 && date.compareTo(to) <= 0;
  }

  @Override
  public int compareTo(FuzzyDateRange other) {
    int fromCompare = from.compareTo(other.from);
    if (fromCompare != 0) {
      return fromCompare;
    }
    return to.compareTo(other.to);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FuzzyDateRange)) {
      return false;
    }
    FuzzyDateRange other = (FuzzyDateRange) o;
    return from.equals(other.from) && to.equals(other.to);
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, to);
  }

  /**
   * For testing and diagnostics only.
   *
   * @return both endpoints joined by a dash
   */
  @Override
  public String toString() {
    return Display.render(this);
  }
}
