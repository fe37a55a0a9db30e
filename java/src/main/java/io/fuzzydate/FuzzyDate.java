package io.fuzzydate;

import io.fuzzydate.display.Display;
import io.fuzzydate.rules.RuleSet;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Year;
import java.time.YearMonth;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A calendar date whose year, month and day may each be unknown.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * FuzzyDate march = FuzzyDate.of(2019, 3);
 * FuzzyDate someday = FuzzyDate.parse("2018");
 * if (someday.compareTo(march) < 0) {
 *     System.out.println(someday + " sorts before " + march);
 * }
 * }</pre>
 *
 * <p>Instances are immutable. Every instance passed the rules of the {@link RuleSet} it was built
 * with, and values derived from it with {@code addYears}, {@code addMonths} or {@code addDays} are
 * checked against the same rules. The static factories here use {@link FuzzyDates#standard()};
 * use {@link FuzzyDates#using(RuleSet)} for other rules.
 *
 * <p>Ordering puts an absent component before a present one, most significant component first,
 * so {@code unknown < 2000 < 2000/01 < 2000/01/01}.
 */
public final class FuzzyDate implements Comparable<FuzzyDate> {
  private final Integer year;
  private final Integer month;
  private final Integer day;
  private final FuzzyDates context;

  private FuzzyDate(Integer year, Integer month, Integer day, FuzzyDates context) {
    this.year = year;
    this.month = month;
    this.day = day;
    this.context = context;

    context.rules().check(this);
  }

  static FuzzyDate create(
      OptionalInt year, OptionalInt month, OptionalInt day, FuzzyDates context) {
    return new FuzzyDate(boxed(year), boxed(month), boxed(day), context);
  }

  /**
   * Returns a fuzzy date with no known component.
   *
   * @return the unknown date
   */
  public static FuzzyDate unknown() {
    return FuzzyDates.standard().unknown();
  }

  /**
   * Returns today's date in the system default time zone.
   *
   * @return a fully specified date
   */
  public static FuzzyDate today() {
    return FuzzyDates.standard().today();
  }

  /**
   * Returns a fully specified date.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param day the day of month
   * @return the date
   * @throws FuzzyDateException if a rule rejects the date
   */
  public static FuzzyDate of(int year, int month, int day) {
    return FuzzyDates.standard().of(year, month, day);
  }

  /**
   * Returns a date with an unknown day.
   *
   * @param year the year
   * @param month the month (1-12)
   * @return the date
   * @throws FuzzyDateException if a rule rejects the date
   */
  public static FuzzyDate of(int year, int month) {
    return FuzzyDates.standard().of(year, month);
  }

  /**
   * Returns a date with only the year known.
   *
   * @param year the year
   * @return the date
   */
  public static FuzzyDate of(int year) {
    return FuzzyDates.standard().of(year);
  }

  /**
   * Returns a fully specified date taken from a calendar date.
   *
   * @param date the calendar date
   * @return the date
   */
  public static FuzzyDate from(LocalDate date) {
    return FuzzyDates.standard().from(date);
  }

  /**
   * Parses a date in the form "YYYY", "YYYY/MM" or "YYYY/MM/DD".
   *
   * @param text the text to parse
   * @return the date
   * @throws FuzzyDateException with kind FORMAT for a non-numeric component, or VALIDATION if a
   *     rule rejects the date
   */
  public static FuzzyDate parse(String text) {
    return FuzzyDates.standard().parse(text);
  }

  /**
   * Returns the year, if known.
   *
   * @return the year
   */
  public OptionalInt year() {
    return unboxed(year);
  }

  /**
   * Returns the month (1-12), if known.
   *
   * @return the month
   */
  public OptionalInt month() {
    return unboxed(month);
  }

  /**
   * Returns the day of month, if known.
   *
   * @return the day
   */
  public OptionalInt day() {
    return unboxed(day);
  }

  /**
   * Returns how many leading components are known.
   *
   * @return the specificity
   */
  public Specificity specificity() {
    return Specificity.of(year != null, month != null, day != null);
  }

  /**
   * Returns the context this date was built in.
   *
   * @return the context whose rules this date satisfies
   */
  public FuzzyDates context() {
    return context;
  }

  /**
   * Returns whether the year is known and is a Gregorian leap year.
   *
   * @return true if the year is defined and is a leap year
   */
  public boolean isLeapYear() {
    return year != null && Year.isLeap(year);
  }

  /**
   * Shifts the year, leaving month and day untouched. An unknown year stays unknown.
   *
   * @param years the number of years to add, may be negative
   * @return the shifted date
   * @throws FuzzyDateException if the result breaks a rule, e.g. February 29 in a common year, or
   *     with kind RANGE if the year overflows an {@code int}
   */
  public FuzzyDate addYears(int years) {
    if (year == null) {
      return new FuzzyDate(null, month, day, context);
    }
    int newYear;
    try {
      newYear = Math.addExact(year, years);
    } catch (ArithmeticException e) {
      throw FuzzyDateException.range(
          String.format("Year %d plus %d years overflows", year, years), e);
    }
    return new FuzzyDate(newYear, month, day, context);
  }

  /**
   * Adds calendar months.
   *
   * <p>When the month is known the date is materialized with {@link #toCalendarDate()}, so an
   * unknown year or day comes back as 1: the result is always fully specified. When the month is
   * unknown an equal copy is returned.
   *
   * @param months the number of months to add, may be negative
   * @return the resulting date
   * @throws FuzzyDateException with kind RANGE if the date or the result cannot be represented as
   *     a {@link LocalDate}
   */
  public FuzzyDate addMonths(int months) {
    if (month != null) {
      LocalDate shifted;
      try {
        shifted = toCalendarDate().plusMonths(months);
      } catch (DateTimeException e) {
        throw FuzzyDateException.range(
            String.format("%s plus %d months is out of range", toCanonicalString(), months), e);
      }
      return context.from(shifted);
    }
    return new FuzzyDate(year, month, day, context);
  }

  /**
   * Adds days.
   *
   * <p>When the day is known the date is materialized with {@link #toCalendarDate()}, so an
   * unknown year or month comes back as 1: the result is always fully specified. When the day is
   * unknown an equal copy is returned.
   *
   * @param days the number of days to add, may be negative
   * @return the resulting date
   * @throws FuzzyDateException with kind RANGE if the date or the result cannot be represented as
   *     a {@link LocalDate}
   */
  public FuzzyDate addDays(int days) {
    if (day != null) {
      LocalDate shifted;
      try {
        shifted = toCalendarDate().plusDays(days);
      } catch (DateTimeException e) {
        throw FuzzyDateException.range(
            String.format("%s plus %d days is out of range", toCanonicalString(), days), e);
      }
      return context.from(shifted);
    }
    return new FuzzyDate(year, month, day, context);
  }

  /**
   * Converts to a calendar date, using 1 for every unknown component.
   *
   * <p>Years below 1 become 1. When that, or an unknown year, puts a leap day into a common year
   * the day is capped at the length of the month, so {@code 0000/02/29} becomes February 28 of
   * year 1.
   *
   * @return the calendar date
   * @throws FuzzyDateException with kind RANGE if the date cannot be represented as a {@link
   *     LocalDate}, e.g. a year past 999,999,999 or a day the context's rules let through
   */
  public LocalDate toCalendarDate() {
    int y = year != null ? Math.max(year, 1) : 1;
    int m = month != null ? month : 1;
    try {
      YearMonth yearMonth = YearMonth.of(y, m);
      if (day == null) {
        return yearMonth.atDay(1);
      }
      // Only a substituted year may shorten the month
      int d = year == null || year < 1 ? Math.min(day, yearMonth.lengthOfMonth()) : day;
      return yearMonth.atDay(d);
    } catch (DateTimeException e) {
      throw FuzzyDateException.range(
          String.format("%s has no calendar date", toCanonicalString()), e);
    }
  }

  /**
   * Returns the canonical form: "" when the year is unknown, otherwise "YYYY", "YYYY/MM" or
   * "YYYY/MM/DD" covering the leading known components. {@link #parse(String)} reads it back.
   *
   * @return the canonical form
   */
  public String toCanonicalString() {
    return Display.canonical(this);
  }

  @Override
  public int compareTo(FuzzyDate other) {
    int result = compareComponent(year, other.year);
    if (result != 0) {
      return result;
    }

    result = compareComponent(month, other.month);
    if (result != 0) {
      return result;
    }

    return compareComponent(day, other.day);
  }

  /** Absent sorts before present, then numeric order. */
  private static int compareComponent(Integer a, Integer b) {
    if (a == null) {
      return b == null ? 0 : -1;
    }
    if (b == null) {
      return 1;
    }
    return Integer.compare(a, b);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FuzzyDate)) {
      return false;
    }
    FuzzyDate other = (FuzzyDate) o;
    return Objects.equals(year, other.year)
        && Objects.equals(month, other.month)
        && Objects.equals(day, other.day);
  }

  @Override
  public int hashCode() {
    return Objects.hash(year, month, day);
  }

  /**
   * For testing and diagnostics only. Consumers should format dates with their own display
   * adapter.
   *
   * @return a human-readable rendering such as "unknown date", "2019", "March 2019" or "Tuesday,
   *     March 5, 2019"
   */
  @Override
  public String toString() {
    return Display.render(this);
  }

  private static Integer boxed(OptionalInt value) {
    return value.isPresent() ? value.getAsInt() : null;
  }

  private static OptionalInt unboxed(Integer value) {
    return value != null ? OptionalInt.of(value) : OptionalInt.empty();
  }
}
