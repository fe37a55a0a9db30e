package io.fuzzydate;

import io.fuzzydate.parser.FuzzyDateParser;
import io.fuzzydate.rules.RuleSet;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Creates fuzzy dates and ranges validated against one {@link RuleSet}.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * FuzzyDates dates = FuzzyDates.using(RuleSet.strict());
 * FuzzyDateRange career = dates.range(dates.of(1998), dates.parse("2019/03"));
 * }</pre>
 *
 * <p>Dates remember the context they were built in, so derived values are checked against the
 * same rules.
 */
public final class FuzzyDates {
  private static final FuzzyDates STANDARD = new FuzzyDates(RuleSet.defaults());

  private final RuleSet rules;

  private FuzzyDates(RuleSet rules) {
    this.rules = rules;
  }

  /**
   * Returns the context bound to {@link RuleSet#defaults()}.
   *
   * @return the standard context
   */
  public static FuzzyDates standard() {
    return STANDARD;
  }

  /**
   * Returns a context bound to the given rules.
   *
   * @param rules the rules every value must satisfy
   * @return a new context
   */
  public static FuzzyDates using(RuleSet rules) {
    return new FuzzyDates(Objects.requireNonNull(rules, "rules"));
  }

  /**
   * Returns the rules of this context.
   *
   * @return the rule set
   */
  public RuleSet rules() {
    return rules;
  }

  /**
   * Returns a date with no known component.
   *
   * @return the unknown date
   */
  public FuzzyDate unknown() {
    return of(OptionalInt.empty(), OptionalInt.empty(), OptionalInt.empty());
  }

  /**
   * Returns today's date in the system default time zone.
   *
   * @return a fully specified date
   */
  public FuzzyDate today() {
    return today(Clock.systemDefaultZone());
  }

  /**
   * Returns today's date according to a clock.
   *
   * @param clock the clock to read
   * @return a fully specified date
   */
  public FuzzyDate today(Clock clock) {
    return from(LocalDate.now(clock));
  }

  /**
   * Returns a fully specified date.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param day the day of month
   * @return the date
   */
  public FuzzyDate of(int year, int month, int day) {
    return of(OptionalInt.of(year), OptionalInt.of(month), OptionalInt.of(day));
  }

  /**
   * Returns a date with an unknown day.
   *
   * @param year the year
   * @param month the month (1-12)
   * @return the date
   */
  public FuzzyDate of(int year, int month) {
    return of(OptionalInt.of(year), OptionalInt.of(month), OptionalInt.empty());
  }

  /**
   * Returns a date with only the year known.
   *
   * @param year the year
   * @return the date
   */
  public FuzzyDate of(int year) {
    return of(OptionalInt.of(year), OptionalInt.empty(), OptionalInt.empty());
  }

  /**
   * Returns a date from any combination of components. Gaps such as a day without a month are
   * only rejected if a rule says so.
   *
   * @param year the year, if known
   * @param month the month, if known
   * @param day the day, if known
   * @return the date
   * @throws FuzzyDateException with kind VALIDATION if a rule rejects the date
   */
  public FuzzyDate of(OptionalInt year, OptionalInt month, OptionalInt day) {
    return FuzzyDate.create(
        Objects.requireNonNull(year, "year"),
        Objects.requireNonNull(month, "month"),
        Objects.requireNonNull(day, "day"),
        this);
  }

  /**
   * Returns a fully specified date taken from a calendar date.
   *
   * @param date the calendar date
   * @return the date
   */
  public FuzzyDate from(LocalDate date) {
    Objects.requireNonNull(date, "date");
    return of(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
  }

  /**
   * Parses a date in the form "YYYY", "YYYY/MM" or "YYYY/MM/DD".
   *
   * @param text the text to parse
   * @return the date
   * @throws FuzzyDateException with kind FORMAT for a non-numeric component, or VALIDATION if a
   *     rule rejects the date
   */
  public FuzzyDate parse(String text) {
    FuzzyDateParser.Fields fields = FuzzyDateParser.parse(text);
    return of(fields.year(), fields.month(), fields.day());
  }

  /**
   * Checks whether text parses into a valid date without throwing.
   *
   * @param text the text to check
   * @return true if {@link #parse(String)} would succeed
   */
  public boolean validate(String text) {
    if (text == null) {
      return false;
    }
    try {
      parse(text);
      return true;
    } catch (FuzzyDateException e) {
      return false;
    }
  }

  /**
   * Returns a range between two dates. A null endpoint stands for the unknown date.
   *
   * @param from the start, or null
   * @param to the end, or null
   * @return the range
   * @throws FuzzyDateException with kind VALIDATION if a rule rejects the range
   */
  public FuzzyDateRange range(FuzzyDate from, FuzzyDate to) {
    return FuzzyDateRange.create(
        from != null ? from : unknown(), to != null ? to : unknown(), this);
  }

  @Override
  public String toString() {
    return "FuzzyDates" + rules;
  }
}
