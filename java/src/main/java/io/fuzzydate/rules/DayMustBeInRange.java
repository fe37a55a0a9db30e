package io.fuzzydate.rules;

import io.fuzzydate.FuzzyDate;
import java.time.Month;
import java.time.Year;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Rejects a fuzzy date whose day is present but cannot occur.
 *
 * <p>The day must lie in 1-31. When the month is known it must also fit in that month; February
 * allows the 29th unless the year is known and is not a leap year.
 */
public final class DayMustBeInRange implements Rule<FuzzyDate> {

  @Override
  public String name() {
    return "day-must-be-in-range";
  }

  @Override
  public Class<FuzzyDate> target() {
    return FuzzyDate.class;
  }

  @Override
  public Optional<String> check(FuzzyDate candidate) {
    OptionalInt day = candidate.day();
    if (day.isEmpty()) {
      return Optional.empty();
    }

    int value = day.getAsInt();
    if (value < 1 || value > 31) {
      return Optional.of("Day must be between 1 and 31, was " + value);
    }

    OptionalInt month = candidate.month();
    if (month.isEmpty() || month.getAsInt() < 1 || month.getAsInt() > 12) {
      // An out-of-range month is reported by MonthMustBeInRange
      return Optional.empty();
    }

    Month m = Month.of(month.getAsInt());
    OptionalInt year = candidate.year();
    int max = year.isPresent() ? m.length(Year.isLeap(year.getAsInt())) : m.maxLength();
    if (value > max) {
      return Optional.of(
          String.format(
              "Day must be between 1 and %d for %s, was %d",
              max, candidate.toCanonicalString(), value));
    }
    return Optional.empty();
  }
}
