package io.fuzzydate.rules;

import io.fuzzydate.FuzzyDate;
import java.util.Optional;
import java.util.OptionalInt;

/** Rejects a fuzzy date whose month is present but outside 1-12. */
public final class MonthMustBeInRange implements Rule<FuzzyDate> {

  @Override
  public String name() {
    return "month-must-be-in-range";
  }

  @Override
  public Class<FuzzyDate> target() {
    return FuzzyDate.class;
  }

  @Override
  public Optional<String> check(FuzzyDate candidate) {
    OptionalInt month = candidate.month();
    if (month.isPresent() && (month.getAsInt() < 1 || month.getAsInt() > 12)) {
      return Optional.of("Month must be between 1 and 12, was " + month.getAsInt());
    }
    return Optional.empty();
  }
}
