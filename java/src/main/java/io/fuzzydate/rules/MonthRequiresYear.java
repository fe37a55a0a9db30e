package io.fuzzydate.rules;

import io.fuzzydate.FuzzyDate;
import java.util.Optional;

/** Rejects a fuzzy date that has a month but no year. Only part of {@link RuleSet#strict()}. */
public final class MonthRequiresYear implements Rule<FuzzyDate> {

  @Override
  public String name() {
    return "month-requires-year";
  }

  @Override
  public Class<FuzzyDate> target() {
    return FuzzyDate.class;
  }

  @Override
  public Optional<String> check(FuzzyDate candidate) {
    if (candidate.month().isPresent() && candidate.year().isEmpty()) {
      return Optional.of("Month " + candidate.month().getAsInt() + " given without a year");
    }
    return Optional.empty();
  }
}
