package io.fuzzydate.rules;

import io.fuzzydate.FuzzyDate;
import java.util.Optional;

/** Rejects a fuzzy date that has a day but no month. Only part of {@link RuleSet#strict()}. */
public final class DayRequiresMonth implements Rule<FuzzyDate> {

  @Override
  public String name() {
    return "day-requires-month";
  }

  @Override
  public Class<FuzzyDate> target() {
    return FuzzyDate.class;
  }

  @Override
  public Optional<String> check(FuzzyDate candidate) {
    if (candidate.day().isPresent() && candidate.month().isEmpty()) {
      return Optional.of("Day " + candidate.day().getAsInt() + " given without a month");
    }
    return Optional.empty();
  }
}
