package io.fuzzydate.rules;

import io.fuzzydate.FuzzyDateRange;
import io.fuzzydate.Specificity;
import java.util.Optional;

/**
 * Rejects a range whose end precedes its start.
 *
 * <p>Only applies once both endpoints are fully specified; partially known endpoints are left
 * alone since their order says nothing about the real dates.
 */
public final class RangeMustNotBeInverted implements Rule<FuzzyDateRange> {

  @Override
  public String name() {
    return "range-must-not-be-inverted";
  }

  @Override
  public Class<FuzzyDateRange> target() {
    return FuzzyDateRange.class;
  }

  @Override
  public Optional<String> check(FuzzyDateRange candidate) {
    if (candidate.from().specificity() != Specificity.FULL
        || candidate.to().specificity() != Specificity.FULL) {
      return Optional.empty();
    }
    if (candidate.to().compareTo(candidate.from()) < 0) {
      return Optional.of(
          String.format(
              "Range end %s precedes start %s",
              candidate.to().toCanonicalString(), candidate.from().toCanonicalString()));
    }
    return Optional.empty();
  }
}
