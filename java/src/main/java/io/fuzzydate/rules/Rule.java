package io.fuzzydate.rules;

import java.util.Optional;

/**
 * A single validation constraint over a fuzzy date or a fuzzy date range.
 *
 * <p>Rules run while a value is being constructed, so they must be deterministic, free of side
 * effects, and read only the candidate's public state. A {@link RuleSet} only hands a rule
 * candidates that are instances of its {@link #target()}.
 *
 * <p>Example:
 *
 * <pre>{@code
 * public final class NoFutureYears implements Rule<FuzzyDate> {
 *   public String name() { return "no-future-years"; }
 *   public Class<FuzzyDate> target() { return FuzzyDate.class; }
 *   public Optional<String> check(FuzzyDate date) {
 *     if (date.year().isPresent() && date.year().getAsInt() > 2100) {
 *       return Optional.of("Year must not be after 2100, was " + date.year().getAsInt());
 *     }
 *     return Optional.empty();
 *   }
 * }
 * }</pre>
 *
 * @param <T> the type of value this rule validates
 */
public interface Rule<T> {

  /**
   * Returns the unique name of this rule, e.g. "month-must-be-in-range".
   *
   * @return the rule name
   */
  String name();

  /**
   * Returns the type of value this rule validates.
   *
   * @return the target type
   */
  Class<T> target();

  /**
   * Checks a candidate value.
   *
   * @param candidate the value being constructed
   * @return a message describing the violation, or empty if the candidate is acceptable
   */
  Optional<String> check(T candidate);
}
