package io.fuzzydate.rules;

import io.fuzzydate.FuzzyDateException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered, immutable collection of validation rules.
 *
 * <p>Every fuzzy date and range is checked against a rule set while it is constructed. Rules run
 * in registration order and only against candidates of their {@link Rule#target() target type};
 * the first rule that rejects a candidate aborts construction and no further rules run.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * RuleSet rules = RuleSet.defaults().toBuilder().add(new NoFutureYears()).build();
 * FuzzyDates dates = FuzzyDates.using(rules);
 * FuzzyDate date = dates.of(2019, 3);
 * }</pre>
 *
 * <p>A rule set cannot change once built, so it can be shared between threads freely.
 */
public final class RuleSet {
  private static final Logger log = LoggerFactory.getLogger(RuleSet.class);

  private static final RuleSet EMPTY = new RuleSet(List.of());

  private static final RuleSet DEFAULTS =
      builder()
          .add(new MonthMustBeInRange())
          .add(new DayMustBeInRange())
          .add(new RangeMustNotBeInverted())
          .build();

  private static final RuleSet STRICT =
      builder().add(new MonthRequiresYear()).add(new DayRequiresMonth()).addAll(DEFAULTS).build();

  private final List<Rule<?>> rules;

  private RuleSet(List<Rule<?>> rules) {
    this.rules = List.copyOf(rules);
  }

  /**
   * Returns the built-in rules: month and day ranges, and non-inverted ranges.
   *
   * @return the default rule set
   */
  public static RuleSet defaults() {
    return DEFAULTS;
  }

  /**
   * Returns the default rules preceded by the component hierarchy rules, so that a month needs a
   * year and a day needs a month.
   *
   * @return the strict rule set
   */
  public static RuleSet strict() {
    return STRICT;
  }

  /**
   * Returns a rule set that accepts everything.
   *
   * @return the empty rule set
   */
  public static RuleSet empty() {
    return EMPTY;
  }

  /**
   * Starts a new, empty builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts a builder holding this set's rules, to extend it.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return new Builder().addAll(this);
  }

  /**
   * Returns the rules in registration order.
   *
   * @return an unmodifiable list of rules
   */
  public List<Rule<?>> rules() {
    return rules;
  }

  /**
   * Returns the rules that apply to values of the given type, in registration order.
   *
   * @param type the value type
   * @return an unmodifiable list of matching rules
   */
  public List<Rule<?>> rulesFor(Class<?> type) {
    List<Rule<?>> matching = new ArrayList<>();
    for (Rule<?> rule : rules) {
      if (rule.target().isAssignableFrom(type)) {
        matching.add(rule);
      }
    }
    return List.copyOf(matching);
  }

  /**
   * Runs every applicable rule against a candidate.
   *
   * @param candidate the value being constructed
   * @throws FuzzyDateException with kind VALIDATION from the first rule that rejects the candidate
   */
  public void check(Object candidate) {
    Objects.requireNonNull(candidate, "candidate");
    for (Rule<?> rule : rules) {
      checkOne(rule, candidate);
    }
  }

  private static <T> void checkOne(Rule<T> rule, Object candidate) {
    Class<T> target = rule.target();
    if (!target.isInstance(candidate)) {
      return;
    }

    Optional<String> violation = rule.check(target.cast(candidate));
    if (violation.isPresent()) {
      log.debug("Rule {} rejected {}: {}", rule.name(), candidate, violation.get());
      throw FuzzyDateException.validation(rule.name(), violation.get());
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("RuleSet[");
    for (int i = 0; i < rules.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(rules.get(i).name());
    }
    return sb.append("]").toString();
  }

  /** Collects rules in registration order. */
  public static final class Builder {
    private final List<Rule<?>> rules = new ArrayList<>();

    private Builder() {}

    /**
     * Appends a rule.
     *
     * @param rule the rule to append
     * @return this builder
     */
    public Builder add(Rule<?> rule) {
      Objects.requireNonNull(rule, "rule");
      Objects.requireNonNull(rule.target(), "rule target");
      rules.add(rule);
      return this;
    }

    /**
     * Appends every rule of another set, keeping their order.
     *
     * @param other the rules to append
     * @return this builder
     */
    public Builder addAll(RuleSet other) {
      rules.addAll(other.rules);
      return this;
    }

    /**
     * Builds the rule set.
     *
     * @return an immutable rule set
     */
    public RuleSet build() {
      RuleSet built = new RuleSet(rules);
      log.debug("Built {}", built);
      return built;
    }
  }
}
