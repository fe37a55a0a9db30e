package io.fuzzydate;

import java.util.Optional;

/** Exception thrown when a fuzzy date or range cannot be built or parsed. */
public final class FuzzyDateException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /** The error kind. */
  private final ErrorKind kind;

  /** The name of the rule that rejected the value, for validation errors. */
  private final String rule;

  /** The span of the offending text, for format errors. */
  private final Span span;

  /** The original input string, for format errors. */
  private final String input;

  private FuzzyDateException(
      ErrorKind kind, String message, String rule, Span span, String input, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.rule = rule;
    this.span = span;
    this.input = input;
  }

  /**
   * Creates a new validation error.
   *
   * @param rule the name of the rule that rejected the value
   * @param message the rule's message
   * @return a new FuzzyDateException for a validation error
   */
  public static FuzzyDateException validation(String rule, String message) {
    return new FuzzyDateException(ErrorKind.VALIDATION, message, rule, null, null, null);
  }

  /**
   * Creates a new format error.
   *
   * @param message the error message
   * @param span the location of the offending text
   * @param input the original input string
   * @param cause the underlying number format failure
   * @return a new FuzzyDateException for a format error
   */
  public static FuzzyDateException format(
      String message, Span span, String input, Throwable cause) {
    return new FuzzyDateException(ErrorKind.FORMAT, message, null, span, input, cause);
  }

  /**
   * Creates a new range error.
   *
   * @param message the error message
   * @param cause the underlying calendar or arithmetic failure
   * @return a new FuzzyDateException for a range error
   */
  public static FuzzyDateException range(String message, Throwable cause) {
    return new FuzzyDateException(ErrorKind.RANGE, message, null, null, null, cause);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the name of the rule that rejected the value, if available.
   *
   * @return the rule name, or empty for format errors
   */
  public Optional<String> rule() {
    return Optional.ofNullable(rule);
  }

  /**
   * Returns the span of the offending text, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the original input string, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats a rich error message.
   *
   * <p>For format errors with span and input, produces output like:
   *
   * <pre>
   * error: invalid month "x3"
   *   2019/x3/01
   *        ^^
   * </pre>
   *
   * <p>Validation errors are prefixed with the rule name.
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (kind == ErrorKind.FORMAT && span != null && input != null) {
      StringBuilder sb = new StringBuilder();
      sb.append("error: ").append(getMessage()).append("\n");
      sb.append("  ").append(input).append("\n");
      sb.append(" ".repeat(span.start() + 2));
      sb.append("^".repeat(span.length()));
      return sb.toString();
    }

    if (rule != null) {
      return "error: " + rule + ": " + getMessage();
    }
    return "error: " + getMessage();
  }
}
