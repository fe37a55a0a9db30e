package io.fuzzydate;

/** The type of error raised while building or parsing a fuzzy date. */
public enum ErrorKind {
  /** Validation error - a rule rejected the candidate value. */
  VALIDATION("validation"),
  /** Format error - the text is not in canonical fixed-width form. */
  FORMAT("format"),
  /** Range error - the date falls outside what the calendar can represent. */
  RANGE("range");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
