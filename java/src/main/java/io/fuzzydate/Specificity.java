package io.fuzzydate;

/** How many leading components (year, then month, then day) of a fuzzy date are known. */
public enum Specificity {
  /** Nothing is known, or the year is absent. */
  UNKNOWN,
  /** Only the year is known. */
  YEAR,
  /** Year and month are known. */
  YEAR_MONTH,
  /** Year, month and day are known. */
  FULL;

  /**
   * Returns the specificity implied by which components are present.
   *
   * <p>Only the leading run counts: a day without a month is {@link #YEAR} at best.
   *
   * @param hasYear whether the year is present
   * @param hasMonth whether the month is present
   * @param hasDay whether the day is present
   * @return the specificity
   */
  static Specificity of(boolean hasYear, boolean hasMonth, boolean hasDay) {
    if (!hasYear) {
      return UNKNOWN;
    }
    if (!hasMonth) {
      return YEAR;
    }
    return hasDay ? FULL : YEAR_MONTH;
  }
}
