package io.fuzzydate;

/**
 * Represents a range of character positions in parsed text.
 *
 * @param start the start position (inclusive)
 * @param end the end position (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns the length of this span.
   *
   * @return the number of characters covered by this span
   */
  public int length() {
    return Math.max(1, end - start);
  }

  /**
   * Returns the part of {@code text} covered by this span.
   *
   * @param text the text the span points into
   * @return the covered substring
   */
  public String slice(String text) {
    return text.substring(start, end);
  }
}
