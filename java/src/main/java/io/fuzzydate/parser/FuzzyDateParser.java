package io.fuzzydate.parser;

import io.fuzzydate.FuzzyDateException;
import io.fuzzydate.Span;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Reads the fixed-width canonical forms {@code YYYY}, {@code YYYY/MM} and {@code YYYY/MM/DD}.
 *
 * <p>Components are sliced by position, not by delimiter: the year is always characters 0-3, the
 * month 5-6 once the text is at least 7 long, and the day 8-9 when the text is exactly 10 long.
 * The separator characters are never inspected. Text shorter than 4 characters yields no
 * components at all.
 *
 * <p>Components hold ASCII digits only. The year alone may start with {@code -}, so negative
 * canonical years such as {@code -005} read back; a {@code +} sign is always rejected.
 */
public final class FuzzyDateParser {
  private static final Span YEAR = new Span(0, 4);
  private static final Span MONTH = new Span(5, 7);
  private static final Span DAY = new Span(8, 10);

  private FuzzyDateParser() {}

  /**
   * The raw components read from text, before any rule has looked at them.
   *
   * @param year the year, if the text was long enough to hold one
   * @param month the month, if the text was long enough to hold one
   * @param day the day, if the text was exactly long enough to hold one
   */
  public record Fields(OptionalInt year, OptionalInt month, OptionalInt day) {}

  /**
   * Parses text in canonical form.
   *
   * @param input the text to parse
   * @return the components found
   * @throws FuzzyDateException with kind FORMAT if a component is not made of ASCII digits
   */
  public static Fields parse(String input) {
    Objects.requireNonNull(input, "input");

    OptionalInt year = OptionalInt.empty();
    OptionalInt month = OptionalInt.empty();
    OptionalInt day = OptionalInt.empty();

    if (input.length() >= 4) {
      year = OptionalInt.of(readInt(input, YEAR, "year", true));

      if (input.length() >= 7) {
        month = OptionalInt.of(readInt(input, MONTH, "month", false));

        if (input.length() == 10) {
          day = OptionalInt.of(readInt(input, DAY, "day", false));
        }
      }
    }

    return new Fields(year, month, day);
  }

  private static int readInt(String input, Span span, String component, boolean signed) {
    String text = span.slice(input);
    try {
      return parseDigits(text, signed);
    } catch (NumberFormatException e) {
      throw FuzzyDateException.format(
          String.format("invalid %s \"%s\"", component, text), span, input, e);
    }
  }

  /** ASCII digits only, with an optional leading '-' when signed. */
  private static int parseDigits(String text, boolean signed) {
    int start = signed && text.length() > 1 && text.charAt(0) == '-' ? 1 : 0;
    for (int i = start; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c < '0' || c > '9') {
        throw new NumberFormatException("For input string: \"" + text + "\"");
      }
    }
    return Integer.parseInt(text);
  }
}
