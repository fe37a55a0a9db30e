package io.fuzzydate.display;

import io.fuzzydate.FuzzyDate;
import io.fuzzydate.FuzzyDateRange;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders fuzzy dates as diagnostic text and as canonical strings.
 *
 * <p>The diagnostic rendering is fixed English and exists for tests and logs; it is not meant to
 * be shown to end users.
 */
public final class Display {
  private static final DateTimeFormatter YEAR_MONTH =
      DateTimeFormatter.ofPattern("MMMM u", Locale.ENGLISH);
  private static final DateTimeFormatter FULL =
      DateTimeFormatter.ofPattern("EEEE, MMMM d, u", Locale.ENGLISH);

  private Display() {}

  /**
   * Renders a date for diagnostics.
   *
   * @param date the date to render
   * @return "unknown date", the year, "March 2019" or "Tuesday, March 5, 2019"
   */
  public static String render(FuzzyDate date) {
    if (date.year().isEmpty()) {
      return "unknown date";
    }

    int year = date.year().getAsInt();
    if (date.month().isEmpty()) {
      return Integer.toString(year);
    }

    int month = date.month().getAsInt();
    try {
      if (date.day().isEmpty()) {
        return YearMonth.of(year, month).format(YEAR_MONTH);
      }
      return LocalDate.of(year, month, date.day().getAsInt()).format(FULL);
    } catch (DateTimeException e) {
      // Only reachable when the rules let an impossible date through
      return canonical(date);
    }
  }

  /**
   * Renders a range for diagnostics.
   *
   * @param range the range to render
   * @return both endpoints joined by a dash
   */
  public static String render(FuzzyDateRange range) {
    return render(range.from()) + "-" + render(range.to());
  }

  /**
   * Renders the canonical fixed-width form covering the leading known components.
   *
   * @param date the date to render
   * @return "", "YYYY", "YYYY/MM" or "YYYY/MM/DD"
   */
  public static String canonical(FuzzyDate date) {
    if (date.year().isEmpty()) {
      return "";
    }

    StringBuilder sb = new StringBuilder();
    sb.append(String.format("%04d", date.year().getAsInt()));

    if (date.month().isPresent()) {
      sb.append(String.format("/%02d", date.month().getAsInt()));

      if (date.day().isPresent()) {
        sb.append(String.format("/%02d", date.day().getAsInt()));
      }
    }

    return sb.toString();
  }
}
