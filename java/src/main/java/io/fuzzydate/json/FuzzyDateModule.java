package io.fuzzydate.json;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.fuzzydate.FuzzyDate;
import io.fuzzydate.FuzzyDateRange;
import io.fuzzydate.FuzzyDates;
import java.util.Objects;

/**
 * Jackson module writing fuzzy dates and ranges field by field.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * ObjectMapper mapper = new ObjectMapper().registerModule(new FuzzyDateModule());
 * String json = mapper.writeValueAsString(FuzzyDate.of(2019, 3));
 * // {"Year":2019,"Month":3,"Day":null}
 * }</pre>
 *
 * <p>Dates are written as {@code {"Year", "Month", "Day"}} and ranges as {@code {"From", "To"}}.
 * Unknown components are written as null. Values read back are built by the module's {@link
 * FuzzyDates} context, so its rules apply to deserialized input as well.
 */
public final class FuzzyDateModule extends SimpleModule {
  private static final long serialVersionUID = 1L;

  static final String YEAR = "Year";
  static final String MONTH = "Month";
  static final String DAY = "Day";
  static final String FROM = "From";
  static final String TO = "To";

  /** Creates a module that reads values through {@link FuzzyDates#standard()}. */
  public FuzzyDateModule() {
    this(FuzzyDates.standard());
  }

  /**
   * Creates a module that reads values through the given context.
   *
   * @param context the context whose rules deserialized values must satisfy
   */
  public FuzzyDateModule(FuzzyDates context) {
    super("FuzzyDateModule");
    Objects.requireNonNull(context, "context");

    FuzzyDateSerializer dateSerializer = new FuzzyDateSerializer();
    FuzzyDateDeserializer dateDeserializer = new FuzzyDateDeserializer(context);
    addSerializer(FuzzyDate.class, dateSerializer);
    addDeserializer(FuzzyDate.class, dateDeserializer);
    addSerializer(FuzzyDateRange.class, new FuzzyDateRangeSerializer(dateSerializer));
    addDeserializer(
        FuzzyDateRange.class, new FuzzyDateRangeDeserializer(context, dateDeserializer));
  }
}
