package io.fuzzydate.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.fuzzydate.FuzzyDateRange;
import java.io.IOException;
import java.util.Objects;

/** Writes a range as {@code {"From": {..}, "To": {..}}}. */
final class FuzzyDateRangeSerializer extends StdSerializer<FuzzyDateRange> {
  private static final long serialVersionUID = 1L;

  private final FuzzyDateSerializer dates;

  FuzzyDateRangeSerializer(FuzzyDateSerializer dates) {
    super(FuzzyDateRange.class);
    this.dates = dates;
  }

  @Override
  public void serialize(FuzzyDateRange value, JsonGenerator gen, SerializerProvider provider)
      throws IOException {
    Objects.requireNonNull(gen, "gen");
    gen.writeStartObject();
    gen.writeFieldName(FuzzyDateModule.FROM);
    dates.serialize(value.from(), gen, provider);
    gen.writeFieldName(FuzzyDateModule.TO);
    dates.serialize(value.to(), gen, provider);
    gen.writeEndObject();
  }
}
