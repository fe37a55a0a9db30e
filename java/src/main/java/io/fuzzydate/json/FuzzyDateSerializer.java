package io.fuzzydate.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.fuzzydate.FuzzyDate;
import java.io.IOException;
import java.util.Objects;
import java.util.OptionalInt;

/** Writes a fuzzy date as {@code {"Year": .., "Month": .., "Day": ..}}. */
final class FuzzyDateSerializer extends StdSerializer<FuzzyDate> {
  private static final long serialVersionUID = 1L;

  FuzzyDateSerializer() {
    super(FuzzyDate.class);
  }

  @Override
  public void serialize(FuzzyDate value, JsonGenerator gen, SerializerProvider provider)
      throws IOException {
    Objects.requireNonNull(gen, "gen");
    gen.writeStartObject();
    writeComponent(gen, FuzzyDateModule.YEAR, value.year());
    writeComponent(gen, FuzzyDateModule.MONTH, value.month());
    writeComponent(gen, FuzzyDateModule.DAY, value.day());
    gen.writeEndObject();
  }

  private static void writeComponent(JsonGenerator gen, String name, OptionalInt component)
      throws IOException {
    if (component.isPresent()) {
      gen.writeNumberField(name, component.getAsInt());
    } else {
      gen.writeNullField(name);
    }
  }
}
