package io.fuzzydate.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.fuzzydate.FuzzyDate;
import io.fuzzydate.FuzzyDateException;
import io.fuzzydate.FuzzyDates;
import java.io.IOException;
import java.util.OptionalInt;

/** Reads a fuzzy date from {@code {"Year": .., "Month": .., "Day": ..}}; missing means unknown. */
final class FuzzyDateDeserializer extends StdDeserializer<FuzzyDate> {
  private static final long serialVersionUID = 1L;

  private final transient FuzzyDates context;

  FuzzyDateDeserializer(FuzzyDates context) {
    super(FuzzyDate.class);
    this.context = context;
  }

  @Override
  public FuzzyDate deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode node = p.readValueAsTree();
    return fromNode(node, ctxt);
  }

  FuzzyDate fromNode(JsonNode node, DeserializationContext ctxt) throws JsonMappingException {
    if (!node.isObject()) {
      return ctxt.reportInputMismatch(
          FuzzyDate.class, "Expected an object for FuzzyDate, got %s", node.getNodeType());
    }

    OptionalInt year = component(node, FuzzyDateModule.YEAR, ctxt);
    OptionalInt month = component(node, FuzzyDateModule.MONTH, ctxt);
    OptionalInt day = component(node, FuzzyDateModule.DAY, ctxt);

    try {
      return context.of(year, month, day);
    } catch (FuzzyDateException e) {
      throw JsonMappingException.from(ctxt, e.displayRich(), e);
    }
  }

  private static OptionalInt component(JsonNode node, String name, DeserializationContext ctxt)
      throws JsonMappingException {
    JsonNode value = node.get(name);
    if (value == null || value.isNull()) {
      return OptionalInt.empty();
    }
    if (!value.isIntegralNumber() || !value.canConvertToInt()) {
      return ctxt.reportInputMismatch(
          FuzzyDate.class, "%s must be an integer, got %s", name, value.toString());
    }
    return OptionalInt.of(value.intValue());
  }
}
