package io.fuzzydate.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.fuzzydate.FuzzyDate;
import io.fuzzydate.FuzzyDateException;
import io.fuzzydate.FuzzyDateRange;
import io.fuzzydate.FuzzyDates;
import java.io.IOException;

/** Reads a range from {@code {"From": {..}, "To": {..}}}; a missing endpoint is unknown. */
final class FuzzyDateRangeDeserializer extends StdDeserializer<FuzzyDateRange> {
  private static final long serialVersionUID = 1L;

  private final transient FuzzyDates context;
  private final FuzzyDateDeserializer dates;

  FuzzyDateRangeDeserializer(FuzzyDates context, FuzzyDateDeserializer dates) {
    super(FuzzyDateRange.class);
    this.context = context;
    this.dates = dates;
  }

  @Override
  public FuzzyDateRange deserialize(JsonParser p, DeserializationContext ctxt)
      throws IOException {
    JsonNode node = p.readValueAsTree();
    if (!node.isObject()) {
      return ctxt.reportInputMismatch(
          FuzzyDateRange.class,
          "Expected an object for FuzzyDateRange, got %s",
          node.getNodeType());
    }

    FuzzyDate from = endpoint(node.get(FuzzyDateModule.FROM), ctxt);
    FuzzyDate to = endpoint(node.get(FuzzyDateModule.TO), ctxt);

    try {
      return context.range(from, to);
    } catch (FuzzyDateException e) {
      throw JsonMappingException.from(ctxt, e.displayRich(), e);
    }
  }

  private FuzzyDate endpoint(JsonNode node, DeserializationContext ctxt)
      throws JsonMappingException {
    if (node == null || node.isNull()) {
      return null;
    }
    return dates.fromNode(node, ctxt);
  }
}
