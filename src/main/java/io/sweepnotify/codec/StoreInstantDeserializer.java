package io.sweepnotify.codec;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Reads the timestamp shapes stores hand back into a plain {@link Instant}:
 *
 * <ul>
 *   <li>epoch milliseconds, as a number or a digit string
 *   <li>ISO-8601 instants or offset date-times
 *   <li>{@code {"seconds": s, "nanoseconds": n}} objects, with or without leading underscores
 * </ul>
 */
public class StoreInstantDeserializer extends StdDeserializer<Instant> {
  public StoreInstantDeserializer() {
    super(Instant.class);
  }

  @Override
  public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonToken token = p.currentToken();
    if (token == JsonToken.VALUE_NUMBER_INT) {
      return Instant.ofEpochMilli(p.getLongValue());
    }
    if (token == JsonToken.VALUE_STRING) {
      String text = p.getText().trim();
      if (text.isEmpty()) {
        return null;
      }
      try {
        return parseText(text);
      } catch (DateTimeException | NumberFormatException e) {
        return (Instant) ctxt.handleWeirdStringValue(Instant.class, text, "not a timestamp");
      }
    }
    if (token == JsonToken.START_OBJECT) {
      JsonNode node = ctxt.readTree(p);
      JsonNode seconds = field(node, "seconds");
      if (seconds == null || !seconds.canConvertToLong()) {
        return ctxt.reportInputMismatch(Instant.class, "timestamp object without seconds");
      }
      JsonNode nanos = field(node, "nanoseconds");
      return Instant.ofEpochSecond(seconds.asLong(), nanos == null ? 0 : nanos.asLong());
    }
    return (Instant) ctxt.handleUnexpectedToken(Instant.class, p);
  }

  static Instant parseText(String text) {
    if (text.chars().allMatch(Character::isDigit)) {
      return Instant.ofEpochMilli(Long.parseLong(text));
    }
    if (text.endsWith("Z") || text.endsWith("z")) {
      return Instant.parse(text);
    }
    return OffsetDateTime.parse(text).toInstant();
  }

  private static JsonNode field(JsonNode node, String name) {
    JsonNode value = node.get(name);
    return value != null ? value : node.get("_" + name);
  }
}
