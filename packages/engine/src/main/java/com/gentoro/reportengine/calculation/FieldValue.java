package com.gentoro.reportengine.calculation;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportengine.utility.Values;

/**
 * A value read from or written to the report, with where it came from.
 *
 * <p>String values are coerced once on construction: integer first, then floating point,
 * otherwise left as text.
 *
 * @param value coerced value ({@link Long}, {@link Double}, {@link String}, {@link Boolean}, a
 *     JSON container, or {@code null})
 * @param source {@code "report"} for values read from the report, {@code "calculated_data"} for
 *     computed ones
 * @param fieldName dot path of the field
 */
public record FieldValue(Object value, String source, String fieldName) {

  public FieldValue {
    if (value instanceof String) {
      value = Values.coerce(value);
    }
  }

  public static FieldValue fromJson(JsonNode node, String source, String fieldName) {
    return new FieldValue(Values.fromJson(node), source, fieldName);
  }

  /** Display form of the value; {@code null} renders as an empty string. */
  public String asText() {
    return Values.str(value);
  }
}
