package com.gentoro.reportengine.utility;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Loose value semantics shared by the calculator, the expression evaluator and the table pipeline.
 *
 * <p>Report data arrives as JSON, so numbers frequently show up as strings ({@code "12"}, {@code
 * " 1.5 "}). These helpers decide what counts as numeric, how strings are coerced and what is
 * considered "empty" or "falsy".
 */
public final class Values {

  private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+(_\\d+)*");
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+(_\\d+)*(\\.(\\d+(_\\d+)*)?)?|\\.\\d+(_\\d+)*)([eE][+-]?\\d+)?");
  private static final Pattern SPECIAL =
      Pattern.compile("[+-]?(nan|inf|infinity)", Pattern.CASE_INSENSITIVE);

  private Values() {}

  /**
   * Coerce a raw string: integer first ({@link Long}), then floating point ({@link Double}).
   * Anything else, including the empty string, is returned unchanged.
   */
  public static Object coerce(Object raw) {
    if (!(raw instanceof String text) || text.isEmpty()) {
      return raw;
    }
    String trimmed = text.strip();
    if (INTEGER.matcher(trimmed).matches()) {
      String digits = trimmed.replace("_", "");
      try {
        return Long.parseLong(digits);
      } catch (NumberFormatException overflow) {
        return new BigInteger(digits).doubleValue();
      }
    }
    Double parsed = parseDouble(trimmed);
    return parsed != null ? parsed : raw;
  }

  /**
   * Plain Java view of a JSON node: text, {@link Long}, {@link Double}, {@link Boolean} or {@code
   * null}. Containers are returned as the node itself.
   */
  public static Object fromJson(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isTextual()) return node.textValue();
    if (node.isBoolean()) return node.booleanValue();
    if (node.isIntegralNumber()) {
      return node.canConvertToLong() ? (Object) node.longValue() : (Object) node.doubleValue();
    }
    if (node.isNumber()) return node.doubleValue();
    return node;
  }

  /** Numeric view of a value, or {@code null} when the value cannot be read as a number. */
  public static Double toDouble(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof Boolean bool) {
      return bool ? 1.0 : 0.0;
    }
    if (value instanceof JsonNode node) {
      if (node.isNumber()) return node.doubleValue();
      if (node.isTextual()) return parseDouble(node.asText().strip());
      if (node.isBoolean()) return node.asBoolean() ? 1.0 : 0.0;
      return null;
    }
    if (value instanceof CharSequence text) {
      return parseDouble(text.toString().strip());
    }
    return null;
  }

  public static boolean isNumeric(Object value) {
    return toDouble(value) != null;
  }

  /** Integer view of a value; {@code null} for non-numeric input. Doubles are truncated. */
  public static Long toLong(Object value) {
    if (value instanceof Long || value instanceof Integer || value instanceof Short) {
      return ((Number) value).longValue();
    }
    if (value instanceof String text && INTEGER.matcher(text.strip()).matches()) {
      return Long.parseLong(text.strip().replace("_", ""));
    }
    Double d = toDouble(value);
    if (d == null || d.isNaN() || d.isInfinite()) {
      return null;
    }
    return (long) d.doubleValue();
  }

  /** Whether a number is integral (a {@link Long}, {@link Integer} or {@link BigInteger}). */
  public static boolean isIntegral(Object value) {
    return value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte
        || value instanceof BigInteger;
  }

  /**
   * Truthiness: {@code null}, zero, {@code false}, empty strings and empty collections are falsy.
   */
  public static boolean isTruthy(Object value) {
    if (value == null) return false;
    if (value instanceof Boolean bool) return bool;
    if (value instanceof BigDecimal decimal) return decimal.signum() != 0;
    if (value instanceof Number number) return number.doubleValue() != 0.0;
    if (value instanceof CharSequence text) return text.length() > 0;
    if (value instanceof Collection<?> collection) return !collection.isEmpty();
    if (value instanceof Map<?, ?> map) return !map.isEmpty();
    if (value instanceof JsonNode node) {
      if (node.isNull() || node.isMissingNode()) return false;
      if (node.isContainerNode()) return node.size() > 0;
      if (node.isNumber()) return node.doubleValue() != 0.0;
      if (node.isBoolean()) return node.asBoolean();
      return !node.asText().isEmpty();
    }
    return true;
  }

  /** Whether a cell is blank: {@code null} or whitespace only once rendered. */
  public static boolean isBlank(Object value) {
    return value == null || StringUtils.isBlank(str(value));
  }

  /**
   * Display form of a value. {@code null} renders as an empty string, doubles use {@link
   * NumberFormats#repr(double)} so that {@code 4000.0} stays {@code "4000.0"}.
   */
  public static String str(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Double || value instanceof Float) {
      return NumberFormats.repr(((Number) value).doubleValue());
    }
    if (value instanceof BigDecimal decimal) {
      return NumberFormats.repr(decimal.doubleValue());
    }
    if (value instanceof JsonNode node) {
      if (node.isNull() || node.isMissingNode()) return "";
      if (node.isFloatingPointNumber()) return NumberFormats.repr(node.doubleValue());
      if (node.isValueNode()) return node.asText();
      return node.toString();
    }
    return value.toString();
  }

  private static Double parseDouble(String text) {
    if (text.isEmpty()) {
      return null;
    }
    if (SPECIAL.matcher(text).matches()) {
      String lower = text.toLowerCase(Locale.ROOT);
      if (lower.endsWith("nan")) return Double.NaN;
      return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    if (!DECIMAL.matcher(text).matches()) {
      return null;
    }
    try {
      return Double.parseDouble(text.replace("_", ""));
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
