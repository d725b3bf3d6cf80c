package com.gentoro.reportengine.utility;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Number rendering used for table cells and formatted fields.
 *
 * <p>Two families of output are supported:
 *
 * <ul>
 *   <li>{@link #repr(double)}: the shortest round-trip representation, always with a fractional
 *       part ({@code 4000.0}, {@code 0.1}), switching to exponent notation below {@code 1e-4} and
 *       from {@code 1e16} upwards ({@code 1e-05}, {@code 1e+16}).
 *   <li>{@link #format(Object, String)}: a restricted format-spec language {@code
 *       [.][N](d|f|g|e|%)} where a leading dot introduces the precision and a bare number is a
 *       minimum width.
 * </ul>
 *
 * <p>Rounding is half-even on the exact binary value of the double, so {@code fixed(2.675, 2)} is
 * {@code "2.67"} and {@code fixed(0.125, 2)} is {@code "0.12"}.
 */
public final class NumberFormats {

  /** Accepted format specs: optional dot + digits, then one of {@code d f g e %}. */
  public static final Pattern FORMAT_SPEC = Pattern.compile("^(\\.?)(\\d*)([dfge%])$");

  private static final int DEFAULT_PRECISION = 6;

  /** Upper bound for both the precision and the minimum width of a rendered number. */
  public static final int MAX_DIGITS = 500;

  private NumberFormats() {}

  /** Shortest representation of a double that reads back to the same value. */
  public static String repr(double value) {
    if (Double.isNaN(value)) return "nan";
    if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
    if (value == 0.0) {
      return (1.0 / value) < 0 ? "-0.0" : "0.0";
    }
    BigDecimal bd = new BigDecimal(Double.toString(value)).stripTrailingZeros();
    int exponent = bd.precision() - bd.scale() - 1;
    if (exponent < -4 || exponent >= 16) {
      String digits = bd.unscaledValue().abs().toString();
      StringBuilder sb = new StringBuilder();
      if (bd.signum() < 0) sb.append('-');
      sb.append(digits.charAt(0));
      if (digits.length() > 1) {
        sb.append('.').append(digits, 1, digits.length());
      }
      sb.append('e').append(exponent < 0 ? '-' : '+');
      sb.append(StringUtils.leftPad(Integer.toString(Math.abs(exponent)), 2, '0'));
      return sb.toString();
    }
    String plain = bd.toPlainString();
    return plain.contains(".") ? plain : plain + ".0";
  }

  /** Fixed-point rendering with {@code decimals} fractional digits. */
  public static String fixed(double value, int decimals) {
    if (decimals < 0) {
      throw new IllegalArgumentException("Decimal places must not be negative: " + decimals);
    }
    checkPrecision(decimals);
    if (Double.isNaN(value)) return "nan";
    if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
    String out =
        new BigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).abs().toPlainString();
    return isNegative(value) ? "-" + out : out;
  }

  /**
   * Format a number with a restricted spec, e.g. {@code .2f}, {@code .1%}, {@code .3g}, {@code
   * .2e}, {@code d}.
   *
   * @throws IllegalArgumentException when the spec is not accepted or does not apply to the value
   */
  public static String format(Object value, String spec) {
    Matcher m = FORMAT_SPEC.matcher(spec == null ? "" : spec);
    if (!m.matches()) {
      throw new IllegalArgumentException("Unsupported format spec: '" + spec + "'");
    }
    boolean hasPrecision = !m.group(1).isEmpty();
    String digits = m.group(2);
    char type = m.group(3).charAt(0);
    if (hasPrecision && digits.isEmpty()) {
      throw new IllegalArgumentException("Format specifier missing precision: '" + spec + "'");
    }
    int precision = hasPrecision ? bounded(digits, "Precision") : DEFAULT_PRECISION;
    int width = !hasPrecision && !digits.isEmpty() ? bounded(digits, "Width") : 0;

    Object number = value instanceof Boolean bool ? (bool ? 1L : 0L) : value;
    if (!(number instanceof Number)) {
      throw new IllegalArgumentException(
          "Format code '" + type + "' requires a number, got: " + Values.str(value));
    }
    String rendered =
        switch (type) {
          case 'd' -> {
            if (hasPrecision) {
              throw new IllegalArgumentException(
                  "Precision not allowed in integer format specifier");
            }
            if (!Values.isIntegral(number)) {
              throw new IllegalArgumentException("Unknown format code 'd' for non-integer value");
            }
            yield number.toString();
          }
          case 'f' -> fixed(((Number) number).doubleValue(), precision);
          case '%' -> fixed(((Number) number).doubleValue() * 100, precision) + "%";
          case 'e' -> scientific(((Number) number).doubleValue(), precision);
          case 'g' -> general(((Number) number).doubleValue(), precision);
          default -> throw new IllegalArgumentException("Unsupported format type: " + type);
        };
    return StringUtils.leftPad(rendered, width);
  }

  /** Exponent notation with {@code precision} digits after the point, e.g. {@code 1.23e+04}. */
  public static String scientific(double value, int precision) {
    checkPrecision(precision);
    if (Double.isNaN(value)) return "nan";
    if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
    BigDecimal abs = new BigDecimal(value).abs();
    int exponent = 0;
    String mantissa;
    if (abs.signum() == 0) {
      mantissa = BigDecimal.ZERO.setScale(precision).toPlainString();
    } else {
      BigDecimal rounded = abs.round(new MathContext(precision + 1, RoundingMode.HALF_EVEN));
      exponent = rounded.precision() - rounded.scale() - 1;
      mantissa = rounded.movePointLeft(exponent).setScale(precision, RoundingMode.HALF_EVEN)
          .toPlainString();
    }
    String sign = isNegative(value) ? "-" : "";
    return sign
        + mantissa
        + "e"
        + (exponent < 0 ? "-" : "+")
        + StringUtils.leftPad(Integer.toString(Math.abs(exponent)), 2, '0');
  }

  /**
   * General format: fixed notation when the decimal exponent lies in {@code [-4, precision)},
   * exponent notation otherwise; insignificant trailing zeros are removed in both cases.
   */
  public static String general(double value, int precision) {
    checkPrecision(precision);
    if (Double.isNaN(value)) return "nan";
    if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
    int p = precision == 0 ? 1 : precision;
    BigDecimal abs = new BigDecimal(value).abs();
    if (abs.signum() == 0) {
      return isNegative(value) ? "-0" : "0";
    }
    BigDecimal rounded = abs.round(new MathContext(p, RoundingMode.HALF_EVEN));
    int exponent = rounded.precision() - rounded.scale() - 1;
    String sign = isNegative(value) ? "-" : "";
    if (exponent >= -4 && exponent < p) {
      String fixed = rounded.setScale(Math.max(0, p - 1 - exponent), RoundingMode.HALF_EVEN)
          .toPlainString();
      return sign + stripFraction(fixed);
    }
    String sci = scientific(abs.doubleValue(), p - 1);
    int e = sci.indexOf('e');
    return sign + stripFraction(sci.substring(0, e)) + sci.substring(e);
  }

  private static int bounded(String digits, String what) {
    int parsed = digits.length() > 9 ? Integer.MAX_VALUE : Integer.parseInt(digits);
    if (parsed > MAX_DIGITS) {
      throw new IllegalArgumentException(what + " must not exceed " + MAX_DIGITS + ": " + digits);
    }
    return parsed;
  }

  private static void checkPrecision(int precision) {
    if (precision > MAX_DIGITS) {
      throw new IllegalArgumentException(
          "Precision must not exceed " + MAX_DIGITS + ": " + precision);
    }
  }

  private static String stripFraction(String text) {
    if (!text.contains(".")) return text;
    String stripped = StringUtils.stripEnd(text, "0");
    return StringUtils.removeEnd(stripped, ".");
  }

  private static boolean isNegative(double value) {
    return value < 0 || (value == 0.0 && 1.0 / value < 0);
  }
}
