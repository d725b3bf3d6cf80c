package com.gentoro.reportengine.calculation;

import com.gentoro.reportengine.utility.NumberFormats;
import com.gentoro.reportengine.utility.Values;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Built-in calculation functions for lighting test reports.
 *
 * <p>Each function is available as a typed static method and is registered by {@link
 * #registerAll(FunctionRegistry)} under its configuration name. Functions never throw on bad input:
 * they fall back to a documented placeholder ({@code "N/A"}, {@code "0.00%"}, {@code 0.0}).
 */
public final class BuiltinFunctions {

  private static final String NOT_AVAILABLE = "N/A";

  private BuiltinFunctions() {}

  public static void registerAll(FunctionRegistry registry) {
    CalculationFunction energyClass = args -> energyClassRating(arg(args, 0), arg(args, 1));
    CalculationFunction efficacy = args -> energyEfficacy(arg(args, 0), arg(args, 1));
    CalculationFunction percentage = args -> percentage(arg(args, 0), arg(args, 1));
    CalculationFunction lumenPerWatt = args -> lumenPerWatt(arg(args, 0), arg(args, 1));
    CalculationFunction powerFactor = args -> powerFactor(arg(args, 0), arg(args, 1));
    CalculationFunction cctDeviation = args -> cctDeviation(arg(args, 0), arg(args, 1));
    CalculationFunction average = BuiltinFunctions::average;

    registry
        .register("energy_class_rating", energyClass)
        .register("energy_efficacy", efficacy)
        .register("percentage", percentage)
        .register(
            "format_number",
            args -> formatNumber(arg(args, 0), args.size() > 1 ? args.get(1) : 2))
        .register("concat", args -> concat(args, " "))
        .register("multiply", args -> multiply(arg(args, 0), arg(args, 1)))
        .register(
            "divide",
            args -> divide(arg(args, 0), arg(args, 1), args.size() > 2 ? args.get(2) : 0.0))
        .register("average", average)
        .register(
            "format_with_unit",
            args ->
                formatWithUnit(arg(args, 0), arg(args, 1), args.size() > 2 ? args.get(2) : 2))
        .register("lumen_per_watt", lumenPerWatt)
        .register("power_factor", powerFactor)
        .register("cct_deviation", cctDeviation)
        .register(
            "check_pass_fail", args -> checkPassFail(arg(args, 0), arg(args, 1), arg(args, 2)))
        // names used by existing report configurations
        .register("calculate_energy_class_rating", energyClass)
        .register("calculate_energy_efficacy", efficacy)
        .register("calculate_percentage", percentage)
        .register("calculate_lumen_per_watt", lumenPerWatt)
        .register("calculate_power_factor", powerFactor)
        .register("calculate_cct_deviation", cctDeviation)
        .register("calculate_average", average);
  }

  /**
   * Energy class from luminous efficacy (flux / wattage, lm/W): {@code A++} from 210, {@code A+}
   * from 185, {@code A} from 160, {@code B} from 135, {@code C} from 110, {@code D} from 85,
   * otherwise {@code E}.
   *
   * @return the class, or {@code "N/A"} when either input is missing, zero or not numeric
   */
  public static String energyClassRating(Object wattage, Object flux) {
    Double efficacy = efficacy(wattage, flux);
    if (efficacy == null) {
      return NOT_AVAILABLE;
    }
    if (efficacy >= 210) return "A++";
    if (efficacy >= 185) return "A+";
    if (efficacy >= 160) return "A";
    if (efficacy >= 135) return "B";
    if (efficacy >= 110) return "C";
    if (efficacy >= 85) return "D";
    return "E";
  }

  /** Luminous efficacy in lm/W with two decimals, or {@code "N/A"}. */
  public static String energyEfficacy(Object wattage, Object flux) {
    Double efficacy = efficacy(wattage, flux);
    return efficacy == null ? NOT_AVAILABLE : NumberFormats.fixed(efficacy, 2);
  }

  /** {@code value / total * 100} with two decimals and a percent sign. */
  public static String percentage(Object value, Object total) {
    Double ratio = ratio(value, total);
    return ratio == null ? "0.00%" : NumberFormats.fixed(ratio * 100, 2) + "%";
  }

  /**
   * Fixed-point rendering with {@code decimals} places. Non-numeric values are returned in their
   * display form ({@code null} becomes an empty string).
   */
  public static String formatNumber(Object value, Object decimals) {
    Double number = Values.toDouble(value);
    Long places = Values.toLong(decimals);
    if (number == null || places == null || places < 0) {
      return Values.str(value);
    }
    return NumberFormats.fixed(number, places.intValue());
  }

  /** Joins the non-null values with {@code separator}. */
  public static String concat(List<?> values, String separator) {
    return values.stream()
        .filter(v -> v != null)
        .map(Values::str)
        .collect(Collectors.joining(separator));
  }

  /** Product of two numbers; {@code 0.0} when either is not numeric. */
  public static double multiply(Object a, Object b) {
    Double x = Values.toDouble(a);
    Double y = Values.toDouble(b);
    return x == null || y == null ? 0.0 : x * y;
  }

  /** Quotient of two numbers; {@code defaultValue} on a zero divisor or non-numeric input. */
  public static double divide(Object a, Object b, Object defaultValue) {
    Double fallback = Values.toDouble(defaultValue);
    double otherwise = fallback == null ? 0.0 : fallback;
    Double x = Values.toDouble(a);
    Double y = Values.toDouble(b);
    if (x == null || y == null || y == 0.0) {
      return otherwise;
    }
    return x / y;
  }

  /** Mean of the numeric arguments with two decimals; {@code "0.00"} when there are none. */
  public static String average(List<?> values) {
    List<Double> numbers = new ArrayList<>();
    for (Object value : values) {
      Double d = Values.toDouble(value);
      if (d != null) {
        numbers.add(d);
      }
    }
    if (numbers.isEmpty()) {
      return "0.00";
    }
    double sum = 0;
    for (double d : numbers) {
      sum += d;
    }
    return NumberFormats.fixed(sum / numbers.size(), 2);
  }

  /** {@code "12.50 W"}; non-numeric values are kept as they are. */
  public static String formatWithUnit(Object value, Object unit, Object decimals) {
    return formatNumber(value, decimals) + " " + Values.str(unit);
  }

  /** Lumens per watt with one decimal; {@code "0.0"} on zero or missing wattage. */
  public static String lumenPerWatt(Object lumen, Object watt) {
    Double ratio = ratio(lumen, watt);
    return ratio == null ? "0.0" : NumberFormats.fixed(ratio, 1);
  }

  /** Active over apparent power with two decimals; {@code "0.00"} on zero apparent power. */
  public static String powerFactor(Object activePower, Object apparentPower) {
    Double ratio = ratio(activePower, apparentPower);
    return ratio == null ? "0.00" : NumberFormats.fixed(ratio, 2);
  }

  /** Signed deviation of measured from rated colour temperature, e.g. {@code "+2.5%"}. */
  public static String cctDeviation(Object measured, Object rated) {
    Double m = Values.toDouble(measured);
    Double r = Values.toDouble(rated);
    if (m == null || r == null || r == 0.0) {
      return "0.0%";
    }
    double deviation = (m - r) / r * 100;
    return (deviation > 0 ? "+" : "") + NumberFormats.fixed(deviation, 1) + "%";
  }

  /** {@code "Pass"} when {@code min <= value <= max}, {@code "Fail"} otherwise. */
  public static String checkPassFail(Object value, Object min, Object max) {
    Double v = Values.toDouble(value);
    Double lo = Values.toDouble(min);
    Double hi = Values.toDouble(max);
    if (v == null || lo == null || hi == null) {
      return NOT_AVAILABLE;
    }
    return lo <= v && v <= hi ? "Pass" : "Fail";
  }

  private static Double efficacy(Object wattage, Object flux) {
    if (!Values.isTruthy(wattage) || !Values.isTruthy(flux)) {
      return null;
    }
    return ratio(flux, wattage);
  }

  /** {@code numerator / denominator}, or {@code null} for a zero or non-numeric input. */
  private static Double ratio(Object numerator, Object denominator) {
    Double n = Values.toDouble(numerator);
    Double d = Values.toDouble(denominator);
    if (n == null || d == null || d == 0.0) {
      return null;
    }
    return n / d;
  }

  private static Object arg(List<Object> args, int index) {
    return index < args.size() ? args.get(index) : null;
  }
}
