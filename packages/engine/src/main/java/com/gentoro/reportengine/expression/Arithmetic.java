package com.gentoro.reportengine.expression;

import com.gentoro.reportengine.expression.Expression.BinaryOperator;
import com.gentoro.reportengine.expression.Expression.ComparisonOperator;
import com.gentoro.reportengine.expression.SafeEvalException.Kind;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Operator semantics of the expression language.
 *
 * <p>Integers are {@link Long}, everything else numeric is {@link Double}; booleans take part in
 * arithmetic as {@code 1}/{@code 0}. True division always yields a double, floor division and
 * modulo round towards negative infinity, and integer results that overflow a long continue as
 * doubles.
 */
final class Arithmetic {

  private static final long MAX_REPEATED_LENGTH = 100_000L;

  /** Signals a division, floor division, modulo or power by zero. */
  static final class DivisionByZero extends RuntimeException {
    DivisionByZero(String message) {
      super(message);
    }
  }

  private Arithmetic() {}

  /** Canonical runtime value: Long, Double, String, Boolean or null. */
  static Object normalize(Object value) {
    if (value == null || value instanceof Long || value instanceof Double) {
      return value;
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger big) {
      return big.bitLength() < 64 ? (Object) big.longValue() : (Object) big.doubleValue();
    }
    if (value instanceof BigDecimal || value instanceof Float) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof CharSequence text) {
      return text.toString();
    }
    return value;
  }

  static Object binary(BinaryOperator op, Object leftValue, Object rightValue) {
    Object left = normalize(leftValue);
    Object right = normalize(rightValue);
    if (left instanceof String || right instanceof String) {
      return stringBinary(op, left, right);
    }
    Number a = number(left, op.symbol());
    Number b = number(right, op.symbol());
    boolean integral = a instanceof Long && b instanceof Long;
    return switch (op) {
      case ADD ->
          integral ? addExact(a.longValue(), b.longValue()) : a.doubleValue() + b.doubleValue();
      case SUBTRACT ->
          integral
              ? subtractExact(a.longValue(), b.longValue())
              : a.doubleValue() - b.doubleValue();
      case MULTIPLY ->
          integral
              ? multiplyExact(a.longValue(), b.longValue())
              : a.doubleValue() * b.doubleValue();
      case DIVIDE -> {
        requireNonZero(b, "division by zero");
        yield a.doubleValue() / b.doubleValue();
      }
      case FLOOR_DIVIDE -> {
        requireNonZero(b, "integer division or modulo by zero");
        yield integral
            ? (Object) Math.floorDiv(a.longValue(), b.longValue())
            : (Object) Math.floor(a.doubleValue() / b.doubleValue());
      }
      case MODULO -> {
        requireNonZero(b, "integer division or modulo by zero");
        yield integral
            ? (Object) Math.floorMod(a.longValue(), b.longValue())
            : (Object) floatMod(a.doubleValue(), b.doubleValue());
      }
      case POWER -> power(a, b);
    };
  }

  static Object negate(Object operandValue) {
    Object operand = normalize(operandValue);
    Number n = number(operand, "unary -");
    if (n instanceof Long l) {
      return l == Long.MIN_VALUE ? (Object) (-(double) l) : (Object) (-l);
    }
    return -n.doubleValue();
  }

  static Object plus(Object operandValue) {
    return number(normalize(operandValue), "unary +");
  }

  static boolean compare(ComparisonOperator op, Object leftValue, Object rightValue) {
    Object left = normalize(leftValue);
    Object right = normalize(rightValue);
    boolean leftNumeric = left instanceof Number || left instanceof Boolean;
    boolean rightNumeric = right instanceof Number || right instanceof Boolean;
    if (leftNumeric && rightNumeric) {
      Number a = number(left, op.symbol());
      Number b = number(right, op.symbol());
      if (a instanceof Long x && b instanceof Long y) {
        return test(op, Long.compare(x, y));
      }
      double x = a.doubleValue();
      double y = b.doubleValue();
      return switch (op) {
        case LT -> x < y;
        case LE -> x <= y;
        case GT -> x > y;
        case GE -> x >= y;
        case EQ -> x == y;
        case NE -> x != y;
      };
    }
    if (left instanceof String x && right instanceof String y) {
      return test(op, x.compareTo(y));
    }
    if (op == ComparisonOperator.EQ) {
      return left == null ? right == null : left.equals(right);
    }
    if (op == ComparisonOperator.NE) {
      return !(left == null ? right == null : left.equals(right));
    }
    throw new SafeEvalException(
        Kind.EXECUTION_FAILURE,
        "'%s' not supported between instances of '%s' and '%s'"
            .formatted(op.symbol(), typeName(left), typeName(right)));
  }

  /** Numeric view of a runtime value, failing for strings and null. */
  static Number number(Object value, String operation) {
    if (value instanceof Boolean bool) {
      return bool ? 1L : 0L;
    }
    Object normalized = normalize(value);
    if (normalized instanceof Number number) {
      return number;
    }
    throw new SafeEvalException(
        Kind.EXECUTION_FAILURE,
        "Unsupported operand type for %s: '%s'".formatted(operation, typeName(normalized)));
  }

  static String typeName(Object value) {
    if (value == null) return "None";
    if (value instanceof Boolean) return "bool";
    if (value instanceof Long) return "int";
    if (value instanceof Double) return "float";
    if (value instanceof String) return "str";
    return value.getClass().getSimpleName();
  }

  private static Object stringBinary(BinaryOperator op, Object left, Object right) {
    if (op == BinaryOperator.ADD && left instanceof String a && right instanceof String b) {
      return a + b;
    }
    if (op == BinaryOperator.MULTIPLY) {
      if (left instanceof String text && (right instanceof Long || right instanceof Boolean)) {
        return repeat(text, number(right, op.symbol()).longValue());
      }
      if (right instanceof String text && (left instanceof Long || left instanceof Boolean)) {
        return repeat(text, number(left, op.symbol()).longValue());
      }
    }
    throw new SafeEvalException(
        Kind.EXECUTION_FAILURE,
        "Unsupported operand type(s) for %s: '%s' and '%s'"
            .formatted(op.symbol(), typeName(left), typeName(right)));
  }

  private static String repeat(String text, long times) {
    if (times <= 0 || text.isEmpty()) {
      return "";
    }
    if (times > MAX_REPEATED_LENGTH / text.length()) {
      throw new SafeEvalException(Kind.EXECUTION_FAILURE, "Repeated string is too long");
    }
    return text.repeat((int) times);
  }

  private static Object addExact(long a, long b) {
    try {
      return Math.addExact(a, b);
    } catch (ArithmeticException overflow) {
      return (double) a + (double) b;
    }
  }

  private static Object subtractExact(long a, long b) {
    try {
      return Math.subtractExact(a, b);
    } catch (ArithmeticException overflow) {
      return (double) a - (double) b;
    }
  }

  private static Object multiplyExact(long a, long b) {
    try {
      return Math.multiplyExact(a, b);
    } catch (ArithmeticException overflow) {
      return (double) a * (double) b;
    }
  }

  private static void requireNonZero(Number divisor, String message) {
    if (divisor.doubleValue() == 0.0) {
      throw new DivisionByZero(message);
    }
  }

  private static double floatMod(double a, double b) {
    double r = a % b;
    if (r != 0 && (r < 0) != (b < 0)) {
      r += b;
    }
    return r;
  }

  private static Object power(Number base, Number exponent) {
    if (base instanceof Long b && exponent instanceof Long e) {
      if (e < 0) {
        if (b == 0) {
          throw new DivisionByZero("0 cannot be raised to a negative power");
        }
        return Math.pow(b, e);
      }
      if (b == 0 || b == 1) {
        return e == 0 ? 1L : b;
      }
      if (b == -1) {
        return e % 2 == 0 ? 1L : -1L;
      }
      if (e <= 64) {
        return normalize(BigInteger.valueOf(b).pow(e.intValue()));
      }
      return Math.pow(b, e);
    }
    double b = base.doubleValue();
    double e = exponent.doubleValue();
    if (b == 0.0 && e < 0) {
      throw new DivisionByZero("0.0 cannot be raised to a negative power");
    }
    if (b < 0 && e != Math.rint(e) && Double.isFinite(e)) {
      throw new SafeEvalException(
          Kind.EXECUTION_FAILURE, "Negative number cannot be raised to a fractional power");
    }
    double result = Math.pow(b, e);
    if (Double.isInfinite(result) && Double.isFinite(b) && Double.isFinite(e)) {
      throw new SafeEvalException(Kind.EXECUTION_FAILURE, "Numerical result out of range");
    }
    return result;
  }

  private static boolean test(ComparisonOperator op, int cmp) {
    return switch (op) {
      case LT -> cmp < 0;
      case LE -> cmp <= 0;
      case GT -> cmp > 0;
      case GE -> cmp >= 0;
      case EQ -> cmp == 0;
      case NE -> cmp != 0;
    };
  }
}
