package com.gentoro.reportengine.expression;

import com.gentoro.reportengine.expression.Expression.ComparisonOperator;
import com.gentoro.reportengine.expression.Expression.TemplateField;
import com.gentoro.reportengine.expression.Expression.TemplatePart;
import com.gentoro.reportengine.expression.Expression.TemplateText;
import com.gentoro.reportengine.expression.SafeEvalException.Kind;
import com.gentoro.reportengine.utility.NumberFormats;
import com.gentoro.reportengine.utility.Values;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** Evaluates a validated {@link Expression} tree against a set of bound variables. */
final class ExpressionInterpreter implements ExpressionVisitor<Object> {

  private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

  private final Map<String, Object> bindings;

  ExpressionInterpreter(Map<String, Object> bindings) {
    this.bindings = bindings;
  }

  Object evaluate(Expression expression) {
    return expression.accept(this);
  }

  /** Display form used by {@code str()}, untyped template fields and format results. */
  static String display(Object value) {
    if (value == null) return "None";
    if (value instanceof Boolean bool) return bool ? "True" : "False";
    return Values.str(value);
  }

  @Override
  public Object visitNumber(Expression.NumberLiteral node) {
    return Arithmetic.normalize(node.value());
  }

  @Override
  public Object visitString(Expression.StringLiteral node) {
    return node.value();
  }

  @Override
  public Object visitVariable(Expression.Variable node) {
    if (!bindings.containsKey(node.name())) {
      throw new SafeEvalException(Kind.UNDEFINED_NAME, "Undefined name: " + node.name());
    }
    return Arithmetic.normalize(bindings.get(node.name()));
  }

  @Override
  public Object visitUnary(Expression.Unary node) {
    Object operand = node.operand().accept(this);
    return switch (node.operator()) {
      case PLUS -> Arithmetic.plus(operand);
      case MINUS -> Arithmetic.negate(operand);
    };
  }

  @Override
  public Object visitBinary(Expression.Binary node) {
    Object left = node.left().accept(this);
    Object right = node.right().accept(this);
    return Arithmetic.binary(node.operator(), left, right);
  }

  @Override
  public Object visitComparison(Expression.Comparison node) {
    Object left = node.operands().get(0).accept(this);
    for (int k = 0; k < node.operators().size(); k++) {
      ComparisonOperator op = node.operators().get(k);
      Object right = node.operands().get(k + 1).accept(this);
      if (!Arithmetic.compare(op, left, right)) {
        return false;
      }
      left = right;
    }
    return true;
  }

  @Override
  public Object visitConditional(Expression.Conditional node) {
    return Values.isTruthy(node.test().accept(this))
        ? node.body().accept(this)
        : node.orElse().accept(this);
  }

  @Override
  public Object visitCall(Expression.Call node) {
    List<Object> args = new ArrayList<>(node.arguments().size());
    for (Expression argument : node.arguments()) {
      args.add(argument.accept(this));
    }
    return switch (node.function()) {
      case "abs" -> abs(single(node.function(), args));
      case "round" -> round(args);
      case "max" -> extreme("max", args, ComparisonOperator.GT);
      case "min" -> extreme("min", args, ComparisonOperator.LT);
      case "sum" -> sum(args);
      case "len" -> len(single(node.function(), args));
      case "float" -> args.isEmpty() ? 0.0 : toFloat(single(node.function(), args));
      case "int" -> args.isEmpty() ? 0L : toInt(single(node.function(), args));
      case "str" -> args.isEmpty() ? "" : display(single(node.function(), args));
      default ->
          throw new SafeEvalException(
              Kind.UNDEFINED_FUNCTION, "Undefined function: " + node.function());
    };
  }

  @Override
  public Object visitTemplate(Expression.Template node) {
    StringBuilder sb = new StringBuilder();
    for (TemplatePart part : node.parts()) {
      if (part instanceof TemplateText text) {
        sb.append(text.text());
      } else if (part instanceof TemplateField field) {
        Object value = field.expression().accept(this);
        if (field.formatSpec() == null) {
          sb.append(display(value));
          continue;
        }
        try {
          sb.append(NumberFormats.format(value, field.formatSpec()));
        } catch (IllegalArgumentException e) {
          throw new SafeEvalException(Kind.EXECUTION_FAILURE, e.getMessage(), e);
        }
      }
    }
    return sb.toString();
  }

  private static Object single(String function, List<Object> args) {
    if (args.size() != 1) {
      throw new SafeEvalException(
          Kind.EXECUTION_FAILURE,
          "%s() takes exactly one argument (%d given)".formatted(function, args.size()));
    }
    return args.get(0);
  }

  private static Object abs(Object value) {
    Number n = Arithmetic.number(value, "abs()");
    if (n instanceof Long l) {
      return l == Long.MIN_VALUE ? (Object) Math.abs((double) l) : (Object) Math.abs(l);
    }
    return Math.abs(n.doubleValue());
  }

  private static Object round(List<Object> args) {
    if (args.isEmpty() || args.size() > 2) {
      throw new SafeEvalException(
          Kind.EXECUTION_FAILURE,
          "round() takes 1 or 2 arguments (%d given)".formatted(args.size()));
    }
    Number value = Arithmetic.number(args.get(0), "round()");
    if (args.size() == 1 || args.get(1) == null) {
      if (value instanceof Long) {
        return value;
      }
      double d = value.doubleValue();
      if (!Double.isFinite(d)) {
        throw new SafeEvalException(
            Kind.EXECUTION_FAILURE, "Cannot convert float " + Values.str(d) + " to integer");
      }
      return Arithmetic.normalize(
          new BigDecimal(d).setScale(0, RoundingMode.HALF_EVEN).toBigInteger());
    }
    Object digitsValue = Arithmetic.normalize(args.get(1));
    if (!(digitsValue instanceof Long digits)) {
      throw new SafeEvalException(
          Kind.EXECUTION_FAILURE,
          "'%s' object cannot be interpreted as an integer"
              .formatted(Arithmetic.typeName(digitsValue)));
    }
    int places = (int) Math.max(-400, Math.min(400, digits));
    if (value instanceof Long l) {
      if (places >= 0) {
        return l;
      }
      return Arithmetic.normalize(
          BigDecimal.valueOf(l).setScale(places, RoundingMode.HALF_EVEN).toBigInteger());
    }
    double d = value.doubleValue();
    if (!Double.isFinite(d)) {
      return d;
    }
    return new BigDecimal(d).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
  }

  private static Object extreme(String function, List<Object> args, ComparisonOperator better) {
    if (args.size() < 2) {
      throw new SafeEvalException(
          Kind.EXECUTION_FAILURE, function + "() expects at least two arguments");
    }
    Object best = args.get(0);
    for (int k = 1; k < args.size(); k++) {
      if (Arithmetic.compare(better, args.get(k), best)) {
        best = args.get(k);
      }
    }
    return best;
  }

  private static Object sum(List<Object> args) {
    Object total = 0L;
    for (Object arg : args) {
      Arithmetic.number(arg, "sum()");
      total = Arithmetic.binary(Expression.BinaryOperator.ADD, total, arg);
    }
    return total;
  }

  private static Object len(Object value) {
    if (value instanceof String text) {
      return (long) text.codePointCount(0, text.length());
    }
    throw new SafeEvalException(
        Kind.EXECUTION_FAILURE,
        "Object of type '%s' has no len()".formatted(Arithmetic.typeName(value)));
  }

  private static Object toFloat(Object value) {
    if (value instanceof String text) {
      Double parsed = Values.toDouble(text);
      if (parsed == null) {
        throw new SafeEvalException(
            Kind.EXECUTION_FAILURE, "Could not convert string to float: '" + text + "'");
      }
      return parsed;
    }
    return Arithmetic.number(value, "float()").doubleValue();
  }

  private static Object toInt(Object value) {
    if (value instanceof String text) {
      String trimmed = text.strip();
      if (!INTEGER.matcher(trimmed).matches()) {
        throw new SafeEvalException(
            Kind.EXECUTION_FAILURE, "Invalid literal for int(): '" + text + "'");
      }
      return Arithmetic.normalize(new BigInteger(trimmed));
    }
    Number n = Arithmetic.number(value, "int()");
    if (n instanceof Long) {
      return n;
    }
    double d = n.doubleValue();
    if (!Double.isFinite(d)) {
      throw new SafeEvalException(
          Kind.EXECUTION_FAILURE, "Cannot convert float " + Values.str(d) + " to integer");
    }
    return Arithmetic.normalize(new BigDecimal(d).toBigInteger());
  }
}
