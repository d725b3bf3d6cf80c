package com.gentoro.reportengine.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportengine.config.EngineConfiguration;
import com.gentoro.reportengine.expression.SafeEvalException.Kind;
import com.gentoro.reportengine.logging.LoggingService;
import com.gentoro.reportengine.utility.Values;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point for evaluating user-supplied formulas and format functions without executing
 * arbitrary code.
 *
 * <p>Every expression is parsed into a typed tree and checked against a whitelist of node kinds,
 * functions and names before it is evaluated. Three modes are offered:
 *
 * <ul>
 *   <li><b>Formula</b> ({@link #evaluateFormula}): numeric result, variables bound by name. Any
 *       division, floor division or modulo by zero makes the whole formula evaluate to {@code
 *       0.0}.
 *   <li><b>Row formula</b> ({@link #evaluateRowFormula}): formula over the cells of one table row,
 *       referenced by column letters ({@code B{row}/A{row}*1000}).
 *   <li><b>Format</b> ({@link #evaluateFormat}): a {@code lambda x: ...} function, typically
 *       returning an {@code f'...'} template, rendered to a string. Nesting is capped at {@link
 *       #maxFormatDepth()} levels.
 * </ul>
 *
 * <p>Example:
 *
 * <pre>{@code
 * SafeExpressionEvaluator eval = new SafeExpressionEvaluator();
 * eval.evaluateFormula("A / B * 1000", Map.of("A", 2, "B", 8));         // 250.0
 * eval.evaluateRowFormula("B{row}/A{row}*1000", 0, List.of("2", "8"));  // 4000.0
 * eval.evaluateFormat("lambda x: f'{x:.1f} lm'", 1234.56);              // "1234.6 lm"
 * }</pre>
 */
public final class SafeExpressionEvaluator {

  private static final org.slf4j.Logger log =
      LoggingService.getLogger(SafeExpressionEvaluator.class);

  public static final int DEFAULT_MAX_DEPTH = EngineConfiguration.DEFAULT_MAX_DEPTH;

  /** A cell reference such as {@code B0} or {@code AA12}: column letters, then a row number. */
  private static final Pattern CELL_REFERENCE =
      Pattern.compile("(?<![A-Za-z0-9_.])([A-Z]+)(\\d+)(?![A-Za-z_])");

  private static final String ROW_PLACEHOLDER = "{row}";

  private final int maxFormatDepth;

  public SafeExpressionEvaluator() {
    this(DEFAULT_MAX_DEPTH);
  }

  public SafeExpressionEvaluator(int maxFormatDepth) {
    if (maxFormatDepth <= 0) {
      throw new IllegalArgumentException("Maximum depth must be positive: " + maxFormatDepth);
    }
    this.maxFormatDepth = maxFormatDepth;
  }

  public static SafeExpressionEvaluator fromConfiguration(EngineConfiguration configuration) {
    return new SafeExpressionEvaluator(configuration.maxExpressionDepth());
  }

  public int maxFormatDepth() {
    return maxFormatDepth;
  }

  // ---------------------------------------------------------------------------------------------
  // Formula mode
  // ---------------------------------------------------------------------------------------------

  /**
   * Evaluate an arithmetic formula.
   *
   * <p>Numeric strings among the variable values are coerced ({@code "12"} binds as {@code 12}).
   *
   * @param formula expression such as {@code A / B * 1000}
   * @param variables name to value bindings; may be {@code null}
   * @return a {@link Long} or {@link Double}; {@code 0.0} when the formula divides by zero
   * @throws SafeEvalException when the formula is rejected or cannot be evaluated
   */
  public Number evaluateFormula(String formula, Map<String, ?> variables) {
    Map<String, Object> bindings = bind(variables);
    Expression expression = ExpressionParser.parse(formula);
    new ExpressionValidator(false, bindings.keySet(), 0).validate(expression);
    Object result;
    try {
      result = new ExpressionInterpreter(bindings).evaluate(expression);
    } catch (Arithmetic.DivisionByZero e) {
      log.debug("Formula '{}' divides by zero, evaluating to 0", formula);
      return 0.0;
    } catch (SafeEvalException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SafeEvalException(Kind.EXECUTION_FAILURE, "Evaluation error: " + e.getMessage(), e);
    }
    return asNumber(result);
  }

  public EvalResult<Number> tryEvaluateFormula(String formula, Map<String, ?> variables) {
    try {
      return EvalResult.success(evaluateFormula(formula, variables));
    } catch (SafeEvalException e) {
      return EvalResult.failure(e);
    }
  }

  /** Check that a formula is acceptable without binding or evaluating it. */
  public boolean validateFormula(String formula) {
    try {
      new ExpressionValidator(false, null, 0).validate(ExpressionParser.parse(formula));
      return true;
    } catch (SafeEvalException e) {
      log.debug("Formula '{}' rejected: {}", formula, e.getMessage());
      return false;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Row formulas
  // ---------------------------------------------------------------------------------------------

  /**
   * Evaluate a formula over one table row. {@code {row}} is replaced with {@code rowIndex}; each
   * reference to that row ({@code B{row}}, or {@code B0} when {@code rowIndex} is 0) is replaced
   * with the numeric value of that column in {@code row}, or {@code 0} when the cell is missing or
   * not numeric. References to other rows are not resolved and fail as undefined names.
   */
  public Number evaluateRowFormula(String formula, int rowIndex, List<?> row) {
    return evaluateFormula(resolveRowReferences(formula, rowIndex, row), Map.of());
  }

  public EvalResult<Number> tryEvaluateRowFormula(String formula, int rowIndex, List<?> row) {
    try {
      return EvalResult.success(evaluateRowFormula(formula, rowIndex, row));
    } catch (SafeEvalException e) {
      return EvalResult.failure(e);
    }
  }

  /** Substitute the row placeholder and column references of a row formula. */
  public static String resolveRowReferences(String formula, int rowIndex, List<?> row) {
    if (formula == null || formula.isBlank()) {
      throw new SafeEvalException(Kind.SYNTAX_ERROR, "Formula must be a non-empty string");
    }
    String current = Integer.toString(rowIndex);
    String withRow = formula.replace(ROW_PLACEHOLDER, current);
    Matcher m = CELL_REFERENCE.matcher(withRow);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String replacement = current.equals(m.group(2)) ? cellLiteral(m.group(1), row) : m.group();
      m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  private static String cellLiteral(String letters, List<?> row) {
    int column;
    try {
      column = ColumnLetters.toIndex(letters);
    } catch (ArithmeticException overflow) {
      return "0";
    }
    if (row == null || column >= row.size()) {
      return "0";
    }
    Object cell = bindValue(row.get(column));
    if (!(cell instanceof Number) && !(cell instanceof Boolean)) {
      return "0";
    }
    Number number = Arithmetic.number(cell, "cell reference");
    if (number instanceof Double d && !Double.isFinite(d)) {
      return "0";
    }
    String literal = Values.str(number);
    return number.doubleValue() < 0 ? "(" + literal + ")" : literal;
  }

  // ---------------------------------------------------------------------------------------------
  // Format mode
  // ---------------------------------------------------------------------------------------------

  /**
   * Parse and validate a {@code lambda <param>: <body>} format function.
   *
   * @throws SafeEvalException when the function is malformed, uses disallowed syntax, references
   *     names other than its parameter or nests deeper than {@link #maxFormatDepth()}
   */
  public CompiledFormat compileFormat(String function) {
    FormatLambda lambda = ExpressionParser.parseLambda(function);
    new ExpressionValidator(true, Set.of(lambda.parameter()), maxFormatDepth)
        .validate(lambda.body());
    return new CompiledFormat(lambda);
  }

  /** Apply a format function to one value and return the rendered string. */
  public String evaluateFormat(String function, Object value) {
    return compileFormat(function).apply(value);
  }

  public EvalResult<String> tryEvaluateFormat(String function, Object value) {
    try {
      return EvalResult.success(evaluateFormat(function, value));
    } catch (SafeEvalException e) {
      return EvalResult.failure(e);
    }
  }

  /** Check that a format function is acceptable without applying it. */
  public boolean validateFormat(String function) {
    try {
      compileFormat(function);
      return true;
    } catch (SafeEvalException e) {
      log.debug("Format function '{}' rejected: {}", function, e.getMessage());
      return false;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------------------------------

  private static Map<String, Object> bind(Map<String, ?> variables) {
    Map<String, Object> bindings = new LinkedHashMap<>();
    if (variables != null) {
      variables.forEach((name, value) -> bindings.put(name, bindValue(value)));
    }
    return bindings;
  }

  private static Object bindValue(Object value) {
    if (value instanceof JsonNode node) {
      if (node.isNull() || node.isMissingNode()) return null;
      if (node.isNumber()) return Arithmetic.normalize(node.numberValue());
      if (node.isBoolean()) return node.booleanValue();
      if (node.isTextual()) return Values.coerce(node.textValue());
      return node;
    }
    if (value instanceof String text) {
      return Values.coerce(text);
    }
    return Arithmetic.normalize(value);
  }

  private static Number asNumber(Object result) {
    if (result instanceof Boolean bool) {
      return bool ? 1L : 0L;
    }
    if (result instanceof Number number) {
      return number;
    }
    throw new SafeEvalException(
        Kind.EXECUTION_FAILURE,
        "Formula must evaluate to a number, got '%s'".formatted(Arithmetic.typeName(result)));
  }
}
