package com.gentoro.reportengine.expression;

import com.gentoro.reportengine.expression.Expression.TemplateField;
import com.gentoro.reportengine.expression.Expression.TemplatePart;
import com.gentoro.reportengine.expression.SafeEvalException.Kind;
import java.util.Set;

/**
 * Checks a parsed tree against the whitelist before anything is evaluated.
 *
 * <p>String literals and templates are accepted only when the validator is created for format
 * mode. Names are checked against the bound variables when those are known. The depth cap counts
 * the body of an expression as level 1 and rejects any node below level {@code maxDepth}.
 */
final class ExpressionValidator implements ExpressionVisitor<Void> {

  static final Set<String> ALLOWED_FUNCTIONS =
      Set.of("abs", "round", "max", "min", "sum", "len", "float", "int", "str");

  /** Builtins that are reported as disallowed rather than merely unknown. */
  private static final Set<String> DANGEROUS_FUNCTIONS =
      Set.of(
          "eval", "exec", "compile", "open", "getattr", "setattr", "delattr", "hasattr", "globals",
          "locals", "vars", "dir", "input", "breakpoint", "help", "memoryview", "type", "object",
          "super", "classmethod", "staticmethod", "property", "exit", "quit");

  private final boolean allowStrings;
  private final Set<String> names;
  private final int maxDepth;
  private int depth;

  /**
   * @param allowStrings whether string literals and templates are accepted (format mode)
   * @param names bound variable names, or {@code null} to accept any non-reserved name
   * @param maxDepth maximum nesting level, {@code 0} for no limit
   */
  ExpressionValidator(boolean allowStrings, Set<String> names, int maxDepth) {
    this.allowStrings = allowStrings;
    this.names = names;
    this.maxDepth = maxDepth;
  }

  void validate(Expression expression) {
    depth = 0;
    visitChild(expression);
  }

  private void visitChild(Expression child) {
    depth++;
    if (maxDepth > 0 && depth > maxDepth) {
      throw new SafeEvalException(
          Kind.TOO_COMPLEX, "Expression too complex: nesting exceeds " + maxDepth + " levels");
    }
    child.accept(this);
    depth--;
  }

  @Override
  public Void visitNumber(Expression.NumberLiteral node) {
    return null;
  }

  @Override
  public Void visitString(Expression.StringLiteral node) {
    if (!allowStrings) {
      throw new SafeEvalException(
          Kind.DISALLOWED_CONSTRUCT, "String literals are not allowed in formulas");
    }
    return null;
  }

  @Override
  public Void visitVariable(Expression.Variable node) {
    String name = node.name();
    if (name.startsWith("_")) {
      throw new SafeEvalException(
          Kind.DISALLOWED_CONSTRUCT, "Names starting with '_' are not allowed: " + name);
    }
    if (names != null && !names.contains(name)) {
      throw new SafeEvalException(Kind.UNDEFINED_NAME, "Undefined name: " + name);
    }
    return null;
  }

  @Override
  public Void visitUnary(Expression.Unary node) {
    visitChild(node.operand());
    return null;
  }

  @Override
  public Void visitBinary(Expression.Binary node) {
    visitChild(node.left());
    visitChild(node.right());
    return null;
  }

  @Override
  public Void visitComparison(Expression.Comparison node) {
    for (Expression operand : node.operands()) {
      visitChild(operand);
    }
    return null;
  }

  @Override
  public Void visitConditional(Expression.Conditional node) {
    visitChild(node.test());
    visitChild(node.body());
    visitChild(node.orElse());
    return null;
  }

  @Override
  public Void visitCall(Expression.Call node) {
    String function = node.function();
    if (!ALLOWED_FUNCTIONS.contains(function)) {
      if (function.startsWith("_") || DANGEROUS_FUNCTIONS.contains(function)) {
        throw new SafeEvalException(
            Kind.DISALLOWED_CONSTRUCT, "Function call not allowed: " + function);
      }
      throw new SafeEvalException(Kind.UNDEFINED_FUNCTION, "Undefined function: " + function);
    }
    for (Expression argument : node.arguments()) {
      visitChild(argument);
    }
    return null;
  }

  @Override
  public Void visitTemplate(Expression.Template node) {
    if (!allowStrings) {
      throw new SafeEvalException(
          Kind.DISALLOWED_CONSTRUCT, "String templates are not allowed in formulas");
    }
    for (TemplatePart part : node.parts()) {
      if (part instanceof TemplateField field) {
        visitChild(field.expression());
      }
    }
    return null;
  }
}
