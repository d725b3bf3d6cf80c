package com.gentoro.reportengine.expression;

/** Visitor over the closed set of {@link Expression} node kinds. */
public interface ExpressionVisitor<T> {
  T visitNumber(Expression.NumberLiteral node);

  T visitString(Expression.StringLiteral node);

  T visitVariable(Expression.Variable node);

  T visitUnary(Expression.Unary node);

  T visitBinary(Expression.Binary node);

  T visitComparison(Expression.Comparison node);

  T visitConditional(Expression.Conditional node);

  T visitCall(Expression.Call node);

  T visitTemplate(Expression.Template node);
}
