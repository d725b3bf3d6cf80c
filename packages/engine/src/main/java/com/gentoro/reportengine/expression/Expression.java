package com.gentoro.reportengine.expression;

import java.util.List;

/**
 * Typed expression tree produced by {@link ExpressionParser}.
 *
 * <p>The interface is sealed: these records are the complete whitelist of node kinds. There is no
 * node for attribute access, subscripts, assignments or arbitrary calls, so such constructs cannot
 * be represented, let alone evaluated.
 */
public sealed interface Expression {

  <T> T accept(ExpressionVisitor<T> visitor);

  enum UnaryOperator {
    PLUS("+"),
    MINUS("-");

    private final String symbol;

    UnaryOperator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    FLOOR_DIVIDE("//"),
    MODULO("%"),
    POWER("**");

    private final String symbol;

    BinaryOperator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  enum ComparisonOperator {
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    EQ("=="),
    NE("!=");

    private final String symbol;

    ComparisonOperator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  /** Integer ({@link Long}) or floating point ({@link Double}) constant. */
  record NumberLiteral(Number value) implements Expression {
    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
      return visitor.visitNumber(this);
    }
  }

  record StringLiteral(String value) implements Expression {
    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
      return visitor.visitString(this);
    }
  }

  record Variable(String name) implements Expression {
    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
      return visitor.visitVariable(this);
    }
  }

  record Unary(UnaryOperator operator, Expression operand) implements Expression {
    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
      return visitor.visitUnary(this);
    }
  }

  record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {
    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
      return visitor.visitBinary(this);
    }
  }

  /**
   * Possibly chained comparison: {@code a < b <= c} holds {@code operands=[a, b, c]} and {@code
   * operators=[LT, LE]} and means {@code a < b && b <= c}.
   */
  record Comparison(List<Expression> operands, List<ComparisonOperator> operators)
      implements Expression {
    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
      return visitor.visitComparison(this);
    }
  }

  /** {@code body if test else orElse}. */
  record Conditional(Expression test, Expression body, Expression orElse) implements Expression {
    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
      return visitor.visitConditional(this);
    }
  }

  /** Call of a named function; the name is checked against the allowed set during validation. */
  record Call(String function, List<Expression> arguments) implements Expression {
    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
      return visitor.visitCall(this);
    }
  }

  /** Interpolated string ({@code f'{x:.2f} lm'}), a sequence of literal text and fields. */
  record Template(List<TemplatePart> parts) implements Expression {
    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
      return visitor.visitTemplate(this);
    }
  }

  sealed interface TemplatePart {}

  record TemplateText(String text) implements TemplatePart {}

  /** Embedded sub-expression with an optional format spec ({@code null} when absent). */
  record TemplateField(Expression expression, String formatSpec) implements TemplatePart {}
}
