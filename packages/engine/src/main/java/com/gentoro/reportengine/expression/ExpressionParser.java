package com.gentoro.reportengine.expression;

import com.gentoro.reportengine.expression.Expression.BinaryOperator;
import com.gentoro.reportengine.expression.Expression.ComparisonOperator;
import com.gentoro.reportengine.expression.Expression.TemplatePart;
import com.gentoro.reportengine.expression.SafeEvalException.Kind;
import com.gentoro.reportengine.utility.NumberFormats;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for the arithmetic expression language used by formulas and format
 * lambdas.
 *
 * <p>Grammar (lowest to highest precedence):
 *
 * <pre>
 * lambda      := 'lambda' NAME ':' conditional
 * conditional := comparison ('if' comparison 'else' conditional)?
 * comparison  := additive (cmp_op additive)*
 * additive    := term (('+' | '-') term)*
 * term        := factor (('*' | '/' | '//' | '%') factor)*
 * factor      := ('+' | '-') factor | power
 * power       := primary ('**' factor)?
 * primary     := NUMBER | STRING | TEMPLATE | NAME | NAME '(' args ')' | '(' conditional ')'
 * </pre>
 *
 * <p>The parser only recognizes whitelisted syntax. Tokens that introduce anything else (attribute
 * access, subscripts, keywords, assignments) are reported as {@link Kind#DISALLOWED_CONSTRUCT};
 * malformed input is reported as {@link Kind#SYNTAX_ERROR}.
 */
public final class ExpressionParser {

  /**
   * Hard recursion guard, independent of the configurable depth cap. Each chained binary operator
   * counts as one level, since chains build left-leaning trees.
   */
  static final int MAX_NESTING = 200;

  private static final Set<String> KEYWORDS =
      Set.of(
          "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
          "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
          "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
          "return", "try", "while", "with", "yield");

  private static final Map<String, ComparisonOperator> COMPARISONS =
      Map.of(
          "<", ComparisonOperator.LT,
          "<=", ComparisonOperator.LE,
          ">", ComparisonOperator.GT,
          ">=", ComparisonOperator.GE,
          "==", ComparisonOperator.EQ,
          "!=", ComparisonOperator.NE);

  private final List<Token> tokens;
  private int pos;
  private int nesting;

  private ExpressionParser(String source, int nesting) {
    this.tokens = ExpressionLexer.tokenize(source);
    this.nesting = nesting;
  }

  /** Parse a standalone expression (formula mode, or a format body). */
  public static Expression parse(String source) {
    requireText(source);
    return new ExpressionParser(source, 0).parseComplete();
  }

  /** Parse a {@code lambda <param>: <body>} format function. */
  public static FormatLambda parseLambda(String source) {
    requireText(source);
    ExpressionParser p = new ExpressionParser(source, 0);
    if (!p.peek().isName("lambda")) {
      throw new SafeEvalException(
          Kind.DISALLOWED_CONSTRUCT, "Only lambda expressions are allowed as format functions");
    }
    p.advance();
    Token param = p.advance();
    if (param.type() != Token.Type.NAME || KEYWORDS.contains(param.text())) {
      throw new SafeEvalException(Kind.SYNTAX_ERROR, "Invalid lambda syntax: missing parameter");
    }
    if (param.text().startsWith("_")) {
      throw new SafeEvalException(
          Kind.DISALLOWED_CONSTRUCT, "Parameter names starting with '_' are not allowed");
    }
    if (p.peek().isOperator(",")) {
      throw new SafeEvalException(
          Kind.SYNTAX_ERROR, "Invalid lambda syntax: exactly one parameter is expected");
    }
    if (!p.advance().isOperator(":")) {
      throw new SafeEvalException(Kind.SYNTAX_ERROR, "Invalid lambda syntax: expected ':'");
    }
    return new FormatLambda(param.text(), p.parseComplete());
  }

  private static void requireText(String source) {
    if (source == null || source.isBlank()) {
      throw new SafeEvalException(Kind.SYNTAX_ERROR, "Expression must be a non-empty string");
    }
  }

  private Expression parseComplete() {
    Expression expression = parseConditional();
    Token next = peek();
    if (next.type() != Token.Type.END) {
      throw unexpected(next);
    }
    return expression;
  }

  // Grammar: conditional := comparison ('if' comparison 'else' conditional)?
  private Expression parseConditional() {
    enter();
    Expression body = parseComparison();
    if (peek().isName("if")) {
      advance();
      Expression test = parseComparison();
      if (!peek().isName("else")) {
        throw new SafeEvalException(
            Kind.SYNTAX_ERROR, "Expected 'else' in conditional expression");
      }
      advance();
      Expression orElse = parseConditional();
      body = new Expression.Conditional(test, body, orElse);
    }
    leave();
    return body;
  }

  // Grammar: comparison := additive (cmp_op additive)*
  private Expression parseComparison() {
    Expression first = parseAdditive();
    List<Expression> operands = new ArrayList<>();
    List<ComparisonOperator> operators = new ArrayList<>();
    operands.add(first);
    while (peek().type() == Token.Type.OPERATOR && COMPARISONS.containsKey(peek().text())) {
      operators.add(COMPARISONS.get(advance().text()));
      operands.add(parseAdditive());
    }
    if (operators.isEmpty()) {
      return first;
    }
    return new Expression.Comparison(List.copyOf(operands), List.copyOf(operators));
  }

  // Grammar: additive := term (('+' | '-') term)*
  private Expression parseAdditive() {
    Expression left = parseTerm();
    int chained = 0;
    while (peek().isOperator("+") || peek().isOperator("-")) {
      BinaryOperator op =
          advance().text().equals("+") ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
      enter();
      chained++;
      left = new Expression.Binary(op, left, parseTerm());
    }
    leave(chained);
    return left;
  }

  // Grammar: term := factor (('*' | '/' | '//' | '%') factor)*
  private Expression parseTerm() {
    Expression left = parseFactor();
    int chained = 0;
    while (true) {
      Token t = peek();
      BinaryOperator op;
      if (t.isOperator("*")) op = BinaryOperator.MULTIPLY;
      else if (t.isOperator("/")) op = BinaryOperator.DIVIDE;
      else if (t.isOperator("//")) op = BinaryOperator.FLOOR_DIVIDE;
      else if (t.isOperator("%")) op = BinaryOperator.MODULO;
      else break;
      advance();
      enter();
      chained++;
      left = new Expression.Binary(op, left, parseFactor());
    }
    leave(chained);
    return left;
  }

  // Grammar: factor := ('+' | '-') factor | power
  private Expression parseFactor() {
    Token t = peek();
    if (t.isOperator("+") || t.isOperator("-")) {
      advance();
      enter();
      Expression operand = parseFactor();
      leave();
      return new Expression.Unary(
          t.text().equals("+") ? Expression.UnaryOperator.PLUS : Expression.UnaryOperator.MINUS,
          operand);
    }
    return parsePower();
  }

  // Grammar: power := primary ('**' factor)?
  private Expression parsePower() {
    Expression base = parsePrimary();
    if (peek().isOperator("**")) {
      advance();
      enter();
      Expression exponent = parseFactor();
      leave();
      return new Expression.Binary(BinaryOperator.POWER, base, exponent);
    }
    return base;
  }

  private Expression parsePrimary() {
    Token t = advance();
    Expression result;
    switch (t.type()) {
      case NUMBER -> result = new Expression.NumberLiteral((Number) t.value());
      case STRING -> result = new Expression.StringLiteral((String) t.value());
      case TEMPLATE -> result = parseTemplate(t.text(), t.position());
      case NAME -> result = parseName(t);
      case OPERATOR -> {
        if (!t.isOperator("(")) {
          throw unexpected(t);
        }
        enter();
        Expression inner = parseConditional();
        if (peek().isOperator(",")) {
          throw new SafeEvalException(Kind.DISALLOWED_CONSTRUCT, "Tuples are not allowed");
        }
        expectOperator(")");
        leave();
        result = inner;
      }
      default -> throw unexpected(t);
    }
    rejectTrailers();
    return result;
  }

  private Expression parseName(Token t) {
    String name = t.text();
    if (KEYWORDS.contains(name)) {
      throw unexpected(t);
    }
    if (!peek().isOperator("(")) {
      return new Expression.Variable(name);
    }
    advance();
    enter();
    List<Expression> args = new ArrayList<>();
    if (!peek().isOperator(")")) {
      while (true) {
        args.add(parseConditional());
        if (peek().isOperator(",")) {
          advance();
          continue;
        }
        break;
      }
    }
    expectOperator(")");
    leave();
    return new Expression.Call(name, List.copyOf(args));
  }

  /** Attribute access, subscripts and calls on anything but a plain name end here. */
  private void rejectTrailers() {
    Token next = peek();
    if (next.isOperator(".")) {
      throw new SafeEvalException(Kind.DISALLOWED_CONSTRUCT, "Attribute access is not allowed");
    }
    if (next.isOperator("[")) {
      throw new SafeEvalException(Kind.DISALLOWED_CONSTRUCT, "Subscripts are not allowed");
    }
    if (next.isOperator("(")) {
      throw new SafeEvalException(
          Kind.DISALLOWED_CONSTRUCT, "Only named functions may be called");
    }
  }

  /**
   * Split the raw body of an {@code f'...'} literal into text and fields. {@code {{} and {@code }}}
   * are escapes; each field is {@code {expr}} or {@code {expr:spec}}.
   */
  private Expression parseTemplate(String raw, int position) {
    List<TemplatePart> parts = new ArrayList<>();
    StringBuilder text = new StringBuilder();
    int k = 0;
    while (k < raw.length()) {
      char c = raw.charAt(k);
      if (c == '{' && k + 1 < raw.length() && raw.charAt(k + 1) == '{') {
        text.append('{');
        k += 2;
      } else if (c == '}' && k + 1 < raw.length() && raw.charAt(k + 1) == '}') {
        text.append('}');
        k += 2;
      } else if (c == '}') {
        throw new SafeEvalException(
            Kind.SYNTAX_ERROR, "Single '}' is not allowed in template at position " + position);
      } else if (c == '{') {
        if (text.length() > 0) {
          String literal = ExpressionLexer.unescape(text.toString(), position);
          parts.add(new Expression.TemplateText(literal));
          text.setLength(0);
        }
        int end = fieldEnd(raw, k + 1, position);
        parts.add(parseField(raw.substring(k + 1, end), position));
        k = end + 1;
      } else {
        text.append(c);
        k++;
      }
    }
    if (text.length() > 0) {
      parts.add(new Expression.TemplateText(ExpressionLexer.unescape(text.toString(), position)));
    }
    return new Expression.Template(List.copyOf(parts));
  }

  private Expression.TemplateField parseField(String field, int position) {
    int split = -1;
    int depth = 0;
    char quote = 0;
    for (int k = 0; k < field.length() && split < 0; k++) {
      char c = field.charAt(k);
      if (quote != 0) {
        if (c == quote) quote = 0;
        continue;
      }
      switch (c) {
        case '\'', '"' -> quote = c;
        case '(', '[' -> depth++;
        case ')', ']' -> depth--;
        case '!' -> {
          boolean comparison = k + 1 < field.length() && field.charAt(k + 1) == '=';
          if (depth == 0 && !comparison) {
            throw new SafeEvalException(
                Kind.DISALLOWED_CONSTRUCT, "Conversions in template fields are not allowed");
          }
        }
        case ':' -> {
          if (depth == 0) split = k;
        }
        default -> {}
      }
    }
    String exprText = split < 0 ? field : field.substring(0, split);
    String spec = split < 0 ? null : field.substring(split + 1);
    if (exprText.isBlank()) {
      throw new SafeEvalException(
          Kind.SYNTAX_ERROR, "Empty expression in template at position " + position);
    }
    if (spec != null) {
      if (spec.isEmpty()) {
        spec = null;
      } else if (!NumberFormats.FORMAT_SPEC.matcher(spec).matches()) {
        throw new SafeEvalException(
            Kind.DISALLOWED_CONSTRUCT, "Unsafe format spec '" + spec + "' in template");
      }
    }
    Expression inner = new ExpressionParser(exprText, nesting + 1).parseComplete();
    return new Expression.TemplateField(inner, spec);
  }

  /** Index of the '}' closing a field that starts at {@code from}. */
  private static int fieldEnd(String raw, int from, int position) {
    int depth = 0;
    char quote = 0;
    for (int k = from; k < raw.length(); k++) {
      char c = raw.charAt(k);
      if (quote != 0) {
        if (c == quote) quote = 0;
        continue;
      }
      if (c == '\'' || c == '"') quote = c;
      else if (c == '(' || c == '[' || c == '{') depth++;
      else if (c == ')' || c == ']') depth--;
      else if (c == '}') {
        if (depth == 0) return k;
        depth--;
      }
    }
    throw new SafeEvalException(
        Kind.SYNTAX_ERROR, "Unterminated template field at position " + position);
  }

  private SafeEvalException unexpected(Token t) {
    if (t.type() == Token.Type.END) {
      return new SafeEvalException(Kind.SYNTAX_ERROR, "Unexpected end of expression");
    }
    if (t.type() == Token.Type.NAME && KEYWORDS.contains(t.text())) {
      return new SafeEvalException(
          Kind.DISALLOWED_CONSTRUCT, "Keyword '" + t.text() + "' is not allowed");
    }
    if (t.type() == Token.Type.OPERATOR
        && ExpressionLexer.FORBIDDEN_PUNCTUATION.contains(t.text())) {
      String message =
          switch (t.text()) {
            case "=", ":=" -> "Assignments are not allowed";
            case "." -> "Attribute access is not allowed";
            case "[", "]" -> "Subscripts and list literals are not allowed";
            case "{", "}" -> "Set and dict literals are not allowed";
            case ";" -> "Multiple statements are not allowed";
            default -> "Operator '" + t.text() + "' is not allowed";
          };
      return new SafeEvalException(Kind.DISALLOWED_CONSTRUCT, message);
    }
    return new SafeEvalException(
        Kind.SYNTAX_ERROR, "Unexpected token '" + t.text() + "' at position " + t.position());
  }

  private void expectOperator(String symbol) {
    Token t = advance();
    if (!t.isOperator(symbol)) {
      if (t.type() == Token.Type.END
          || (t.type() == Token.Type.OPERATOR
              && !ExpressionLexer.FORBIDDEN_PUNCTUATION.contains(t.text()))) {
        throw new SafeEvalException(
            Kind.SYNTAX_ERROR, "Expected '" + symbol + "' at position " + t.position());
      }
      throw unexpected(t);
    }
  }

  private void enter() {
    if (++nesting > MAX_NESTING) {
      throw new SafeEvalException(Kind.TOO_COMPLEX, "Expression is nested too deeply");
    }
  }

  private void leave() {
    nesting--;
  }

  private void leave(int levels) {
    nesting -= levels;
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private Token advance() {
    Token t = tokens.get(pos);
    if (t.type() != Token.Type.END) {
      pos++;
    }
    return t;
  }
}
