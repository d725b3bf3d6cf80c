package com.gentoro.reportengine.expression;

import com.gentoro.reportengine.expression.SafeEvalException.Kind;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits expression text into {@link Token}s.
 *
 * <p>Punctuation that belongs to constructs outside the whitelist ({@code .}, {@code [}, {@code =},
 * ...) is still tokenized so that the parser can report it as a disallowed construct rather than a
 * syntax error.
 */
final class ExpressionLexer {

  /** Operators, longest first so that {@code **} wins over {@code *}. */
  private static final List<String> OPERATORS =
      List.of(
          "**", "//", "<=", ">=", "==", "!=", ":=", "->", "<<", ">>", "+", "-", "*", "/", "%", "<",
          ">", "(", ")", ",", ":", ".", "[", "]", "{", "}", "=", ";", "@", "&", "|", "^", "~", "!");

  static final Set<String> FORBIDDEN_PUNCTUATION =
      Set.of(
          ".", "[", "]", "{", "}", "=", ":=", "->", ";", "@", "&", "|", "^", "~", "!", "<<", ">>");

  private final String s;
  private final int n;
  private int i;

  private ExpressionLexer(String source) {
    this.s = source;
    this.n = source.length();
  }

  static List<Token> tokenize(String source) {
    return new ExpressionLexer(source).run();
  }

  private List<Token> run() {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWs();
      if (i >= n) {
        tokens.add(new Token(Token.Type.END, "", null, n));
        return tokens;
      }
      char c = s.charAt(i);
      if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(s.charAt(i + 1)))) {
        tokens.add(readNumber());
      } else if (Character.isLetter(c) || c == '_') {
        tokens.add(readNameOrPrefixedString());
      } else if (c == '\'' || c == '"') {
        int start = i;
        String raw = readQuoted();
        tokens.add(new Token(Token.Type.STRING, raw, unescape(raw, start), start));
      } else {
        tokens.add(readOperator());
      }
    }
  }

  private void skipWs() {
    while (i < n && Character.isWhitespace(s.charAt(i))) i++;
  }

  private Token readNumber() {
    int start = i;
    boolean floating = false;
    while (i < n && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '_')) i++;
    if (i < n && s.charAt(i) == '.') {
      floating = true;
      i++;
      while (i < n && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '_')) i++;
    }
    if (i < n && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
      int mark = i;
      i++;
      if (i < n && (s.charAt(i) == '+' || s.charAt(i) == '-')) i++;
      if (i < n && Character.isDigit(s.charAt(i))) {
        floating = true;
        while (i < n && Character.isDigit(s.charAt(i))) i++;
      } else {
        i = mark;
      }
    }
    if (i < n && (Character.isLetter(s.charAt(i)) || s.charAt(i) == '_')) {
      throw new SafeEvalException(
          Kind.SYNTAX_ERROR, "Invalid numeric literal at position " + start);
    }
    String text = s.substring(start, i);
    String digits = text.replace("_", "");
    Number value;
    try {
      if (floating) {
        value = Double.parseDouble(digits);
      } else {
        BigInteger big = new BigInteger(digits);
        value = big.bitLength() < 64 ? (Number) big.longValue() : (Number) big.doubleValue();
      }
    } catch (NumberFormatException e) {
      throw new SafeEvalException(
          Kind.SYNTAX_ERROR, "Invalid numeric literal '" + text + "' at position " + start, e);
    }
    return new Token(Token.Type.NUMBER, text, value, start);
  }

  private Token readNameOrPrefixedString() {
    int start = i;
    while (i < n && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) i++;
    String name = s.substring(start, i);
    if (i < n && (s.charAt(i) == '\'' || s.charAt(i) == '"') && name.length() <= 2) {
      if (name.equalsIgnoreCase("f")) {
        String raw = readQuoted();
        return new Token(Token.Type.TEMPLATE, raw, raw, start);
      }
      if (name.chars().allMatch(ch -> "rRbBuUfF".indexOf(ch) >= 0)) {
        throw new SafeEvalException(
            Kind.DISALLOWED_CONSTRUCT,
            "String prefix '" + name + "' is not supported at position " + start);
      }
    }
    return new Token(Token.Type.NAME, name, name, start);
  }

  /** Read a single-line quoted literal and return its raw (still escaped) body. */
  private String readQuoted() {
    char quote = s.charAt(i);
    int start = i;
    if (s.startsWith(String.valueOf(quote).repeat(3), i)) {
      throw new SafeEvalException(
          Kind.DISALLOWED_CONSTRUCT, "Triple-quoted strings are not supported");
    }
    i++;
    int bodyStart = i;
    while (i < n) {
      char c = s.charAt(i);
      if (c == '\\') {
        i += 2;
        continue;
      }
      if (c == quote) {
        String body = s.substring(bodyStart, i);
        i++;
        return body;
      }
      if (c == '\n') break;
      i++;
    }
    throw new SafeEvalException(
        Kind.SYNTAX_ERROR, "Unterminated string literal at position " + start);
  }

  private Token readOperator() {
    for (String op : OPERATORS) {
      if (s.startsWith(op, i)) {
        Token token = new Token(Token.Type.OPERATOR, op, op, i);
        i += op.length();
        return token;
      }
    }
    throw new SafeEvalException(
        Kind.SYNTAX_ERROR, "Unexpected character '" + s.charAt(i) + "' at position " + i);
  }

  /** Resolve backslash escapes of a literal body. */
  static String unescape(String raw, int position) {
    if (raw.indexOf('\\') < 0) {
      return raw;
    }
    StringBuilder sb = new StringBuilder(raw.length());
    for (int k = 0; k < raw.length(); k++) {
      char c = raw.charAt(k);
      if (c != '\\' || k + 1 >= raw.length()) {
        sb.append(c);
        continue;
      }
      char e = raw.charAt(++k);
      switch (e) {
        case 'n' -> sb.append('\n');
        case 't' -> sb.append('\t');
        case 'r' -> sb.append('\r');
        case '0' -> sb.append('\0');
        case '\\' -> sb.append('\\');
        case '\'' -> sb.append('\'');
        case '"' -> sb.append('"');
        case 'u' -> {
          if (k + 4 >= raw.length()) {
            throw new SafeEvalException(
                Kind.SYNTAX_ERROR, "Truncated \\u escape in literal at position " + position);
          }
          try {
            sb.append((char) Integer.parseInt(raw.substring(k + 1, k + 5), 16));
          } catch (NumberFormatException ex) {
            throw new SafeEvalException(
                Kind.SYNTAX_ERROR, "Invalid \\u escape in literal at position " + position, ex);
          }
          k += 4;
        }
        default -> sb.append('\\').append(e);
      }
    }
    return sb.toString();
  }
}
