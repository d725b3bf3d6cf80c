package com.gentoro.reportengine.table;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportengine.utility.NumberFormats;
import com.gentoro.reportengine.utility.Values;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoublePredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered list of {@link FormatRule}s with a default pattern; the first matching rule wins.
 *
 * <p>Configured as:
 *
 * <pre>{@code
 * [{"condition": "x >= 100", "format": "{:.1f}"}, {"condition": "x < 100", "format": ".2f"}]
 * }</pre>
 *
 * Conditions compare {@code x} to a non-negative number with {@code >= => <= =< > < ==}; any other
 * operator always matches. Entries whose condition cannot be read are ignored. Patterns are either
 * a bare spec ({@code .1f}) or text with {@code {:spec}} placeholders ({@code {:.1f} lm}).
 */
public final class FormatRules {

  public static final String DEFAULT_PATTERN = "{:.2f}";

  private static final Pattern CONDITION = Pattern.compile("^x\\s*([><=!]+)\\s*([\\d.]+)");
  private static final Pattern PLACEHOLDER =
      Pattern.compile("\\{\\{|\\}\\}|\\{0?(?::([^{}]*))?\\}");

  private final List<FormatRule> rules;
  private final String defaultPattern;

  public FormatRules(List<FormatRule> rules, String defaultPattern) {
    this.rules = List.copyOf(rules);
    this.defaultPattern = defaultPattern;
  }

  /** Parse a rule array; {@code null} or a non-array yields no rules. */
  public static FormatRules parse(JsonNode config) {
    List<FormatRule> rules = new ArrayList<>();
    if (config != null && config.isArray()) {
      for (JsonNode entry : config) {
        String condition = entry.path("condition").asText("");
        String pattern = entry.path("format").asText("{:.1f}");
        DoublePredicate predicate = predicate(condition);
        if (predicate != null) {
          validatePattern(pattern);
          rules.add(new FormatRule(condition, predicate, pattern));
        }
      }
    }
    return new FormatRules(rules, DEFAULT_PATTERN);
  }

  public List<FormatRule> rules() {
    return rules;
  }

  public boolean isEmpty() {
    return rules.isEmpty();
  }

  /**
   * Render a value: non-numeric values keep their display form ({@code null} becomes an empty
   * string); with no rules the plain number is returned; otherwise the first matching rule or the
   * default pattern is applied.
   */
  public String apply(Object value) {
    Double number = Values.toDouble(value);
    if (number == null) {
      return Values.str(value);
    }
    if (rules.isEmpty()) {
      return NumberFormats.repr(number);
    }
    for (FormatRule rule : rules) {
      if (rule.matches(number)) {
        return render(rule.pattern(), number);
      }
    }
    return render(defaultPattern, number);
  }

  /**
   * Render {@code value} with a pattern such as {@code {:.1f}}, {@code {:.0f} cd}, {@code {}} or a
   * bare spec {@code .2f}.
   *
   * @throws TransformConfigException when the pattern uses an unsupported spec
   */
  public static String render(String pattern, double value) {
    if (pattern.indexOf('{') < 0 && pattern.indexOf('}') < 0) {
      return format(value, pattern);
    }
    Matcher m = PLACEHOLDER.matcher(pattern);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String token = m.group();
      String replacement;
      if (token.equals("{{")) {
        replacement = "{";
      } else if (token.equals("}}")) {
        replacement = "}";
      } else if (m.group(1) == null || m.group(1).isEmpty()) {
        replacement = NumberFormats.repr(value);
      } else {
        replacement = format(value, m.group(1));
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  /** Render {@code value} with {@code pattern} when it is numeric, else its display form. */
  public static String renderValue(String pattern, Object value) {
    Double number = Values.toDouble(value);
    return number == null ? Values.str(value) : render(pattern, number);
  }

  private static String format(double value, String spec) {
    try {
      return NumberFormats.format(value, spec);
    } catch (IllegalArgumentException e) {
      throw new TransformConfigException("Unsupported number format '" + spec + "'", e);
    }
  }

  private static void validatePattern(String pattern) {
    render(pattern, 0.0);
  }

  private static DoublePredicate predicate(String condition) {
    Matcher m = CONDITION.matcher(condition);
    if (!m.find()) {
      return null;
    }
    double threshold;
    try {
      threshold = Double.parseDouble(m.group(2));
    } catch (NumberFormatException e) {
      return null;
    }
    return switch (m.group(1)) {
      case ">=", "=>" -> x -> x >= threshold;
      case "<=", "=<" -> x -> x <= threshold;
      case ">" -> x -> x > threshold;
      case "<" -> x -> x < threshold;
      case "==" -> x -> x == threshold;
      default -> x -> true;
    };
  }
}
