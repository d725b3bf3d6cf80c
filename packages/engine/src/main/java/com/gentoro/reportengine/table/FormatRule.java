package com.gentoro.reportengine.table;

import java.util.function.DoublePredicate;

/**
 * A conditional number format: when {@code condition} holds for a value, the value is rendered
 * with {@code pattern} (see {@link FormatRules#render(String, double)}).
 *
 * @param condition textual form of the condition, e.g. {@code x >= 100}
 */
public record FormatRule(String condition, DoublePredicate predicate, String pattern) {

  public boolean matches(double value) {
    return predicate.test(value);
  }
}
