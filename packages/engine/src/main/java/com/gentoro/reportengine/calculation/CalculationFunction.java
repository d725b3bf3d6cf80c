package com.gentoro.reportengine.calculation;

import java.util.List;

/**
 * A named scalar function used by calculated fields.
 *
 * <p>Arguments arrive already resolved and coerced (see {@link FieldValue}); missing arguments are
 * {@code null}. Any exception thrown is reported as a {@link CalculatorException}.
 */
@FunctionalInterface
public interface CalculationFunction {
  Object apply(List<Object> args) throws Exception;
}
