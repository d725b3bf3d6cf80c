package com.gentoro.reportengine.expression;

import com.gentoro.reportengine.expression.SafeEvalException.Kind;
import java.util.HashMap;
import java.util.Map;

/**
 * A validated format lambda, ready to be applied to many values.
 *
 * <p>Obtained from {@link SafeExpressionEvaluator#compileFormat(String)}; instances are immutable
 * and can be shared.
 */
public final class CompiledFormat {

  private final FormatLambda lambda;

  CompiledFormat(FormatLambda lambda) {
    this.lambda = lambda;
  }

  public String parameter() {
    return lambda.parameter();
  }

  /**
   * Apply the lambda to {@code value} and return the string form of the result.
   *
   * @throws SafeEvalException with {@link Kind#EXECUTION_FAILURE} when evaluation fails
   */
  public String apply(Object value) {
    Map<String, Object> bindings = new HashMap<>();
    bindings.put(lambda.parameter(), value);
    Object result;
    try {
      result = new ExpressionInterpreter(bindings).evaluate(lambda.body());
    } catch (SafeEvalException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SafeEvalException(
          Kind.EXECUTION_FAILURE, "Function execution failed: " + e.getMessage(), e);
    }
    return ExpressionInterpreter.display(result);
  }

  /**
   * Like {@link #apply(Object)} but reports failures as a result instead of throwing.
   */
  public EvalResult<String> tryApply(Object value) {
    try {
      return EvalResult.success(apply(value));
    } catch (SafeEvalException e) {
      return EvalResult.failure(e);
    }
  }

  @Override
  public String toString() {
    return "CompiledFormat[lambda " + lambda.parameter() + ": " + lambda.body() + "]";
  }
}
